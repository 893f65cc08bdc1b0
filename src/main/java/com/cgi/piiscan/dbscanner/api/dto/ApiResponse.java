package com.cgi.piiscan.dbscanner.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope for every API payload.
 *
 * @param <T> Type of data contained in the response
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiResponse<T> {
    private boolean success;

    private T data;

    /**
     * Error message, null on success.
     */
    private String error;

    /**
     * Error code from the exception hierarchy, null on success.
     */
    private String errorCode;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data, null, null);
    }

    /**
     * Creates an error response with a message and code.
     *
     * @param errorMessage Error message
     * @param errorCode Error code
     * @param <T> Type of data
     * @return Error API response
     */
    public static <T> ApiResponse<T> error(String errorMessage, String errorCode) {
        return new ApiResponse<>(false, null, errorMessage, errorCode);
    }
}
