package com.cgi.piiscan.dbscanner.exception;

/**
 * Exception for scanner service errors.
 */
public class ScannerException extends BaseException {
    private static final long serialVersionUID = 1L;

    public ScannerException(String message) {
        super(message, "SCANNER_ERROR");
    }

    public ScannerException(String message, Throwable cause) {
        super(message, cause, "SCANNER_ERROR");
    }
}
