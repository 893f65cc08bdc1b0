package com.cgi.piiscan.dbscanner.exception;

/**
 * Exception for schema introspection errors.
 */
public class IntrospectionException extends BaseException {
    private static final long serialVersionUID = 1L;

    public IntrospectionException(String message) {
        super(message, "INTROSPECTION_ERROR");
    }

    public IntrospectionException(String message, Throwable cause) {
        super(message, cause, "INTROSPECTION_ERROR");
    }
}
