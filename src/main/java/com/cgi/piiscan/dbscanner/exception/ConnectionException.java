package com.cgi.piiscan.dbscanner.exception;

import com.cgi.piiscan.dbscanner.model.EngineKind;

/**
 * Raised when a database engine cannot be reached or refuses the credentials.
 * This is the only failure that aborts a whole scan.
 */
public class ConnectionException extends BaseException {
    private static final long serialVersionUID = 1L;

    /**
     * Engine the connection was attempted against.
     */
    private final EngineKind engine;

    public ConnectionException(EngineKind engine, String message) {
        super(message, "CONNECTION_ERROR");
        this.engine = engine;
    }

    public ConnectionException(EngineKind engine, String message, Throwable cause) {
        super(message, cause, "CONNECTION_ERROR");
        this.engine = engine;
    }

    /**
     * Gets the engine the failed connection targeted.
     *
     * @return Engine kind
     */
    public EngineKind getEngine() {
        return engine;
    }
}
