package com.cgi.piiscan.dbscanner.core.connector;

import com.cgi.piiscan.dbscanner.model.EngineKind;

import java.lang.annotation.*;

/**
 * Annotation to mark a DatabaseConnector implementation with the engine it connects to.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface DatabaseType {
    /**
     * The engine kind.
     */
    EngineKind value();
}
