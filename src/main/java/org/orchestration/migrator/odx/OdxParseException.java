package org.orchestration.migrator.odx;

/**
 * Base type for everything that can go wrong while turning an ODX file's content
 * into an orchestration model. I/O problems are reported separately as {@link java.io.IOException}.
 */
public class OdxParseException extends RuntimeException {

    public OdxParseException(String message) {
        super(message);
    }

    public OdxParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
