package org.orchestration.migrator.odx;

/**
 * Well-formed XML that is missing data the model cannot be built without,
 * e.g. the orchestration name.
 */
public class OdxSemanticException extends OdxParseException {

    public OdxSemanticException(String message) {
        super(message);
    }
}
