package org.orchestration.migrator.odx;

/**
 * Wraps a failure raised while building one section of an orchestration
 * (message declarations, port types, port declarations or shapes).
 */
public class OdxSectionException extends OdxParseException {
    private final String orchestrationName;
    private final String section;

    public OdxSectionException(String orchestrationName, String section, Throwable cause) {
        super(String.format("Failed to parse %s in orchestration '%s': %s",
                section, orchestrationName, cause.getMessage()), cause);
        this.orchestrationName = orchestrationName;
        this.section = section;
    }

    public String getOrchestrationName() {
        return orchestrationName;
    }

    public String getSection() {
        return section;
    }
}
