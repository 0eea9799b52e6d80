package org.orchestration.migrator.odx.models;

/**
 * An operation of a port type. Message types are kept as the raw references found
 * in the file and are resolved by the consumer when needed.
 */
public record OperationModel(
        String name,
        OperationKind kind,
        String requestMessageType,
        String responseMessageType,
        String faultMessageType
) {
    public boolean isRequestResponse() {
        return kind == OperationKind.REQUEST_RESPONSE;
    }
}
