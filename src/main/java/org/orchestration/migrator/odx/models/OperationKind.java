package org.orchestration.migrator.odx.models;

public enum OperationKind {
    ONE_WAY,
    REQUEST_RESPONSE;

    public static OperationKind fromDesignerValue(String raw) {
        if (raw != null && raw.trim().equalsIgnoreCase("RequestResponse")) {
            return REQUEST_RESPONSE;
        }
        return ONE_WAY;
    }
}
