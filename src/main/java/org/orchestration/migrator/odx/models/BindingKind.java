package org.orchestration.migrator.odx.models;

public enum BindingKind {
    LOGICAL,
    PHYSICAL,
    DIRECT,
    WEB,
    UNKNOWN
}
