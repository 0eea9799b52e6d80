package org.orchestration.migrator.odx.models;

/**
 * A statement reference owned by a correlation declaration.
 *
 * @param statementOid the OID of the referenced shape
 * @param initializes  true when the referenced statement initializes the set, false when it follows it
 */
public record CorrelationReference(String statementOid, boolean initializes) {
}
