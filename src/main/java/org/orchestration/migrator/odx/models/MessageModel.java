package org.orchestration.migrator.odx.models;

/**
 * A message declared on the orchestration service.
 *
 * @param name       the logical message name used by shapes
 * @param type       the schema (or .NET) type of the message
 * @param direction  the parameter direction
 */
public record MessageModel(String name, String type, MessageDirection direction) {
}
