package org.orchestration.migrator.odx;

import org.orchestration.migrator.odx.models.ShapeNode;

/**
 * Receives diagnostics while a shape tree is built. The parser itself never logs;
 * everything it wants to say goes through this interface.
 */
public interface ParseListener {
    ParseListener NONE = new ParseListener() {
    };

    default void shapeParsed(ShapeNode node) {
    }

    /**
     * An element type with no dedicated builder; a fallback node was created for it.
     */
    default void unknownShape(String rawType, String oid) {
    }

    /**
     * A metadata element that produces no node, e.g. a transaction attribute.
     */
    default void metadataSkipped(String rawType, String oid) {
    }

    /**
     * A branch container of a Decide that fills neither the true nor the false slot.
     */
    default void branchIgnored(ShapeNode owner, String branchName) {
    }

    default void warning(String message) {
    }
}
