package org.orchestration.migrator.odx;

import org.orchestration.migrator.odx.models.ShapeTree;

/**
 * State shared by the whole recursive build of one orchestration: the node arena
 * with its OID index and the diagnostics listener. Sequence counters are per
 * {@link ParseContext}.
 */
public final class ParseState {
    private final ShapeTree tree;
    private final ParseListener listener;

    public ParseState(ParseListener listener) {
        this.tree = new ShapeTree();
        this.listener = listener == null ? ParseListener.NONE : listener;
    }

    public ShapeTree tree() {
        return tree;
    }

    public ParseListener listener() {
        return listener;
    }
}
