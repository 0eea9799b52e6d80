package org.orchestration.migrator.odx.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A control-flow node stored in a {@link ShapeTree}. Nodes reference each other by
 * integer handle only: the parent handle and the generic child handles. Branch, case
 * and listen lists are kept in the payload and are not mirrored into the child list.
 */
public final class ShapeNode {
    public static final int NO_PARENT = -1;

    private final int handle;
    private final String oid;
    private final String name;
    private final ShapeKind kind;
    private final String shapeType;
    private final int sequence;
    private final String uniqueId;
    private final int parent;
    private final List<Integer> children = new ArrayList<>();
    private ShapePayload payload;

    ShapeNode(int handle, String oid, String name, ShapeKind kind, String shapeType,
              int sequence, String uniqueId, int parent) {
        this.handle = handle;
        this.oid = oid == null ? "" : oid;
        this.name = name == null ? "" : name;
        this.kind = kind;
        this.shapeType = shapeType;
        this.sequence = sequence;
        this.uniqueId = uniqueId;
        this.parent = parent;
    }

    public int handle() {
        return handle;
    }

    public String oid() {
        return oid;
    }

    public String name() {
        return name;
    }

    public ShapeKind kind() {
        return kind;
    }

    /**
     * The designer type name this node is counted under, e.g. "Decide" or "ForEach".
     * Fallback nodes keep the unrecognized raw type.
     */
    public String shapeType() {
        return shapeType;
    }

    public int sequence() {
        return sequence;
    }

    /**
     * Deterministic key made of the OID (or shape type when there is none), the
     * parsing context path and the sequence within that context.
     */
    public String uniqueId() {
        return uniqueId;
    }

    public int parent() {
        return parent;
    }

    public boolean hasParent() {
        return parent != NO_PARENT;
    }

    public List<Integer> children() {
        return Collections.unmodifiableList(children);
    }

    public ShapePayload payload() {
        return payload;
    }

    /**
     * Returns the payload as the expected variant.
     *
     * @param type the payload record class
     * @return the payload
     * @throws IllegalStateException if the node carries a different variant
     */
    public <T extends ShapePayload> T payload(Class<T> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalStateException(String.format("Shape '%s' (%s) has no %s payload",
                    name, shapeType, type.getSimpleName()));
        }
        return type.cast(payload);
    }

    public boolean is(ShapeKind other) {
        return kind == other;
    }

    void addChild(int childHandle) {
        children.add(childHandle);
    }

    void attach(ShapePayload payload) {
        if (this.payload != null) {
            throw new IllegalStateException("Payload already attached to shape " + uniqueId);
        }
        this.payload = payload;
    }

    void replace(ShapePayload replacement) {
        if (payload == null || payload.getClass() != replacement.getClass()) {
            throw new IllegalStateException("Cannot replace payload of shape " + uniqueId
                    + " with " + replacement.getClass().getSimpleName());
        }
        this.payload = replacement;
    }

    @Override
    public String toString() {
        return shapeType + "[" + name + "]";
    }
}
