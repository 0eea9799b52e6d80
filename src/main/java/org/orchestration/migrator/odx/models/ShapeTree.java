package org.orchestration.migrator.odx.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Arena holding every node of one orchestration, addressed by stable integer handles,
 * together with the OID index. The index is global over the whole arena, so a node
 * inside a branch or case is found the same way as a top-level one.
 */
public final class ShapeTree {
    private final List<ShapeNode> nodes = new ArrayList<>();
    private final Map<String, Integer> oidIndex = new LinkedHashMap<>();
    private boolean sealed;

    /**
     * Creates a node. The node is not listed as a child of {@code parent} until {@link #link} is called.
     */
    public ShapeNode add(String oid, String name, ShapeKind kind, String shapeType,
                         int sequence, String uniqueId, int parent) {
        checkOpen();
        ShapeNode node = new ShapeNode(nodes.size(), oid, name, kind, shapeType, sequence, uniqueId, parent);
        nodes.add(node);
        return node;
    }

    /**
     * Registers an OID. The first registration wins; later nodes with the same OID are not indexed.
     *
     * @return true if the OID was newly registered
     */
    public boolean register(String oid, ShapeNode node) {
        checkOpen();
        if (oid == null || oid.isEmpty() || oidIndex.containsKey(oid)) {
            return false;
        }
        oidIndex.put(oid, node.handle());
        return true;
    }

    public void link(int parentHandle, int childHandle) {
        checkOpen();
        ShapeNode child = node(childHandle);
        if (child.parent() != parentHandle) {
            throw new IllegalArgumentException(String.format("Shape %s does not belong to parent %d",
                    child.uniqueId(), parentHandle));
        }
        node(parentHandle).addChild(childHandle);
    }

    public void attach(ShapeNode node, ShapePayload payload) {
        checkOpen();
        node.attach(payload);
    }

    /**
     * Swaps the payload of a node for another one of the same variant.
     */
    public void replace(ShapeNode node, ShapePayload payload) {
        checkOpen();
        node.replace(payload);
    }

    /**
     * Closes the arena once the model is complete. Payload lists are immutable already,
     * so after this no node, link, index entry or payload can change.
     */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public ShapeNode node(int handle) {
        if (handle < 0 || handle >= nodes.size()) {
            throw new IllegalArgumentException("Unknown shape handle: " + handle);
        }
        return nodes.get(handle);
    }

    public List<ShapeNode> resolve(List<Integer> handles) {
        List<ShapeNode> resolved = new ArrayList<>(handles.size());
        for (int handle : handles) {
            resolved.add(node(handle));
        }
        return resolved;
    }

    public Optional<ShapeNode> parentOf(ShapeNode node) {
        return node.hasParent() ? Optional.of(node(node.parent())) : Optional.empty();
    }

    public List<ShapeNode> childrenOf(ShapeNode node) {
        return resolve(node.children());
    }

    public Optional<ShapeNode> findByOid(String oid) {
        Integer handle = oidIndex.get(oid);
        return handle == null ? Optional.empty() : Optional.of(node(handle));
    }

    public Map<String, Integer> oidIndex() {
        return Collections.unmodifiableMap(oidIndex);
    }

    public List<ShapeNode> allNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public List<ShapeNode> trueBranch(ShapeNode decide) {
        return resolve(decide.payload(ShapePayload.Decide.class).trueBranch());
    }

    public List<ShapeNode> falseBranch(ShapeNode decide) {
        return resolve(decide.payload(ShapePayload.Decide.class).falseBranch());
    }

    public List<ShapeNode> switchCase(ShapeNode switchNode, String key) {
        List<Integer> handles = switchNode.payload(ShapePayload.Switch.class).cases().get(key);
        return handles == null ? List.of() : resolve(handles);
    }

    public List<ShapeNode> defaultCase(ShapeNode switchNode) {
        return resolve(switchNode.payload(ShapePayload.Switch.class).defaultCase());
    }

    public List<ShapeNode> listenBranch(ShapeNode listen, int index) {
        return resolve(listen.payload(ShapePayload.Listen.class).branches().get(index));
    }

    /**
     * Handles held in the payload that are not generic children: Decide branches,
     * Switch cases (default last) and Listen branches, in that order.
     */
    public List<Integer> branchHandles(ShapeNode node) {
        List<Integer> handles = new ArrayList<>();
        ShapePayload payload = node.payload();
        if (payload instanceof ShapePayload.Decide decide) {
            handles.addAll(decide.trueBranch());
            handles.addAll(decide.falseBranch());
        } else if (payload instanceof ShapePayload.Switch switchPayload) {
            switchPayload.cases().values().forEach(handles::addAll);
            handles.addAll(switchPayload.defaultCase());
        } else if (payload instanceof ShapePayload.Listen listen) {
            listen.branches().forEach(handles::addAll);
        }
        return handles;
    }

    /**
     * Visits every node reachable from {@code roots}, depth-first in document order:
     * the node, its generic children, then its branch/case/listen payload lists.
     */
    public void walk(List<Integer> roots, Consumer<ShapeNode> visitor) {
        for (int handle : roots) {
            ShapeNode node = node(handle);
            visitor.accept(node);
            walk(node.children(), visitor);
            walk(branchHandles(node), visitor);
        }
    }

    public List<ShapeNode> collect(List<Integer> roots) {
        List<ShapeNode> collected = new ArrayList<>();
        walk(roots, collected::add);
        return collected;
    }

    private void checkOpen() {
        if (sealed) {
            throw new IllegalStateException("Shape tree is sealed");
        }
    }
}
