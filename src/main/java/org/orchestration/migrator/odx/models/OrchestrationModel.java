package org.orchestration.migrator.odx.models;

import java.util.List;
import java.util.Optional;

/**
 * A fully parsed orchestration: metadata sections plus the node arena.
 *
 * @param namespace              the module name
 * @param name                   the service (orchestration) name
 * @param messages               declared messages
 * @param portTypes              declared port types
 * @param ports                  declared ports
 * @param tree                   arena of every node, including branch and case contents
 * @param shapeHandles           top-level nodes of the service body in document order
 * @param serviceVariableHandles service-level variable declarations
 * @param warnings               non-fatal problems met while parsing
 */
public record OrchestrationModel(
        String namespace,
        String name,
        List<MessageModel> messages,
        List<PortTypeModel> portTypes,
        List<PortModel> ports,
        ShapeTree tree,
        List<Integer> shapeHandles,
        List<Integer> serviceVariableHandles,
        List<String> warnings
) {
    public OrchestrationModel {
        messages = messages == null ? List.of() : List.copyOf(messages);
        portTypes = portTypes == null ? List.of() : List.copyOf(portTypes);
        ports = ports == null ? List.of() : List.copyOf(ports);
        tree = tree == null ? new ShapeTree() : tree;
        shapeHandles = shapeHandles == null ? List.of() : List.copyOf(shapeHandles);
        serviceVariableHandles = serviceVariableHandles == null ? List.of() : List.copyOf(serviceVariableHandles);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public String fullName() {
        if (namespace == null || namespace.isEmpty()) {
            return name;
        }
        return namespace + "." + name;
    }

    public List<ShapeNode> shapes() {
        return tree.resolve(shapeHandles);
    }

    public List<ShapeNode> serviceVariables() {
        return tree.resolve(serviceVariableHandles);
    }

    /**
     * Every node reachable from the top-level list, branch and case contents included.
     */
    public List<ShapeNode> allShapes() {
        return tree.collect(shapeHandles);
    }

    /**
     * Looks up the schema type of a declared message. Names are matched exactly.
     *
     * @param logicalName message name as used by shapes
     * @return the message type, or {@code logicalName} itself if no such message is declared
     */
    public String findMessageType(String logicalName) {
        if (logicalName == null) {
            return "";
        }
        return messages.stream()
                .filter(m -> m.name().equals(logicalName))
                .map(MessageModel::type)
                .findFirst()
                .orElse(logicalName);
    }

    public Optional<PortModel> findPort(String portName) {
        return ports.stream().filter(p -> p.name().equals(portName)).findFirst();
    }
}
