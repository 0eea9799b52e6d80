package org.orchestration.migrator.odx;

import org.orchestration.migrator.odx.models.BindingKind;
import org.orchestration.migrator.odx.models.MessageDirection;
import org.orchestration.migrator.odx.models.MessageModel;
import org.orchestration.migrator.odx.models.OperationKind;
import org.orchestration.migrator.odx.models.OperationModel;
import org.orchestration.migrator.odx.models.OrchestrationModel;
import org.orchestration.migrator.odx.models.PortDirection;
import org.orchestration.migrator.odx.models.PortModel;
import org.orchestration.migrator.odx.models.PortTypeModel;
import org.orchestration.migrator.odx.models.ShapeNode;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

public class OdxHelper {
    private static final String MODULE_PATH = "/om:MetaModel/om:Element[@Type='Module']";
    private static final String SERVICE_PATH = MODULE_PATH + "/om:Element[@Type='ServiceDeclaration']";
    private static final String SERVICE_BODY_PATH = SERVICE_PATH + "/om:Element[@Type='ServiceBody']";

    // checked in this order, the first one present wins
    private static final List<Map.Entry<String, BindingKind>> BINDING_TYPES = List.of(
            Map.entry("LogicalBindingAttribute", BindingKind.LOGICAL),
            Map.entry("PhysicalBindingAttribute", BindingKind.PHYSICAL),
            Map.entry("DirectBindingAttribute", BindingKind.DIRECT),
            Map.entry("WebPortBindingAttribute", BindingKind.WEB));

    /**
     * Reads and parses an ODX file.
     *
     * @param odxFile path of the .odx file
     * @return the orchestration model
     * @throws IOException         if the file is missing or unreadable
     * @throws OdxParseException   if the content cannot be turned into a model
     */
    public static OrchestrationModel parseOdxFile(Path odxFile) throws IOException {
        return parseOdxFile(odxFile, ParseListener.NONE);
    }

    public static OrchestrationModel parseOdxFile(Path odxFile, ParseListener listener) throws IOException {
        String content = new String(Files.readAllBytes(odxFile), StandardCharsets.UTF_8);
        return parseOdxContent(content, listener);
    }

    /**
     * Parses the raw text of an ODX file: designer XML followed by generated code.
     */
    public static OrchestrationModel parseOdxContent(String content, ParseListener listener) {
        Document document = OdxSourceExtractor.extractDocument(content);
        return parseDocument(document, listener);
    }

    /**
     * Builds the model from an already parsed designer document.
     *
     * @param document the designer XML
     * @param listener receives parse diagnostics, may be null
     * @return the orchestration model with correlations resolved
     * @throws OdxSemanticException if the orchestration has no name
     * @throws OdxSectionException  if one of the sections fails to build
     */
    public static OrchestrationModel parseDocument(Document document, ParseListener listener) {
        OdxElementReader reader = new OdxElementReader();
        WarningCollector collector = new WarningCollector(listener == null ? ParseListener.NONE : listener);
        ParseState state = new ParseState(collector);

        String namespace = reader.eval(document, MODULE_PATH + "/om:Property[@Name='Name']/@Value");
        String name = reader.eval(document, SERVICE_PATH + "/om:Property[@Name='Name']/@Value");
        if (name.isBlank()) {
            throw new OdxSemanticException("Orchestration name not found: ServiceDeclaration has no Name property");
        }

        Optional<Element> module = first(reader.select(document, MODULE_PATH));
        Optional<Element> service = first(reader.select(document, SERVICE_PATH));

        List<MessageModel> messages = parseSection(name, "message declarations",
                () -> service.map(s -> parseMessages(reader, s)).orElse(List.of()));
        List<PortTypeModel> portTypes = parseSection(name, "port types",
                () -> module.map(m -> parsePortTypes(reader, m)).orElse(List.of()));
        List<PortModel> ports = parseSection(name, "port declarations",
                () -> service.map(s -> parsePorts(reader, s)).orElse(List.of()));

        ShapeTreeParser parser = new ShapeTreeParser(reader, state);
        List<Integer> serviceVariables = new ArrayList<>();
        try {
            service.ifPresent(s -> serviceVariables.addAll(parseServiceVariables(reader, parser, s)));
        } catch (RuntimeException e) {
            collector.warning("Failed to parse service variables in orchestration '" + name + "': " + e.getMessage());
        }

        List<Integer> shapes = parseSection(name, "shapes", () -> {
            List<Integer> body = first(reader.select(document, SERVICE_BODY_PATH))
                    .map(b -> parser.parseShapes(b, ParseContext.root("body"), ShapeNode.NO_PARENT))
                    .orElseGet(List::of);
            CorrelationResolver.resolve(state.tree());
            return body;
        });
        state.tree().seal();

        return new OrchestrationModel(namespace, name, messages, portTypes, ports, state.tree(),
                shapes, serviceVariables, collector.warnings);
    }

    static List<MessageModel> parseMessages(OdxElementReader reader, Element service) {
        List<MessageModel> messages = new ArrayList<>();
        for (Element element : reader.childElements(service, "MessageDeclaration")) {
            String messageName = reader.property(element, "Name");
            if (messageName.isBlank()) {
                continue;
            }
            messages.add(new MessageModel(messageName,
                    reader.property(element, "Type"),
                    MessageDirection.fromDesignerValue(reader.property(element, "ParamDirection"))));
        }
        return messages;
    }

    static List<PortTypeModel> parsePortTypes(OdxElementReader reader, Element module) {
        List<PortTypeModel> portTypes = new ArrayList<>();
        for (Element element : reader.childElements(module, "PortType")) {
            String portTypeName = reader.property(element, "Name");
            if (portTypeName.isBlank()) {
                continue;
            }
            List<OperationModel> operations = new ArrayList<>();
            for (Element operation : reader.childElements(element, "OperationDeclaration")) {
                String operationName = reader.property(operation, "Name");
                if (operationName.isBlank()) {
                    continue;
                }
                String request = "";
                String response = "";
                String fault = "";
                for (Element messageRef : reader.childElements(operation, "MessageRef")) {
                    String ref = reader.property(messageRef, "Ref");
                    switch (reader.property(messageRef, "Name")) {
                        case "Request" -> request = ref;
                        case "Response" -> response = ref;
                        case "Fault" -> fault = ref;
                        default -> {
                            // unnamed references carry no role
                        }
                    }
                }
                operations.add(new OperationModel(operationName,
                        OperationKind.fromDesignerValue(reader.property(operation, "OperationType")),
                        request, response, fault));
            }
            portTypes.add(new PortTypeModel(portTypeName, reader.property(element, "TypeModifier"), operations));
        }
        return portTypes;
    }

    static List<PortModel> parsePorts(OdxElementReader reader, Element service) {
        List<PortModel> ports = new ArrayList<>();
        for (Element element : reader.childElements(service, "PortDeclaration")) {
            String portName = reader.property(element, "Name");
            if (portName.isBlank()) {
                continue;
            }
            ports.add(PortModel.builder()
                    .name(portName)
                    .portTypeName(reader.property(element, "Type"))
                    .direction(PortDirection.fromDesignerFlags(
                            reader.property(element, "PortModifier"),
                            reader.property(element, "Signal")))
                    .bindingKind(bindingKind(reader, element))
                    .adapterName(adapterName(reader, element))
                    .build());
        }
        return ports;
    }

    private static BindingKind bindingKind(OdxElementReader reader, Element port) {
        for (Map.Entry<String, BindingKind> binding : BINDING_TYPES) {
            if (reader.firstChildElement(port, binding.getKey()).isPresent()) {
                return binding.getValue();
            }
        }
        return BindingKind.UNKNOWN;
    }

    private static String adapterName(OdxElementReader reader, Element port) {
        Optional<Element> physical = reader.firstChildElement(port, "PhysicalBindingAttribute");
        if (physical.isPresent()) {
            String adapter = reader.firstProperty(physical.get(), "TransportType", "Adapter", "AdapterName");
            if (!adapter.isBlank()) {
                return adapter;
            }
        }
        return reader.firstChildElement(port, "WebPortBindingAttribute")
                .map(web -> reader.property(web, "TransportType"))
                .orElse("");
    }

    private static List<Integer> parseServiceVariables(OdxElementReader reader, ShapeTreeParser parser, Element service) {
        ParseContext context = ParseContext.root("service");
        List<Integer> handles = new ArrayList<>();
        for (Element element : reader.childElements(service, "VariableDeclaration")) {
            parser.parseShape(element, context, ShapeNode.NO_PARENT).ifPresent(node -> handles.add(node.handle()));
        }
        return handles;
    }

    private static <T> T parseSection(String orchestrationName, String section, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            throw new OdxSectionException(orchestrationName, section, e);
        }
    }

    private static Optional<Element> first(List<Element> elements) {
        return elements.isEmpty() ? Optional.empty() : Optional.of(elements.get(0));
    }

    // forwards every event and keeps warnings for the model
    private static class WarningCollector implements ParseListener {
        private final ParseListener delegate;
        private final List<String> warnings = new ArrayList<>();

        WarningCollector(ParseListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public void shapeParsed(ShapeNode node) {
            delegate.shapeParsed(node);
        }

        @Override
        public void unknownShape(String rawType, String oid) {
            delegate.unknownShape(rawType, oid);
        }

        @Override
        public void metadataSkipped(String rawType, String oid) {
            delegate.metadataSkipped(rawType, oid);
        }

        @Override
        public void branchIgnored(ShapeNode owner, String branchName) {
            warnings.add(String.format("Decide '%s': branch '%s' was not mapped", owner.name(), branchName));
            delegate.branchIgnored(owner, branchName);
        }

        @Override
        public void warning(String message) {
            warnings.add(message);
            delegate.warning(message);
        }
    }
}
