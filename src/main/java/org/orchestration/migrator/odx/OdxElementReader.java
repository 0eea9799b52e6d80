package org.orchestration.migrator.odx;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;
import javax.xml.namespace.QName;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpression;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * XPath access to the designer schema, where every construct is an {@code om:Element}
 * with a {@code Type} attribute and {@code om:Property} children carrying Name/Value pairs.
 * Not thread-safe; use one reader per parse.
 */
public class OdxElementReader {
    public static final String DESIGNER_NS = "http://schemas.microsoft.com/BizTalk/2003/DesignerData";
    public static final String DESIGNER_PREFIX = "om";

    private final XPath xpath;
    private final Map<String, XPathExpression> compiled = new HashMap<>();

    public OdxElementReader() {
        this.xpath = XPathFactory.newInstance().newXPath();
        this.xpath.setNamespaceContext(new DesignerNamespaceContext());
    }

    /**
     * Selects all nodes matching a path relative to {@code context}.
     *
     * @param context the node to evaluate from
     * @param path    an XPath expression using the {@code om} prefix
     * @return matching elements in document order
     */
    public List<Element> select(Node context, String path) {
        NodeList nodes = (NodeList) evaluate(context, path, XPathConstants.NODESET);
        List<Element> elements = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element element) {
                elements.add(element);
            }
        }
        return elements;
    }

    /**
     * Evaluates a path to the string value of its first match.
     *
     * @return the value, or an empty string when nothing matches
     */
    public String eval(Node context, String path) {
        String value = (String) evaluate(context, path, XPathConstants.STRING);
        return value == null ? "" : value;
    }

    public String type(Element element) {
        return element.getAttribute("Type");
    }

    public String oid(Element element) {
        return element.getAttribute("OID");
    }

    public String property(Element element, String name) {
        return eval(element, "om:Property[@Name='" + name + "']/@Value");
    }

    /**
     * Value of the first of {@code names} that carries a non-blank value.
     */
    public String firstProperty(Element element, String... names) {
        for (String name : names) {
            String value = property(element, name);
            if (!value.isBlank()) {
                return value;
            }
        }
        return "";
    }

    public List<Element> childElements(Element element) {
        return select(element, "om:Element");
    }

    public List<Element> childElements(Element element, String type) {
        return select(element, "om:Element[@Type='" + type + "']");
    }

    public Optional<Element> firstChildElement(Element element, String type) {
        List<Element> children = childElements(element, type);
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0));
    }

    private Object evaluate(Node context, String path, QName returnType) {
        try {
            XPathExpression expression = compiled.get(path);
            if (expression == null) {
                expression = xpath.compile(path);
                compiled.put(path, expression);
            }
            return expression.evaluate(context, returnType);
        } catch (XPathExpressionException e) {
            throw new OdxParseException("Invalid designer path: " + path, e);
        }
    }

    private static class DesignerNamespaceContext implements NamespaceContext {
        @Override
        public String getNamespaceURI(String prefix) {
            if (DESIGNER_PREFIX.equals(prefix)) {
                return DESIGNER_NS;
            }
            if (XMLConstants.XML_NS_PREFIX.equals(prefix)) {
                return XMLConstants.XML_NS_URI;
            }
            return XMLConstants.NULL_NS_URI;
        }

        @Override
        public String getPrefix(String namespaceURI) {
            return DESIGNER_NS.equals(namespaceURI) ? DESIGNER_PREFIX : null;
        }

        @Override
        public Iterator<String> getPrefixes(String namespaceURI) {
            return DESIGNER_NS.equals(namespaceURI)
                    ? Collections.singletonList(DESIGNER_PREFIX).iterator()
                    : Collections.emptyIterator();
        }
    }
}
