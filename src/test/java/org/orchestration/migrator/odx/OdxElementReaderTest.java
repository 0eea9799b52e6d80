package org.orchestration.migrator.odx;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.orchestration.migrator.odx.OdxTestContent.*;

class OdxElementReaderTest {
    private static final String BODY_PATH =
            "//om:Element[@Type='ServiceBody']";

    private OdxElementReader reader;
    private Element body;

    @BeforeEach
    void setUp() {
        Document document = OdxSourceExtractor.extractDocument(odx(
                element("Receive", "r1", property("Name", "First"), property("PolicyName", "  ")),
                element("Send", "s1", property("Name", "Second"), property("Ruleset", "Rules.V2")),
                element("Receive", "r2", property("Name", "Third"))));
        reader = new OdxElementReader();
        body = reader.select(document, BODY_PATH).get(0);
    }

    @Test
    void shouldSelectChildElementsInDocumentOrder() {
        List<Element> children = reader.childElements(body);

        assertEquals(3, children.size());
        assertEquals("r1", reader.oid(children.get(0)));
        assertEquals("Send", reader.type(children.get(1)));
    }

    @Test
    void shouldFilterChildElementsByType() {
        List<Element> receives = reader.childElements(body, "Receive");

        assertEquals(2, receives.size());
        assertEquals("Third", reader.property(receives.get(1), "Name"));
        assertTrue(reader.firstChildElement(body, "Listen").isEmpty());
    }

    @Test
    void shouldEvaluateToEmptyStringWhenNothingMatches() {
        Element receive = reader.childElements(body).get(0);

        assertEquals("", reader.property(receive, "MessageName"));
        assertEquals("", reader.eval(body, "om:Element[@Type='Missing']/@OID"));
    }

    @Test
    void shouldReturnFirstMatchOfEval() {
        assertEquals("r1", reader.eval(body, "om:Element[@Type='Receive']/@OID"));
    }

    @Test
    void shouldReturnFirstNonBlankProperty() {
        Element receive = reader.childElements(body).get(0);
        Element send = reader.childElements(body).get(1);

        assertEquals("", reader.firstProperty(receive, "PolicyName", "Ruleset"));
        assertEquals("Rules.V2", reader.firstProperty(send, "PolicyName", "Ruleset"));
    }

    @Test
    void shouldWrapInvalidPaths() {
        assertThrows(OdxParseException.class, () -> reader.select(body, "om:Element[@Type="));
    }
}
