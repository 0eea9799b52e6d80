package org.orchestration.migrator.odx;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;

/**
 * Isolates the designer XML embedded in an ODX file. The file holds the XML segment
 * first and the generated orchestration code after the {@code #endif} sentinel.
 */
public class OdxSourceExtractor {
    private static final Logger log = LoggerFactory.getLogger(OdxSourceExtractor.class);

    public static final String XML_DECLARATION = "<?xml";
    public static final String SENTINEL = "#endif";

    /**
     * Cuts the XML document out of the raw file text, from the XML declaration
     * (inclusive) up to the first sentinel after it (exclusive).
     *
     * @param rawContent the complete file content
     * @return the XML document text
     * @throws OdxFormatException if the declaration or the sentinel is missing
     */
    public static String extractXml(String rawContent) {
        if (rawContent == null) {
            throw new OdxFormatException("ODX content is empty");
        }
        int start = rawContent.indexOf(XML_DECLARATION);
        if (start < 0) {
            throw new OdxFormatException("XML declaration '" + XML_DECLARATION + "' not found in ODX content");
        }
        int end = rawContent.indexOf(SENTINEL, start);
        if (end < 0) {
            throw new OdxFormatException("Sentinel '" + SENTINEL + "' not found after the XML declaration");
        }
        return rawContent.substring(start, end);
    }

    /**
     * Parses the extracted XML into a namespace-aware DOM.
     *
     * @param xml the XML document text
     * @return the parsed document
     * @throws OdxFormatException with line and column if the XML is not well-formed
     */
    public static Document parseDocument(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new RethrowingErrorHandler());
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXParseException e) {
            throw new OdxFormatException("Malformed designer XML: " + e.getMessage(),
                    e.getLineNumber(), e.getColumnNumber(), e);
        } catch (SAXException e) {
            throw new OdxFormatException("Malformed designer XML: " + e.getMessage());
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not configurable", e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Extracts and parses in one step.
     */
    public static Document extractDocument(String rawContent) {
        return parseDocument(extractXml(rawContent));
    }

    // keeps the parser from printing "[Fatal Error]" to stderr
    private static class RethrowingErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException exception) {
            log.debug("XML warning at {}:{}: {}", exception.getLineNumber(),
                    exception.getColumnNumber(), exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
