package work.lcod.converter.document;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Parses raw workflow bytes into a DOM tree. Never throws for bad input; failures come back as a {@link LoadResult}.
 */
public final class DocumentLoader {
    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);

    private static final ErrorHandler QUIET_ERRORS = new ErrorHandler() {
        @Override
        public void warning(SAXParseException ex) {
            log.debug("XML warning at line {}: {}", ex.getLineNumber(), ex.getMessage());
        }

        @Override
        public void error(SAXParseException ex) throws SAXException {
            throw ex;
        }

        @Override
        public void fatalError(SAXParseException ex) throws SAXException {
            throw ex;
        }
    };

    private DocumentLoader() {}

    public static LoadResult load(byte[] raw) {
        if (raw == null || raw.length == 0) {
            return LoadResult.failure("Workflow document is empty");
        }
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            builder.setErrorHandler(QUIET_ERRORS);
            Document document = builder.parse(new ByteArrayInputStream(raw));
            if (document.getDocumentElement() == null) {
                return LoadResult.failure("Workflow document has no root element");
            }
            return LoadResult.success(document);
        } catch (SAXParseException ex) {
            String message = "Malformed workflow document (line " + ex.getLineNumber()
                + ", column " + ex.getColumnNumber() + "): " + ex.getMessage();
            log.warn(message);
            return LoadResult.failure(message);
        } catch (SAXException | IOException ex) {
            String message = "Unable to read workflow document: " + ex.getMessage();
            log.warn(message);
            return LoadResult.failure(message);
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser is not available", ex);
        }
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        var factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        return factory;
    }
}
