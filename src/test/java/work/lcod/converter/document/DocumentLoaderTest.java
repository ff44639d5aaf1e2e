package work.lcod.converter.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.converter.support.ConverterTestSupport;

class DocumentLoaderTest {
    @Test
    void loadsWellFormedDocument() {
        LoadResult result = DocumentLoader.load(ConverterTestSupport.fixture("sales_filter.yxmd"));
        assertTrue(result.isSuccess());
        assertEquals("AlteryxDocument", result.document().orElseThrow().getDocumentElement().getTagName());
    }

    @Test
    void rejectsEmptyInput() {
        LoadResult result = DocumentLoader.load(new byte[0]);
        assertFalse(result.isSuccess());
        assertTrue(result.error().contains("empty"));
    }

    @Test
    void rejectsNullInput() {
        assertFalse(DocumentLoader.load(null).isSuccess());
    }

    @Test
    void reportsMalformedDocumentWithPosition() {
        LoadResult result = DocumentLoader.load(ConverterTestSupport.fixture("malformed.yxmd"));
        assertFalse(result.isSuccess());
        assertTrue(result.document().isEmpty());
        assertTrue(result.error().startsWith("Malformed workflow document (line"), result.error());
    }

    @Test
    void rejectsDoctypeDeclarations() {
        String xml = "<?xml version=\"1.0\"?>"
            + "<!DOCTYPE AlteryxDocument [<!ENTITY secret SYSTEM \"file:///etc/passwd\">]>"
            + "<AlteryxDocument>&secret;</AlteryxDocument>";
        LoadResult result = DocumentLoader.load(xml.getBytes(StandardCharsets.UTF_8));
        assertFalse(result.isSuccess());
    }

    @Test
    void failedLoadRequiresMessage() {
        assertThrows(IllegalArgumentException.class, () -> new LoadResult(Optional.empty(), " "));
    }
}
