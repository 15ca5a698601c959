package de.htwsaar.extractcache.cache.key;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.htwsaar.extractcache.common.util.Sha256Util;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FingerprintDeriverTest {

    private static final byte[] DOC = "content".getBytes(StandardCharsets.UTF_8);

    @Test
    void derive_isDeterministic() {
        Fingerprint k1 = FingerprintDeriver.derive(DOC, "prompt", Map.of(), "gemini");
        Fingerprint k2 = FingerprintDeriver.derive(DOC.clone(), "prompt", Map.of(), "gemini");

        assertEquals(k1, k2);
        assertEquals(k1.hashCode(), k2.hashCode());
        assertEquals(k1.toKeyString(), k2.toKeyString());
    }

    @Test
    void derive_isStableAcrossRuns() {
        Fingerprint key = FingerprintDeriver.derive(DOC, "prompt", Map.of(), "gemini");

        assertEquals(Sha256Util.sha256Hex("content"), key.contentHash());
        assertEquals(Sha256Util.sha256Hex("prompt"), key.promptHash());
        assertEquals(Sha256Util.sha256Hex("{}"), key.schemaHash());
    }

    @Test
    void identicalBytesFromDifferentFiles_collide(@TempDir Path tmp) throws Exception {
        Path a = Files.writeString(tmp.resolve("a.pdf"), "same bytes");
        Path b = Files.writeString(tmp.resolve("copy-of-a.pdf"), "same bytes");

        assertEquals(
                FingerprintDeriver.derive(Files.readAllBytes(a), "p", null, "g"),
                FingerprintDeriver.derive(Files.readAllBytes(b), "p", null, "g"));
    }

    @Test
    void everyComponent_discriminates() {
        Fingerprint base = FingerprintDeriver.derive(DOC, "A", Map.of(), "g", "m");

        assertNotEquals(base, FingerprintDeriver.derive("other".getBytes(StandardCharsets.UTF_8), "A", Map.of(), "g", "m"));
        assertNotEquals(base, FingerprintDeriver.derive(DOC, "B", Map.of(), "g", "m"));
        assertNotEquals(base, FingerprintDeriver.derive(DOC, "A", Map.of("a", 1), "g", "m"));
        assertNotEquals(base, FingerprintDeriver.derive(DOC, "A", Map.of(), "openai", "m"));
        assertNotEquals(base, FingerprintDeriver.derive(DOC, "A", Map.of(), "g", "m2"));
        assertNotEquals(base, FingerprintDeriver.derive(DOC, "A", Map.of(), "g"));
    }

    @Test
    void componentsAreHashedSeparately() {
        Fingerprint k1 = FingerprintDeriver.derive("ab".getBytes(StandardCharsets.UTF_8), "c", null, "g");
        Fingerprint k2 = FingerprintDeriver.derive("a".getBytes(StandardCharsets.UTF_8), "bc", null, "g");

        assertNotEquals(k1, k2);
    }

    @Test
    void schemaKeyOrder_doesNotMatter() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("invoice_number", "string");
        first.put("line_items", List.of(Map.of("qty", "number", "sku", "string")));

        ObjectNode second = JsonNodeFactory.instance.objectNode();
        ObjectNode item = second.putArray("line_items").addObject();
        item.put("sku", "string");
        item.put("qty", "number");
        second.put("invoice_number", "string");

        assertEquals(FingerprintDeriver.schemaHash(first), FingerprintDeriver.schemaHash(second));
        assertEquals(
                FingerprintDeriver.derive(DOC, "p", first, "g"), FingerprintDeriver.derive(DOC, "p", second, "g"));
    }

    @Test
    void providerAndModelCase_doesNotMatter() {
        assertEquals(
                FingerprintDeriver.derive(DOC, "p", null, "Gemini", "Gemini-2.5-Flash"),
                FingerprintDeriver.derive(DOC, "p", null, "gemini", "gemini-2.5-flash"));
    }

    @Test
    void promptCase_matters() {
        assertNotEquals(
                FingerprintDeriver.derive(DOC, "Extract", null, "g"), FingerprintDeriver.derive(DOC, "extract", null, "g"));
    }

    @Test
    void derive_rejectsMissingInputs() {
        assertThrows(NullPointerException.class, () -> FingerprintDeriver.derive(null, "p", null, "g"));
        assertThrows(NullPointerException.class, () -> FingerprintDeriver.derive(DOC, null, null, "g"));
        assertThrows(NullPointerException.class, () -> FingerprintDeriver.derive(DOC, "p", null, null));
    }
}
