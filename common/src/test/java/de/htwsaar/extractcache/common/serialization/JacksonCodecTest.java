package de.htwsaar.extractcache.common.serialization;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JacksonCodecTest {

    record Invoice(String invoiceNumber, double total) {}

    record Stamp(Instant at) {}

    @Test
    void testToJson() {
        String json = JacksonCodec.toJson(new Invoice("INV-001", 1500.0));

        assertNotNull(json);
        assertTrue(json.contains("\"invoiceNumber\":\"INV-001\""));
        assertTrue(json.contains("\"total\":1500.0"));
    }

    @Test
    void testFromJson() {
        Invoice invoice = JacksonCodec.fromJson("{\"invoiceNumber\":\"INV-002\",\"total\":12.5}", Invoice.class);

        assertEquals("INV-002", invoice.invoiceNumber());
        assertEquals(12.5, invoice.total());
    }

    @Test
    void testFromJson_InvalidJson_ThrowsException() {
        // Kein gültiges JSON
        String invalidJson = "{invoiceNumber: kaputt}";
        assertThrows(ExtractCacheSerializationException.class, () -> JacksonCodec.fromJson(invalidJson, Invoice.class));
        assertThrows(ExtractCacheSerializationException.class, () -> JacksonCodec.readTree(invalidJson));
    }

    @Test
    void instantsAreWrittenAsIsoText() {
        String json = JacksonCodec.toJson(new Stamp(Instant.parse("2026-01-01T00:00:00Z")));

        assertEquals("{\"at\":\"2026-01-01T00:00:00Z\"}", json);
    }

    @Test
    void treeConversionKeepsValues() {
        JsonNode tree = JacksonCodec.toTree(new Invoice("INV-003", 99.0));

        assertEquals("INV-003", tree.get("invoiceNumber").asText());
        assertEquals(new Invoice("INV-003", 99.0), JacksonCodec.fromTree(tree, Invoice.class));
    }

    @Test
    void canonicalJson_isIndependentOfKeyOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("b", 2);
        first.put("a", Map.of("y", 1, "x", List.of(3, 1)));

        Map<String, Object> second = new LinkedHashMap<>();
        second.put("a", new LinkedHashMap<>(Map.of("x", List.of(3, 1), "y", 1)));
        second.put("b", 2);

        assertEquals(JacksonCodec.toCanonicalJson(first), JacksonCodec.toCanonicalJson(second));
        assertEquals("{\"a\":{\"x\":[3,1],\"y\":1},\"b\":2}", JacksonCodec.toCanonicalJson(first));
    }

    @Test
    void canonicalJson_keepsArrayOrder() {
        assertNotEquals(JacksonCodec.toCanonicalJson(List.of(1, 2)), JacksonCodec.toCanonicalJson(List.of(2, 1)));
    }

    @Test
    void canonicalJson_ofNullAndEmptyObject() {
        assertEquals("null", JacksonCodec.toCanonicalJson(null));
        assertEquals("{}", JacksonCodec.toCanonicalJson(Map.of()));
    }

    @Test
    void readTree_keepsDecimalsThatDoNotFitADouble() {
        JsonNode tree = JacksonCodec.readTree("{\"amount\":12345678901234567.89}");

        assertEquals(DecimalNode.valueOf(new BigDecimal("12345678901234567.89")), tree.get("amount"));
    }

    @Test
    void readTree_usesNarrowestExactNumberNode() {
        JsonNode tree = JacksonCodec.readTree("[5, 5000000000, 19.99, 1500.0]");

        assertEquals(IntNode.valueOf(5), tree.get(0));
        assertEquals(LongNode.valueOf(5_000_000_000L), tree.get(1));
        assertEquals(DoubleNode.valueOf(19.99), tree.get(2));
        assertEquals(DoubleNode.valueOf(1500.0), tree.get(3));
    }

    @Test
    void toTree_andReadTree_agreeOnNumbers() {
        record Amounts(long small, long large, double price, BigDecimal exact) {}
        Amounts amounts = new Amounts(5L, 5_000_000_000L, 19.99, new BigDecimal("12345678901234567.89"));

        JsonNode tree = JacksonCodec.toTree(amounts);

        assertEquals(tree, JacksonCodec.readTree(JacksonCodec.toJson(tree)));
        assertEquals(IntNode.valueOf(5), tree.get("small"));
    }

    @Test
    void fromJsonBytes_rejectsInvalidEncoding() {
        byte[] garbage = {(byte) 0xFF, (byte) 0xFE, (byte) 0xC3, (byte) 0x28};

        assertThrows(ExtractCacheSerializationException.class, () -> JacksonCodec.fromJson(garbage, Stamp.class));
        assertEquals(
                new Stamp(Instant.parse("2026-01-01T00:00:00Z")),
                JacksonCodec.fromJson(
                        "{\"at\":\"2026-01-01T00:00:00Z\"}".getBytes(StandardCharsets.UTF_8), Stamp.class));
    }
}
