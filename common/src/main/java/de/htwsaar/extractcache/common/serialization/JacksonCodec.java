package de.htwsaar.extractcache.common.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NumericNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.ValueNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Zentrale JSON-Kodierung für Cache-Einträge, Schemata und Ergebniswerte.
 *
 * <p>Alle Module teilen sich einen {@link ObjectMapper}; Zeitstempel werden als ISO-8601 geschrieben,
 * damit Cache-Dateien von Hand lesbar bleiben.</p>
 *
 * <p>Zahlen in Bäumen werden verlustfrei gelesen: Dezimalzahlen, die ein {@code double} nicht exakt
 * darstellen kann, bleiben {@link DecimalNode}. Ansonsten gilt für Ganz- und Dezimalzahlen dieselbe
 * Regel, der kleinste exakte Knotentyp gewinnt ({@code IntNode} vor {@code LongNode},
 * {@code DoubleNode} vor {@code DecimalNode}). Dadurch liefert Schreiben und erneutes Lesen
 * denselben Baum wie {@link #toTree(Object)} bzw. {@link #readTree(String)}.</p>
 */
public final class JacksonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static {
        // register the module
        MAPPER.registerModule(new JavaTimeModule());
        MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        MAPPER.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        MAPPER.setNodeFactory(new ExactNumberNodeFactory());
    }

    private JacksonCodec() {
        // Utility
    }

    /**
     * Gibt den geteilten Mapper zurück (z. B. für Node-Factories).
     *
     * @return konfigurierter {@link ObjectMapper}
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Object obj) {
        try {
            return MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExtractCacheSerializationException("Failed to serialize object to the JSON format !", e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return MAPPER.readValue(json, clazz);
        } catch (JsonProcessingException e) {
            throw new ExtractCacheSerializationException(
                    "Failed to deserialize JSON format to : [" + clazz.getSimpleName() + "]", e);
        }
    }

    /**
     * Liest JSON direkt aus Bytes; die Zeichenkodierung erkennt Jackson selbst.
     *
     * @param json  JSON-Bytes
     * @param clazz Zieltyp
     * @return gelesener Wert
     * @throws ExtractCacheSerializationException bei ungültigem JSON oder ungültiger Kodierung
     */
    public static <T> T fromJson(byte[] json, Class<T> clazz) {
        try {
            return MAPPER.readValue(json, clazz);
        } catch (IOException e) {
            throw new ExtractCacheSerializationException(
                    "Failed to deserialize JSON format to : [" + clazz.getSimpleName() + "]", e);
        }
    }

    /**
     * Liest beliebiges JSON als Baum.
     *
     * @param json JSON-Text
     * @return geparster Baum
     * @throws ExtractCacheSerializationException bei ungültigem JSON
     */
    public static JsonNode readTree(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ExtractCacheSerializationException("Failed to parse JSON tree", e);
        }
    }

    /**
     * Wandelt ein Objekt (POJO, Record, Map, Liste, ...) in einen JSON-Baum um.
     *
     * @param value Objekt oder {@code null}
     * @return Baum; {@code NullNode} für {@code null}
     */
    public static JsonNode toTree(Object value) {
        try {
            return MAPPER.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new ExtractCacheSerializationException("Failed to convert object to a JSON tree", e);
        }
    }

    /**
     * Wandelt einen JSON-Baum in den Zieltyp um.
     *
     * @param tree  Baum
     * @param clazz Zieltyp
     * @return konvertierter Wert
     */
    public static <T> T fromTree(JsonNode tree, Class<T> clazz) {
        try {
            return MAPPER.treeToValue(tree, clazz);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ExtractCacheSerializationException(
                    "Failed to convert JSON tree to : [" + clazz.getSimpleName() + "]", e);
        }
    }

    /**
     * Serialisiert ein Objekt in eine kanonische, reihenfolgeunabhängige Textform.
     *
     * <p>Objekt-Schlüssel werden auf allen Ebenen lexikographisch sortiert, Array-Reihenfolge bleibt
     * erhalten. Zwei logisch gleiche Strukturen liefern damit denselben Text, egal in welcher
     * Reihenfolge sie aufgebaut wurden.</p>
     *
     * @param value Objekt oder {@code null}
     * @return kanonisches, kompaktes JSON
     */
    public static String toCanonicalJson(Object value) {
        return toJson(canonicalize(toTree(value)));
    }

    private static JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> it = node.fieldNames();
            while (it.hasNext()) {
                names.add(it.next());
            }
            Collections.sort(names);
            ObjectNode sorted = MAPPER.createObjectNode();
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode copy = MAPPER.createArrayNode();
            for (JsonNode child : node) {
                copy.add(canonicalize(child));
            }
            return copy;
        }
        return node;
    }

    /**
     * Node-Factory, die Zahlen auf den kleinsten exakten Knotentyp abbildet.
     */
    static final class ExactNumberNodeFactory extends JsonNodeFactory {

        private static final long serialVersionUID = 1L;

        ExactNumberNodeFactory() {
            // keine Normalisierung von 1.50 zu 1.5
            super(true);
        }

        @Override
        public NumericNode numberNode(long v) {
            if (v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE) {
                return IntNode.valueOf((int) v);
            }
            return super.numberNode(v);
        }

        @Override
        public ValueNode numberNode(Long value) {
            return value == null ? nullNode() : numberNode(value.longValue());
        }

        @Override
        public ValueNode numberNode(BigDecimal v) {
            if (v == null) {
                return nullNode();
            }
            double d = v.doubleValue();
            if (Double.isFinite(d) && new BigDecimal(Double.toString(d)).compareTo(v) == 0) {
                return DoubleNode.valueOf(d);
            }
            return DecimalNode.valueOf(v);
        }
    }
}
