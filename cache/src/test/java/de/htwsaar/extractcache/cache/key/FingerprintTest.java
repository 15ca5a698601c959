package de.htwsaar.extractcache.cache.key;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FingerprintTest {

    @Test
    void keyString_withoutModel_hasFourSegments() {
        Fingerprint key = new Fingerprint("abc123", "def456", "ghi789", "gemini");

        assertEquals("abc123:def456:ghi789:gemini", key.toKeyString());
        assertEquals("", key.model());
    }

    @Test
    void keyString_withModel_hasFiveSegments() {
        Fingerprint key = new Fingerprint("a1b2c3", "d4e5f6", "g7h8i9", "gemini", "gemini-2.5-flash");

        assertEquals("a1b2c3:d4e5f6:g7h8i9:gemini:gemini-2.5-flash", key.toKeyString());
    }

    @Test
    void providerAndModel_areCaseInsensitive() {
        Fingerprint upper = new Fingerprint("c", "p", "s", "OpenAI", "GPT-4o");
        Fingerprint lower = new Fingerprint("c", "p", "s", "openai", "gpt-4o");

        assertEquals(lower, upper);
        assertEquals(lower.hashCode(), upper.hashCode());
        assertEquals("openai", upper.provider());
    }

    @Test
    void nullModel_equalsEmptyModel() {
        assertEquals(new Fingerprint("c", "p", "s", "g", null), new Fingerprint("c", "p", "s", "g"));
    }

    @Test
    void worksAsHashMapKey() {
        Map<Fingerprint, String> map = new HashMap<>();
        map.put(new Fingerprint("c", "p", "s", "g", "m"), "value");

        assertEquals("value", map.get(new Fingerprint("c", "p", "s", "G", "M")));
        assertNull(map.get(new Fingerprint("c", "p", "s", "g")));
    }

    @Test
    void parse_roundTripsKeyString() {
        Fingerprint withModel = new Fingerprint("c", "p", "s", "ollama", "llama3:8b");
        Fingerprint withoutModel = new Fingerprint("c", "p", "s", "gemini");

        assertEquals(withModel, Fingerprint.parse(withModel.toKeyString()));
        assertEquals(withoutModel, Fingerprint.parse(withoutModel.toKeyString()));
    }

    @Test
    void parse_rejectsMalformedKeys() {
        assertThrows(IllegalArgumentException.class, () -> Fingerprint.parse(""));
        assertThrows(IllegalArgumentException.class, () -> Fingerprint.parse("a:b:c"));
        assertThrows(IllegalArgumentException.class, () -> Fingerprint.parse("a::c:d"));
    }

    @Test
    void components_mustNotBeBlankOrContainDelimiter() {
        assertThrows(IllegalArgumentException.class, () -> new Fingerprint(" ", "p", "s", "g"));
        assertThrows(IllegalArgumentException.class, () -> new Fingerprint("c", "p", "s", "vertex:gemini"));
        assertThrows(NullPointerException.class, () -> new Fingerprint("c", null, "s", "g"));
    }
}
