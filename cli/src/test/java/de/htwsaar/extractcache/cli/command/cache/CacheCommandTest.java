package de.htwsaar.extractcache.cli.command.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import de.htwsaar.extractcache.cache.key.Fingerprint;
import de.htwsaar.extractcache.cache.key.FingerprintDeriver;
import de.htwsaar.extractcache.cache.store.FileResultCache;
import de.htwsaar.extractcache.cache.store.SqliteResultCache;
import de.htwsaar.extractcache.cli.app.ExtractCacheCliMain;
import de.htwsaar.extractcache.cli.di.CliContext;
import de.htwsaar.extractcache.common.serialization.JacksonCodec;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CacheCommandTest {

    private static final Fingerprint KEY = Fingerprint.parse("abc123:def456:ghi789:gemini");
    private static final JsonNode VALUE = JacksonCodec.toTree(Map.of("invoice_number", "INV-001", "total", 99.5));

    @TempDir
    Path tmp;

    private StringWriter out;
    private StringWriter err;
    private Path db;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        db = tmp.resolve("cache.db");
    }

    private int run(String... args) {
        CliContext ctx = new CliContext(new PrintWriter(out, true), new PrintWriter(err, true), Clock.systemUTC());
        return ExtractCacheCliMain.commandLine(ctx).execute(args);
    }

    @Test
    void withoutSubcommand_printsUsage() {
        assertEquals(0, run("cache"));
        assertTrue(out.toString().contains("stats"));
        assertTrue(out.toString().contains("cleanup"));
    }

    @Test
    void key_printsDerivedKey() throws IOException {
        Path doc = Files.write(tmp.resolve("invoice.pdf"), "%PDF-1.4 invoice".getBytes(StandardCharsets.UTF_8));
        Path schema = Files.writeString(tmp.resolve("schema.json"), "{\"total\":\"number\",\"invoice_number\":\"string\"}");

        int rc = run("cache", "key", "--file", doc.toString(), "--prompt", "Extract invoice",
                "--schema", schema.toString(), "--provider", "Gemini", "--model", "llama3:8b");

        Fingerprint expected = FingerprintDeriver.derive(
                Files.readAllBytes(doc),
                "Extract invoice",
                Map.of("invoice_number", "string", "total", "number"),
                "gemini",
                "llama3:8b");
        assertEquals(0, rc);
        assertEquals(expected.toKeyString(), out.toString().trim());
    }

    @Test
    void key_missingDocumentIsAnError() {
        int rc = run("cache", "key", "--file", tmp.resolve("missing.pdf").toString(),
                "--prompt", "Extract", "--provider", "gemini");

        assertEquals(1, rc);
        assertTrue(err.toString().contains("Unable to derive key"));
    }

    @Test
    void get_printsStoredValue() {
        new SqliteResultCache(db, 10, null).set(KEY, VALUE);

        int rc = run("cache", "get", "--location", db.toString(), "--key", KEY.toKeyString());

        assertEquals(0, rc);
        assertEquals(VALUE, JacksonCodec.readTree(out.toString().trim()));
    }

    @Test
    void get_missReturnsNotFound() {
        int rc = run("cache", "get", "--location", db.toString(), "--key", KEY.toKeyString());

        assertEquals(3, rc);
        assertEquals("miss", out.toString().trim());
    }

    @Test
    void get_malformedKeyIsUsageError() {
        int rc = run("cache", "get", "--location", db.toString(), "--key", "only:three:parts");

        assertEquals(2, rc);
        assertTrue(err.toString().contains("--key"));
    }

    @Test
    void unknownBackendIsUsageError() {
        assertEquals(2, run("cache", "stats", "--backend", "redis"));
        assertTrue(err.toString().contains("memory, file, sqlite"));
    }

    @Test
    void memoryBackendIsRejected() {
        assertEquals(2, run("cache", "stats", "--backend", "memory"));
        assertTrue(err.toString().contains("does not persist"));
    }

    @Test
    void unusableLocationIsAnError() throws IOException {
        Path blocker = Files.writeString(tmp.resolve("blocker"), "not a directory");

        int rc = run("cache", "stats", "--backend", "file", "--location", blocker.resolve("entries").toString());

        assertEquals(1, rc);
        assertTrue(err.toString().contains("Cache storage unavailable"));
    }

    @Test
    void stats_reportsSizeAndLocation() {
        new SqliteResultCache(db, 10, null).set(KEY, VALUE);

        assertEquals(0, run("cache", "stats", "--location", db.toString()));

        String text = out.toString();
        assertTrue(text.contains("backend:   sqlite"));
        assertTrue(text.contains("entries:   1"));
        assertTrue(text.contains("max size:  1000"));
    }

    @Test
    void stats_json() {
        Path dir = tmp.resolve("entries");
        new FileResultCache(dir, null).set(KEY, VALUE);

        assertEquals(0, run("cache", "stats", "--backend", "file", "--location", dir.toString(), "--json"));

        JsonNode stats = JacksonCodec.readTree(out.toString().trim());
        assertEquals("file", stats.get("backend").asText());
        assertEquals(1, stats.get("size").asLong());
        assertEquals(0, stats.get("maxSize").asLong());
    }

    @Test
    void delete_removesEntryOnce() {
        SqliteResultCache cache = new SqliteResultCache(db, 10, null);
        cache.set(KEY, VALUE);

        assertEquals(0, run("cache", "delete", "--location", db.toString(), "--key", KEY.toKeyString()));
        assertNull(cache.get(KEY));
        assertEquals(3, run("cache", "delete", "--location", db.toString(), "--key", KEY.toKeyString()));
    }

    @Test
    void clear_reportsRemovedCount() {
        Path dir = tmp.resolve("entries");
        FileResultCache cache = new FileResultCache(dir, null);
        cache.set(KEY, VALUE);
        cache.set(Fingerprint.parse("abc123:def456:ghi789:openai:gpt-4o"), VALUE);

        assertEquals(0, run("cache", "clear", "--backend", "file", "--location", dir.toString()));

        assertEquals("Cleared 2 entries", out.toString().trim());
        assertEquals(0, cache.stats().size());
    }

    @Test
    void cleanup_removesOnlyExpiredEntries() {
        Clock past = Clock.fixed(Instant.parse("2020-01-01T00:00:00Z"), ZoneOffset.UTC);
        SqliteResultCache old = new SqliteResultCache(db, 10, null, past);
        old.set(KEY, VALUE, Duration.ofSeconds(1));
        Fingerprint durable = Fingerprint.parse("abc123:def456:ghi789:gemini:gemini-pro");
        old.set(durable, VALUE);

        assertEquals(0, run("cache", "cleanup", "--location", db.toString()));

        assertEquals("Cleaned up 1 expired entries", out.toString().trim());
        SqliteResultCache now = new SqliteResultCache(db, 10, null);
        assertNull(now.get(KEY));
        assertEquals(VALUE, now.get(durable));
    }
}
