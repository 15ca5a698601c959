package de.htwsaar.extractcache.cache.store;

import com.fasterxml.jackson.databind.JsonNode;
import de.htwsaar.extractcache.cache.key.Fingerprint;
import de.htwsaar.extractcache.common.serialization.ExtractCacheSerializationException;
import de.htwsaar.extractcache.common.serialization.JacksonCodec;
import de.htwsaar.extractcache.common.util.Sha256Util;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persistenter Cache mit einer JSON-Datei pro Eintrag.
 *
 * <p>Der Dateiname ist der SHA-256 Hash der kanonischen Schlüsselform plus {@code .json}. Jede Datei
 * enthält {@code {key, value, createdAt, ttlSeconds}} und lässt sich von Hand inspizieren.</p>
 *
 * <p>Schreiben erfolgt über eine temporäre Datei im selben Verzeichnis und anschließendes atomisches
 * Umbenennen, sodass parallele Leser (auch aus anderen Prozessen) nie eine halb geschriebene Datei
 * sehen. Unlesbare Dateien gelten als Miss und werden entfernt.</p>
 *
 * <p>Abgelaufene oder unlesbare Dateien werden nur gelöscht, solange ihr Inhalt noch dem gelesenen
 * Stand entspricht. Hat eine andere Instanz den Eintrag inzwischen neu geschrieben, bleibt er erhalten.</p>
 */
public final class FileResultCache implements ResultCache {

    private static final Logger log = LoggerFactory.getLogger(FileResultCache.class);

    static final String ENTRY_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final Duration defaultTtl;
    private final Clock clock;
    private final CacheCounters counters = new CacheCounters();

    /**
     * Gespeichertes Format einer Cache-Datei.
     *
     * @param key        kanonischer Schlüssel (zur Kontrolle gegen Hash-Kollisionen)
     * @param value      Ergebniswert
     * @param createdAt  Einfügezeitpunkt
     * @param ttlSeconds Lebensdauer in Sekunden oder {@code null}
     */
    record PersistedEntry(String key, JsonNode value, Instant createdAt, Double ttlSeconds) {}

    /**
     * Erstellt den Cache und legt das Verzeichnis bei Bedarf an.
     *
     * @param directory  Cache-Verzeichnis
     * @param defaultTtl Standard-TTL, {@code null} = läuft nie ab
     * @param clock      Zeitquelle
     * @throws CacheStorageException wenn das Verzeichnis nicht angelegt werden kann
     */
    public FileResultCache(Path directory, Duration defaultTtl, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null").toAbsolutePath();
        this.defaultTtl = Ttls.requireValid(defaultTtl);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        try {
            Files.createDirectories(this.directory);
        } catch (IOException e) {
            throw new CacheStorageException("Unable to create cache directory", this.directory.toString(), e);
        }
        if (!Files.isDirectory(this.directory) || !Files.isWritable(this.directory)) {
            throw new CacheStorageException("Cache directory is not writable", this.directory.toString(), null);
        }
    }

    public FileResultCache(Path directory, Duration defaultTtl) {
        this(directory, defaultTtl, Clock.systemUTC());
    }

    /**
     * @return absolutes Cache-Verzeichnis
     */
    public Path directory() {
        return directory;
    }

    /**
     * Datei, unter der ein Schlüssel gespeichert wird.
     *
     * @param key Fingerprint
     * @return Pfad im Cache-Verzeichnis
     */
    public Path fileFor(Fingerprint key) {
        return directory.resolve(Sha256Util.sha256Hex(key.toKeyString()) + ENTRY_SUFFIX);
    }

    @Override
    public JsonNode get(Fingerprint key) {
        if (key == null) return null;
        Path file = fileFor(key);

        byte[] content = readBytes(file);
        if (content == null) {
            counters.recordMiss();
            return null;
        }
        PersistedEntry entry = parse(file, content);
        if (entry == null) {
            deleteIfUnchanged(file, content);
            counters.recordMiss();
            return null;
        }
        if (!key.toKeyString().equals(entry.key())) {
            log.warn("Cache file {} belongs to a different key, treating as miss", file.getFileName());
            counters.recordMiss();
            return null;
        }
        if (Ttls.isExpired(entry.createdAt(), Ttls.fromSeconds(entry.ttlSeconds()), clock.instant())) {
            deleteIfUnchanged(file, content);
            counters.recordMiss();
            return null;
        }
        counters.recordHit();
        return entry.value();
    }

    @Override
    public void set(Fingerprint key, JsonNode value) {
        set(key, value, defaultTtl);
    }

    @Override
    public void set(Fingerprint key, JsonNode value, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Ttls.requireValid(ttl);

        Path target = fileFor(key);
        PersistedEntry entry = new PersistedEntry(key.toKeyString(), value, clock.instant(), Ttls.toSeconds(ttl));
        Path tmp = null;
        try {
            String json = JacksonCodec.toJson(entry);
            Files.createDirectories(directory);
            tmp = Files.createTempFile(directory, target.getFileName().toString(), TEMP_SUFFIX);
            Files.writeString(tmp, json);
            moveIntoPlace(tmp, target);
            tmp = null;
        } catch (IOException | ExtractCacheSerializationException e) {
            log.warn("Failed to write cache entry {}: {}", key, e.getMessage());
        } finally {
            if (tmp != null) {
                deleteQuietly(tmp);
            }
        }
    }

    @Override
    public boolean delete(Fingerprint key) {
        if (key == null) return false;
        return deleteQuietly(fileFor(key));
    }

    /**
     * Entfernt alle Einträge sowie liegengebliebene Temp-Dateien abgebrochener Schreibvorgänge.
     * Fremde Dateien im Verzeichnis bleiben unberührt.
     *
     * @return Anzahl entfernter Einträge (ohne Temp-Dateien)
     */
    @Override
    public int clear() {
        int removed = 0;
        for (Path file : listEntryFiles()) {
            if (deleteQuietly(file)) removed++;
        }
        for (Path tmp : listFiles("*" + ENTRY_SUFFIX + "*" + TEMP_SUFFIX)) {
            deleteQuietly(tmp);
        }
        return removed;
    }

    @Override
    public int cleanupExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Path file : listEntryFiles()) {
            byte[] content = readBytes(file);
            if (content == null) {
                continue;
            }
            PersistedEntry entry = parse(file, content);
            // unlesbare Dateien zählen als abgelaufen
            boolean expired = entry == null
                    || Ttls.isExpired(entry.createdAt(), Ttls.fromSeconds(entry.ttlSeconds()), now);
            if (expired && deleteIfUnchanged(file, content)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Removed {} expired entries from {}", removed, directory);
        }
        return removed;
    }

    @Override
    public CacheStats stats() {
        return counters.snapshot("file", listEntryFiles().size(), 0, directory.toString());
    }

    /**
     * Liest den Rohinhalt einer Cache-Datei.
     *
     * @return Bytes oder {@code null} wenn die Datei fehlt oder nicht lesbar ist
     */
    private static byte[] readBytes(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            log.warn("Unable to read cache file {}: {}", file.getFileName(), e.getMessage());
            return null;
        }
    }

    /**
     * Dekodiert und validiert einen Dateiinhalt. Falsche Zeichenkodierung gilt ebenfalls als defekt.
     *
     * @return Eintrag oder {@code null} wenn der Inhalt defekt ist
     */
    private static PersistedEntry parse(Path file, byte[] content) {
        try {
            PersistedEntry entry = JacksonCodec.fromJson(content, PersistedEntry.class);
            if (entry == null || entry.key() == null || entry.value() == null || entry.createdAt() == null) {
                throw new ExtractCacheSerializationException("Incomplete cache entry");
            }
            return entry;
        } catch (ExtractCacheSerializationException e) {
            log.warn("Corrupt cache file {}: {}", file.getFileName(), e.getMessage());
            return null;
        }
    }

    /**
     * Löscht eine Datei nur, wenn sie noch den erwarteten Inhalt hat.
     *
     * @param file     Cache-Datei
     * @param expected zuvor gelesener Inhalt
     * @return {@code true} wenn die Datei entfernt wurde
     */
    static boolean deleteIfUnchanged(Path file, byte[] expected) {
        byte[] current = readBytes(file);
        if (current == null) {
            return false;
        }
        if (!Arrays.equals(current, expected)) {
            log.debug("Cache file {} was rewritten concurrently, keeping it", file.getFileName());
            return false;
        }
        return deleteQuietly(file);
    }

    private List<Path> listEntryFiles() {
        return listFiles("*" + ENTRY_SUFFIX);
    }

    private List<Path> listFiles(String glob) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) files.add(p);
            }
        } catch (IOException e) {
            log.warn("Unable to list cache directory {}: {}", directory, e.getMessage());
        }
        return files;
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static boolean deleteQuietly(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Unable to delete cache file {}: {}", file.getFileName(), e.getMessage());
            return false;
        }
    }
}
