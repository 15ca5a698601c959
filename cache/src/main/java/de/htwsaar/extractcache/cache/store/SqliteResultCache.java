package de.htwsaar.extractcache.cache.store;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.table;
import static org.jooq.impl.DSL.val;

import com.fasterxml.jackson.databind.JsonNode;
import de.htwsaar.extractcache.cache.key.Fingerprint;
import de.htwsaar.extractcache.common.serialization.ExtractCacheSerializationException;
import de.htwsaar.extractcache.common.serialization.JacksonCodec;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record3;
import org.jooq.SQLDialect;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/**
 * jOOQ-basierter Cache in einer SQLite-Datei.
 *
 * <p>Eine Tabelle {@code cache} mit den Spalten {@code key, value, created_at, ttl, last_access}.
 * Zeitstempel und TTL liegen als Sekunden ({@code REAL}) vor. Tabelle und Index werden im Konstruktor
 * angelegt, damit ein nicht nutzbarer Pfad sofort auffällt.</p>
 *
 * <p>Jede Operation öffnet eine eigene Verbindung; Schreibzugriffe laufen in einer Transaktion.
 * Mehrere Instanzen (auch aus anderen Prozessen) auf derselben Datei sehen so gegenseitig ihre
 * Änderungen, Serialisierung übernimmt das Locking von SQLite (WAL + Busy-Timeout).</p>
 *
 * <p>{@code last_access} steigt streng monoton, auch bei grober oder stehender Uhr. Die Verdrängung
 * entfernt damit immer den am längsten nicht benutzten Eintrag. Löschungen aus {@code get} greifen nur,
 * solange die Zeile noch dem gelesenen Stand entspricht.</p>
 */
public final class SqliteResultCache implements ResultCache {

    private static final Logger log = LoggerFactory.getLogger(SqliteResultCache.class);

    static final Table<?> CACHE = table(name("cache"));
    static final Field<String> KEY = field(name("key"), SQLDataType.VARCHAR);
    static final Field<String> VALUE = field(name("value"), SQLDataType.CLOB);
    static final Field<Double> CREATED_AT = field(name("created_at"), SQLDataType.DOUBLE);
    static final Field<Double> TTL = field(name("ttl"), SQLDataType.DOUBLE);
    static final Field<Double> LAST_ACCESS = field(name("last_access"), SQLDataType.DOUBLE);
    private static final Field<Long> ROWID = field("rowid", Long.class);

    // Abstand zwischen zwei Zugriffen, wenn die Uhr noch auf demselben Wert steht
    private static final double ACCESS_STEP_SECONDS = 0.000_001;

    private static final int BUSY_TIMEOUT_MS = 5_000;

    private final Path path;
    private final SQLiteDataSource dataSource;
    private final int maxSize;
    private final Duration defaultTtl;
    private final Clock clock;
    private final CacheCounters counters = new CacheCounters();

    /**
     * Öffnet (oder erzeugt) die Datenbank und legt das Schema an.
     *
     * @param path       Datenbankdatei
     * @param maxSize    maximale Anzahl Zeilen (mindestens 1)
     * @param defaultTtl Standard-TTL, {@code null} = läuft nie ab
     * @param clock      Zeitquelle
     * @throws CacheStorageException wenn Datei oder Schema nicht angelegt werden können
     */
    public SqliteResultCache(Path path, int maxSize, Duration defaultTtl, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1 but was " + maxSize);
        }
        this.path = Objects.requireNonNull(path, "path must not be null").toAbsolutePath();
        this.maxSize = maxSize;
        this.defaultTtl = Ttls.requireValid(defaultTtl);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        this.dataSource = new SQLiteDataSource(config);
        this.dataSource.setUrl("jdbc:sqlite:" + this.path);

        initSchema();
    }

    public SqliteResultCache(Path path, int maxSize, Duration defaultTtl) {
        this(path, maxSize, defaultTtl, Clock.systemUTC());
    }

    /**
     * @return absolute Datenbankdatei
     */
    public Path path() {
        return path;
    }

    private void initSchema() {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Connection conn = dataSource.getConnection()) {
                DSLContext dsl = DSL.using(conn, SQLDialect.SQLITE);
                dsl.createTableIfNotExists(CACHE)
                        .column(KEY, SQLDataType.VARCHAR.nullable(false))
                        .column(VALUE, SQLDataType.CLOB.nullable(false))
                        .column(CREATED_AT, SQLDataType.DOUBLE.nullable(false))
                        .column(TTL, SQLDataType.DOUBLE.nullable(true))
                        .column(LAST_ACCESS, SQLDataType.DOUBLE.nullable(false))
                        .constraints(DSL.primaryKey(KEY))
                        .execute();
                dsl.createIndexIfNotExists(name("idx_cache_last_access"))
                        .on(CACHE, LAST_ACCESS)
                        .execute();
            }
        } catch (IOException | SQLException | DataAccessException e) {
            throw new CacheStorageException("Unable to initialize SQLite cache", path.toString(), e);
        }
    }

    @Override
    public JsonNode get(Fingerprint key) {
        if (key == null) return null;
        String k = key.toKeyString();
        double now = nowSeconds();
        try (Connection conn = dataSource.getConnection()) {
            DSLContext dsl = DSL.using(conn, SQLDialect.SQLITE);
            Record3<String, Double, Double> row = dsl.select(VALUE, CREATED_AT, TTL)
                    .from(CACHE)
                    .where(KEY.eq(k))
                    .fetchOne();
            if (row == null) {
                counters.recordMiss();
                return null;
            }
            if (isExpired(row.value2(), row.value3(), now)) {
                dsl.deleteFrom(CACHE).where(staleRow(k, now)).execute();
                counters.recordMiss();
                return null;
            }
            JsonNode value = decode(dsl, k, row.value1());
            if (value == null) {
                counters.recordMiss();
                return null;
            }
            dsl.update(CACHE).set(LAST_ACCESS, nextAccess(now)).where(KEY.eq(k)).execute();
            counters.recordHit();
            return value;
        } catch (SQLException | DataAccessException e) {
            log.warn("SQLite cache lookup failed for {}: {}", key, e.getMessage());
            counters.recordMiss();
            return null;
        }
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

        String k = key.toKeyString();
        double now = nowSeconds();
        Double ttlSeconds = Ttls.toSeconds(ttl);
        try (Connection conn = dataSource.getConnection()) {
            String json = JacksonCodec.toJson(value);
            int evicted = DSL.using(conn, SQLDialect.SQLITE).transactionResult(cfg -> {
                DSLContext tx = DSL.using(cfg);
                tx.insertInto(CACHE, KEY, VALUE, CREATED_AT, TTL, LAST_ACCESS)
                        .values(val(k), val(json), val(now), val(ttlSeconds, TTL), nextAccess(now))
                        .onConflict(KEY)
                        .doUpdate()
                        .set(VALUE, json)
                        .set(CREATED_AT, now)
                        .set(TTL, ttlSeconds)
                        .set(LAST_ACCESS, nextAccess(now))
                        .execute();
                return evictIfNeeded(tx);
            });
            counters.recordEvictions(evicted);
        } catch (SQLException | DataAccessException | ExtractCacheSerializationException e) {
            log.warn("Failed to write SQLite cache entry {}: {}", key, e.getMessage());
        }
    }

    @Override
    public boolean delete(Fingerprint key) {
        if (key == null) return false;
        try (Connection conn = dataSource.getConnection()) {
            return DSL.using(conn, SQLDialect.SQLITE)
                            .deleteFrom(CACHE)
                            .where(KEY.eq(key.toKeyString()))
                            .execute()
                    > 0;
        } catch (SQLException | DataAccessException e) {
            log.warn("SQLite cache delete failed for {}: {}", key, e.getMessage());
            return false;
        }
    }

    @Override
    public int clear() {
        try (Connection conn = dataSource.getConnection()) {
            return DSL.using(conn, SQLDialect.SQLITE).deleteFrom(CACHE).execute();
        } catch (SQLException | DataAccessException e) {
            log.warn("SQLite cache clear failed: {}", e.getMessage());
            return 0;
        }
    }

    @Override
    public int cleanupExpired() {
        try (Connection conn = dataSource.getConnection()) {
            int removed = DSL.using(conn, SQLDialect.SQLITE)
                    .deleteFrom(CACHE)
                    .where(expiredAt(nowSeconds()))
                    .execute();
            if (removed > 0) {
                log.debug("Removed {} expired rows from {}", removed, path);
            }
            return removed;
        } catch (SQLException | DataAccessException e) {
            log.warn("SQLite cache cleanup failed: {}", e.getMessage());
            return 0;
        }
    }

    @Override
    public CacheStats stats() {
        long size = 0;
        try (Connection conn = dataSource.getConnection()) {
            size = DSL.using(conn, SQLDialect.SQLITE).fetchCount(CACHE);
        } catch (SQLException | DataAccessException e) {
            log.warn("SQLite cache count failed: {}", e.getMessage());
        }
        return counters.snapshot("sqlite", size, maxSize, path.toString());
    }

    /**
     * Entfernt die Zeilen mit dem ältesten {@code last_access}, bis höchstens {@code maxSize} übrig sind.
     *
     * @return Anzahl entfernter Zeilen
     */
    private int evictIfNeeded(DSLContext tx) {
        int count = tx.fetchCount(CACHE);
        int excess = count - maxSize;
        if (excess <= 0) {
            return 0;
        }
        int removed = tx.deleteFrom(CACHE)
                .where(KEY.in(tx.select(KEY)
                        .from(CACHE)
                        .orderBy(LAST_ACCESS.asc(), ROWID.asc())
                        .limit(excess)))
                .execute();
        log.debug("Evicted {} least recently accessed rows from {}", removed, path);
        return removed;
    }

    /**
     * Dekodiert den gespeicherten JSON-Text; unlesbare Zeilen werden gelöscht.
     */
    private JsonNode decode(DSLContext dsl, String key, String json) {
        try {
            return JacksonCodec.readTree(json);
        } catch (ExtractCacheSerializationException e) {
            log.warn("Removing undecodable SQLite cache row {}: {}", key, e.getMessage());
            dsl.deleteFrom(CACHE).where(KEY.eq(key).and(VALUE.eq(json))).execute();
            return null;
        }
    }

    private static boolean isExpired(Double createdAt, Double ttl, double now) {
        if (ttl == null || createdAt == null) {
            return false;
        }
        return now - createdAt > ttl;
    }

    private static Condition expiredAt(double now) {
        return TTL.isNotNull().and(val(now).minus(CREATED_AT).gt(TTL));
    }

    /**
     * Zeile zum Schlüssel, sofern sie zum Zeitpunkt {@code now} noch abgelaufen ist. Eine inzwischen
     * von anderer Stelle neu geschriebene Zeile erfüllt die Bedingung nicht mehr.
     */
    static Condition staleRow(String key, double now) {
        return KEY.eq(key).and(expiredAt(now));
    }

    /**
     * Nächster Zugriffszeitpunkt: {@code now}, mindestens aber knapp nach dem jüngsten Zugriff der Tabelle.
     */
    private static Field<Double> nextAccess(double now) {
        Field<Double> latest = DSL.select(DSL.max(LAST_ACCESS)).from(CACHE).asField();
        return DSL.greatest(val(now), DSL.coalesce(latest.plus(ACCESS_STEP_SECONDS), val(now)));
    }

    private double nowSeconds() {
        Instant now = clock.instant();
        return now.getEpochSecond() + now.getNano() / 1_000_000_000.0;
    }
}
