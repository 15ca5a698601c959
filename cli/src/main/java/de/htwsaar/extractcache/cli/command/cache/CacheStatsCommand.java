package de.htwsaar.extractcache.cli.command.cache;

import de.htwsaar.extractcache.cache.store.CacheStats;
import de.htwsaar.extractcache.cache.store.ResultCache;
import de.htwsaar.extractcache.common.serialization.JacksonCodec;
import java.io.PrintWriter;
import java.util.Locale;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Zeigt Größe und Zähler eines Caches.
 *
 * <p>Hit/Miss-Zähler gelten pro Prozess; für einen frisch geöffneten Cache sind sie 0.
 */
@Command(name = "stats", description = "Show cache size and location", mixinStandardHelpOptions = true)
public final class CacheStatsCommand extends AbstractCacheSubcommand {

    @Option(names = "--json", description = "Rohdaten als JSON ausgeben")
    private boolean json;

    @Override
    protected int execute(ResultCache cache) {
        CacheStats stats = cache.stats();
        PrintWriter out = ctx().out();
        if (json) {
            out.println(JacksonCodec.toJson(stats));
            return CacheCommand.EXIT_OK;
        }
        out.printf("backend:   %s%n", stats.backend());
        out.printf("location:  %s%n", stats.location());
        out.printf("entries:   %d%n", stats.size());
        out.printf("max size:  %s%n", stats.maxSize() == 0 ? "unbounded" : String.valueOf(stats.maxSize()));
        out.printf(Locale.ROOT, "hit rate:  %.2f (%d hits / %d misses)%n", stats.hitRate(), stats.hits(), stats.misses());
        out.printf("evictions: %d%n", stats.evictions());
        return CacheCommand.EXIT_OK;
    }
}
