package de.htwsaar.extractcache.cli.command.cache;

import com.fasterxml.jackson.databind.JsonNode;
import de.htwsaar.extractcache.cache.key.Fingerprint;
import de.htwsaar.extractcache.cache.store.ResultCache;
import de.htwsaar.extractcache.common.serialization.JacksonCodec;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Gibt den gespeicherten Wert zu einem Schlüssel aus.
 */
@Command(name = "get", description = "Print the cached value for a key", mixinStandardHelpOptions = true)
public final class CacheGetCommand extends AbstractCacheSubcommand {

    @Option(names = {"-k", "--key"}, required = true, paramLabel = "KEY", description = "Schlüssel aus 'cache key'")
    private Fingerprint key;

    @Override
    protected int execute(ResultCache cache) {
        JsonNode value = cache.get(key);
        if (value == null) {
            ctx().out().println("miss");
            return CacheCommand.EXIT_NOT_FOUND;
        }
        ctx().out().println(JacksonCodec.toJson(value));
        return CacheCommand.EXIT_OK;
    }
}
