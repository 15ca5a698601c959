package de.htwsaar.extractcache.cli.command.cache;

import de.htwsaar.extractcache.cache.key.Fingerprint;
import de.htwsaar.extractcache.cache.store.ResultCache;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Entfernt einen einzelnen Eintrag.
 */
@Command(name = "delete", description = "Delete one cache entry", mixinStandardHelpOptions = true)
public final class CacheDeleteCommand extends AbstractCacheSubcommand {

    @Option(names = {"-k", "--key"}, required = true, paramLabel = "KEY", description = "Schlüssel aus 'cache key'")
    private Fingerprint key;

    @Override
    protected int execute(ResultCache cache) {
        if (cache.delete(key)) {
            ctx().out().printf("Deleted %s%n", key);
            return CacheCommand.EXIT_OK;
        }
        ctx().out().printf("Not found: %s%n", key);
        return CacheCommand.EXIT_NOT_FOUND;
    }
}
