package de.htwsaar.extractcache.cli.command.cache;

import de.htwsaar.extractcache.cache.store.ResultCache;
import picocli.CommandLine.Command;

@Command(name = "cleanup", description = "Remove expired cache entries", mixinStandardHelpOptions = true)
public final class CacheCleanupCommand extends AbstractCacheSubcommand {

    @Override
    protected int execute(ResultCache cache) {
        ctx().out().printf("Cleaned up %d expired entries%n", cache.cleanupExpired());
        return CacheCommand.EXIT_OK;
    }
}
