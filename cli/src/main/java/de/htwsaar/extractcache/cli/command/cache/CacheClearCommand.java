package de.htwsaar.extractcache.cli.command.cache;

import de.htwsaar.extractcache.cache.store.ResultCache;
import picocli.CommandLine.Command;

@Command(name = "clear", description = "Remove all cache entries", mixinStandardHelpOptions = true)
public final class CacheClearCommand extends AbstractCacheSubcommand {

    @Override
    protected int execute(ResultCache cache) {
        ctx().out().printf("Cleared %d entries%n", cache.clear());
        return CacheCommand.EXIT_OK;
    }
}
