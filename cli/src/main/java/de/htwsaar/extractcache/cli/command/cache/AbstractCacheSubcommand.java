package de.htwsaar.extractcache.cli.command.cache;

import de.htwsaar.extractcache.cache.store.CacheStorageException;
import de.htwsaar.extractcache.cache.store.ResultCache;
import de.htwsaar.extractcache.cli.di.CliContext;
import java.util.concurrent.Callable;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.ParentCommand;

/**
 * Basis für Subcommands, die ein Backend öffnen.
 *
 * <p>Ein nicht nutzbarer Speicherort wird als Fehlermeldung mit Exit-Code 1 ausgegeben.
 */
abstract class AbstractCacheSubcommand implements Callable<Integer> {

    @ParentCommand
    private CacheCommand parent;

    @Mixin
    private CacheOptions options;

    @Override
    public final Integer call() {
        ResultCache cache;
        try {
            cache = options.open(ctx().clock());
        } catch (CacheStorageException e) {
            ctx().err().printf("Cache storage unavailable: %s%n", e.getMessage());
            ctx().err().flush();
            return CacheCommand.EXIT_ERROR;
        }
        int rc = execute(cache);
        ctx().out().flush();
        return rc;
    }

    /**
     * Führt den Befehl gegen das geöffnete Backend aus.
     *
     * @param cache Backend
     * @return Exit-Code
     */
    protected abstract int execute(ResultCache cache);

    protected CliContext ctx() {
        return parent.ctx();
    }
}
