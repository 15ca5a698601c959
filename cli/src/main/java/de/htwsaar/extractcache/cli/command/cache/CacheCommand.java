package de.htwsaar.extractcache.cli.command.cache;

import de.htwsaar.extractcache.cli.di.CliContext;
import java.util.Objects;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Commands für einen persistenten Ergebnis-Cache (File oder SQLite).
 *
 * <p>Ohne Subcommand wird die Usage angezeigt. Die Backend-Optionen kommen über {@link CacheOptions}.
 *
 * <p>Exit-Codes:
 * - 0: OK
 * - 1: Speicher nicht nutzbar / unerwarteter Fehler
 * - 2: ungültige Argumente
 * - 3: Eintrag nicht gefunden
 */
@Command(
        name = "cache",
        description = "Operations on a durable result cache",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  extractcache cache stats --backend sqlite --location .extractcache/cache.db",
            "  extractcache cache key --file invoice.pdf --prompt \"Extract\" --provider gemini",
            "  extractcache cache cleanup --backend file --location .extractcache/entries"
        },
        subcommands = {
            CacheKeyCommand.class,
            CacheGetCommand.class,
            CacheStatsCommand.class,
            CacheDeleteCommand.class,
            CacheClearCommand.class,
            CacheCleanupCommand.class
        })
public final class CacheCommand implements Runnable {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_NOT_FOUND = 3;

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    /**
     * Konstruktor für Constructor Injection via {@code ContextFactory}.
     *
     * @param ctx CLI-Kontext
     */
    public CacheCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().flush();
    }

    CliContext ctx() {
        return ctx;
    }
}
