package de.htwsaar.extractcache.cli.command.root;

import de.htwsaar.extractcache.cli.command.cache.CacheCommand;
import de.htwsaar.extractcache.cli.di.CliContext;
import java.util.Objects;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root-Command des CLI-Kommandobaums.
 */
@Command(
        name = "extractcache",
        description = "Inspect and maintain the extraction result cache",
        mixinStandardHelpOptions = true,
        version = "extractcache 0.1.0",
        subcommands = {CacheCommand.class, HelpCommand.class})
public final class ExtractCacheRootCommand implements Runnable {

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    public ExtractCacheRootCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().flush();
    }
}
