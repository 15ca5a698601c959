package de.htwsaar.extractcache.cli.app;

import de.htwsaar.extractcache.cache.key.Fingerprint;
import de.htwsaar.extractcache.cli.command.root.ExtractCacheRootCommand;
import de.htwsaar.extractcache.cli.di.CliContext;
import de.htwsaar.extractcache.cli.di.ContextFactory;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import picocli.CommandLine;

/**
 * Einstiegspunkt der CLI.
 *
 * <p>Baut den Kontext und die Picocli-Command-Struktur, führt den Befehl aus und beendet den Prozess
 * mit dessen Exit-Code.
 */
public final class ExtractCacheCliMain {

    private ExtractCacheCliMain() {}

    /**
     * Baut die Command-Struktur für einen Kontext (auch für Tests).
     *
     * @param ctx Kontext
     * @return konfigurierte {@link CommandLine}
     */
    public static CommandLine commandLine(CliContext ctx) {
        CommandLine cmd = new CommandLine(ExtractCacheRootCommand.class, new ContextFactory(ctx));
        // ungültige Schlüssel werden zu ParameterExceptions (Exit-Code 2)
        cmd.registerConverter(Fingerprint.class, Fingerprint::parse);
        cmd.setOut(ctx.out());
        cmd.setErr(ctx.err());
        return cmd;
    }

    public static void main(String[] args) {
        CliContext ctx = new CliContext(
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8),
                Clock.systemUTC());
        int rc = commandLine(ctx).execute(args);
        ctx.out().flush();
        ctx.err().flush();
        System.exit(rc);
    }
}
