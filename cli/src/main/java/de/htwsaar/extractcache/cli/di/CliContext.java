package de.htwsaar.extractcache.cli.di;

import java.io.PrintWriter;
import java.time.Clock;
import java.util.Objects;

/**
 * Gemeinsamer Laufzeit-Kontext für CLI-Commands.
 *
 * <p>Aufgaben:
 * - Bündelt die Ausgabekanäle (stdout/stderr).
 * - Stellt die Zeitquelle für die Cache-Backends bereit.
 * - Ermöglicht testbare Commands durch Constructor Injection statt statischer Globals.
 */
public final class CliContext {
    private final PrintWriter out;
    private final PrintWriter err;
    private final Clock clock;

    /**
     * Erzeugt einen neuen CLI-Kontext.
     *
     * @param out Writer für normale Ausgaben
     * @param err Writer für Fehlermeldungen
     * @param clock Zeitquelle für TTL-Prüfungen
     */
    public CliContext(PrintWriter out, PrintWriter err, Clock clock) {
        this.out = Objects.requireNonNull(out);
        this.err = Objects.requireNonNull(err);
        this.clock = Objects.requireNonNull(clock);
    }

    public PrintWriter out() {
        return out;
    }

    public PrintWriter err() {
        return err;
    }

    public Clock clock() {
        return clock;
    }
}
