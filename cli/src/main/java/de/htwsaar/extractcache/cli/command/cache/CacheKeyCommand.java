package de.htwsaar.extractcache.cli.command.cache;

import com.fasterxml.jackson.databind.JsonNode;
import de.htwsaar.extractcache.cache.key.Fingerprint;
import de.htwsaar.extractcache.cache.key.FingerprintDeriver;
import de.htwsaar.extractcache.common.serialization.ExtractCacheSerializationException;
import de.htwsaar.extractcache.common.serialization.JacksonCodec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

/**
 * Berechnet den Cache-Schlüssel einer Anfrage, ohne auf einen Cache zuzugreifen.
 *
 * <p>Gehasht wird der Dateiinhalt, nicht der Pfad: Kopien derselben Datei ergeben denselben Schlüssel.
 */
@Command(
        name = "key",
        description = "Derive the cache key for a document, prompt and schema",
        mixinStandardHelpOptions = true)
public final class CacheKeyCommand implements Callable<Integer> {

    @ParentCommand
    private CacheCommand parent;

    @Option(names = {"-f", "--file"}, required = true, paramLabel = "DOCUMENT", description = "Eingabedokument")
    private Path file;

    @Option(names = {"-p", "--prompt"}, required = true, paramLabel = "TEXT", description = "Extraktions-Prompt")
    private String prompt;

    @Option(names = {"-s", "--schema"}, paramLabel = "JSON_FILE", description = "Schema als JSON-Datei (optional)")
    private Path schema;

    @Option(names = "--provider", required = true, paramLabel = "NAME", description = "Provider, z. B. gemini")
    private String provider;

    @Option(names = {"-m", "--model"}, paramLabel = "NAME", description = "Modell (optional)")
    private String model;

    @Override
    public Integer call() {
        try {
            byte[] document = Files.readAllBytes(file);
            JsonNode schemaTree = schema == null ? null : JacksonCodec.readTree(Files.readString(schema, StandardCharsets.UTF_8));
            Fingerprint key = FingerprintDeriver.derive(document, prompt, schemaTree, provider, model);
            parent.ctx().out().println(key.toKeyString());
            parent.ctx().out().flush();
            return CacheCommand.EXIT_OK;
        } catch (IOException | ExtractCacheSerializationException e) {
            parent.ctx().err().printf("Unable to derive key: %s%n", e.getMessage());
            parent.ctx().err().flush();
            return CacheCommand.EXIT_ERROR;
        }
    }
}
