package ca.gc.cra.trace.config;

import ca.gc.cra.trace.application.build.HashPolicy;
import ca.gc.cra.trace.domain.id.GrammarConfig;
import ca.gc.cra.trace.validation.Numbers;
import ca.gc.cra.trace.validation.Strings;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable build configuration.
 *
 * @param idPrefix identifier prefix, upper-case letters
 * @param sequenceDigits digits in an identifier sequence
 * @param namespaceLength letters in an associated-repository namespace
 * @param journeyPrefix prefix of journey identifiers
 * @param hashLength hex characters kept from the content hash
 * @param hashPolicy how stored hashes are enforced
 * @param parseParallelism worker threads parsing documents; {@code 1} parses on the calling thread
 * @param metricsExporter {@code none} or {@code otlp}
 * @param verbose whether to raise logging to DEBUG
 * @param schemaPath YAML schema file; {@code null} selects the built-in schema
 * @since 0.1.0
 */
public record TraceConfig(
    String idPrefix,
    int sequenceDigits,
    int namespaceLength,
    String journeyPrefix,
    int hashLength,
    HashPolicy hashPolicy,
    int parseParallelism,
    String metricsExporter,
    boolean verbose,
    Path schemaPath) {

  public static final int MAX_PARSE_PARALLELISM = 64;

  public TraceConfig {
    idPrefix = Strings.requireUpperLetters("idPrefix", idPrefix, 16);
    Numbers.requireRange("sequenceDigits", sequenceDigits, 1, 12);
    Numbers.requireRange("namespaceLength", namespaceLength, 1, 8);
    journeyPrefix = Strings.requireUpperLetters("journeyPrefix", journeyPrefix, 16);
    Numbers.requireRange("hashLength", hashLength, 4, 64);
    Objects.requireNonNull(hashPolicy, "hashPolicy");
    Numbers.requireRange("parseParallelism", parseParallelism, 1, MAX_PARSE_PARALLELISM);
    metricsExporter = Strings.requireNonBlank("metricsExporter", metricsExporter).toLowerCase(Locale.ROOT);
    if (!metricsExporter.equals("none") && !metricsExporter.equals("otlp")) {
      throw new IllegalArgumentException("metricsExporter must be none or otlp (was '" + metricsExporter + "')");
    }
  }

  public static TraceConfig defaults() {
    return new TraceConfig("REQ", 5, 3, "JNY", 8, HashPolicy.LENIENT, 1, "none", false, null);
  }

  public GrammarConfig grammarConfig() {
    return new GrammarConfig(idPrefix, sequenceDigits, namespaceLength);
  }

  public Optional<Path> schemaPathOptional() {
    return Optional.ofNullable(schemaPath);
  }
}
