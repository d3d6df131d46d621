package ca.gc.cra.trace.config;

import ca.gc.cra.trace.application.build.HashPolicy;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * <strong>What:</strong> Loads {@link TraceConfig} instances from properties files.
 * <p><strong>Why:</strong> Lets operators override grammar shape, hash policy and parallelism without code
 * changes.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class ConfigLoader {
  private ConfigLoader() {}

  /**
   * Reads optional configuration properties from the given path.
   *
   * @param path properties file path; may be {@code null} or non-existent to use defaults
   * @return configuration populated with file values overriding defaults
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static TraceConfig fromProperties(Path path) throws IOException {
    Properties props = new Properties();
    if (path != null && Files.exists(path)) {
      try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        props.load(reader);
      }
    }
    return fromProperties(props, path == null ? null : path.toAbsolutePath().getParent());
  }

  /**
   * Builds a configuration from already-loaded properties.
   *
   * @param baseDirectory directory a relative {@code schemaPath} resolves against; {@code null} leaves it as is
   */
  public static TraceConfig fromProperties(Properties props, Path baseDirectory) {
    TraceConfig defaults = TraceConfig.defaults();
    String schema = props.getProperty("schemaPath");
    Path schemaPath = null;
    if (schema != null && !schema.isBlank()) {
      schemaPath = Path.of(schema.trim());
      if (!schemaPath.isAbsolute() && baseDirectory != null) {
        schemaPath = baseDirectory.resolve(schemaPath);
      }
    }
    return new TraceConfig(
        props.getProperty("idPrefix", defaults.idPrefix()).trim(),
        toInt(props, "sequenceDigits", defaults.sequenceDigits()),
        toInt(props, "namespaceLength", defaults.namespaceLength()),
        props.getProperty("journeyPrefix", defaults.journeyPrefix()).trim(),
        toInt(props, "hashLength", defaults.hashLength()),
        HashPolicy.parse(props.getProperty("hashPolicy")),
        toInt(props, "parseParallelism", defaults.parseParallelism()),
        props.getProperty("metricsExporter", defaults.metricsExporter()),
        Boolean.parseBoolean(props.getProperty("verbose", String.valueOf(defaults.verbose())).trim()),
        schemaPath);
  }

  private static int toInt(Properties props, String key, int fallback) {
    String raw = props.getProperty(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": '" + raw + "'", ex);
    }
  }
}
