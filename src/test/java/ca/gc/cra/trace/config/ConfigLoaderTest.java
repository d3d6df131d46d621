package ca.gc.cra.trace.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trace.application.build.HashPolicy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void loadsDefaultsWhenFileMissing() throws Exception {
    TraceConfig cfg = ConfigLoader.fromProperties(null);
    assertEquals(TraceConfig.defaults(), cfg);
    assertEquals("REQ", cfg.idPrefix());
    assertEquals(HashPolicy.LENIENT, cfg.hashPolicy());
    assertTrue(cfg.schemaPathOptional().isEmpty());
  }

  @Test
  void loadsOverridesFromFile() throws Exception {
    Path file = tempDir.resolve("trace.properties");
    Files.writeString(file, """
        idPrefix=SPEC
        sequenceDigits=4
        hashPolicy=Strict
        parseParallelism=4
        metricsExporter=OTLP
        verbose=true
        schemaPath=schema/trace.yaml
        """);

    TraceConfig cfg = ConfigLoader.fromProperties(file);

    assertEquals("SPEC", cfg.idPrefix());
    assertEquals(4, cfg.sequenceDigits());
    assertEquals(HashPolicy.STRICT, cfg.hashPolicy());
    assertEquals(4, cfg.parseParallelism());
    assertEquals("otlp", cfg.metricsExporter());
    assertTrue(cfg.verbose());
    assertEquals(tempDir.toAbsolutePath().resolve("schema/trace.yaml"), cfg.schemaPath());
    assertEquals("JNY", cfg.journeyPrefix());
  }

  @Test
  void malformedIntegerIsRejected() {
    Properties props = new Properties();
    props.setProperty("hashLength", "eight");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigLoader.fromProperties(props, null));
    assertTrue(ex.getMessage().contains("hashLength"), ex.getMessage());
  }

  @Test
  void outOfRangeValuesAreRejected() {
    Properties props = new Properties();
    props.setProperty("parseParallelism", "0");
    assertThrows(IllegalArgumentException.class, () -> ConfigLoader.fromProperties(props, null));

    Properties prefix = new Properties();
    prefix.setProperty("idPrefix", "req");
    assertThrows(IllegalArgumentException.class, () -> ConfigLoader.fromProperties(prefix, null));

    Properties exporter = new Properties();
    exporter.setProperty("metricsExporter", "prometheus");
    assertThrows(IllegalArgumentException.class, () -> ConfigLoader.fromProperties(exporter, null));

    Properties policy = new Properties();
    policy.setProperty("hashPolicy", "paranoid");
    assertThrows(IllegalArgumentException.class, () -> ConfigLoader.fromProperties(policy, null));
  }

  @Test
  void absoluteSchemaPathIsKept() {
    Path schema = tempDir.resolve("abs.yaml").toAbsolutePath();
    Properties props = new Properties();
    props.setProperty("schemaPath", schema.toString());

    TraceConfig cfg = ConfigLoader.fromProperties(props, Path.of("/elsewhere"));

    assertEquals(schema, cfg.schemaPath());
    assertFalse(cfg.verbose());
  }
}
