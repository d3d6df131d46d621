package ca.gc.cra.trace.config;

import ca.gc.cra.trace.application.build.GraphBuilder;
import ca.gc.cra.trace.application.metrics.MetricsRollupEngine;
import ca.gc.cra.trace.application.parse.DocumentCorpusParser;
import ca.gc.cra.trace.application.parse.DocumentParser;
import ca.gc.cra.trace.application.parse.JourneyParser;
import ca.gc.cra.trace.application.parse.RequirementMerger;
import ca.gc.cra.trace.application.pipeline.TraceBuildUseCase;
import ca.gc.cra.trace.application.port.ClockPort;
import ca.gc.cra.trace.application.port.MetricsPort;
import ca.gc.cra.trace.domain.id.IdentifierGrammar;
import ca.gc.cra.trace.domain.requirement.ContentHasher;
import ca.gc.cra.trace.domain.schema.GraphSchema;
import ca.gc.cra.trace.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.trace.infrastructure.json.GraphJsonWriter;
import ca.gc.cra.trace.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.trace.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.trace.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.trace.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires grammar, parsers, builder, rollup, metrics and clock into a
 * {@link TraceBuildUseCase}.
 * <p><strong>Why:</strong> Keeps the translation from {@link TraceConfig} to runnable services in one place.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the identifier grammar and hasher from configuration.</li>
 *   <li>Load the schema file when one is configured.</li>
 *   <li>Select the metrics adapter and the parse executor.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create fresh services.</p>
 *
 * @since 0.1.0
 * @see TraceBuildUseCase
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final TraceConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final IdentifierGrammar grammar;

  /** Composition root whose metrics adapter follows {@link TraceConfig#metricsExporter()}. */
  public CompositionRoot(TraceConfig config) {
    this(config, defaultMetrics(Objects.requireNonNull(config, "config")), new SystemClockAdapter());
  }

  /**
   * Creates a composition root with explicit metrics and clock adapters.
   *
   * @throws NullPointerException if any argument is {@code null}
   */
  public CompositionRoot(TraceConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.grammar = new IdentifierGrammar(config.grammarConfig());
    if (config.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
  }

  private static MetricsPort defaultMetrics(TraceConfig config) {
    if ("none".equals(config.metricsExporter())) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter(config.metricsExporter());
  }

  public TraceConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public IdentifierGrammar grammar() {
    return grammar;
  }

  /**
   * Schema from {@link TraceConfig#schemaPath()}, or the built-in schema when none is configured.
   *
   * @throws IOException when the configured file is missing or unreadable
   */
  public GraphSchema schema() throws IOException {
    return new YamlSchemaLoader().loadOrDefaults(config.schemaPathOptional());
  }

  public DocumentCorpusParser corpusParser() {
    DocumentParser documents =
        new DocumentParser(grammar, new ContentHasher(config.hashLength()), config.journeyPrefix());
    return new DocumentCorpusParser(documents, new JourneyParser(grammar, config.journeyPrefix()));
  }

  public GraphBuilder graphBuilder() {
    return new GraphBuilder(grammar, config.hashPolicy());
  }

  public GraphJsonWriter graphJsonWriter() {
    return new GraphJsonWriter(true);
  }

  /**
   * Builds the pipeline use case.
   *
   * @throws IOException when the configured schema file cannot be read
   */
  public TraceBuildUseCase traceBuildUseCase() throws IOException {
    GraphSchema schema = schema();
    log.info("Trace build configured: prefix={}, hashPolicy={}, parseParallelism={}, schema={}",
        config.idPrefix(), config.hashPolicy(), config.parseParallelism(),
        config.schemaPathOptional().map(Object::toString).orElse("built-in"));
    return new TraceBuildUseCase(
        corpusParser(),
        new RequirementMerger(),
        graphBuilder(),
        new MetricsRollupEngine(),
        schema,
        metrics,
        clock,
        parseExecutorFactory());
  }

  private Supplier<ExecutorService> parseExecutorFactory() {
    int workers = config.parseParallelism();
    if (workers <= 1) {
      return null;
    }
    return () -> ExecutorFactories.newParsePool(workers, "trace-parse",
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
  }
}
