package ca.gc.cra.trace.application.pipeline;

import ca.gc.cra.trace.application.build.BuildResult;
import ca.gc.cra.trace.application.build.GraphBuilder;
import ca.gc.cra.trace.application.metrics.MetricsRollupEngine;
import ca.gc.cra.trace.application.parse.DocumentCorpusParser;
import ca.gc.cra.trace.application.parse.ParsedDocument;
import ca.gc.cra.trace.application.parse.RequirementMerger;
import ca.gc.cra.trace.application.port.ClockPort;
import ca.gc.cra.trace.application.port.MetricsPort;
import ca.gc.cra.trace.domain.diagnostic.CheckName;
import ca.gc.cra.trace.domain.diagnostic.Diagnostic;
import ca.gc.cra.trace.domain.diagnostic.Severity;
import ca.gc.cra.trace.domain.diagnostic.ValidationResult;
import ca.gc.cra.trace.domain.graph.TraceGraph;
import ca.gc.cra.trace.domain.record.TraceRecords;
import ca.gc.cra.trace.domain.requirement.SourceDocument;
import ca.gc.cra.trace.domain.schema.GraphSchema;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs one complete build: parse, merge, construct, validate and roll up.
 * <p><strong>Why:</strong> Gives callers a single entry point that always returns a graph paired with diagnostics,
 * whatever shape the input is in.</p>
 * <p><strong>Role:</strong> Application use case wired by {@code CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse documents, in parallel when an executor factory is supplied, then merge on the calling thread.</li>
 *   <li>Build and validate the graph against the configured schema, then compute metrics.</li>
 *   <li>Emit {@code trace.*} metrics and one summary log line per build.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each run uses its own executor and graph, so concurrent runs do not interact.</p>
 * <p><strong>Observability:</strong> Increments {@code trace.documents.parsed}, {@code trace.requirements.parsed},
 * {@code trace.requirements.conflicting} and {@code trace.diagnostics.<check>}; observes
 * {@code trace.build.latencyMs} and {@code trace.graph.nodes}.</p>
 *
 * @since 0.1.0
 */
public final class TraceBuildUseCase {
  private static final Logger log = LoggerFactory.getLogger(TraceBuildUseCase.class);

  private final DocumentCorpusParser corpusParser;
  private final RequirementMerger merger;
  private final GraphBuilder builder;
  private final MetricsRollupEngine rollup;
  private final GraphSchema schema;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Supplier<ExecutorService> executorFactory;

  /**
   * Creates the use case.
   *
   * @param executorFactory supplies a fresh parse executor per run; {@code null}, or a supplier returning
   *     {@code null}, parses sequentially on the calling thread
   */
  public TraceBuildUseCase(
      DocumentCorpusParser corpusParser,
      RequirementMerger merger,
      GraphBuilder builder,
      MetricsRollupEngine rollup,
      GraphSchema schema,
      MetricsPort metrics,
      ClockPort clock,
      Supplier<ExecutorService> executorFactory) {
    this.corpusParser = Objects.requireNonNull(corpusParser, "corpusParser");
    this.merger = Objects.requireNonNull(merger, "merger");
    this.builder = Objects.requireNonNull(builder, "builder");
    this.rollup = Objects.requireNonNull(rollup, "rollup");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.executorFactory = executorFactory;
  }

  /**
   * Builds a graph from a corpus and external records.
   *
   * @param corpus documents in corpus order; earlier documents win identifier conflicts
   * @param records code references, tests, results and journeys from adapters
   * @return frozen graph, combined diagnostics and per-document parse results
   */
  public TraceBuild run(List<SourceDocument> corpus, TraceRecords records) {
    Objects.requireNonNull(corpus, "corpus");
    Objects.requireNonNull(records, "records");
    long started = clock.nowMillis();

    List<ParsedDocument> documents = parse(corpus);
    RequirementMerger.Merged merged = merger.merge(documents);
    for (ParsedDocument document : documents) {
      metrics.increment("trace.documents.parsed");
      for (int i = 0; i < document.requirements().size(); i++) {
        metrics.increment("trace.requirements.parsed");
      }
    }
    for (int i = 0; i < merged.conflictCount(); i++) {
      metrics.increment("trace.requirements.conflicting");
    }

    BuildResult built = builder.build(merged.requirements(), records.withJourneys(merged.journeys()), schema);
    TraceGraph graph = built.graph();
    ValidationResult validation = ValidationResult.of(merged.diagnostics()).concat(built.validation());
    // the graph carries parse and build diagnostics alike; rollup freezes it
    graph.setValidation(validation);
    rollup.compute(graph);

    for (Diagnostic diagnostic : validation.diagnostics()) {
      metrics.increment("trace.diagnostics." + diagnostic.check().metricSuffix());
    }
    long elapsed = Math.max(0L, clock.nowMillis() - started);
    metrics.observe("trace.build.latencyMs", elapsed);
    metrics.observe("trace.graph.nodes", graph.size());

    log.info("Built trace graph from {} documents: {} requirements ({} conflicting), {} nodes, {} edges, "
            + "{} errors, {} warnings, {} info in {} ms",
        documents.size(), merged.requirements().size(), merged.conflictCount(), graph.size(),
        graph.edges().size(), validation.errors().size(), validation.warnings().size(),
        validation.withSeverity(Severity.INFO).size(), elapsed);
    if (validation.count(CheckName.CYCLE) > 0) {
      log.warn("Trace graph contains {} cycle(s); rollup metrics exclude the closing edges",
          validation.count(CheckName.CYCLE));
    }
    return new TraceBuild(graph, validation, documents);
  }

  private List<ParsedDocument> parse(List<SourceDocument> corpus) {
    ExecutorService executor = executorFactory == null ? null : executorFactory.get();
    if (executor == null) {
      return corpusParser.parseAll(corpus);
    }
    try {
      return corpusParser.parseAll(corpus, executor);
    } finally {
      executor.shutdown();
      try {
        if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
          executor.shutdownNow();
        }
      } catch (InterruptedException ex) {
        executor.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }
}
