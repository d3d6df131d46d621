package ca.gc.cra.trace.application.parse;

import ca.gc.cra.trace.domain.requirement.SourceDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Parses every document of a corpus, optionally on parallel workers.
 * <p><strong>Why:</strong> Documents have no cross-document dependency while parsing, so they can be parsed
 * independently; all global reasoning happens afterwards in {@link RequirementMerger}.</p>
 * <p><strong>Role:</strong> First stage of the trace build pipeline.</p>
 * <p><strong>Thread-safety:</strong> Stateless; each worker produces its own {@link ParsedDocument}.</p>
 * <p><strong>Observability:</strong> Puts the document path in the SLF4J {@code MDC} under {@value #MDC_DOCUMENT}
 * while a document is parsed.</p>
 *
 * @since 0.1.0
 */
public final class DocumentCorpusParser {
  /** MDC key holding the document being parsed. */
  public static final String MDC_DOCUMENT = "trace.document";

  private static final Logger log = LoggerFactory.getLogger(DocumentCorpusParser.class);

  private final DocumentParser documentParser;
  private final JourneyParser journeyParser;

  public DocumentCorpusParser(DocumentParser documentParser, JourneyParser journeyParser) {
    this.documentParser = Objects.requireNonNull(documentParser, "documentParser");
    this.journeyParser = Objects.requireNonNull(journeyParser, "journeyParser");
  }

  /** Parses sequentially on the calling thread. */
  public List<ParsedDocument> parseAll(List<SourceDocument> corpus) {
    return parseAll(corpus, null);
  }

  /**
   * Parses every document.
   *
   * @param corpus documents in corpus order
   * @param executor workers to parse on; {@code null} parses on the calling thread. The caller owns its lifecycle.
   * @return one result per document, in corpus order regardless of completion order
   */
  public List<ParsedDocument> parseAll(List<SourceDocument> corpus, ExecutorService executor) {
    Objects.requireNonNull(corpus, "corpus");
    if (executor == null || corpus.size() <= 1) {
      List<ParsedDocument> parsed = new ArrayList<>(corpus.size());
      for (SourceDocument document : corpus) {
        parsed.add(parseOne(document));
      }
      return parsed;
    }
    List<Future<ParsedDocument>> futures = new ArrayList<>(corpus.size());
    for (SourceDocument document : corpus) {
      futures.add(executor.submit(() -> parseOne(document)));
    }
    List<ParsedDocument> parsed = new ArrayList<>(corpus.size());
    try {
      for (Future<ParsedDocument> future : futures) {
        parsed.add(future.get());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancel(futures);
      throw new IllegalStateException("Interrupted while parsing documents", e);
    } catch (ExecutionException e) {
      cancel(futures);
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("Document parsing failed", cause);
    }
    return parsed;
  }

  /** Parses one document's requirements and journeys. */
  public ParsedDocument parseOne(SourceDocument document) {
    Objects.requireNonNull(document, "document");
    MDC.put(MDC_DOCUMENT, document.path());
    try {
      ParseResult requirements = documentParser.parse(document.text(), document.path());
      JourneyParseResult journeys = journeyParser.parse(document.text(), document.path());
      log.debug("Document {} yielded {} requirements, {} journeys", document.path(),
          requirements.requirements().size(), journeys.journeys().size());
      return ParsedDocument.of(document.path(), requirements, journeys);
    } finally {
      MDC.remove(MDC_DOCUMENT);
    }
  }

  private static void cancel(List<Future<ParsedDocument>> futures) {
    for (Future<ParsedDocument> future : futures) {
      future.cancel(true);
    }
  }
}
