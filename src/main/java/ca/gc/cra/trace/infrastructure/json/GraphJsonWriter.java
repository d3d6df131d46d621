package ca.gc.cra.trace.infrastructure.json;

import ca.gc.cra.trace.domain.diagnostic.Diagnostic;
import ca.gc.cra.trace.domain.diagnostic.ValidationResult;
import ca.gc.cra.trace.domain.graph.Edge;
import ca.gc.cra.trace.domain.graph.GraphNode;
import ca.gc.cra.trace.domain.graph.NodeMetrics;
import ca.gc.cra.trace.domain.graph.TraceGraph;
import ca.gc.cra.trace.domain.requirement.Requirement;
import ca.gc.cra.trace.domain.requirement.SourceLocation;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteFeature;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Streams a built graph as JSON for report and query layers: nodes with their links and metrics, edges, roots,
 * conflicting requirements and diagnostics.
 *
 * <p>Output is deterministic for a given graph: nodes in insertion order, edges in creation order.</p>
 *
 * @since 0.1.0
 */
public final class GraphJsonWriter {
  private static final int FORMAT_VERSION = 1;

  private final JsonFactory jsonFactory = JsonFactory.builder()
      .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
      .build();
  private final boolean pretty;

  public GraphJsonWriter() {
    this(false);
  }

  public GraphJsonWriter(boolean pretty) {
    this.pretty = pretty;
  }

  /**
   * Writes {@code graph} to {@code out}. The writer is flushed but not closed.
   *
   * @throws IOException when the target rejects the write
   */
  public void write(TraceGraph graph, Writer out) throws IOException {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(out, "out");
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      if (pretty) {
        gen.useDefaultPrettyPrinter();
      }
      gen.writeStartObject();
      gen.writeNumberField("formatVersion", FORMAT_VERSION);
      writeNodes(gen, graph);
      writeEdges(gen, graph);
      gen.writeArrayFieldStart("roots");
      for (GraphNode root : graph.roots()) {
        gen.writeString(root.id());
      }
      gen.writeEndArray();
      writeConflicts(gen, graph);
      writeDiagnostics(gen, graph.validation());
      gen.writeEndObject();
    }
    out.flush();
  }

  /** Graph rendered as a JSON string. */
  public String toJson(TraceGraph graph) {
    StringWriter out = new StringWriter();
    try {
      write(graph, out);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render graph JSON", ex);
    }
    return out.toString();
  }

  private static void writeNodes(JsonGenerator gen, TraceGraph graph) throws IOException {
    gen.writeArrayFieldStart("nodes");
    for (GraphNode node : graph.nodes()) {
      gen.writeStartObject();
      gen.writeStringField("id", node.id());
      gen.writeStringField("kind", node.kind().name());
      gen.writeStringField("label", node.label());
      writeLocation(gen, "source", node.location());
      gen.writeArrayFieldStart("parents");
      for (GraphNode parent : node.parents()) {
        gen.writeString(parent.id());
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("children");
      for (GraphNode child : node.children()) {
        gen.writeString(child.id());
      }
      gen.writeEndArray();
      Optional<NodeMetrics> metrics = node.metrics();
      if (metrics.isPresent()) {
        gen.writeObjectFieldStart("metrics");
        for (Map.Entry<String, Number> entry : metrics.get().asMap().entrySet()) {
          if (entry.getValue() instanceof Double value) {
            gen.writeNumberField(entry.getKey(), value);
          } else {
            gen.writeNumberField(entry.getKey(), entry.getValue().intValue());
          }
        }
        gen.writeEndObject();
      }
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeEdges(JsonGenerator gen, TraceGraph graph) throws IOException {
    gen.writeArrayFieldStart("edges");
    for (Edge edge : graph.edges()) {
      gen.writeStartObject();
      gen.writeStringField("parent", edge.parentId());
      gen.writeStringField("child", edge.childId());
      gen.writeStringField("relationship", edge.relationship());
      gen.writeBooleanField("rollup", edge.rollup());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeConflicts(JsonGenerator gen, TraceGraph graph) throws IOException {
    gen.writeArrayFieldStart("conflicts");
    for (Requirement requirement : graph.conflicts()) {
      gen.writeStartObject();
      gen.writeStringField("id", requirement.idText());
      gen.writeStringField("title", requirement.title());
      writeLocation(gen, "source", Optional.of(requirement.location()));
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeDiagnostics(JsonGenerator gen, ValidationResult validation) throws IOException {
    gen.writeArrayFieldStart("diagnostics");
    for (Diagnostic diagnostic : validation.diagnostics()) {
      gen.writeStartObject();
      gen.writeStringField("severity", diagnostic.severity().name());
      gen.writeStringField("check", diagnostic.check().name());
      if (diagnostic.nodeId() != null) {
        gen.writeStringField("nodeId", diagnostic.nodeId());
      }
      gen.writeStringField("message", diagnostic.message());
      writeLocation(gen, "source", Optional.ofNullable(diagnostic.location()));
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeLocation(JsonGenerator gen, String field, Optional<SourceLocation> location)
      throws IOException {
    if (location.isEmpty()) {
      return;
    }
    SourceLocation at = location.get();
    gen.writeObjectFieldStart(field);
    gen.writeStringField("path", at.path());
    gen.writeNumberField("line", at.line());
    if (at.endLine() != null) {
      gen.writeNumberField("endLine", at.endLine());
    }
    gen.writeEndObject();
  }
}
