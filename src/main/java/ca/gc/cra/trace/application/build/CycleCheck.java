package ca.gc.cra.trace.application.build;

import ca.gc.cra.trace.domain.diagnostic.CheckName;
import ca.gc.cra.trace.domain.diagnostic.Diagnostic;
import ca.gc.cra.trace.domain.graph.Edge;
import ca.gc.cra.trace.domain.graph.GraphNode;
import ca.gc.cra.trace.domain.graph.TraceGraph;
import ca.gc.cra.trace.domain.schema.CheckToggles;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;

/**
 * Depth-first search over rollup edges with white/gray/black marking; an edge back to a gray node closes a cycle,
 * reported with its full path. Iterative so deep hierarchies cannot exhaust the call stack.
 *
 * @since 0.1.0
 */
final class CycleCheck implements ValidationCheck {
  private static final byte WHITE = 0;
  private static final byte GRAY = 1;
  private static final byte BLACK = 2;

  @Override
  public boolean enabled(CheckToggles toggles) {
    return toggles.cycle();
  }

  @Override
  public void run(TraceGraph graph, Consumer<Diagnostic> sink) {
    byte[] color = new byte[graph.size()];
    for (GraphNode start : graph.nodes()) {
      if (color[start.index()] == WHITE) {
        visit(start, color, sink);
      }
    }
  }

  private static void visit(GraphNode start, byte[] color, Consumer<Diagnostic> sink) {
    List<GraphNode> path = new ArrayList<>();
    List<Iterator<GraphNode>> pending = new ArrayList<>();
    push(start, path, pending, color);
    while (!path.isEmpty()) {
      int top = path.size() - 1;
      Iterator<GraphNode> children = pending.get(top);
      if (!children.hasNext()) {
        color[path.get(top).index()] = BLACK;
        path.remove(top);
        pending.remove(top);
        continue;
      }
      GraphNode child = children.next();
      byte state = color[child.index()];
      if (state == WHITE) {
        push(child, path, pending, color);
      } else if (state == GRAY) {
        sink.accept(cycle(path, child));
      }
    }
  }

  private static void push(GraphNode node, List<GraphNode> path, List<Iterator<GraphNode>> pending, byte[] color) {
    color[node.index()] = GRAY;
    path.add(node);
    pending.add(node.children(Edge::rollup).iterator());
  }

  private static Diagnostic cycle(List<GraphNode> path, GraphNode closing) {
    int from = path.indexOf(closing);
    List<String> ids = new ArrayList<>();
    for (GraphNode node : path.subList(from, path.size())) {
      ids.add(node.id());
    }
    ids.add(closing.id());
    return Diagnostic.error(CheckName.CYCLE, closing.id(), "cycle: " + String.join(" -> ", ids),
        closing.location().orElse(null));
  }
}
