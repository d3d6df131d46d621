package ca.gc.cra.trace.domain.graph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Lazy iterators behind {@link GraphNode#walk} and {@link TraceGraph#walk}. Each node is produced once per walk even
 * when reachable through several parents.
 */
final class NodeWalker {

  private NodeWalker() {
    // Utility
  }

  static Iterable<GraphNode> walk(List<GraphNode> starts, TraversalOrder order) {
    List<GraphNode> snapshot = List.copyOf(starts);
    return () -> iterator(snapshot, order);
  }

  private static Iterator<GraphNode> iterator(List<GraphNode> starts, TraversalOrder order) {
    switch (order) {
      case PRE:
        return new PreOrder(starts);
      case POST:
        return new PostOrder(starts);
      case LEVEL:
        return new LevelOrder(starts);
      default:
        throw new IllegalArgumentException("order " + order);
    }
  }

  private static final class PreOrder implements Iterator<GraphNode> {
    private final Deque<GraphNode> stack = new ArrayDeque<>();
    private final Set<GraphNode> visited = new HashSet<>();
    private GraphNode next;

    PreOrder(List<GraphNode> starts) {
      for (int i = starts.size() - 1; i >= 0; i--) {
        stack.push(starts.get(i));
      }
      advance();
    }

    private void advance() {
      next = null;
      while (!stack.isEmpty()) {
        GraphNode candidate = stack.pop();
        if (visited.add(candidate)) {
          List<GraphNode> children = candidate.children();
          for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
          }
          next = candidate;
          return;
        }
      }
    }

    @Override
    public boolean hasNext() {
      return next != null;
    }

    @Override
    public GraphNode next() {
      if (next == null) {
        throw new NoSuchElementException();
      }
      GraphNode current = next;
      advance();
      return current;
    }
  }

  private static final class PostOrder implements Iterator<GraphNode> {
    private final Iterator<GraphNode> starts;
    private final Deque<Frame> stack = new ArrayDeque<>();
    private final Set<GraphNode> visited = new HashSet<>();
    private GraphNode next;

    PostOrder(List<GraphNode> starts) {
      this.starts = starts.iterator();
      advance();
    }

    private void advance() {
      next = null;
      while (true) {
        if (stack.isEmpty()) {
          GraphNode start = nextUnvisitedStart();
          if (start == null) {
            return;
          }
          stack.push(new Frame(start));
        }
        Frame top = stack.peek();
        if (top.children.hasNext()) {
          GraphNode child = top.children.next();
          if (visited.add(child)) {
            stack.push(new Frame(child));
          }
        } else {
          stack.pop();
          next = top.node;
          return;
        }
      }
    }

    private GraphNode nextUnvisitedStart() {
      while (starts.hasNext()) {
        GraphNode candidate = starts.next();
        if (visited.add(candidate)) {
          return candidate;
        }
      }
      return null;
    }

    @Override
    public boolean hasNext() {
      return next != null;
    }

    @Override
    public GraphNode next() {
      if (next == null) {
        throw new NoSuchElementException();
      }
      GraphNode current = next;
      advance();
      return current;
    }

    private static final class Frame {
      final GraphNode node;
      final Iterator<GraphNode> children;

      Frame(GraphNode node) {
        this.node = node;
        this.children = node.children().iterator();
      }
    }
  }

  private static final class LevelOrder implements Iterator<GraphNode> {
    private final Deque<GraphNode> queue = new ArrayDeque<>();
    private final Set<GraphNode> visited = new HashSet<>();

    LevelOrder(List<GraphNode> starts) {
      for (GraphNode start : starts) {
        if (visited.add(start)) {
          queue.add(start);
        }
      }
    }

    @Override
    public boolean hasNext() {
      return !queue.isEmpty();
    }

    @Override
    public GraphNode next() {
      GraphNode current = queue.poll();
      if (current == null) {
        throw new NoSuchElementException();
      }
      for (GraphNode child : current.children()) {
        if (visited.add(child)) {
          queue.add(child);
        }
      }
      return current;
    }
  }
}
