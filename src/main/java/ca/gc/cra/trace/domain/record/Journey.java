package ca.gc.cra.trace.domain.record;

import ca.gc.cra.trace.domain.requirement.SourceLocation;
import java.util.List;
import java.util.Objects;

/**
 * Non-normative user journey; contributes structure but never coverage.
 *
 * @param id journey identifier such as {@code JNY-Login-01}
 * @param title journey title
 * @param actor who performs the journey; empty when not declared
 * @param goal what the actor wants to achieve; empty when not declared
 * @param steps ordered steps
 * @param addresses requirement identifiers the journey scopes
 * @param location declaring block, {@code null} for records not read from a document
 * @since 0.1.0
 */
public record Journey(
    String id,
    String title,
    String actor,
    String goal,
    List<String> steps,
    List<String> addresses,
    SourceLocation location) {

  public Journey {
    Objects.requireNonNull(id, "id");
    title = title == null ? "" : title;
    actor = actor == null ? "" : actor;
    goal = goal == null ? "" : goal;
    steps = List.copyOf(Objects.requireNonNull(steps, "steps"));
    addresses = List.copyOf(Objects.requireNonNull(addresses, "addresses"));
  }
}
