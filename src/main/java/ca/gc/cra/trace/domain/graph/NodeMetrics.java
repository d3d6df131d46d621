package ca.gc.cra.trace.domain.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rolled-up statistics of a node over itself and its distinct rollup descendants.
 *
 * @param totalAssertions assertions in the set
 * @param coveredAssertions assertions with at least one rollup child
 * @param directCovered covered assertions with a test or code reference child
 * @param explicitCovered covered assertions with a requirement child
 * @param inferredCovered uncovered assertions whose requirement is validated as a whole; informational only
 * @param totalRequirements descendant requirements, the node itself excluded
 * @param totalTests tests in the set
 * @param passedTests tests whose aggregated status is passed
 * @param failedTests tests whose aggregated status is failed
 * @param skippedTests tests whose aggregated status is skipped
 * @param unknownTests tests without a conclusive result
 * @param totalResults test results in the set
 * @param totalCodeRefs code references in the set
 * @param coveragePct covered over total assertions, {@code 0} when there are none
 * @param passRatePct passed over total tests, {@code 0} when there are none
 * @since 0.1.0
 */
public record NodeMetrics(
    int totalAssertions,
    int coveredAssertions,
    int directCovered,
    int explicitCovered,
    int inferredCovered,
    int totalRequirements,
    int totalTests,
    int passedTests,
    int failedTests,
    int skippedTests,
    int unknownTests,
    int totalResults,
    int totalCodeRefs,
    double coveragePct,
    double passRatePct) {

  public static final NodeMetrics EMPTY = new NodeMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0.0, 0.0);

  /** {@code part * 100 / total}, or {@code 0} when {@code total} is zero. */
  public static double percent(int part, int total) {
    return total == 0 ? 0.0 : part * 100.0 / total;
  }

  /** Metrics keyed by stable snake_case names, in declaration order. */
  public Map<String, Number> asMap() {
    Map<String, Number> map = new LinkedHashMap<>();
    map.put("total_assertions", totalAssertions);
    map.put("covered_assertions", coveredAssertions);
    map.put("direct_covered", directCovered);
    map.put("explicit_covered", explicitCovered);
    map.put("inferred_covered", inferredCovered);
    map.put("total_requirements", totalRequirements);
    map.put("total_tests", totalTests);
    map.put("passed_tests", passedTests);
    map.put("failed_tests", failedTests);
    map.put("skipped_tests", skippedTests);
    map.put("unknown_tests", unknownTests);
    map.put("total_results", totalResults);
    map.put("total_code_refs", totalCodeRefs);
    map.put("coverage_pct", coveragePct);
    map.put("pass_rate_pct", passRatePct);
    return Collections.unmodifiableMap(map);
  }
}
