/**
 * <strong>Purpose:</strong> Argument validation shared by configuration loading.
 * <p><strong>Concurrency:</strong> Stateless utilities; thread-safe.
 * <p><strong>Observability:</strong> No logs or metrics; failures raise {@link java.lang.IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trace.validation;
