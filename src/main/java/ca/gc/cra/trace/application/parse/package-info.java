/**
 * Line-oriented parsers for requirement blocks and journeys.
 * <p>Parsers never throw on malformed text: they skip the offending block, keep going and return a diagnostic with
 * the file and line. Suggestions for misspelt keywords and identifiers come from {@code Suggestions}.</p>
 */
package ca.gc.cra.trace.application.parse;
