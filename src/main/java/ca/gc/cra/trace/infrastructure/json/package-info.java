/**
 * JSON export of built graphs using Jackson's streaming generator.
 */
package ca.gc.cra.trace.infrastructure.json;
