/**
 * Relationship table driving graph construction, roots, level rules and check switches.
 */
package ca.gc.cra.trace.domain.schema;
