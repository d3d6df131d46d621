/**
 * Parsed requirement documents: requirements, assertions, references, locations and content hashes.
 */
package ca.gc.cra.trace.domain.requirement;
