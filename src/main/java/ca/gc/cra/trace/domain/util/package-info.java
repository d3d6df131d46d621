/**
 * Small helpers shared by the domain and parsers, such as edit-distance suggestions.
 */
package ca.gc.cra.trace.domain.util;
