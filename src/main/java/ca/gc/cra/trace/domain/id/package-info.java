/**
 * Identifier grammar for requirements and assertions.
 * <p><strong>Role:</strong> Single place where {@code REQ-[NS-]{level}{digits}[-A]} text is recognized, canonicalized
 * and rejected with a reason. Parsers and the graph builder both go through {@code IdentifierGrammar}.</p>
 * <p><strong>Configuration:</strong> Prefix, sequence width and namespace length come from {@code GrammarConfig}.</p>
 * <p><strong>Concurrency:</strong> The grammar holds only compiled patterns and is safe to share.</p>
 */
package ca.gc.cra.trace.domain.id;
