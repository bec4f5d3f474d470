package org.pragmatica.querylang.peg.grammar;

import org.pragmatica.querylang.peg.source.SourceSpan;

/**
 * A grammar rule: Name <- Expression
 */
public record Rule(
 SourceSpan span,
 String name,
 Expression expression) {}
