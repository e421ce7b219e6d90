package org.shellsafe.compiler.api;

/**
 * Size and complexity figures of a compiled script, for external reporting layers.
 *
 * @param branchCount The number of decision points.
 * @param nestingDepth The deepest nesting of compound statements.
 * @param functionCount The number of emitted user functions, {@code main} included.
 * @param statementCount The number of statements.
 */
public record ScriptMetrics(int branchCount, int nestingDepth, int functionCount, int statementCount) {
}
