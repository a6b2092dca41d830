package org.javai.stl.ast;

import java.util.Objects;

/**
 * A formula together with the requirement text it was built from and the positions
 * of its nodes in that text.
 *
 * @param source the requirement text
 * @param formula the formula AST
 * @param sourceMap node positions within {@code source}
 */
public record ParsedFormula(String source, Formula formula, SourceMap sourceMap) {

	public ParsedFormula {
		Objects.requireNonNull(formula, "formula must not be null");
		sourceMap = sourceMap != null ? sourceMap : SourceMap.empty();
	}

	/**
	 * Wraps a formula built in code; its positions are unknown and its source is the
	 * canonical rendering.
	 */
	public static ParsedFormula of(Formula formula) {
		return new ParsedFormula(FormulaPrinter.print(formula), formula, SourceMap.empty());
	}

	public int positionOf(Object node) {
		return sourceMap.positionOf(node);
	}
}
