package org.javai.stl.syntax;

import java.util.List;

/**
 * Visitor that renders a {@link ParseTree} as an s-expression, for diagnostics and
 * debug logging. Rule nodes print as {@code (RULE child ...)}, terminals as their
 * source text.
 */
public class ParseTreePrinter implements ParseTreeVisitor<Void> {

	private final StringBuilder output = new StringBuilder();
	private int indentLevel = 0;
	private final boolean pretty;
	private final int indentSize;

	public ParseTreePrinter() {
		this(true, 2);
	}

	public ParseTreePrinter(boolean pretty, int indentSize) {
		this.pretty = pretty;
		this.indentSize = indentSize;
	}

	@Override
	public Void visitRule(ParseTree.Rule rule, StlToken token, List<ParseTree> children) {
		output.append('(').append(rule);

		if (pretty) {
			indentLevel++;
			for (ParseTree child : children) {
				output.append('\n');
				indent();
				child.accept(this);
			}
			indentLevel--;
		}
		else {
			for (ParseTree child : children) {
				output.append(' ');
				child.accept(this);
			}
		}
		output.append(')');
		return null;
	}

	@Override
	public Void visitTerminal(StlToken token) {
		output.append(token.value());
		return null;
	}

	private void indent() {
		output.append(" ".repeat(indentLevel * indentSize));
	}

	/**
	 * Returns the rendered output as a string.
	 */
	public String toString() {
		return output.toString();
	}

	public static String print(ParseTree tree) {
		ParseTreePrinter printer = new ParseTreePrinter();
		tree.accept(printer);
		return printer.toString();
	}

	public static String printCompact(ParseTree tree) {
		ParseTreePrinter printer = new ParseTreePrinter(false, 0);
		tree.accept(printer);
		return printer.toString();
	}
}
