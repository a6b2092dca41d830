package org.javai.stl.ast;

/**
 * Renders a {@link Formula} in canonical STL text.
 * <p>
 * The canonical form uses the word spelling of every operator, wraps each binary
 * operator in parentheses, writes intervals with their original brackets and numbers
 * in plain decimal notation. Compiling the output again yields an equal formula.
 *
 * <pre>
 * FormulaPrinter.print(formula); // "((x &gt;= 10 and x &lt;= 20) implies eventually[0, 4] not (x &gt;= 10 and x &lt;= 20))"
 * </pre>
 */
public final class FormulaPrinter {

	private FormulaPrinter() {
	}

	public static String print(Formula formula) {
		StringBuilder output = new StringBuilder();
		append(output, formula);
		return output.toString();
	}

	/**
	 * Canonical text of a single predicate, e.g. {@code -x <= 5} or {@code door_open}.
	 */
	public static String printPredicate(Formula.Predicate predicate) {
		if (predicate.isBoolean()) {
			return predicate.name();
		}
		return (predicate.negatedName() ? "-" : "") + predicate.name() + " " + predicate.relop().symbol() + " "
				+ Numbers.format(predicate.threshold());
	}

	private static void append(StringBuilder output, Formula formula) {
		if (formula instanceof Formula.Predicate) {
			output.append(printPredicate((Formula.Predicate) formula));
			return;
		}

		Formula.Compound compound = (Formula.Compound) formula;
		Operator operator = compound.operator();
		if (operator.arity() == 1) {
			output.append(operator.keyword());
			appendInterval(output, compound.interval());
			output.append(' ');
			append(output, compound.operands().get(0));
			return;
		}

		output.append('(');
		append(output, compound.operands().get(0));
		output.append(' ').append(operator.keyword());
		appendInterval(output, compound.interval());
		output.append(' ');
		append(output, compound.operands().get(1));
		output.append(')');
	}

	private static void appendInterval(StringBuilder output, Interval interval) {
		if (interval != null) {
			output.append(interval);
		}
	}
}
