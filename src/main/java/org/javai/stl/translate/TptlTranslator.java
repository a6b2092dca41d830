package org.javai.stl.translate;

import org.javai.stl.ast.Bound;
import org.javai.stl.ast.Formula;
import org.javai.stl.ast.FormulaPrinter;
import org.javai.stl.ast.Interval;
import org.javai.stl.ast.Operator;

/**
 * Renders an STL formula as an equivalent Timed Propositional Temporal Logic formula.
 * <p>
 * Unbounded operators map one-to-one onto TPTL symbols. A bounded operator freezes a
 * clock at the current time with {@code @Var_t} and expresses its window as clock
 * constraints; nested bounded operators use fresh clocks {@code Var_t1}, {@code Var_t2}
 * and so on.
 *
 * <pre>
 * always[0, 10] (a and b)  =&gt;  @Var_t [](({ Var_t &gt;= 0 } /\ { Var_t &lt;= 10 }) -&gt; ( a /\ b ))
 * </pre>
 *
 * A translator instance numbers clocks per call and can be reused.
 */
public final class TptlTranslator {

	static final String CLOCK = "Var_t";

	public String translate(Formula formula) {
		return new Rendering().render(formula);
	}

	private static final class Rendering {

		private int clocks;

		private String render(Formula formula) {
			if (formula instanceof Formula.Predicate predicate) {
				return FormulaPrinter.printPredicate(predicate);
			}
			Formula.Compound compound = (Formula.Compound) formula;
			Operator operator = compound.operator();
			Interval interval = compound.interval();
			if (interval != null) {
				return renderBounded(compound, interval);
			}
			if (operator.arity() == 1) {
				return operator.tptlSymbol() + " " + operand(compound.operands().get(0));
			}
			return operand(compound.operands().get(0)) + " " + operator.tptlSymbol() + " "
					+ operand(compound.operands().get(1));
		}

		private String renderBounded(Formula.Compound compound, Interval interval) {
			String clock = clocks == 0 ? CLOCK : CLOCK + clocks;
			clocks++;
			String constraint = constraint(clock, interval);
			String freeze = "@" + clock + " ";
			Operator operator = compound.operator();
			return switch (operator) {
				case GLOBALLY -> freeze + "[](" + constraint + " -> " + operand(compound.operands().get(0)) + ")";
				case FUTURE, NEXT -> freeze + operator.tptlSymbol() + "(" + constraint + " /\\ "
						+ operand(compound.operands().get(0)) + ")";
				case UNTIL -> freeze + "(" + operand(compound.operands().get(0)) + " U (" + constraint + " /\\ "
						+ operand(compound.operands().get(1)) + "))";
				case RELEASE -> freeze + "(" + operand(compound.operands().get(0)) + " R (" + constraint + " -> "
						+ operand(compound.operands().get(1)) + "))";
				default -> throw new IllegalArgumentException(operator + " cannot carry an interval");
			};
		}

		private String operand(Formula formula) {
			String text = render(formula);
			return needsGrouping(formula) ? "( " + text + " )" : text;
		}

		private static boolean needsGrouping(Formula formula) {
			if (formula instanceof Formula.Compound compound) {
				return compound.operator().arity() == 2 || compound.interval() != null;
			}
			return false;
		}

		private static String constraint(String clock, Interval interval) {
			String lower = "{ " + clock + (interval.lowerClosed() ? " >= " : " > ") + interval.lower().text() + " }";
			if (!(interval.upper() instanceof Bound.Finite)) {
				return lower;
			}
			String upper = "{ " + clock + (interval.upperClosed() ? " <= " : " < ") + interval.upper().text() + " }";
			return "(" + lower + " /\\ " + upper + ")";
		}
	}
}
