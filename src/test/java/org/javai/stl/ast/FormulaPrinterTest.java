package org.javai.stl.ast;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class FormulaPrinterTest {

	@Test
	void printsCanonicalSpellings() {
		Formula formula = AstBuilderTest.formula("(x>=10 && x<=20) -> F[0,4] !(x>=10 /\\ x<=20)");

		assertThat(FormulaPrinter.print(formula))
				.isEqualTo("((x >= 10 and x <= 20) implies eventually[0, 4] not (x >= 10 and x <= 20))");
	}

	@Test
	void printsIntervalsWithTheirBrackets() {
		assertThat(FormulaPrinter.print(AstBuilderTest.formula("G(0.5, inf) a"))).isEqualTo("always(0.5, inf) a");
		assertThat(FormulaPrinter.print(AstBuilderTest.formula("a U(1,2] b"))).isEqualTo("(a until(1, 2] b)");
	}

	@Test
	void printsPredicates() {
		assertThat(FormulaPrinter.printPredicate(Formula.Predicate.negated("x", Relop.LE, 5))).isEqualTo("-x <= 5");
		assertThat(FormulaPrinter.printPredicate(Formula.Predicate.compare("x", Relop.GT, -2.5))).isEqualTo("x > -2.5");
		assertThat(FormulaPrinter.printPredicate(Formula.Predicate.signal("door_open"))).isEqualTo("door_open");
	}

	@ParameterizedTest
	@ValueSource(strings = {
			"always (alt >= 0)",
			"(x>=10 and x<=20 and y<=5 and y>=0) -> F[0,4] !(x>=10 and x<=20 and y<=5 and y>=0)",
			"a and b or c",
			"a or (b and c)",
			"-x <= 5 iff x <= -5",
			"[](1, inf) pred1",
			"next X pred1",
			"not not not a",
			"a U[0, 5) b R c",
			"always[0, 30] (rpm < 4500) and eventually(0, 10] (speed > 120.25)",
			"G[.5, 3.] (door_open -> X_ alarm)"
	})
	void printedFormulaCompilesToTheSameFormula(String requirement) {
		Formula formula = AstBuilderTest.formula(requirement);
		String printed = FormulaPrinter.print(formula);

		assertThat(AstBuilderTest.formula(printed)).isEqualTo(formula);
		assertThat(FormulaPrinter.print(AstBuilderTest.formula(printed))).isEqualTo(printed);
	}

	@Test
	void parsedFormulaOfCodeBuiltFormulaUsesCanonicalSource() {
		Formula formula = new Formula.Globally(Interval.closed(0, 10),
				new Formula.And(Formula.Predicate.signal("a"), Formula.Predicate.signal("b")));

		ParsedFormula parsed = ParsedFormula.of(formula);

		assertThat(parsed.source()).isEqualTo("always[0, 10] (a and b)");
		assertThat(parsed.positionOf(formula)).isEqualTo(-1);
	}
}
