package org.javai.stl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.apache.logging.log4j.Level;
import org.javai.stl.ast.Formula;
import org.javai.stl.ast.ParsedFormula;
import org.javai.stl.signal.SignalCatalog;
import org.javai.stl.signal.SignalCatalogRegistry;
import org.javai.stl.signal.SignalType;
import org.javai.stl.syntax.StlLexException;
import org.javai.stl.syntax.StlSyntaxException;
import org.javai.stl.testsupport.LogCaptorAppender;
import org.javai.stl.translate.CompiledSpecification;
import org.javai.stl.translate.CompiledSpecification.LinearSpecification;
import org.javai.stl.translate.CompiledSpecification.TreeSpecification;
import org.javai.stl.translate.TemporalLogic;
import org.javai.stl.translate.VariableBinding;
import org.javai.stl.validate.MonitorBackend;
import org.javai.stl.validate.StlValidationException;
import org.javai.stl.validate.ValidationError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("StlCompiler")
class StlCompilerTest {

	private final StlCompiler compiler = new StlCompiler();
	private final SignalCatalog vehicle = SignalCatalogRegistry.create()
			.registerMetaInfCatalogs(StlCompilerTest.class.getClassLoader())
			.requireCatalog("vehicle");

	@Test
	void compilesAgainstACatalogLoadedFromTheClasspath() {
		TreeSpecification spec = compiler.compileTree("always (speed <= 120 and (door_open -> speed <= 5))", vehicle);

		assertThat(spec.declarations()).extracting(VariableBinding::name).containsExactly("speed", "door_open");
		assertThat(spec.declarations().get(1).type()).isEqualTo(SignalType.BOOL);
	}

	@Test
	void compileSelectsTheTranslatorByBackend() {
		CompiledSpecification linear = compiler.compile("G[0, 5] rpm <= 4500", vehicle, MonitorBackend.LINEAR_CONSTRAINT);
		CompiledSpecification tree = compiler.compile("G[0, 5] rpm <= 4500", vehicle, MonitorBackend.TREE_WALKING);

		assertThat(linear).isInstanceOf(LinearSpecification.class);
		assertThat(tree).isInstanceOf(TreeSpecification.class);
		assertThat(linear.variables()).hasSize(4);
		assertThat(tree.variables()).hasSize(1);
	}

	@Test
	void parseKeepsSourceAndPositions() {
		ParsedFormula parsed = compiler.parse("F[0, 4] gear >= 3");

		assertThat(parsed.source()).isEqualTo("F[0, 4] gear >= 3");
		assertThat(parsed.positionOf(((Formula.Future) parsed.formula()).operand())).isEqualTo(8);
	}

	@Test
	void logsCompilationStagesAtDebug() {
		try (LogCaptorAppender appender = LogCaptorAppender.create(StlCompiler.class, Level.DEBUG)) {
			compiler.compile("speed <= 1", vehicle, MonitorBackend.TREE_WALKING);

			assertThat(appender.messages()).containsExactly(
					"Parsed 'speed <= 1' from 4 tokens",
					"Compiled 'speed <= 1' for the tree-walking monitor");
		}
	}

	@Nested
	@DisplayName("Failures carry positions")
	class Failures {

		@Test
		void lexError() {
			assertThatThrownBy(() -> compiler.parse("speed <= 1 $"))
					.isInstanceOf(StlLexException.class)
					.isInstanceOf(StlCompilationException.class)
					.satisfies(e -> assertThat(((StlCompilationException) e).position()).isEqualTo(11));
		}

		@Test
		void thresholdBeyondDoubleRange() {
			assertThatThrownBy(() -> compiler.parse("speed <= 1" + "0".repeat(400)))
					.isInstanceOf(StlLexException.class)
					.satisfies(e -> assertThat(((StlCompilationException) e).position()).isEqualTo(9));
		}

		@Test
		void intervalBoundBeyondDoubleRange() {
			assertThatThrownBy(() -> compiler.parse("always[0, 1" + "0".repeat(400) + "] (speed <= 1)"))
					.isInstanceOf(StlLexException.class)
					.satisfies(e -> assertThat(((StlCompilationException) e).position()).isEqualTo(10));
		}

		@Test
		void syntaxError() {
			assertThatThrownBy(() -> compiler.parse("always (speed <= 1"))
					.isInstanceOf(StlSyntaxException.class)
					.satisfies(e -> assertThat(((StlCompilationException) e).position()).isEqualTo(18));
		}

		@Test
		void validationErrorStopsBeforeTranslation() {
			assertThatThrownBy(() -> compiler.compile("always (unknown_var >= 0)", SignalCatalog.empty(),
					MonitorBackend.LINEAR_CONSTRAINT))
					.isInstanceOf(StlValidationException.class)
					.satisfies(e -> assertThat(((StlValidationException) e).errors())
							.containsExactly(new ValidationError.UndeclaredVariable("unknown_var", 8)));
		}

		@Test
		void backendIsRequired() {
			assertThatThrownBy(() -> compiler.compile("speed <= 1", vehicle, null))
					.isInstanceOf(NullPointerException.class);
		}
	}

	@Nested
	@DisplayName("Logic translation")
	class LogicTranslation {

		@Test
		void sameLogicReturnsInputUnchanged() {
			String stl = "always[0, 10] (a and b)";
			String tptl = "@Var_t [](({ Var_t >= 0 } /\\ { Var_t <= 10 }) -> (a /\\ b))";

			assertThat(compiler.translate(stl, TemporalLogic.STL, TemporalLogic.STL)).isSameAs(stl);
			assertThat(compiler.translate(tptl, TemporalLogic.TPTL, TemporalLogic.TPTL)).isSameAs(tptl);
		}

		@Test
		void stlToTptl() {
			assertThat(compiler.translate("not not not a", TemporalLogic.STL, TemporalLogic.TPTL)).isEqualTo("! ! ! a");
			assertThat(compiler.translate("always[0, 10] (a and b)", TemporalLogic.STL, TemporalLogic.TPTL))
					.isEqualTo("@Var_t [](({ Var_t >= 0 } /\\ { Var_t <= 10 }) -> ( a /\\ b ))");
		}

		@Test
		void cannotTranslateToALessExpressiveLogic() {
			assertThatThrownBy(() -> compiler.translate("@Var_t X a", TemporalLogic.TPTL, TemporalLogic.STL))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("Cannot translate from TPTL to STL");
		}
	}
}
