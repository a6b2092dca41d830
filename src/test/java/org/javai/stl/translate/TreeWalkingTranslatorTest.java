package org.javai.stl.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;
import org.javai.stl.StlCompiler;
import org.javai.stl.ast.Interval;
import org.javai.stl.ast.Operator;
import org.javai.stl.ast.Relop;
import org.javai.stl.signal.SignalCatalog;
import org.javai.stl.signal.SignalDeclaration;
import org.javai.stl.signal.SignalType;
import org.javai.stl.translate.CompiledSpecification.TreeSpecification;
import org.javai.stl.validate.MonitorBackend;
import org.javai.stl.validate.StlValidationException;
import org.javai.stl.validate.ValidationError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TreeWalkingTranslatorTest {

	@Mock
	private SignalCatalog catalog;

	private final StlCompiler compiler = new StlCompiler();
	private TreeWalkingTranslator translator;

	@BeforeEach
	void setUp() {
		translator = new TreeWalkingTranslator();
	}

	@Test
	void replacesNamesWithColumnsAndKeepsTheOperatorTree() {
		when(catalog.find("speed")).thenReturn(Optional.of(SignalDeclaration.ofFloat("speed", 3)));
		when(catalog.find("door_open")).thenReturn(Optional.of(SignalDeclaration.of("door_open", SignalType.BOOL, 5)));

		TreeSpecification spec = translator.translate(
				compiler.parse("always[0, 10] (speed <= 120 or not door_open)"), catalog);

		assertThat(spec.backend()).isEqualTo(MonitorBackend.TREE_WALKING);
		OperatorTree.Node<ResolvedPredicate> root = (OperatorTree.Node<ResolvedPredicate>) spec.tree();
		assertThat(root.operator()).isEqualTo(Operator.GLOBALLY);
		assertThat(root.interval()).isEqualTo(Interval.closed(0, 10));
		OperatorTree.Node<ResolvedPredicate> or = (OperatorTree.Node<ResolvedPredicate>) root.operands().get(0);
		assertThat(or.operator()).isEqualTo(Operator.OR);
		assertThat(or.operands().get(1)).isInstanceOf(OperatorTree.Node.class);

		assertThat(spec.tree().leaves()).containsExactly(
				new ResolvedPredicate(3, Relop.LE, 120.0, false, SignalType.FLOAT),
				new ResolvedPredicate(5, null, null, false, SignalType.BOOL));
	}

	@Test
	void declarationTableListsReferencedSignalsOnceInFirstEncounterOrder() {
		when(catalog.find("rpm")).thenReturn(Optional.of(SignalDeclaration.ofFloat("rpm", 1)));
		when(catalog.find("speed")).thenReturn(Optional.of(SignalDeclaration.ofFloat("speed", 0)));

		TreeSpecification spec = translator.translate(
				compiler.parse("(rpm < 4500 and speed > 10) -> F[0, 2] (rpm <= 3000 U speed >= 50)"), catalog);

		assertThat(spec.declarations()).containsExactly(
				new VariableBinding("rpm", 1, SignalType.FLOAT),
				new VariableBinding("speed", 0, SignalType.FLOAT));
		assertThat(spec.variables()).isEqualTo(spec.declarations());
		assertThat(spec.tree().leaves()).extracting(ResolvedPredicate::columnIndex).containsExactly(1, 0, 1, 0);
		verify(catalog, never()).declarations();
	}

	@Test
	void keepsNegatedNameAndNegativeThresholdApart() {
		when(catalog.find("x")).thenReturn(Optional.of(SignalDeclaration.ofFloat("x", 0)));

		TreeSpecification spec = translator.translate(compiler.parse("-x <= 5 and x <= -5"), catalog);

		assertThat(spec.tree().leaves()).containsExactly(
				new ResolvedPredicate(0, Relop.LE, 5.0, true, SignalType.FLOAT),
				new ResolvedPredicate(0, Relop.LE, -5.0, false, SignalType.FLOAT));
	}

	@Test
	void nextIsSupported() {
		when(catalog.find("x")).thenReturn(Optional.of(SignalDeclaration.ofFloat("x", 0)));

		TreeSpecification spec = translator.translate(compiler.parse("X_ x > 1"), catalog);

		assertThat(((OperatorTree.Node<ResolvedPredicate>) spec.tree()).operator()).isEqualTo(Operator.NEXT);
	}

	@Test
	void unboundNameFailsEvenWithoutValidation() {
		when(catalog.find(anyString())).thenReturn(Optional.empty());

		assertThatThrownBy(() -> translator.translate(compiler.parse("always (unknown_var >= 0)"), catalog))
				.isInstanceOf(StlValidationException.class)
				.satisfies(e -> assertThat(((StlValidationException) e).errors())
						.containsExactly(new ValidationError.UndeclaredVariable("unknown_var", 8)));
	}
}
