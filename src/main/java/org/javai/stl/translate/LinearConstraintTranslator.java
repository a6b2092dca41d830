package org.javai.stl.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.stl.ast.Formula;
import org.javai.stl.ast.Formulas;
import org.javai.stl.ast.ParsedFormula;
import org.javai.stl.signal.SignalCatalog;
import org.javai.stl.signal.SignalDeclaration;
import org.javai.stl.translate.CompiledSpecification.LinearSpecification;
import org.javai.stl.validate.MonitorBackend;
import org.javai.stl.validate.StlValidationException;
import org.javai.stl.validate.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates a formula for the dense-time monitor, which evaluates predicates of the
 * form {@code a · x <= b}.
 * <p>
 * Every predicate occurrence becomes one table entry, in left-to-right order, so a
 * predicate written twice appears twice. Rows are built from the declared
 * coefficients, or a one-hot vector at the declared column, and sign-adjusted:
 * <ul>
 *   <li>{@code x <= c} gives {@code (row, c)}</li>
 *   <li>{@code x >= c} gives {@code (-row, -c)}</li>
 *   <li>{@code -x <= c} gives {@code (-row, c)}</li>
 *   <li>{@code -x >= c} gives {@code (row, -c)}</li>
 * </ul>
 * A bare name gives {@code (row, bound)} with the declared bound, {@code 0} if none.
 * Strict comparisons and {@code next} have no encoding and are rejected.
 */
public final class LinearConstraintTranslator implements BackendTranslator<LinearSpecification> {

	private static final Logger logger = LoggerFactory.getLogger(LinearConstraintTranslator.class);

	@Override
	public MonitorBackend backend() {
		return MonitorBackend.LINEAR_CONSTRAINT;
	}

	@Override
	public LinearSpecification translate(ParsedFormula parsed, SignalCatalog catalog) {
		Objects.requireNonNull(parsed, "parsed must not be null");
		Objects.requireNonNull(catalog, "catalog must not be null");

		List<ValidationError> errors = Bindings.undeclared(parsed, catalog);
		errors.addAll(unsupported(parsed));
		if (!errors.isEmpty()) {
			throw new StlValidationException(errors);
		}

		int dimension = catalog.dimension();
		List<LinearPredicate> predicates = new ArrayList<>();
		OperatorTree<Integer> skeleton = OperatorTree.of(parsed.formula(), predicate -> {
			SignalDeclaration declaration = catalog.find(predicate.name()).orElseThrow();
			predicates.add(toLinear(predicate, declaration, dimension));
			return predicates.size() - 1;
		});

		List<VariableBinding> variables = catalog.declarations().stream()
				.map(VariableBinding::of)
				.toList();
		logger.debug("Translated '{}' into {} linear predicates over {} columns",
				parsed.source(), predicates.size(), dimension);
		return new LinearSpecification(variables, dimension, predicates, skeleton);
	}

	private List<ValidationError> unsupported(ParsedFormula parsed) {
		List<ValidationError> errors = new ArrayList<>();
		Formulas.walkPreOrder(parsed.formula(), node -> {
			if (node instanceof Formula.Next next) {
				errors.add(new ValidationError.UnsupportedOperator(
						next.operator().keyword(), backend(), parsed.positionOf(node)));
			}
			else if (node instanceof Formula.Predicate predicate && !predicate.isBoolean() && predicate.relop().isStrict()) {
				errors.add(new ValidationError.UnsupportedOperator(
						predicate.relop().symbol(), backend(), parsed.positionOf(node)));
			}
		});
		return errors;
	}

	static LinearPredicate toLinear(Formula.Predicate predicate, SignalDeclaration declaration, int dimension) {
		double[] row = baseRow(declaration, dimension);
		if (predicate.isBoolean()) {
			return new LinearPredicate(predicate.name(), boxed(row, 1), declaration.boundOrZero());
		}
		boolean upperBound = predicate.relop().isUpperBound();
		int sign = (upperBound ? 1 : -1) * (predicate.negatedName() ? -1 : 1);
		double threshold = upperBound ? predicate.threshold() : negate(predicate.threshold());
		return new LinearPredicate(predicate.name(), boxed(row, sign), threshold);
	}

	private static double[] baseRow(SignalDeclaration declaration, int dimension) {
		double[] row = new double[dimension];
		if (declaration.hasCoefficients()) {
			List<Double> coefficients = declaration.coefficients();
			for (int i = 0; i < coefficients.size(); i++) {
				row[i] = coefficients.get(i);
			}
		}
		else {
			row[declaration.column()] = 1.0;
		}
		return row;
	}

	private static List<Double> boxed(double[] row, int sign) {
		List<Double> values = new ArrayList<>(row.length);
		for (double value : row) {
			values.add(sign < 0 ? negate(value) : value);
		}
		return values;
	}

	// -0.0 would not compare equal to 0.0 as a Double
	private static double negate(double value) {
		return value == 0.0 ? 0.0 : -value;
	}
}
