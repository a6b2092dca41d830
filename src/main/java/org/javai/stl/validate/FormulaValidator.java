package org.javai.stl.validate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.stl.ast.Formula;
import org.javai.stl.ast.Interval;
import org.javai.stl.ast.ParsedFormula;
import org.javai.stl.signal.SignalCatalog;
import org.javai.stl.signal.SignalDeclaration;
import org.javai.stl.signal.SignalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a formula against a signal catalog and, optionally, the monitor it is meant for.
 * <p>
 * The tree is walked once in pre-order and never modified. Name, type, backend and
 * reserved-name errors are collected across the whole tree; a malformed interval stops
 * the walk, since the window of everything below it is meaningless.
 */
public final class FormulaValidator {

	private static final Logger logger = LoggerFactory.getLogger(FormulaValidator.class);

	/**
	 * Validates a formula built in code, without backend-specific checks.
	 */
	public Formula validate(Formula formula, SignalCatalog catalog) {
		return validate(ParsedFormula.of(formula), catalog, null).formula();
	}

	/**
	 * Validates a parsed formula.
	 *
	 * @param parsed the formula and its source positions
	 * @param catalog the declared signals
	 * @param backend the target monitor, or {@code null} to skip backend checks
	 * @return {@code parsed}, unchanged
	 * @throws StlValidationException listing every error found
	 */
	public ParsedFormula validate(ParsedFormula parsed, SignalCatalog catalog, MonitorBackend backend) {
		Objects.requireNonNull(parsed, "parsed must not be null");
		Objects.requireNonNull(catalog, "catalog must not be null");

		Walk walk = new Walk(parsed, catalog, backend);
		walk.visit(parsed.formula());
		if (!walk.errors.isEmpty()) {
			logger.debug("Formula '{}' failed validation with {} error(s)", parsed.source(), walk.errors.size());
			throw new StlValidationException(walk.errors);
		}
		logger.debug("Formula '{}' validated against catalog '{}'", parsed.source(), catalog.id());
		return parsed;
	}

	private static final class Walk {

		private final ParsedFormula parsed;
		private final SignalCatalog catalog;
		private final MonitorBackend backend;
		private final List<ValidationError> errors = new ArrayList<>();

		private Walk(ParsedFormula parsed, SignalCatalog catalog, MonitorBackend backend) {
			this.parsed = parsed;
			this.catalog = catalog;
			this.backend = backend;
		}

		/**
		 * @return false once an interval error has stopped the walk
		 */
		private boolean visit(Formula node) {
			if (node instanceof Formula.Predicate predicate) {
				checkPredicate(predicate);
				return true;
			}
			Formula.Compound compound = (Formula.Compound) node;
			Interval interval = compound.interval();
			if (interval != null && !interval.isWellFormed()) {
				int position = parsed.positionOf(interval);
				errors.add(new ValidationError.InvalidInterval(interval,
						position >= 0 ? position : parsed.positionOf(node)));
				return false;
			}
			if (node instanceof Formula.Next && backend != null && backend.isDenseTime()) {
				errors.add(new ValidationError.UnsupportedOperator(
						compound.operator().keyword(), backend, parsed.positionOf(node)));
			}
			for (Formula operand : node.operands()) {
				if (!visit(operand)) {
					return false;
				}
			}
			return true;
		}

		private void checkPredicate(Formula.Predicate predicate) {
			int position = parsed.positionOf(predicate);
			String name = predicate.name();
			if (backend != null && backend.reservedNames().contains(name)) {
				errors.add(new ValidationError.ReservedName(name, backend, position));
				return;
			}
			Optional<SignalDeclaration> declaration = catalog.find(name);
			if (declaration.isEmpty()) {
				errors.add(new ValidationError.UndeclaredVariable(name, position));
				return;
			}
			SignalType declared = declaration.get().type();
			if (predicate.isBoolean() != (declared == SignalType.BOOL)) {
				errors.add(new ValidationError.TypeMismatch(name, declared, position));
			}
			if (backend == MonitorBackend.LINEAR_CONSTRAINT && !predicate.isBoolean() && predicate.relop().isStrict()) {
				errors.add(new ValidationError.UnsupportedOperator(predicate.relop().symbol(), backend, position));
			}
		}
	}
}
