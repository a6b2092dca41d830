package org.javai.stl.translate;

import java.util.ArrayList;
import java.util.List;
import org.javai.stl.ast.Formula;
import org.javai.stl.ast.Formulas;
import org.javai.stl.ast.ParsedFormula;
import org.javai.stl.signal.SignalCatalog;
import org.javai.stl.validate.ValidationError;

/**
 * Binding checks shared by the translators.
 */
final class Bindings {

	private Bindings() {
	}

	/**
	 * One {@link ValidationError.UndeclaredVariable} per predicate occurrence whose
	 * signal is not in the catalog.
	 */
	static List<ValidationError> undeclared(ParsedFormula parsed, SignalCatalog catalog) {
		List<ValidationError> errors = new ArrayList<>();
		for (Formula.Predicate predicate : Formulas.predicates(parsed.formula())) {
			if (catalog.find(predicate.name()).isEmpty()) {
				errors.add(new ValidationError.UndeclaredVariable(predicate.name(), parsed.positionOf(predicate)));
			}
		}
		return errors;
	}
}
