package org.javai.stl.translate;

import org.javai.stl.ast.Formula;
import org.javai.stl.ast.ParsedFormula;
import org.javai.stl.signal.SignalCatalog;
import org.javai.stl.validate.MonitorBackend;

/**
 * Translates a formula into the structure one monitor consumes.
 * <p>
 * Implementations check signal bindings themselves and fail with
 * {@link org.javai.stl.validate.StlValidationException} on an undeclared name, so
 * they are safe to call on formulas that were never validated.
 *
 * @param <S> the compiled form produced
 */
public interface BackendTranslator<S extends CompiledSpecification> {

	MonitorBackend backend();

	S translate(ParsedFormula parsed, SignalCatalog catalog);

	default S translate(Formula formula, SignalCatalog catalog) {
		return translate(ParsedFormula.of(formula), catalog);
	}
}
