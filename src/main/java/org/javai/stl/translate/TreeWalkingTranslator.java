package org.javai.stl.translate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.stl.ast.ParsedFormula;
import org.javai.stl.signal.SignalCatalog;
import org.javai.stl.signal.SignalDeclaration;
import org.javai.stl.translate.CompiledSpecification.TreeSpecification;
import org.javai.stl.validate.MonitorBackend;
import org.javai.stl.validate.StlValidationException;
import org.javai.stl.validate.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates a formula for the discrete-time monitor, which walks the formula tree and
 * reads each predicate's signal from its trace column.
 */
public final class TreeWalkingTranslator implements BackendTranslator<TreeSpecification> {

	private static final Logger logger = LoggerFactory.getLogger(TreeWalkingTranslator.class);

	@Override
	public MonitorBackend backend() {
		return MonitorBackend.TREE_WALKING;
	}

	@Override
	public TreeSpecification translate(ParsedFormula parsed, SignalCatalog catalog) {
		Objects.requireNonNull(parsed, "parsed must not be null");
		Objects.requireNonNull(catalog, "catalog must not be null");

		List<ValidationError> errors = Bindings.undeclared(parsed, catalog);
		if (!errors.isEmpty()) {
			throw new StlValidationException(errors);
		}

		Map<String, VariableBinding> declarations = new LinkedHashMap<>();
		OperatorTree<ResolvedPredicate> tree = OperatorTree.of(parsed.formula(), predicate -> {
			SignalDeclaration declaration = catalog.find(predicate.name()).orElseThrow();
			declarations.computeIfAbsent(declaration.name(), name -> VariableBinding.of(declaration));
			return new ResolvedPredicate(declaration.column(), predicate.relop(), predicate.threshold(),
					predicate.negatedName(), declaration.type());
		});

		logger.debug("Translated '{}' into a tree over {} signals", parsed.source(), declarations.size());
		return new TreeSpecification(List.copyOf(declarations.values()), tree);
	}
}
