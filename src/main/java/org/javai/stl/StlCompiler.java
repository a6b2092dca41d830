package org.javai.stl;

import java.util.List;
import java.util.Objects;
import org.javai.stl.ast.AstBuilder;
import org.javai.stl.ast.ParsedFormula;
import org.javai.stl.signal.SignalCatalog;
import org.javai.stl.syntax.ParseTree;
import org.javai.stl.syntax.ParseTreePrinter;
import org.javai.stl.syntax.StlParser;
import org.javai.stl.syntax.StlToken;
import org.javai.stl.syntax.StlTokenizer;
import org.javai.stl.translate.CompiledSpecification;
import org.javai.stl.translate.CompiledSpecification.LinearSpecification;
import org.javai.stl.translate.CompiledSpecification.TreeSpecification;
import org.javai.stl.translate.LinearConstraintTranslator;
import org.javai.stl.translate.TemporalLogic;
import org.javai.stl.translate.TptlTranslator;
import org.javai.stl.translate.TreeWalkingTranslator;
import org.javai.stl.validate.FormulaValidator;
import org.javai.stl.validate.MonitorBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for compiling STL requirements.
 * <p>
 * Runs the stages in order (tokenize, parse, build the AST, validate, translate) and
 * stops at the first stage that fails. Every failure is a
 * {@link StlCompilationException} carrying the offending character offset.
 *
 * <pre>{@code
 * SignalCatalog catalog = SignalCatalog.builder("demo").signal("x", 0).signal("y", 1).build();
 * LinearSpecification spec = new StlCompiler().compileLinear("always[0, 10] (x <= 5)", catalog);
 * }</pre>
 *
 * Stateless; one instance can be shared.
 */
public final class StlCompiler {

	private static final Logger logger = LoggerFactory.getLogger(StlCompiler.class);

	private final AstBuilder astBuilder = new AstBuilder();
	private final FormulaValidator validator = new FormulaValidator();
	private final LinearConstraintTranslator linearTranslator = new LinearConstraintTranslator();
	private final TreeWalkingTranslator treeTranslator = new TreeWalkingTranslator();
	private final TptlTranslator tptlTranslator = new TptlTranslator();

	/**
	 * Parses a requirement into its AST without any semantic checks.
	 */
	public ParsedFormula parse(String requirement) {
		List<StlToken> tokens = new StlTokenizer(requirement).tokenize();
		ParseTree tree = new StlParser(tokens).parse();
		if (logger.isTraceEnabled()) {
			logger.trace("Parse tree of '{}': {}", requirement, ParseTreePrinter.printCompact(tree));
		}
		ParsedFormula parsed = astBuilder.build(requirement, tree);
		logger.debug("Parsed '{}' from {} tokens", requirement, tokens.size());
		return parsed;
	}

	/**
	 * Parses and validates a requirement.
	 *
	 * @param backend the target monitor, or {@code null} to skip backend checks
	 */
	public ParsedFormula validate(String requirement, SignalCatalog catalog, MonitorBackend backend) {
		return validator.validate(parse(requirement), catalog, backend);
	}

	/**
	 * Compiles a requirement for the given monitor.
	 */
	public CompiledSpecification compile(String requirement, SignalCatalog catalog, MonitorBackend backend) {
		Objects.requireNonNull(backend, "backend must not be null");
		ParsedFormula parsed = validate(requirement, catalog, backend);
		CompiledSpecification compiled = switch (backend) {
			case LINEAR_CONSTRAINT -> linearTranslator.translate(parsed, catalog);
			case TREE_WALKING -> treeTranslator.translate(parsed, catalog);
		};
		logger.debug("Compiled '{}' for the {} monitor", requirement, backend.label());
		return compiled;
	}

	public LinearSpecification compileLinear(String requirement, SignalCatalog catalog) {
		return (LinearSpecification) compile(requirement, catalog, MonitorBackend.LINEAR_CONSTRAINT);
	}

	public TreeSpecification compileTree(String requirement, SignalCatalog catalog) {
		return (TreeSpecification) compile(requirement, catalog, MonitorBackend.TREE_WALKING);
	}

	/**
	 * Translates a requirement between temporal logics.
	 *
	 * @return the requirement unchanged when {@code source == target}, otherwise its
	 *         translation
	 * @throws IllegalArgumentException if {@code target} is less expressive than {@code source}
	 */
	public String translate(String requirement, TemporalLogic source, TemporalLogic target) {
		Objects.requireNonNull(source, "source must not be null");
		Objects.requireNonNull(target, "target must not be null");
		if (!source.canTranslateTo(target)) {
			throw new IllegalArgumentException("Cannot translate from " + source + " to " + target);
		}
		if (source == target) {
			return requirement;
		}
		return tptlTranslator.translate(parse(requirement).formula());
	}
}
