package org.javai.stl;

import java.util.Map;
import java.util.Objects;
import org.javai.stl.signal.SignalCatalog;
import org.javai.stl.translate.CompiledSpecification.LinearSpecification;
import org.javai.stl.translate.CompiledSpecification.TreeSpecification;

/**
 * Shortcuts for compiling a requirement over real-valued signals given only their
 * trace columns.
 */
public final class StlSpecifications {

	private static final StlCompiler COMPILER = new StlCompiler();

	private StlSpecifications() {
	}

	/**
	 * Compiles for the discrete-time (tree-walking) monitor.
	 *
	 * @param requirement the STL requirement
	 * @param columns signal name to trace column
	 */
	public static TreeSpecification parseDiscrete(String requirement, Map<String, Integer> columns) {
		Objects.requireNonNull(columns, "columns must not be null");
		return COMPILER.compileTree(requirement, SignalCatalog.ofColumns(columns));
	}

	/**
	 * Compiles for the dense-time (linear-constraint) monitor.
	 *
	 * @param requirement the STL requirement
	 * @param columns signal name to trace column
	 */
	public static LinearSpecification parseDense(String requirement, Map<String, Integer> columns) {
		Objects.requireNonNull(columns, "columns must not be null");
		return COMPILER.compileLinear(requirement, SignalCatalog.ofColumns(columns));
	}
}
