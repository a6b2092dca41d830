package org.javai.stl.signal;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The set of signals a requirement may reference, with their types and trace columns.
 * <p>
 * The validator and both backend translators look names up through this interface.
 */
public interface SignalCatalog {

	/**
	 * Identifier used to register the catalog, e.g. {@code "autotrans"}.
	 */
	String id();

	/**
	 * Looks up a declaration by signal name.
	 *
	 * @param name the signal name as written in the requirement
	 * @return the declaration, or empty if the name is not declared
	 */
	Optional<SignalDeclaration> find(String name);

	/**
	 * All declarations in declaration order.
	 */
	List<SignalDeclaration> declarations();

	/**
	 * Length of a coefficient row: one past the highest declared column, or the length
	 * of the longest user-supplied row if that is larger.
	 */
	default int dimension() {
		int dimension = 0;
		for (SignalDeclaration declaration : declarations()) {
			dimension = Math.max(dimension, declaration.column() + 1);
			dimension = Math.max(dimension, declaration.coefficients().size());
		}
		return dimension;
	}

	static DefaultSignalCatalog.Builder builder(String id) {
		return DefaultSignalCatalog.builder(id);
	}

	/**
	 * Catalog of {@link SignalType#FLOAT} signals from a name to column mapping, in the
	 * mapping's iteration order.
	 */
	static SignalCatalog ofColumns(Map<String, Integer> columns) {
		DefaultSignalCatalog.Builder builder = DefaultSignalCatalog.builder("columns");
		columns.forEach(builder::signal);
		return builder.build();
	}

	static SignalCatalog empty() {
		return DefaultSignalCatalog.builder("empty").build();
	}
}
