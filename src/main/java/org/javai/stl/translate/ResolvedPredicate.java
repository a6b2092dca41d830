package org.javai.stl.translate;

import java.util.Objects;
import org.javai.stl.ast.Relop;
import org.javai.stl.signal.SignalType;

/**
 * A predicate whose signal name has been replaced by its trace column.
 * {@code relop} and {@code threshold} are {@code null} for a boolean signal.
 */
public record ResolvedPredicate(int columnIndex, Relop relop, Double threshold, boolean negatedName, SignalType type) {

	public ResolvedPredicate {
		Objects.requireNonNull(type, "type must not be null");
	}

	public boolean isBoolean() {
		return relop == null;
	}
}
