package org.javai.stl.translate;

import java.util.Objects;
import org.javai.stl.signal.SignalDeclaration;
import org.javai.stl.signal.SignalType;

/**
 * One row of a monitor's declaration table: a signal name and where to find it in
 * the trace.
 */
public record VariableBinding(String name, int columnIndex, SignalType type) {

	public VariableBinding {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(type, "type must not be null");
	}

	public static VariableBinding of(SignalDeclaration declaration) {
		return new VariableBinding(declaration.name(), declaration.column(), declaration.type());
	}
}
