package org.javai.stl.signal;

import java.util.Locale;

/**
 * Data type of a declared signal.
 * <p>
 * {@code FLOAT} signals are compared against constants ({@code speed <= 120});
 * {@code BOOL} signals are referenced by bare name ({@code door_open}).
 */
public enum SignalType {

	FLOAT("float"),
	BOOL("bool");

	private final String label;

	SignalType(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}

	public static SignalType fromLabel(String label) {
		if (label == null) {
			return FLOAT;
		}
		return switch (label.trim().toLowerCase(Locale.ROOT)) {
			case "float", "double", "real" -> FLOAT;
			case "bool", "boolean" -> BOOL;
			default -> throw new IllegalArgumentException("Unknown signal type: " + label);
		};
	}
}
