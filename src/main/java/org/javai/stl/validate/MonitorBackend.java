package org.javai.stl.validate;

import java.util.Set;

/**
 * The robustness monitors a formula can be compiled for.
 */
public enum MonitorBackend {

	/**
	 * Discrete-time monitor evaluating the formula tree directly over named signals.
	 * Its trace format uses a {@code time} column, so that name cannot be a signal.
	 */
	TREE_WALKING("tree-walking", false, Set.of("time")),

	/**
	 * Dense-time monitor over linear predicates {@code a·x <= b}.
	 */
	LINEAR_CONSTRAINT("linear-constraint", true, Set.of());

	private final String label;
	private final boolean denseTime;
	private final Set<String> reservedNames;

	MonitorBackend(String label, boolean denseTime, Set<String> reservedNames) {
		this.label = label;
		this.denseTime = denseTime;
		this.reservedNames = reservedNames;
	}

	public String label() {
		return label;
	}

	public boolean isDenseTime() {
		return denseTime;
	}

	/**
	 * Signal names the monitor claims for itself.
	 */
	public Set<String> reservedNames() {
		return reservedNames;
	}
}
