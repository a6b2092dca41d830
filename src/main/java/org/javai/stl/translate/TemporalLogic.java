package org.javai.stl.translate;

/**
 * Temporal logics a requirement can be written in, ordered by expressiveness.
 * A requirement can be translated into a logic of the same or a higher level only.
 */
public enum TemporalLogic {

	STL(1),
	TPTL(2);

	private final int level;

	TemporalLogic(int level) {
		this.level = level;
	}

	public boolean canTranslateTo(TemporalLogic target) {
		return level <= target.level;
	}
}
