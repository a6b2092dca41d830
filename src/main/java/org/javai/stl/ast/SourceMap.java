package org.javai.stl.ast;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Character offsets of formula nodes and intervals in the requirement they were
 * parsed from.
 * <p>
 * Keys are compared by identity: two structurally equal predicates at different
 * places of one requirement keep their own positions.
 */
public final class SourceMap {

	private static final SourceMap EMPTY = new SourceMap(new IdentityHashMap<>());

	private final Map<Object, Integer> positions;

	private SourceMap(IdentityHashMap<Object, Integer> positions) {
		this.positions = Collections.unmodifiableMap(positions);
	}

	public static SourceMap empty() {
		return EMPTY;
	}

	/**
	 * Position of a {@link Formula} or {@link Interval} instance, or {@code -1} if unknown.
	 */
	public int positionOf(Object node) {
		Integer position = positions.get(node);
		return position != null ? position : -1;
	}

	public int size() {
		return positions.size();
	}

	static Builder builder() {
		return new Builder();
	}

	static final class Builder {

		private final IdentityHashMap<Object, Integer> positions = new IdentityHashMap<>();

		<T> T record(T node, int position) {
			positions.put(node, position);
			return node;
		}

		SourceMap build() {
			return new SourceMap(new IdentityHashMap<>(positions));
		}
	}
}
