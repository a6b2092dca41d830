package org.javai.stl.signal;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable {@link SignalCatalog} built with {@link #builder(String)}.
 */
public final class DefaultSignalCatalog implements SignalCatalog {

	private final String id;
	private final Map<String, SignalDeclaration> declarations;

	private DefaultSignalCatalog(String id, Map<String, SignalDeclaration> declarations) {
		this.id = id;
		this.declarations = declarations;
	}

	public static Builder builder(String id) {
		return new Builder(id);
	}

	@Override
	public String id() {
		return id;
	}

	@Override
	public Optional<SignalDeclaration> find(String name) {
		return Optional.ofNullable(declarations.get(name));
	}

	@Override
	public List<SignalDeclaration> declarations() {
		return List.copyOf(declarations.values());
	}

	@Override
	public String toString() {
		return "SignalCatalog[" + id + ", " + declarations.keySet() + "]";
	}

	public static final class Builder {

		private final String id;
		private final Map<String, SignalDeclaration> declarations = new LinkedHashMap<>();

		private Builder(String id) {
			if (id == null || id.isBlank()) {
				throw new IllegalArgumentException("Catalog id cannot be null or empty");
			}
			this.id = id;
		}

		/**
		 * Declares a {@link SignalType#FLOAT} signal.
		 */
		public Builder signal(String name, int column) {
			return declare(SignalDeclaration.ofFloat(name, column));
		}

		public Builder signal(String name, SignalType type, int column) {
			return declare(SignalDeclaration.of(name, type, column));
		}

		/**
		 * Adds a declaration.
		 *
		 * @throws IllegalArgumentException if a signal with the same name is already declared
		 */
		public Builder declare(SignalDeclaration declaration) {
			if (declaration == null) {
				throw new IllegalArgumentException("Declaration cannot be null");
			}
			if (declarations.containsKey(declaration.name())) {
				throw new IllegalArgumentException("Signal '" + declaration.name() + "' is declared twice in catalog " + id);
			}
			declarations.put(declaration.name(), declaration);
			return this;
		}

		public DefaultSignalCatalog build() {
			return new DefaultSignalCatalog(id, new LinkedHashMap<>(declarations));
		}
	}
}
