package org.javai.stl.signal;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for signal catalog YAML files.
 *
 * <pre>
 * catalog: autotrans
 * signals:
 *   - name: speed
 *     type: float
 *     column: 0
 *   - name: overspeed
 *     type: bool
 *     column: 0
 *     coefficients: [1.0, 0.0]
 *     bound: 120
 * </pre>
 */
public class SignalCatalogParser {

	private final Yaml yaml = new Yaml();

	/**
	 * Parse a catalog YAML file from a path.
	 */
	public SignalCatalog parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (StlConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new StlConfigurationException("Failed to parse signal catalog from path: " + path, e);
		}
	}

	/**
	 * Parse a catalog YAML file from an input stream.
	 */
	public SignalCatalog parse(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildCatalog(data);
		} catch (StlConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new StlConfigurationException("Failed to parse signal catalog from input stream", e);
		}
	}

	/**
	 * Parse a catalog YAML file from a reader.
	 */
	public SignalCatalog parse(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildCatalog(data);
		} catch (StlConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new StlConfigurationException("Failed to parse signal catalog from reader", e);
		}
	}

	/**
	 * Parse a catalog from a YAML string.
	 */
	public SignalCatalog parseString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildCatalog(data);
		} catch (StlConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new StlConfigurationException("Failed to parse signal catalog from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private SignalCatalog buildCatalog(Map<String, Object> data) {
		if (data == null) {
			throw new StlConfigurationException("Signal catalog document is empty");
		}
		String id = toString(data.get("catalog"));
		if (id == null || id.isBlank()) {
			throw new StlConfigurationException("Missing required 'catalog' id");
		}

		Object signalsObj = data.get("signals");
		if (!(signalsObj instanceof List)) {
			throw new StlConfigurationException("Catalog '" + id + "' requires a 'signals' list");
		}

		DefaultSignalCatalog.Builder builder = DefaultSignalCatalog.builder(id);
		for (Object entry : (List<Object>) signalsObj) {
			if (!(entry instanceof Map)) {
				throw new StlConfigurationException("Each signal in catalog '" + id + "' must be a mapping");
			}
			try {
				builder.declare(buildDeclaration((Map<String, Object>) entry));
			} catch (IllegalArgumentException e) {
				throw new StlConfigurationException("Invalid signal in catalog '" + id + "': " + e.getMessage(), e);
			}
		}
		return builder.build();
	}

	private SignalDeclaration buildDeclaration(Map<String, Object> signal) {
		String name = toString(signal.get("name"));
		SignalType type = SignalType.fromLabel(toString(signal.get("type")));
		Object columnObj = signal.get("column");
		if (!(columnObj instanceof Number)) {
			throw new IllegalArgumentException("signal '" + name + "' requires an integer 'column'");
		}
		return new SignalDeclaration(
			name,
			type,
			((Number) columnObj).intValue(),
			toDoubles(signal.get("coefficients")),
			toDouble(signal.get("bound"))
		);
	}

	private List<Double> toDoubles(Object value) {
		if (value == null) {
			return List.of();
		}
		if (!(value instanceof List)) {
			throw new IllegalArgumentException("'coefficients' must be a list of numbers");
		}
		List<Double> result = new ArrayList<>();
		for (Object item : (List<?>) value) {
			result.add(toDouble(item));
		}
		return result;
	}

	private Double toDouble(Object value) {
		if (value == null) {
			return null;
		}
		if (value instanceof Number) {
			return ((Number) value).doubleValue();
		}
		throw new IllegalArgumentException("expected a number but found '" + value + "'");
	}

	private String toString(Object value) {
		return value == null ? null : String.valueOf(value);
	}
}
