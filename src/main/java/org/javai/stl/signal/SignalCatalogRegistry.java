package org.javai.stl.signal;

import java.io.InputStream;
import java.net.JarURLConnection;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry for signal catalogs.
 *
 * Applications register the catalogs of their models once and look them up by id
 * when compiling requirements. Registrations are idempotent per catalog id: the first
 * catalog registered under an id wins. Not thread-safe.
 */
public final class SignalCatalogRegistry {

	private static final Logger logger = LoggerFactory.getLogger(SignalCatalogRegistry.class);

	static final String CATALOG_PREFIX = "stl-signals-";

	private final Map<String, SignalCatalog> catalogs = new LinkedHashMap<>();
	private final SignalCatalogParser parser;

	private SignalCatalogRegistry(SignalCatalogParser parser) {
		this.parser = parser;
	}

	/**
	 * Create an empty registry backed by a fresh parser.
	 */
	public static SignalCatalogRegistry create() {
		return new SignalCatalogRegistry(new SignalCatalogParser());
	}

	/**
	 * Register a catalog object directly. If a catalog with the same id is already
	 * present, the existing one is kept and returned.
	 */
	public SignalCatalog register(SignalCatalog catalog) {
		Objects.requireNonNull(catalog, "catalog must not be null");
		String id = catalog.id();
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("Catalog is missing an id");
		}
		SignalCatalog existing = catalogs.get(id);
		if (existing != null) {
			logger.debug("Signal catalog with id '{}' already registered; skipping", id);
			return existing;
		}
		catalogs.put(id, catalog);
		logger.debug("Registered signal catalog '{}' with {} signals", id, catalog.declarations().size());
		return catalog;
	}

	/**
	 * Discover and register catalogs found under META-INF on the classpath.
	 * <p>
	 * This scans both exploded directories and JARs for files named
	 * {@code stl-signals-*.yml}. Files that fail to parse are logged and skipped.
	 */
	public SignalCatalogRegistry registerMetaInfCatalogs(ClassLoader loader) {
		Objects.requireNonNull(loader, "loader must not be null");
		try {
			Enumeration<URL> resources = loader.getResources("META-INF/");
			while (resources.hasMoreElements()) {
				URL url = resources.nextElement();
				if ("file".equalsIgnoreCase(url.getProtocol())) {
					loadFromDirectory(url);
				}
				else if ("jar".equalsIgnoreCase(url.getProtocol())) {
					loadFromJar(url);
				}
			}
		}
		catch (Exception e) {
			throw new StlConfigurationException("Failed to scan META-INF for signal catalogs", e);
		}
		return this;
	}

	/**
	 * Load a catalog from a classpath resource using this class' loader.
	 */
	public SignalCatalog registerResource(String resourcePath) {
		return registerResource(resourcePath, SignalCatalogRegistry.class.getClassLoader());
	}

	/**
	 * Load and register a catalog from a classpath resource.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found
	 * @throws StlConfigurationException if parsing fails
	 */
	public SignalCatalog registerResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			return register(parser.parse(is));
		} catch (IllegalArgumentException | StlConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new StlConfigurationException("Failed to load signal catalog from resource: " + resourcePath, e);
		}
	}

	/**
	 * Load and register a catalog from a filesystem path.
	 *
	 * @throws StlConfigurationException if parsing fails
	 */
	public SignalCatalog registerPath(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		return register(parser.parse(path));
	}

	/**
	 * Retrieve a catalog by id.
	 */
	public Optional<SignalCatalog> catalogFor(String id) {
		return Optional.ofNullable(catalogs.get(id));
	}

	/**
	 * Retrieve a catalog by id or throw if not present.
	 */
	public SignalCatalog requireCatalog(String id) {
		return catalogFor(id).orElseThrow(() -> new IllegalStateException("No signal catalog registered for id: " + id));
	}

	/**
	 * All registered catalogs in insertion order.
	 */
	public List<SignalCatalog> catalogs() {
		return List.copyOf(catalogs.values());
	}

	private void loadFromDirectory(URL url) {
		try {
			Path path = Paths.get(url.toURI());
			if (!Files.isDirectory(path)) {
				return;
			}
			try (Stream<Path> files = Files.list(path)) {
				files.filter(Files::isRegularFile)
						.filter(p -> isCatalogFile(p.getFileName().toString()))
						.sorted()
						.forEach(p -> {
							try {
								register(parser.parse(p));
							}
							catch (StlConfigurationException ex) {
								logger.warn("Failed to load signal catalog from {}", p, ex);
							}
						});
			}
		}
		catch (Exception e) {
			logger.warn("Failed to scan directory {}", url, e);
		}
	}

	private void loadFromJar(URL url) {
		try {
			JarURLConnection conn = (JarURLConnection) url.openConnection();
			// a cached JarFile is shared with other jar: URL readers and must not be closed here
			conn.setUseCaches(false);
			try (JarFile jar = conn.getJarFile()) {
				Enumeration<JarEntry> entries = jar.entries();
				while (entries.hasMoreElements()) {
					JarEntry entry = entries.nextElement();
					if (entry.isDirectory()) {
						continue;
					}
					String name = entry.getName();
					if (!name.startsWith("META-INF/") || !isCatalogFile(name.substring("META-INF/".length()))) {
						continue;
					}
					try (InputStream is = jar.getInputStream(entry)) {
						register(parser.parse(is));
					}
					catch (Exception ex) {
						logger.warn("Failed to load signal catalog from JAR entry {}", name, ex);
					}
				}
			}
		}
		catch (Exception e) {
			logger.warn("Failed to scan JAR {}", url, e);
		}
	}

	private static boolean isCatalogFile(String fileName) {
		return fileName.startsWith(CATALOG_PREFIX) && (fileName.endsWith(".yml") || fileName.endsWith(".yaml"));
	}
}
