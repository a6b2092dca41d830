package org.javai.stl.signal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.apache.logging.log4j.Level;
import org.javai.stl.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SignalCatalogRegistryTest {

	@Test
	void shouldLoadCatalogFromResource() {
		SignalCatalogRegistry registry = SignalCatalogRegistry.create();
		SignalCatalog catalog = registry.registerResource("catalogs/autotrans.yml", getClass().getClassLoader());

		assertThat(catalog.id()).isEqualTo("autotrans");
		assertThat(registry.catalogFor("autotrans")).contains(catalog);
		assertThat(registry.requireCatalog("autotrans")).isSameAs(catalog);
	}

	@Test
	void shouldKeepFirstRegistrationPerId() {
		SignalCatalogRegistry registry = SignalCatalogRegistry.create();
		SignalCatalog first = registry.registerResource("catalogs/autotrans.yml");

		try (LogCaptorAppender appender = LogCaptorAppender.create(SignalCatalogRegistry.class, Level.DEBUG)) {
			SignalCatalog second = registry.register(SignalCatalog.builder("autotrans").signal("other", 0).build());

			assertThat(second).isSameAs(first);
			assertThat(appender.messages()).anyMatch(msg -> msg.contains("'autotrans' already registered"));
		}
		assertThat(registry.catalogs()).hasSize(1);
	}

	@Test
	void shouldRegisterFromPath() throws Exception {
		SignalCatalogRegistry registry = SignalCatalogRegistry.create();
		URL resource = Objects.requireNonNull(getClass().getClassLoader().getResource("catalogs/autotrans.yml"));

		SignalCatalog catalog = registry.registerPath(Path.of(resource.toURI()));

		assertThat(registry.catalogFor("autotrans")).contains(catalog);
	}

	@Test
	void shouldFailWhenResourceIsMissing() {
		SignalCatalogRegistry registry = SignalCatalogRegistry.create();

		assertThatThrownBy(() -> registry.registerResource("does-not-exist.yml", getClass().getClassLoader()))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void shouldFailForUnknownId() {
		SignalCatalogRegistry registry = SignalCatalogRegistry.create();

		assertThat(registry.catalogFor("nope")).isEmpty();
		assertThatThrownBy(() -> registry.requireCatalog("nope"))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("nope");
	}

	@Test
	void shouldDiscoverMetaInfCatalogsOnTheClasspath() {
		SignalCatalogRegistry registry = SignalCatalogRegistry.create()
				.registerMetaInfCatalogs(getClass().getClassLoader());

		SignalCatalog vehicle = registry.requireCatalog("vehicle");
		assertThat(vehicle.find("door_open").orElseThrow().type()).isEqualTo(SignalType.BOOL);
		assertThat(vehicle.declarations()).hasSize(4);
	}

	@Test
	void shouldSkipBrokenMetaInfCatalogsWithAWarning(@TempDir Path root) throws Exception {
		Path metaInf = Files.createDirectories(root.resolve("META-INF"));
		Files.writeString(metaInf.resolve("stl-signals-good.yml"), "catalog: good\nsignals:\n  - name: x\n    column: 0\n");
		Files.writeString(metaInf.resolve("stl-signals-bad.yml"), "catalog: bad\n");
		Files.writeString(metaInf.resolve("unrelated.yml"), "catalog: ignored\nsignals: []\n");

		try (URLClassLoader loader = new URLClassLoader(new URL[] { root.toUri().toURL() }, null);
				LogCaptorAppender appender = LogCaptorAppender.create(SignalCatalogRegistry.class, Level.WARN)) {
			SignalCatalogRegistry registry = SignalCatalogRegistry.create().registerMetaInfCatalogs(loader);

			assertThat(registry.catalogs()).extracting(SignalCatalog::id).containsExactly("good");
			assertThat(appender.messagesAt(Level.WARN)).singleElement().asString().startsWith("Failed to load signal catalog from");
		}
	}
}
