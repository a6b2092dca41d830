package org.javai.stl.testsupport;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;

/**
 * Log4j2 appender that records the events of one compiler class for assertions.
 * <p>
 * The captured logger is raised to the requested level for the lifetime of the appender
 * and restored on {@link #close()}.
 * <pre>
 * try (LogCaptorAppender appender = LogCaptorAppender.create(SignalCatalogRegistry.class, Level.DEBUG)) {
 *     registry.register(duplicate);
 *     assertThat(appender.messages()).anyMatch(msg -&gt; msg.contains("already registered"));
 * }
 * </pre>
 */
public final class LogCaptorAppender extends AbstractAppender implements AutoCloseable {

	private final LoggerContext context;
	private final LoggerConfig loggerConfig;
	private final Level previousLevel;
	private final List<LogEvent> events = new CopyOnWriteArrayList<>();

	private LogCaptorAppender(LoggerContext context, LoggerConfig loggerConfig, Level previousLevel) {
		super("StlLogCaptor-" + System.nanoTime(), null, null, false, Property.EMPTY_ARRAY);
		this.context = context;
		this.loggerConfig = loggerConfig;
		this.previousLevel = previousLevel;
	}

	public static LogCaptorAppender create(Class<?> loggerClass, Level level) {
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		LoggerConfig loggerConfig = dedicatedConfig(context.getConfiguration(), loggerClass.getName(), level);
		Level previousLevel = loggerConfig.getLevel();
		loggerConfig.setLevel(level);

		LogCaptorAppender appender = new LogCaptorAppender(context, loggerConfig, previousLevel);
		appender.start();
		loggerConfig.addAppender(appender, level, null);
		context.updateLoggers();
		return appender;
	}

	// log4j2-test.xml only configures the package logger, so most classes need their own
	private static LoggerConfig dedicatedConfig(Configuration configuration, String loggerName, Level level) {
		LoggerConfig existing = configuration.getLoggerConfig(loggerName);
		if (existing.getName().equals(loggerName)) {
			return existing;
		}
		LoggerConfig created = new LoggerConfig(loggerName, level, true);
		configuration.addLogger(loggerName, created);
		return created;
	}

	@Override
	public void append(LogEvent event) {
		events.add(event.toImmutable());
	}

	public List<LogEvent> events() {
		return Collections.unmodifiableList(events);
	}

	/**
	 * Formatted messages of every captured event, oldest first.
	 */
	public List<String> messages() {
		return events.stream()
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	/**
	 * Formatted messages logged at exactly {@code level}.
	 */
	public List<String> messagesAt(Level level) {
		return events.stream()
				.filter(e -> e.getLevel() == level)
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	@Override
	public void close() {
		stop();
		loggerConfig.removeAppender(getName());
		loggerConfig.setLevel(previousLevel);
		context.updateLoggers();
		events.clear();
	}
}
