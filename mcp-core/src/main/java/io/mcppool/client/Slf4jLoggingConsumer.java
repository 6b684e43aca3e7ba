/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.client;

import java.util.function.Consumer;

import io.mcppool.spec.McpSchema;
import io.mcppool.spec.McpSchema.LoggingMessageNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * Logs the {@code notifications/message} log messages a server sends, at the SLF4J level
 * matching the MCP severity.
 */
public class Slf4jLoggingConsumer implements Consumer<LoggingMessageNotification> {

	private static final Logger LOG = LoggerFactory.getLogger(Slf4jLoggingConsumer.class);

	private final String serverName;

	public Slf4jLoggingConsumer(String serverName) {
		this.serverName = serverName;
	}

	@Override
	public void accept(LoggingMessageNotification notif) {
		McpSchema.LoggingLevel level = notif.level() != null ? notif.level() : McpSchema.LoggingLevel.INFO;
		LoggingEventBuilder builder = LOG.atLevel(convert(level))
			.setMessage("[{}] {}")
			.addArgument(this.serverName)
			.addArgument(notif.data());
		if (notif.logger() != null) {
			builder = builder.addKeyValue("logger", notif.logger());
		}
		builder.log();
	}

	static Level convert(McpSchema.LoggingLevel level) {
		return switch (level) {
			case DEBUG -> Level.DEBUG;
			case INFO, NOTICE -> Level.INFO;
			case WARNING -> Level.WARN;
			case ERROR, CRITICAL, ALERT, EMERGENCY -> Level.ERROR;
		};
	}

}
