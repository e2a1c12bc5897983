/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.commandeer;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Basic implementation of {@link ExecutionListener} which logs via <a href="https://docs.oracle.com/en/java/javase/17/docs/api/java.logging/java/util/logging/package-summary.html">java.util.logging</a>.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultExecutionLogger implements ExecutionListener {
	@Nonnull
	public static final String DEFAULT_LOGGER_NAME = "com.commandeer.SQL";
	@Nonnull
	public static final Level DEFAULT_LOGGER_LEVEL = Level.FINE;

	/**
	 * The point at which we ellipsize output for parameters.
	 */
	private static final int MAXIMUM_PARAMETER_LOGGING_LENGTH = 100;

	@Nonnull
	private final Logger logger;
	@Nonnull
	private final Level loggerLevel;

	/**
	 * Creates a new execution logger with the default logger name <code>{@value #DEFAULT_LOGGER_NAME}</code> and level.
	 */
	public DefaultExecutionLogger() {
		this(DEFAULT_LOGGER_NAME, DEFAULT_LOGGER_LEVEL);
	}

	/**
	 * Creates a new execution logger with the given logger name and level.
	 *
	 * @param loggerName  the logger name to use
	 * @param loggerLevel the logger level to use
	 */
	public DefaultExecutionLogger(@Nonnull String loggerName,
																@Nonnull Level loggerLevel) {
		requireNonNull(loggerName);
		requireNonNull(loggerLevel);

		this.logger = Logger.getLogger(loggerName);
		this.loggerLevel = loggerLevel;
	}

	@Override
	public void executed(@Nonnull Commandeer commandeer,
											 @Nonnull ExecutionLog executionLog) {
		requireNonNull(commandeer);
		requireNonNull(executionLog);

		if (getLogger().isLoggable(getLoggerLevel()))
			getLogger().log(getLoggerLevel(), formatExecutionLog(executionLog));
	}

	@Nonnull
	protected String formatExecutionLog(@Nonnull ExecutionLog executionLog) {
		requireNonNull(executionLog);

		List<String> timingEntries = new ArrayList<>(2);

		if (executionLog.getConnectionAcquisitionDuration().isPresent())
			timingEntries.add(format("%s acquiring connection", executionLog.getConnectionAcquisitionDuration().get()));

		timingEntries.add(format("%s executing command", executionLog.getExecutionDuration()));

		String parameterLine = null;

		if (executionLog.getCommand().getParameters().size() > 0) {
			StringBuilder parameterLineBuilder = new StringBuilder();
			parameterLineBuilder.append("Parameters: ");
			parameterLineBuilder.append(executionLog.getCommand().getParameters().entrySet().stream()
					.map(entry -> format("@%s = %s", entry.getKey(), formatParameter(entry.getValue())))
					.collect(joining(", ")));

			parameterLine = parameterLineBuilder.toString();
		}

		List<String> lines = new ArrayList<>(4);

		lines.add(executionLog.getJdbcSql().orElse(executionLog.getCommand().getText()));

		if (parameterLine != null)
			lines.add(parameterLine);

		lines.add(timingEntries.stream().collect(joining(", ")));

		Throwable exception = executionLog.getException().orElse(null);

		if (exception != null) {
			if (exception instanceof DatabaseException && exception.getCause() != null)
				exception = exception.getCause();

			lines.add(format("Failed due to %s", exception));
		}

		return lines.stream().collect(joining("\n"));
	}

	@Nonnull
	protected String formatParameter(Object parameter) {
		if (parameter == null)
			return "null";

		if (parameter instanceof Number)
			return format("%s", parameter);

		if (parameter instanceof byte[] bytes)
			return format("[byte array of length %d]", bytes.length);

		return format("'%s'", ellipsize(parameter.toString(), MAXIMUM_PARAMETER_LOGGING_LENGTH));
	}

	/**
	 * Ellipsizes the given {@code string}, capping at {@code maximumLength}.
	 *
	 * @param string        the string to ellipsize
	 * @param maximumLength the maximum length of the ellipsized string, not including ellipsis
	 * @return an ellipsized version of {@code string}
	 */
	@Nonnull
	protected String ellipsize(@Nonnull String string,
														 int maximumLength) {
		requireNonNull(string);

		string = string.trim();

		if (string.length() <= maximumLength)
			return string;

		return format("%s...", string.substring(0, maximumLength));
	}

	@Nonnull
	protected Logger getLogger() {
		return this.logger;
	}

	@Nonnull
	protected Level getLoggerLevel() {
		return this.loggerLevel;
	}
}
