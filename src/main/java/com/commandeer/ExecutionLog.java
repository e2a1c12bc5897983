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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An event handed to {@link ExecutionListener} instances after every command execution.
 * <p>
 * Includes timing data and the fault that occurred, if any.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ExecutionLog {
	@NonNull
	private final CommandDescriptor command;
	@Nullable
	private final String jdbcSql;
	@NonNull
	private final Long executionNumber;
	@Nullable
	private final Duration connectionAcquisitionDuration;
	@NonNull
	private final Duration executionDuration;
	@Nullable
	private final Exception exception;

	/**
	 * Creates a {@code ExecutionLog} for the given {@code builder}.
	 *
	 * @param builder the builder used to construct this {@code ExecutionLog}
	 */
	private ExecutionLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.command = builder.command;
		this.jdbcSql = builder.jdbcSql;
		this.executionNumber = builder.executionNumber;
		this.connectionAcquisitionDuration = builder.connectionAcquisitionDuration;
		this.executionDuration = builder.executionDuration == null ? Duration.ZERO : builder.executionDuration;
		this.exception = builder.exception;
	}

	/**
	 * Creates a {@link ExecutionLog} builder for the given {@code command}.
	 *
	 * @param command         the command that was executed
	 * @param executionNumber the executor's execution count after this execution
	 * @return a {@link ExecutionLog} builder
	 */
	@NonNull
	public static Builder withCommand(@NonNull CommandDescriptor command,
																		@NonNull Long executionNumber) {
		requireNonNull(command);
		requireNonNull(executionNumber);

		return new Builder(command, executionNumber);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(6);

		components.add(format("command=%s", getCommand()));
		components.add(format("executionNumber=%s", getExecutionNumber()));

		String jdbcSql = getJdbcSql().orElse(null);

		if (jdbcSql != null)
			components.add(format("jdbcSql=%s", jdbcSql));

		Duration connectionAcquisitionDuration = getConnectionAcquisitionDuration().orElse(null);

		if (connectionAcquisitionDuration != null)
			components.add(format("connectionAcquisitionDuration=%s", connectionAcquisitionDuration));

		components.add(format("executionDuration=%s", getExecutionDuration()));

		Exception exception = getException().orElse(null);

		if (exception != null)
			components.add(format("exception=%s", exception));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ExecutionLog executionLog))
			return false;

		return Objects.equals(getCommand(), executionLog.getCommand())
				&& Objects.equals(getJdbcSql(), executionLog.getJdbcSql())
				&& Objects.equals(getExecutionNumber(), executionLog.getExecutionNumber())
				&& Objects.equals(getConnectionAcquisitionDuration(), executionLog.getConnectionAcquisitionDuration())
				&& Objects.equals(getExecutionDuration(), executionLog.getExecutionDuration())
				&& Objects.equals(getException(), executionLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getCommand(), getJdbcSql(), getExecutionNumber(), getConnectionAcquisitionDuration(),
				getExecutionDuration(), getException());
	}

	@NonNull
	public CommandDescriptor getCommand() {
		return this.command;
	}

	/**
	 * The SQL actually handed to the JDBC driver, with {@code ?} markers in place of named parameters.
	 *
	 * @return the driver-level SQL, or empty if execution never got as far as preparing a statement
	 */
	@NonNull
	public Optional<String> getJdbcSql() {
		return Optional.ofNullable(this.jdbcSql);
	}

	@NonNull
	public Long getExecutionNumber() {
		return this.executionNumber;
	}

	/**
	 * How long did it take to acquire a {@link java.sql.Connection} from the {@link javax.sql.DataSource}?
	 *
	 * @return connection acquisition time, or empty if the connection was already open
	 */
	@NonNull
	public Optional<Duration> getConnectionAcquisitionDuration() {
		return Optional.ofNullable(this.connectionAcquisitionDuration);
	}

	/**
	 * How long did the execution take, including reading results?
	 *
	 * @return the elapsed time of the execution
	 */
	@NonNull
	public Duration getExecutionDuration() {
		return this.executionDuration;
	}

	/**
	 * The fault that occurred during execution, whether or not it was suppressed by error handlers.
	 *
	 * @return the fault, if any
	 */
	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link ExecutionLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	public static class Builder {
		@NonNull
		private final CommandDescriptor command;
		@NonNull
		private final Long executionNumber;
		@Nullable
		private String jdbcSql;
		@Nullable
		private Duration connectionAcquisitionDuration;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Exception exception;

		private Builder(@NonNull CommandDescriptor command,
										@NonNull Long executionNumber) {
			this.command = requireNonNull(command);
			this.executionNumber = requireNonNull(executionNumber);
		}

		/**
		 * @param jdbcSql the driver-level SQL
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder jdbcSql(@Nullable String jdbcSql) {
			this.jdbcSql = jdbcSql;
			return this;
		}

		/**
		 * @param connectionAcquisitionDuration how long it took to acquire a connection
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder connectionAcquisitionDuration(@Nullable Duration connectionAcquisitionDuration) {
			this.connectionAcquisitionDuration = connectionAcquisitionDuration;
			return this;
		}

		/**
		 * @param executionDuration how long the execution took
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		/**
		 * @param exception the fault that occurred during execution
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		@NonNull
		public ExecutionLog build() {
			return new ExecutionLog(this);
		}
	}
}
