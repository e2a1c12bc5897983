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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Immutable snapshot of the command a {@link Commandeer} holds: its text, type, bound parameters and output
 * declarations.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class CommandDescriptor {
	@NonNull
	private final String text;
	@NonNull
	private final CommandType commandType;
	@NonNull
	private final Map<String, @Nullable Object> parameters;
	@NonNull
	private final List<OutputParameter> outputParameters;
	private final boolean returnValue;

	public CommandDescriptor(@NonNull String text,
													 @NonNull CommandType commandType,
													 @NonNull Map<String, @Nullable Object> parameters,
													 @NonNull List<OutputParameter> outputParameters,
													 boolean returnValue) {
		requireNonNull(text);
		requireNonNull(commandType);
		requireNonNull(parameters);
		requireNonNull(outputParameters);

		this.text = text;
		this.commandType = commandType;
		this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
		this.outputParameters = outputParameters.stream()
				.map(OutputParameter::copy)
				.collect(Collectors.toUnmodifiableList());
		this.returnValue = returnValue;
	}

	@Override
	public String toString() {
		return format("%s{commandType=%s, text=%s, parameters=%s}", getClass().getSimpleName(),
				getCommandType(), getText(), getParameters());
	}

	/**
	 * @return SQL text for {@link CommandType#TEXT}, the procedure name for {@link CommandType#STORED_PROCEDURE} or
	 * the table name for {@link CommandType#TABLE_DIRECT}
	 */
	@NonNull
	public String getText() {
		return this.text;
	}

	@NonNull
	public CommandType getCommandType() {
		return this.commandType;
	}

	/**
	 * @return normalized parameter names and values in insertion order
	 */
	@NonNull
	public Map<String, @Nullable Object> getParameters() {
		return this.parameters;
	}

	/**
	 * @return declared output parameters, excluding the return value, as they stood when this snapshot was taken
	 */
	@NonNull
	public List<OutputParameter> getOutputParameters() {
		return this.outputParameters;
	}

	/**
	 * @return {@code true} if a return-value parameter is attached
	 */
	public boolean hasReturnValue() {
		return this.returnValue;
	}
}
