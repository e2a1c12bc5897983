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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Builds SQL text from parameter names and renders commands for humans.
 * <p>
 * Table names, column names and where-clauses are passed through verbatim; callers are responsible for quoting.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class CommandAssembler {
	private CommandAssembler() {
		// Non-instantiable
	}

	/**
	 * Generates {@code insert into {table} ({k1}, {k2}) values (@{k1}, @{k2})}.
	 *
	 * @param table          target table
	 * @param parameterNames column/parameter names in order
	 * @return the insert statement
	 */
	@NonNull
	public static String insertText(@NonNull String table,
																	@NonNull List<String> parameterNames) {
		requireNonNull(table);
		requireNonNull(parameterNames);

		String columns = String.join(", ", parameterNames);
		String values = parameterNames.stream()
				.map(parameterName -> "@" + parameterName)
				.collect(Collectors.joining(", "));

		return format("insert into %s (%s) values (%s)", table, columns, values);
	}

	/**
	 * Generates {@code update {table} set {k1} = @{k1}, {k2} = @{k2} where {where}}.
	 *
	 * @param table          target table
	 * @param parameterNames column/parameter names in order
	 * @param where          where-clause body, without the {@code where} keyword
	 * @return the update statement
	 */
	@NonNull
	public static String updateText(@NonNull String table,
																	@NonNull List<String> parameterNames,
																	@NonNull String where) {
		requireNonNull(table);
		requireNonNull(parameterNames);
		requireNonNull(where);

		String assignments = parameterNames.stream()
				.map(parameterName -> format("%s = @%s", parameterName, parameterName))
				.collect(Collectors.joining(", "));

		return format("update %s set %s where %s", table, assignments, where);
	}

	/**
	 * Generates the JDBC call escape for a stored procedure, e.g. {@code {? = call name(?, ?)}}.
	 *
	 * @param procedureName procedure name
	 * @param argumentCount number of {@code IN} and {@code OUT} arguments
	 * @param returnValue   whether to include the leading return-value slot
	 * @return the call escape
	 */
	@NonNull
	public static String procedureCallText(@NonNull String procedureName,
																				 int argumentCount,
																				 boolean returnValue) {
		requireNonNull(procedureName);

		List<String> markers = new ArrayList<>(argumentCount);

		for (int i = 0; i < argumentCount; ++i)
			markers.add("?");

		return format("{%scall %s(%s)}", returnValue ? "? = " : "", procedureName, String.join(", ", markers));
	}

	/**
	 * @param table table name
	 * @return a query reading every row and column of {@code table}
	 */
	@NonNull
	public static String tableDirectText(@NonNull String table) {
		requireNonNull(table);
		return format("select * from %s", table);
	}

	/**
	 * Renders a command the way it would be typed into a console.
	 * <p>
	 * Text and table-direct commands render as their raw text.  Stored procedures render as
	 * {@code exec {name} @p1 = v1, @p2 = v2}, including output parameters but not the return value.
	 *
	 * @param command the command to describe
	 * @return a human-readable description
	 */
	@NonNull
	public static String describe(@NonNull CommandDescriptor command) {
		requireNonNull(command);

		if (command.getCommandType() != CommandType.STORED_PROCEDURE)
			return command.getText();

		List<String> parameterDescriptions = new ArrayList<>();

		for (Map.Entry<String, Object> entry : command.getParameters().entrySet())
			parameterDescriptions.add(format("@%s = %s", entry.getKey(), entry.getValue()));

		for (OutputParameter outputParameter : command.getOutputParameters())
			parameterDescriptions.add(format("@%s = %s", outputParameter.getName(), outputParameter.getValue()));

		String description = "exec " + command.getText();

		if (parameterDescriptions.size() > 0)
			description += " " + String.join(", ", parameterDescriptions);

		return description;
	}
}
