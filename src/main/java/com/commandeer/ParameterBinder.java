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

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Contract for binding parameter values to JDBC statements.
 * <p>
 * A production-ready implementation is available via {@link #defaultInstance()}.  Or, implement your own:
 * <pre>{@code  ParameterBinder myImpl = (commandContext, preparedStatement, parameterIndex, parameter) -> {
 *   // your own code that binds the parameter at the specified index
 * };}</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ParameterBinder {
	/**
	 * Binds a single parameter to a JDBC statement.
	 * <p>
	 * For stored procedures, {@code preparedStatement} is a {@link java.sql.CallableStatement}.
	 *
	 * @param commandContext    current command context
	 * @param preparedStatement the statement to bind to
	 * @param parameterIndex    1-based index of the {@code ?} marker being bound
	 * @param parameter         the value to bind, may be {@code null}
	 * @throws SQLException if an error occurs during binding
	 */
	void bindParameter(@NonNull CommandContext commandContext,
										 @NonNull PreparedStatement preparedStatement,
										 @NonNull Integer parameterIndex,
										 @Nullable Object parameter) throws SQLException;

	/**
	 * Acquires a threadsafe implementation of this interface with out-of-the-box defaults.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static ParameterBinder defaultInstance() {
		return new DefaultParameterBinder();
	}
}
