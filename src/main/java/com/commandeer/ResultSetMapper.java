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

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Contract for turning {@link ResultSet} data into Java values.
 * <p>
 * This is the inverse of {@link FieldMapAdapter}: it maps single columns onto standard types and whole rows onto
 * records and JavaBeans.  It also converts driver-supplied values such as output parameters and generated keys.
 * <p>
 * A production-ready implementation is available via {@link #defaultInstance()}.
 * <p>
 * Implementations should be threadsafe.
 *
 * @since 1.0.0
 */
public interface ResultSetMapper {
	/**
	 * Maps a single column of the current row.
	 *
	 * @param <T>            result type token
	 * @param commandContext current command context
	 * @param resultSet      positioned on the row to read
	 * @param columnIndex    1-based column index
	 * @param type           the type to map to; {@code Object.class} returns the driver's value with temporal types
	 *                       converted to {@code java.time}
	 * @return the column value, or {@code null} for SQL {@code NULL}
	 * @throws SQLException if an error occurs reading the column
	 */
	@Nullable
	<T> T mapColumn(@NonNull CommandContext commandContext,
									@NonNull ResultSet resultSet,
									int columnIndex,
									@NonNull Class<T> type) throws SQLException;

	/**
	 * Maps the whole current row.
	 * <p>
	 * Standard types (numbers, strings, {@code java.time} types, enums, {@code UUID} and so on) require a single-column
	 * row.  Records are built through their canonical constructor and JavaBeans through their setters, matching
	 * column labels to property names.
	 *
	 * @param <T>              result type token
	 * @param commandContext   current command context
	 * @param resultSet        positioned on the row to read
	 * @param rowType          the type to map to
	 * @param instanceProvider instance-creation factory for records and beans
	 * @return the mapped row, or {@code null} if a single standard-type column is SQL {@code NULL}
	 * @throws SQLException if an error occurs reading the row
	 */
	@Nullable
	<T> T mapRow(@NonNull CommandContext commandContext,
							 @NonNull ResultSet resultSet,
							 @NonNull Class<T> rowType,
							 @NonNull InstanceProvider instanceProvider) throws SQLException;

	/**
	 * Converts a value produced by the driver (an output parameter, a generated key) to {@code type}.
	 *
	 * @param <T>            result type token
	 * @param commandContext current command context
	 * @param value          the raw value, may be {@code null}
	 * @param type           the type to convert to
	 * @return the converted value, or {@code null} if {@code value} is {@code null}
	 * @throws DatabaseException if the value cannot be converted
	 */
	@Nullable
	<T> T convert(@NonNull CommandContext commandContext,
								@Nullable Object value,
								@NonNull Class<T> type);

	/**
	 * Acquires a threadsafe implementation of this interface with out-of-the-box defaults.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static ResultSetMapper defaultInstance() {
		return new DefaultResultSetMapper();
	}

	/**
	 * Acquires a threadsafe implementation of this interface which uses {@code normalizationLocale} when matching
	 * column labels against property names.
	 *
	 * @param normalizationLocale the locale to use when massaging JDBC column names
	 * @return a concrete implementation of this interface
	 */
	@NonNull
	static ResultSetMapper withNormalizationLocale(@NonNull Locale normalizationLocale) {
		return new DefaultResultSetMapper(normalizationLocale);
	}
}
