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

import javax.annotation.concurrent.NotThreadSafe;
import java.sql.JDBCType;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A stored-procedure parameter whose value is produced by the database.
 * <p>
 * The value is only available once a stored-procedure execution has completed.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class OutputParameter {
	/**
	 * How the database hands the value back.
	 */
	public enum Direction {
		/**
		 * An {@code OUT} or {@code INOUT} procedure argument.
		 */
		OUTPUT,
		/**
		 * The procedure's return value, bound to the leading {@code ? =} slot of the call escape.
		 */
		RETURN_VALUE
	}

	@NonNull
	private final String name;
	@NonNull
	private final JDBCType jdbcType;
	@NonNull
	private final Direction direction;
	@Nullable
	private Object value;
	private boolean populated;

	public OutputParameter(@NonNull String name,
												 @NonNull JDBCType jdbcType,
												 @NonNull Direction direction) {
		requireNonNull(name);
		requireNonNull(jdbcType);
		requireNonNull(direction);

		this.name = name;
		this.jdbcType = jdbcType;
		this.direction = direction;
	}

	@NonNull
	OutputParameter copy() {
		OutputParameter copy = new OutputParameter(getName(), getJdbcType(), getDirection());
		copy.value = this.value;
		copy.populated = this.populated;
		return copy;
	}

	void populate(@Nullable Object value) {
		this.value = value;
		this.populated = true;
	}

	void reset() {
		this.value = null;
		this.populated = false;
	}

	@Override
	public String toString() {
		return format("%s{name=%s, jdbcType=%s, direction=%s, value=%s}", getClass().getSimpleName(),
				getName(), getJdbcType(), getDirection(), isPopulated() ? getValue() : "[not yet executed]");
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public JDBCType getJdbcType() {
		return this.jdbcType;
	}

	@NonNull
	public Direction getDirection() {
		return this.direction;
	}

	/**
	 * @return the value the database produced, or {@code null} if it produced SQL {@code NULL} or nothing yet
	 */
	@Nullable
	public Object getValue() {
		return this.value;
	}

	/**
	 * @return {@code true} once a stored-procedure execution has filled in this parameter
	 */
	public boolean isPopulated() {
		return this.populated;
	}
}
