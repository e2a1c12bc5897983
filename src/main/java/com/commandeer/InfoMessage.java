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
import java.sql.SQLWarning;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An informational message (a {@link SQLWarning}) reported by the database while a command executed.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class InfoMessage {
	@NonNull
	private final SQLWarning warning;

	public InfoMessage(@NonNull SQLWarning warning) {
		this.warning = requireNonNull(warning);
	}

	@Nullable
	public String getMessage() {
		return getWarning().getMessage();
	}

	@Nullable
	public String getSqlState() {
		return getWarning().getSQLState();
	}

	public int getErrorCode() {
		return getWarning().getErrorCode();
	}

	@NonNull
	public SQLWarning getWarning() {
		return this.warning;
	}

	@Override
	public String toString() {
		return format("%s{message=%s, sqlState=%s, errorCode=%d}", getClass().getSimpleName(), getMessage(),
				getSqlState(), getErrorCode());
	}
}
