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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when reading an output parameter that was never declared via
 * {@link Commandeer#addOutputParameter(String, java.sql.JDBCType)}.
 *
 * @since 1.0.0
 */
public class MissingOutputParameterException extends IllegalArgumentException {
	@NonNull
	private final String parameterName;

	public MissingOutputParameterException(@NonNull String parameterName) {
		super(format("No output parameter named '%s' has been declared", requireNonNull(parameterName)));
		this.parameterName = parameterName;
	}

	@NonNull
	public String getParameterName() {
		return this.parameterName;
	}
}
