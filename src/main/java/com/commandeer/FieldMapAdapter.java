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
import java.util.Map;

/**
 * Contract for decomposing an arbitrary object into an ordered set of named parameter values.
 * <p>
 * Used by {@link Commandeer#addParameters(Object)} and the insert/update command generators.
 * <p>
 * Implementations should be threadsafe.
 *
 * @since 1.0.0
 */
@ThreadSafe
public interface FieldMapAdapter {
	/**
	 * Decomposes {@code source} into parameter names and values.
	 * <p>
	 * Iteration order of the returned map determines parameter order.  Names must already be normalized
	 * via {@link #normalizeName(String)}.
	 *
	 * @param source the object to decompose, e.g. a {@link Map}, a record or a JavaBean
	 * @return an ordered map of normalized names to values
	 */
	@NonNull
	Map<String, @Nullable Object> toFieldMap(@NonNull Object source);

	/**
	 * Converts a caller-supplied parameter name into the form under which it is stored.
	 *
	 * @param name the caller-supplied name, e.g. {@code @firstName}
	 * @return the normalized name, e.g. {@code first_name}
	 */
	@NonNull
	String normalizeName(@NonNull String name);

	/**
	 * Acquires a threadsafe {@link FieldMapAdapter} instance with default behavior.
	 *
	 * @return a {@code FieldMapAdapter} with default behavior
	 */
	@NonNull
	static FieldMapAdapter defaultInstance() {
		return DefaultFieldMapAdapter.defaultInstance();
	}
}
