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
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Converters for column labels, suitable as the {@code fieldNameConverter} of
 * {@link Commandeer#executeDictionaries(java.util.function.UnaryOperator)}:
 * <pre>
 * List&lt;Map&lt;String, Object&gt;&gt; rows = commandeer.createTextCommand("select first_name from person")
 *   .executeDictionaries(FieldNameConverters::camelCase); // keys are "firstName"</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class FieldNameConverters {
	private FieldNameConverters() {
		// Non-instantiable
	}

	/**
	 * Converts {@code first_name} (or {@code FIRST_NAME}) to {@code FirstName}.
	 *
	 * @param label the column label
	 * @return the label in title case
	 */
	@NonNull
	public static String titleCase(@NonNull String label) {
		requireNonNull(label);
		return convert(label, true);
	}

	/**
	 * Converts {@code first_name} (or {@code FIRST_NAME}) to {@code firstName}.
	 *
	 * @param label the column label
	 * @return the label in camel case
	 */
	@NonNull
	public static String camelCase(@NonNull String label) {
		requireNonNull(label);
		return convert(label, false);
	}

	@NonNull
	private static String convert(@NonNull String label,
																boolean capitalizeFirst) {
		String lowercaseLabel = label.toLowerCase(Locale.ROOT);
		StringBuilder converted = new StringBuilder(lowercaseLabel.length());
		boolean capitalizeNext = capitalizeFirst;

		for (int i = 0; i < lowercaseLabel.length(); ++i) {
			char c = lowercaseLabel.charAt(i);

			if (c == '_') {
				// Leading underscores are dropped without capitalizing the first word in camel case
				capitalizeNext = converted.length() > 0 || capitalizeFirst;
				continue;
			}

			converted.append(capitalizeNext ? Character.toUpperCase(c) : c);
			capitalizeNext = false;
		}

		return converted.toString();
	}
}
