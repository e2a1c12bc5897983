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

import org.jspecify.annotations.Nullable;

import static java.lang.String.format;

/**
 * Thrown when a vertical dictionary encounters the same key in more than one row.
 * <p>
 * Use {@link Commandeer#executeVerticalLookup(Class, Class, int, int)} when keys may repeat.
 *
 * @since 1.0.0
 */
public class DuplicateKeyException extends DatabaseException {
	@Nullable
	private final Object key;

	public DuplicateKeyException(@Nullable Object key) {
		super(format("An item with the key '%s' has already been added", key));
		this.key = key;
	}

	@Nullable
	public Object getKey() {
		return this.key;
	}
}
