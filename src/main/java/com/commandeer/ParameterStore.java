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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Ordered, uniquely-named set of parameter values attached to a command.
 * <p>
 * Names are normalized on the way in (and on removal) by a {@link FieldMapAdapter}, so {@code @firstName},
 * {@code firstName} and {@code first_name} all refer to the same parameter.
 * <p>
 * Iteration order is insertion order.  Values may be {@code null}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class ParameterStore {
	@NonNull
	private final FieldMapAdapter fieldMapAdapter;
	@NonNull
	private final Map<String, @Nullable Object> parameters;

	public ParameterStore() {
		this(FieldMapAdapter.defaultInstance());
	}

	public ParameterStore(@NonNull FieldMapAdapter fieldMapAdapter) {
		this.fieldMapAdapter = requireNonNull(fieldMapAdapter);
		this.parameters = new LinkedHashMap<>();
	}

	/**
	 * Adds a single parameter.
	 *
	 * @param name  parameter name, normalized before insertion
	 * @param value parameter value, may be {@code null}
	 * @throws DuplicateParameterException if a parameter with the same normalized name is already present
	 */
	public void add(@NonNull String name,
									@Nullable Object value) {
		requireNonNull(name);

		String normalizedName = getFieldMapAdapter().normalizeName(name);

		if (getParameters().containsKey(normalizedName))
			throw new DuplicateParameterException(normalizedName);

		getParameters().put(normalizedName, value);
	}

	/**
	 * Adds every field of {@code source} in order.
	 * <p>
	 * If a duplicate is encountered partway through, parameters added before it remain in the store.
	 *
	 * @param source a {@link Map}, record or JavaBean, or {@code null} for no-op
	 * @throws DuplicateParameterException if any field name is already present
	 */
	public void addAll(@Nullable Object source) {
		if (source == null)
			return;

		// Map keys are added one at a time so that two keys normalizing to the same name collide here
		if (source instanceof Map<?, ?> map) {
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				if (entry.getKey() == null)
					throw new IllegalArgumentException("Parameter maps cannot contain null keys");

				add(entry.getKey().toString(), entry.getValue());
			}

			return;
		}

		for (Map.Entry<String, Object> entry : getFieldMapAdapter().toFieldMap(source).entrySet()) {
			if (getParameters().containsKey(entry.getKey()))
				throw new DuplicateParameterException(entry.getKey());

			getParameters().put(entry.getKey(), entry.getValue());
		}
	}

	/**
	 * Merges every field of {@code source} into the store.
	 * <p>
	 * Names already present keep their position and take the new value; new names are appended.
	 *
	 * @param source a {@link Map}, record or JavaBean, or {@code null} for no-op
	 */
	public void merge(@Nullable Object source) {
		if (source == null)
			return;

		getParameters().putAll(getFieldMapAdapter().toFieldMap(source));
	}

	/**
	 * Removes the parameter with the given name.
	 *
	 * @param name parameter name, normalized before lookup
	 * @return {@code true} if a parameter was removed
	 */
	@NonNull
	public Boolean remove(@NonNull String name) {
		requireNonNull(name);

		String normalizedName = getFieldMapAdapter().normalizeName(name);

		if (!getParameters().containsKey(normalizedName))
			return false;

		getParameters().remove(normalizedName);
		return true;
	}

	/**
	 * @return the number of parameters removed
	 */
	@NonNull
	public Integer removeNulls() {
		return removeMatching((name, value) -> value == null);
	}

	/**
	 * Removes parameters whose value is the empty string.
	 *
	 * @return the number of parameters removed
	 */
	@NonNull
	public Integer removeBlanks() {
		return removeMatching((name, value) -> isBlank(value));
	}

	/**
	 * @return the number of parameters removed
	 */
	@NonNull
	public Integer removeNullsAndBlanks() {
		return removeMatching((name, value) -> value == null || isBlank(value));
	}

	@NonNull
	protected Integer removeMatching(@NonNull BiPredicate<String, Object> predicate) {
		requireNonNull(predicate);

		int sizeBefore = getParameters().size();
		getParameters().entrySet().removeIf(entry -> predicate.test(entry.getKey(), entry.getValue()));
		return sizeBefore - getParameters().size();
	}

	@NonNull
	protected Boolean isBlank(@Nullable Object value) {
		return value instanceof String string && string.isEmpty();
	}

	/**
	 * @param name parameter name, normalized before lookup
	 * @return {@code true} if a parameter with that name is present
	 */
	@NonNull
	public Boolean contains(@NonNull String name) {
		requireNonNull(name);
		return getParameters().containsKey(getFieldMapAdapter().normalizeName(name));
	}

	/**
	 * @param name parameter name, normalized before lookup
	 * @return the parameter's value, which may be {@code null}
	 * @throws IllegalArgumentException if no parameter with that name is present
	 */
	@Nullable
	public Object get(@NonNull String name) {
		requireNonNull(name);

		String normalizedName = getFieldMapAdapter().normalizeName(name);

		if (!getParameters().containsKey(normalizedName))
			throw new IllegalArgumentException(format("No value was supplied for parameter '%s'. Known parameters: %s",
					normalizedName, getParameters().keySet()));

		return getParameters().get(normalizedName);
	}

	/**
	 * @return normalized parameter names in insertion order
	 */
	@NonNull
	public List<String> names() {
		return List.copyOf(getParameters().keySet());
	}

	/**
	 * @return an unmodifiable copy of the current parameters in insertion order
	 */
	@NonNull
	public Map<String, @Nullable Object> snapshot() {
		return Collections.unmodifiableMap(new LinkedHashMap<>(getParameters()));
	}

	@NonNull
	public Integer size() {
		return getParameters().size();
	}

	@NonNull
	public Boolean isEmpty() {
		return getParameters().isEmpty();
	}

	@Override
	public String toString() {
		return format("%s%s", getClass().getSimpleName(), getParameters());
	}

	@NonNull
	public FieldMapAdapter getFieldMapAdapter() {
		return this.fieldMapAdapter;
	}

	@NonNull
	protected Map<String, @Nullable Object> getParameters() {
		return this.parameters;
	}
}
