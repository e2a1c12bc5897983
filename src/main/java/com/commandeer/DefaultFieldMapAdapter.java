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
import java.beans.BeanInfo;
import java.beans.IntrospectionException;
import java.beans.Introspector;
import java.beans.PropertyDescriptor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link FieldMapAdapter}.
 * <p>
 * Maps are decomposed entry by entry, records component by component in declaration order, and JavaBeans by readable
 * property in field declaration order.  {@link DatabaseColumn} overrides the derived name of a record component or field.
 * <p>
 * Names are normalized by stripping a leading {@code @}, converting {@code camelCase} to {@code camel_case} and
 * lowercasing.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultFieldMapAdapter implements FieldMapAdapter {
	@NonNull
	private static final DefaultFieldMapAdapter DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new DefaultFieldMapAdapter();
	}

	@NonNull
	private final Locale normalizationLocale;
	@NonNull
	private final ConcurrentMap<Class<?>, List<FieldAccessor>> fieldAccessorsCache = new ConcurrentHashMap<>();

	DefaultFieldMapAdapter() {
		this(Locale.ROOT);
	}

	DefaultFieldMapAdapter(@NonNull Locale normalizationLocale) {
		this.normalizationLocale = requireNonNull(normalizationLocale);
	}

	@NonNull
	static DefaultFieldMapAdapter defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	@Override
	@NonNull
	public Map<String, @Nullable Object> toFieldMap(@NonNull Object source) {
		requireNonNull(source);

		Map<String, Object> fieldMap = new LinkedHashMap<>();

		if (source instanceof Map<?, ?> map) {
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				if (entry.getKey() == null)
					throw new IllegalArgumentException("Parameter maps cannot contain null keys");

				String name = normalizeName(entry.getKey().toString());

				if (fieldMap.containsKey(name))
					throw new DuplicateParameterException(name);

				fieldMap.put(name, entry.getValue());
			}

			return fieldMap;
		}

		for (FieldAccessor fieldAccessor : determineFieldAccessors(source.getClass())) {
			try {
				fieldMap.put(fieldAccessor.name(), fieldAccessor.readMethod().invoke(source));
			} catch (IllegalAccessException | InvocationTargetException e) {
				throw new DatabaseException(format("Unable to read '%s' from %s", fieldAccessor.name(),
						source.getClass().getName()), e);
			}
		}

		return fieldMap;
	}

	@Override
	@NonNull
	public String normalizeName(@NonNull String name) {
		requireNonNull(name);

		String normalizedName = name.trim();

		if (normalizedName.startsWith("@"))
			normalizedName = normalizedName.substring(1);

		if (normalizedName.length() == 0)
			throw new IllegalArgumentException("Parameter names cannot be blank");

		// Converts camelCase to camel_case
		String camelCaseRegex = "([a-z])([A-Z]+)";
		String replacement = "$1_$2";

		return normalizedName.replaceAll(camelCaseRegex, replacement).toLowerCase(getNormalizationLocale());
	}

	@NonNull
	protected List<FieldAccessor> determineFieldAccessors(@NonNull Class<?> sourceClass) {
		requireNonNull(sourceClass);

		return getFieldAccessorsCache().computeIfAbsent(sourceClass, type -> {
			if (type.isRecord())
				return determineRecordFieldAccessors(type);

			return determineBeanFieldAccessors(type);
		});
	}

	@NonNull
	protected List<FieldAccessor> determineRecordFieldAccessors(@NonNull Class<?> recordType) {
		requireNonNull(recordType);

		List<FieldAccessor> fieldAccessors = new ArrayList<>();

		for (RecordComponent recordComponent : recordType.getRecordComponents()) {
			Method accessor = recordComponent.getAccessor();
			accessor.setAccessible(true);
			fieldAccessors.add(new FieldAccessor(columnNameFor(recordComponent.getName(),
					recordComponent.getAnnotation(DatabaseColumn.class)), accessor));
		}

		return verifyUniqueNames(fieldAccessors);
	}

	@NonNull
	protected List<FieldAccessor> determineBeanFieldAccessors(@NonNull Class<?> beanType) {
		requireNonNull(beanType);

		Map<String, PropertyDescriptor> propertyDescriptorsByName = new LinkedHashMap<>();

		try {
			BeanInfo beanInfo = Introspector.getBeanInfo(beanType, Object.class);

			for (PropertyDescriptor propertyDescriptor : beanInfo.getPropertyDescriptors()) {
				if (propertyDescriptor.getReadMethod() != null) {
					propertyDescriptor.getReadMethod().setAccessible(true);
					propertyDescriptorsByName.put(propertyDescriptor.getName(), propertyDescriptor);
				}
			}
		} catch (IntrospectionException e) {
			throw new DatabaseException(format("Unable to introspect properties for %s", beanType.getName()), e);
		}

		// Introspector sorts alphabetically; prefer field declaration order, superclass fields first
		List<Class<?>> hierarchy = new ArrayList<>();

		for (Class<?> type = beanType; type != null && type != Object.class; type = type.getSuperclass())
			hierarchy.add(0, type);

		List<FieldAccessor> fieldAccessors = new ArrayList<>(propertyDescriptorsByName.size());

		for (Class<?> type : hierarchy) {
			for (Field field : type.getDeclaredFields()) {
				PropertyDescriptor propertyDescriptor = propertyDescriptorsByName.remove(field.getName());

				if (propertyDescriptor != null)
					fieldAccessors.add(new FieldAccessor(columnNameFor(propertyDescriptor.getName(),
							field.getAnnotation(DatabaseColumn.class)), propertyDescriptor.getReadMethod()));
			}
		}

		// Computed properties without a backing field
		for (PropertyDescriptor propertyDescriptor : propertyDescriptorsByName.values())
			fieldAccessors.add(new FieldAccessor(columnNameFor(propertyDescriptor.getName(), null),
					propertyDescriptor.getReadMethod()));

		return verifyUniqueNames(fieldAccessors);
	}

	/**
	 * Rejects types where two fields (for example {@code firstName} and a {@code @DatabaseColumn("first_name")}
	 * override) map to the same parameter name.
	 */
	@NonNull
	protected List<FieldAccessor> verifyUniqueNames(@NonNull List<FieldAccessor> fieldAccessors) {
		requireNonNull(fieldAccessors);

		Set<String> names = new HashSet<>(fieldAccessors.size());

		for (FieldAccessor fieldAccessor : fieldAccessors)
			if (!names.add(fieldAccessor.name()))
				throw new DuplicateParameterException(fieldAccessor.name());

		return Collections.unmodifiableList(fieldAccessors);
	}

	@NonNull
	protected String columnNameFor(@NonNull String propertyName,
																 @Nullable DatabaseColumn databaseColumn) {
		requireNonNull(propertyName);

		if (databaseColumn != null && databaseColumn.value() != null && databaseColumn.value().length > 0)
			return normalizeName(databaseColumn.value()[0]);

		return normalizeName(propertyName);
	}

	@NonNull
	protected Locale getNormalizationLocale() {
		return this.normalizationLocale;
	}

	@NonNull
	protected ConcurrentMap<Class<?>, List<FieldAccessor>> getFieldAccessorsCache() {
		return this.fieldAccessorsCache;
	}

	/**
	 * A normalized parameter name paired with the method that reads its value.
	 */
	protected record FieldAccessor(@NonNull String name,
																 @NonNull Method readMethod) {
		protected FieldAccessor {
			requireNonNull(name);
			requireNonNull(readMethod);
		}
	}
}
