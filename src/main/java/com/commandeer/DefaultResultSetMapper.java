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
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Currency;
import java.util.Date;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TimeZone;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Basic implementation of {@link ResultSetMapper}.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultResultSetMapper implements ResultSetMapper {
	@NonNull
	private static final Set<Class<?>> STANDARD_TYPES = Set.of(
			Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class, Boolean.class, Character.class,
			String.class, byte[].class, UUID.class, BigDecimal.class, BigInteger.class, Date.class, Instant.class,
			LocalDate.class, LocalTime.class, LocalDateTime.class, OffsetTime.class, OffsetDateTime.class,
			Timestamp.class, java.sql.Date.class, java.sql.Time.class, ZoneId.class, TimeZone.class, Locale.class,
			Currency.class, Object.class
	);

	@NonNull
	private final Locale normalizationLocale;
	@NonNull
	private final ConcurrentMap<Class<?>, PropertyDescriptor[]> propertyDescriptorsCache = new ConcurrentHashMap<>();
	@NonNull
	private final ConcurrentMap<Class<?>, Map<String, Set<String>>> columnLabelAliasesByPropertyNameCache = new ConcurrentHashMap<>();

	DefaultResultSetMapper() {
		this(Locale.ROOT);
	}

	DefaultResultSetMapper(@NonNull Locale normalizationLocale) {
		this.normalizationLocale = requireNonNull(normalizationLocale);
	}

	@Override
	@Nullable
	public <T> T mapColumn(@NonNull CommandContext commandContext,
												 @NonNull ResultSet resultSet,
												 int columnIndex,
												 @NonNull Class<T> type) throws SQLException {
		requireNonNull(commandContext);
		requireNonNull(resultSet);
		requireNonNull(type);

		Object value = extractColumnValue(resultSet, resultSet.getMetaData(), columnIndex);
		return convert(commandContext, value, type);
	}

	@Override
	@Nullable
	@SuppressWarnings("unchecked")
	public <T> T mapRow(@NonNull CommandContext commandContext,
											@NonNull ResultSet resultSet,
											@NonNull Class<T> rowType,
											@NonNull InstanceProvider instanceProvider) throws SQLException {
		requireNonNull(commandContext);
		requireNonNull(resultSet);
		requireNonNull(rowType);
		requireNonNull(instanceProvider);

		ResultSetMetaData resultSetMetaData = resultSet.getMetaData();

		if (isStandardType(rowType)) {
			int columnCount = resultSetMetaData.getColumnCount();

			if (columnCount != 1) {
				List<String> labels = new ArrayList<>(columnCount);

				for (int i = 1; i <= columnCount; ++i)
					labels.add(resultSetMetaData.getColumnLabel(i));

				throw new DatabaseException(format("Expected 1 column to map to %s but encountered %s instead (%s)",
						rowType, columnCount, labels.stream().collect(joining(", "))));
			}

			return mapColumn(commandContext, resultSet, 1, rowType);
		}

		if (rowType.isRecord())
			return (T) mapResultSetToRecord(commandContext, resultSet, resultSetMetaData, (Class<? extends Record>) rowType, instanceProvider);

		return mapResultSetToBean(commandContext, resultSet, resultSetMetaData, rowType, instanceProvider);
	}

	@NonNull
	protected Boolean isStandardType(@NonNull Class<?> type) {
		requireNonNull(type);

		Class<?> boxedType = boxedClass(type);
		return STANDARD_TYPES.contains(boxedType) || boxedType.isEnum();
	}

	@NonNull
	protected <T extends Record> T mapResultSetToRecord(@NonNull CommandContext commandContext,
																											@NonNull ResultSet resultSet,
																											@NonNull ResultSetMetaData resultSetMetaData,
																											@NonNull Class<T> recordType,
																											@NonNull InstanceProvider instanceProvider) throws SQLException {
		requireNonNull(commandContext);
		requireNonNull(resultSet);
		requireNonNull(resultSetMetaData);
		requireNonNull(recordType);
		requireNonNull(instanceProvider);

		RecordComponent[] recordComponents = recordType.getRecordComponents();
		Map<String, Object> columnLabelsToValues = extractColumnLabelsToValues(resultSet, resultSetMetaData);
		Object[] args = new Object[recordComponents.length];

		for (int i = 0; i < recordComponents.length; ++i) {
			RecordComponent recordComponent = recordComponents[i];
			Class<?> recordComponentType = recordComponent.getType();

			for (String potentialColumnLabel : columnLabelsFor(recordComponent.getName(), recordComponent.getAnnotation(DatabaseColumn.class))) {
				if (!columnLabelsToValues.containsKey(potentialColumnLabel))
					continue;

				Object value = convert(commandContext, columnLabelsToValues.get(potentialColumnLabel), recordComponentType);

				// It's considered programmer error to have a NULL value in the ResultSet and map it to a primitive (which does not support null)
				if (value == null && recordComponentType.isPrimitive())
					throw new DatabaseException(format("Column '%s' is NULL but record component '%s' of %s is primitive (%s). Use a non-primitive type or COALESCE/CAST in SQL.",
							potentialColumnLabel, recordComponent.getName(), recordType.getSimpleName(), recordComponentType.getSimpleName()));

				args[i] = value;
			}

			if (args[i] == null && recordComponentType.isPrimitive())
				args[i] = defaultPrimitiveValue(recordComponentType);
		}

		return instanceProvider.provideRecord(commandContext, recordType, args);
	}

	@NonNull
	protected <T> T mapResultSetToBean(@NonNull CommandContext commandContext,
																		 @NonNull ResultSet resultSet,
																		 @NonNull ResultSetMetaData resultSetMetaData,
																		 @NonNull Class<T> beanType,
																		 @NonNull InstanceProvider instanceProvider) throws SQLException {
		requireNonNull(commandContext);
		requireNonNull(resultSet);
		requireNonNull(resultSetMetaData);
		requireNonNull(beanType);
		requireNonNull(instanceProvider);

		T object = instanceProvider.provide(commandContext, beanType);
		Map<String, Object> columnLabelsToValues = extractColumnLabelsToValues(resultSet, resultSetMetaData);
		Map<String, Set<String>> columnLabelAliasesByPropertyName = determineColumnLabelAliasesByPropertyName(beanType);

		for (PropertyDescriptor propertyDescriptor : determinePropertyDescriptors(beanType)) {
			Method writeMethod = propertyDescriptor.getWriteMethod();

			if (writeMethod == null)
				continue;

			Class<?> writeMethodParameterType = writeMethod.getParameterTypes()[0];

			// Pull in column labels, taking into account any aliases defined by @DatabaseColumn
			Set<String> columnLabels = columnLabelAliasesByPropertyName.get(propertyDescriptor.getName());

			if (columnLabels == null || columnLabels.isEmpty())
				columnLabels = databaseColumnNamesForPropertyName(propertyDescriptor.getName());

			for (String columnLabel : columnLabels) {
				if (!columnLabelsToValues.containsKey(columnLabel))
					continue;

				Object value = convert(commandContext, columnLabelsToValues.get(columnLabel), writeMethodParameterType);

				if (value == null && writeMethodParameterType.isPrimitive())
					throw new DatabaseException(format("Column '%s' is NULL but bean property '%s' of %s is primitive (%s). Use a non-primitive type or COALESCE/CAST in SQL.",
							columnLabel, propertyDescriptor.getName(), beanType.getSimpleName(), writeMethodParameterType.getSimpleName()));

				try {
					writeMethod.setAccessible(true);
					writeMethod.invoke(object, value);
				} catch (IllegalAccessException | InvocationTargetException e) {
					throw new DatabaseException(format("Unable to set property '%s' of %s", propertyDescriptor.getName(),
							beanType.getName()), e);
				}
			}
		}

		return object;
	}

	@NonNull
	protected Map<String, Object> extractColumnLabelsToValues(@NonNull ResultSet resultSet,
																														@NonNull ResultSetMetaData resultSetMetaData) throws SQLException {
		requireNonNull(resultSet);
		requireNonNull(resultSetMetaData);

		int columnCount = resultSetMetaData.getColumnCount();
		Map<String, Object> columnLabelsToValues = new HashMap<>(columnCount);
		Map<String, String> normalizedLabelsToRawLabels = new HashMap<>(columnCount);

		for (int i = 1; i <= columnCount; i++) {
			String rawLabel = resultSetMetaData.getColumnLabel(i);
			String label = normalizeColumnLabel(rawLabel);
			String previousRawLabel = normalizedLabelsToRawLabels.putIfAbsent(label, rawLabel);

			if (previousRawLabel != null)
				throw new DatabaseException(format(
						"Duplicate column label '%s' (normalized from '%s' and '%s'); use column aliases to disambiguate.",
						label, previousRawLabel, rawLabel));

			columnLabelsToValues.put(label, extractColumnValue(resultSet, resultSetMetaData, i));
		}

		return columnLabelsToValues;
	}

	/**
	 * Reads a column, preferring {@code java.time} types for temporal columns and materializing LOBs.
	 */
	@Nullable
	protected Object extractColumnValue(@NonNull ResultSet resultSet,
																			@NonNull ResultSetMetaData resultSetMetaData,
																			int columnIndex) throws SQLException {
		requireNonNull(resultSet);
		requireNonNull(resultSetMetaData);

		int jdbcType = resultSetMetaData.getColumnType(columnIndex);
		Object value;

		if (jdbcType == Types.TIMESTAMP_WITH_TIMEZONE) {
			value = tryGet(resultSet, columnIndex, OffsetDateTime.class);
		} else if (jdbcType == Types.TIMESTAMP) {
			value = tryGet(resultSet, columnIndex, LocalDateTime.class);
		} else if (jdbcType == Types.DATE) {
			value = tryGet(resultSet, columnIndex, LocalDate.class);
		} else if (jdbcType == Types.TIME_WITH_TIMEZONE) {
			value = tryGet(resultSet, columnIndex, OffsetTime.class);
		} else if (jdbcType == Types.TIME) {
			value = tryGet(resultSet, columnIndex, LocalTime.class);
		} else {
			// Non-temporal or unknown: take the driver's native object
			value = resultSet.getObject(columnIndex);
		}

		if (value instanceof Clob clob)
			return clob.getSubString(1, (int) clob.length());

		if (value instanceof Blob blob)
			return blob.getBytes(1, (int) blob.length());

		return value;
	}

	@Nullable
	protected Object tryGet(@NonNull ResultSet resultSet,
													int columnIndex,
													@NonNull Class<?> type) throws SQLException {
		requireNonNull(resultSet);
		requireNonNull(type);

		try {
			return resultSet.getObject(columnIndex, type);
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			Object value = resultSet.getObject(columnIndex);

			if (value instanceof Timestamp timestamp)
				return timestamp.toLocalDateTime();
			if (value instanceof java.sql.Date date)
				return date.toLocalDate();
			if (value instanceof java.sql.Time time)
				return time.toLocalTime();

			return value;
		}
	}

	@Override
	@Nullable
	@SuppressWarnings("unchecked")
	public <T> T convert(@NonNull CommandContext commandContext,
											 @Nullable Object value,
											 @NonNull Class<T> type) {
		requireNonNull(commandContext);
		requireNonNull(type);

		if (value == null)
			return null;

		Class<?> boxedType = boxedClass(type);
		Object convertedValue = convertResultSetValueToPropertyType(commandContext, value, boxedType);

		if (convertedValue != null && !boxedType.isInstance(convertedValue))
			throw new DatabaseException(format("Unable to convert value '%s' of %s to %s", value, value.getClass().getName(),
					type.getName()));

		return (T) convertedValue;
	}

	/**
	 * Massages a driver-supplied value to match the given {@code targetType}.
	 * <p>
	 * For example, the JDBC driver might give us {@link Long} but our corresponding record component is of type
	 * {@link Integer}, so we need to manually convert that ourselves.
	 *
	 * @param commandContext current command context
	 * @param value          the driver-supplied value
	 * @param targetType     the (boxed) type we'd like to map {@code value} to
	 * @return a representation of {@code value} that is of type {@code targetType}, where a conversion is known
	 */
	@Nullable
	protected Object convertResultSetValueToPropertyType(@NonNull CommandContext commandContext,
																											 @NonNull Object value,
																											 @NonNull Class<?> targetType) {
		requireNonNull(commandContext);
		requireNonNull(value);
		requireNonNull(targetType);

		// Legacy date types are normalized below, even if they are already assignable
		if (targetType.isInstance(value) && !(value instanceof Date))
			return value;

		ZoneId timeZone = commandContext.getTimeZone();

		if (value instanceof Number number) {
			if (Byte.class == targetType)
				return number.byteValue();
			if (Short.class == targetType)
				return number.shortValue();
			if (Integer.class == targetType)
				return number.intValue();
			if (Long.class == targetType)
				return number.longValue();
			if (Float.class == targetType)
				return number.floatValue();
			if (Double.class == targetType)
				return number.doubleValue();
			if (BigDecimal.class == targetType) {
				if (number instanceof BigInteger bigInteger)
					return new BigDecimal(bigInteger);
				if (number instanceof Byte || number instanceof Short || number instanceof Integer || number instanceof Long)
					return BigDecimal.valueOf(number.longValue());
				return new BigDecimal(number.toString());
			}
			if (BigInteger.class == targetType) {
				if (number instanceof BigDecimal bigDecimal)
					return bigDecimal.toBigInteger();
				if (number instanceof Byte || number instanceof Short || number instanceof Integer || number instanceof Long)
					return BigInteger.valueOf(number.longValue());
				return new BigDecimal(number.toString()).toBigInteger();
			}
			if (Boolean.class == targetType)
				return number.intValue() != 0;
		}

		// Legacy java.sql.* coming from drivers
		if (value instanceof Timestamp timestamp)
			value = timestamp.toLocalDateTime();
		else if (value instanceof java.sql.Date date)
			value = date.toLocalDate();
		else if (value instanceof java.sql.Time time)
			value = time.toLocalTime();
		else if (value instanceof Date date)
			value = date.toInstant();

		if (targetType.isInstance(value))
			return value;

		if (value instanceof Instant instant) {
			if (Date.class == targetType)
				return Date.from(instant);
			if (LocalDateTime.class == targetType)
				return instant.atZone(timeZone).toLocalDateTime();
			if (LocalDate.class == targetType)
				return instant.atZone(timeZone).toLocalDate();
			if (OffsetDateTime.class == targetType)
				return instant.atZone(timeZone).toOffsetDateTime();
			if (Timestamp.class == targetType)
				return Timestamp.from(instant);
		}

		if (value instanceof LocalDateTime localDateTime) {
			if (Instant.class == targetType)
				return localDateTime.atZone(timeZone).toInstant();
			if (Date.class == targetType)
				return Date.from(localDateTime.atZone(timeZone).toInstant());
			if (LocalDate.class == targetType)
				return localDateTime.toLocalDate();
			if (OffsetDateTime.class == targetType)
				return localDateTime.atZone(timeZone).toOffsetDateTime();
			if (Timestamp.class == targetType)
				return Timestamp.valueOf(localDateTime);
			if (java.sql.Date.class == targetType)
				return java.sql.Date.valueOf(localDateTime.toLocalDate());
		}

		if (value instanceof OffsetDateTime offsetDateTime) {
			if (Instant.class == targetType)
				return offsetDateTime.toInstant();
			if (LocalDateTime.class == targetType)
				return offsetDateTime.atZoneSameInstant(timeZone).toLocalDateTime();
			if (Date.class == targetType)
				return Date.from(offsetDateTime.toInstant());
			if (Timestamp.class == targetType)
				return Timestamp.from(offsetDateTime.toInstant());
		}

		if (value instanceof LocalDate localDate) {
			if (LocalDateTime.class == targetType)
				return localDate.atStartOfDay();
			if (Instant.class == targetType)
				return localDate.atStartOfDay(timeZone).toInstant();
			if (java.sql.Date.class == targetType)
				return java.sql.Date.valueOf(localDate);
			if (Date.class == targetType)
				return Date.from(localDate.atStartOfDay(timeZone).toInstant());
		}

		if (value instanceof LocalTime localTime) {
			if (java.sql.Time.class == targetType)
				return java.sql.Time.valueOf(localTime);
			if (OffsetTime.class == targetType)
				return localTime.atOffset(timeZone.getRules().getOffset(Instant.EPOCH));
		}

		if (value instanceof OffsetTime offsetTime) {
			if (LocalTime.class == targetType)
				return offsetTime.toLocalTime();
			if (java.sql.Time.class == targetType)
				return java.sql.Time.valueOf(offsetTime.toLocalTime());
		}

		if ("org.postgresql.util.PGobject".equals(value.getClass().getName()))
			value = ((org.postgresql.util.PGobject) value).getValue();

		if (value == null)
			return null;

		if (String.class == targetType)
			return value.toString();

		if (UUID.class == targetType) {
			try {
				return UUID.fromString(value.toString());
			} catch (IllegalArgumentException e) {
				throw new DatabaseException(format("Unable to convert value '%s' to UUID", value), e);
			}
		}

		if (ZoneId.class == targetType) {
			try {
				return ZoneId.of(value.toString());
			} catch (DateTimeException e) {
				throw new DatabaseException(format("Unable to convert value '%s' to ZoneId", value), e);
			}
		}

		if (TimeZone.class == targetType)
			return TimeZone.getTimeZone(value.toString().trim());

		if (Locale.class == targetType)
			return Locale.forLanguageTag(value.toString().trim());

		if (Currency.class == targetType) {
			try {
				return Currency.getInstance(value.toString());
			} catch (IllegalArgumentException e) {
				throw new DatabaseException(format("Unable to convert value '%s' to Currency", value), e);
			}
		}

		if (targetType.isEnum())
			return extractEnumValue(targetType, value);

		if (Boolean.class == targetType && value instanceof String string)
			return Boolean.parseBoolean(string.trim()) || "1".equals(string.trim());

		if (Character.class == targetType) {
			if (value instanceof String string) {
				if (string.length() == 1)
					return string.charAt(0);

				throw new DatabaseException(format("Cannot map String value '%s' to %s; expected length 1", string, targetType.getSimpleName()));
			}

			if (value instanceof Number number) {
				int code = number.intValue();

				if (code >= Character.MIN_VALUE && code <= Character.MAX_VALUE)
					return (char) code;

				throw new DatabaseException(format("Numeric value %d is outside valid char range", code));
			}
		}

		if (value instanceof String string && Number.class.isAssignableFrom(targetType)) {
			try {
				return convertResultSetValueToPropertyType(commandContext, new BigDecimal(string.trim()), targetType);
			} catch (NumberFormatException e) {
				throw new DatabaseException(format("Unable to convert value '%s' to %s", string, targetType.getSimpleName()), e);
			}
		}

		return value;
	}

	/**
	 * Attempts to convert {@code object} to a corresponding value for enum type {@code enumClass}.
	 *
	 * @param enumClass the enum to which we'd like to convert {@code object}
	 * @param object    the object to convert to an enum value
	 * @return the enum value of {@code object} for {@code enumClass}
	 * @throws DatabaseException if {@code object} does not correspond to a valid enum value
	 */
	@SuppressWarnings({"unchecked", "rawtypes"})
	@NonNull
	protected Enum<?> extractEnumValue(@NonNull Class<?> enumClass,
																		 @NonNull Object object) {
		requireNonNull(enumClass);
		requireNonNull(object);

		if (!enumClass.isEnum())
			throw new IllegalArgumentException(format("%s is not an enum type", enumClass));

		String objectAsString = object.toString();

		try {
			return Enum.valueOf((Class<? extends Enum>) enumClass, objectAsString);
		} catch (IllegalArgumentException e) {
			throw new DatabaseException(format("The value '%s' is not present in enum %s", objectAsString, enumClass), e);
		}
	}

	@NonNull
	protected PropertyDescriptor[] determinePropertyDescriptors(@NonNull Class<?> beanType) {
		requireNonNull(beanType);

		return getPropertyDescriptorsCache().computeIfAbsent(beanType, type -> {
			try {
				BeanInfo beanInfo = Introspector.getBeanInfo(type);
				PropertyDescriptor[] propertyDescriptors = beanInfo.getPropertyDescriptors();
				return propertyDescriptors == null ? new PropertyDescriptor[0] : propertyDescriptors;
			} catch (IntrospectionException e) {
				throw new DatabaseException(format("Unable to introspect properties for %s", type.getName()), e);
			}
		});
	}

	@NonNull
	protected Map<String, Set<String>> determineColumnLabelAliasesByPropertyName(@NonNull Class<?> beanType) {
		requireNonNull(beanType);

		return getColumnLabelAliasesByPropertyNameCache().computeIfAbsent(beanType, type -> {
			Map<String, Set<String>> columnLabelAliasesByPropertyName = new HashMap<>();

			for (Class<?> currentType = type; currentType != null && currentType != Object.class; currentType = currentType.getSuperclass()) {
				for (Field field : currentType.getDeclaredFields()) {
					DatabaseColumn databaseColumn = field.getAnnotation(DatabaseColumn.class);

					if (databaseColumn != null)
						columnLabelAliasesByPropertyName.putIfAbsent(field.getName(), columnLabelsFor(field.getName(), databaseColumn));
				}
			}

			return Collections.unmodifiableMap(columnLabelAliasesByPropertyName);
		});
	}

	@NonNull
	protected Set<String> columnLabelsFor(@NonNull String propertyName,
																				@Nullable DatabaseColumn databaseColumn) {
		requireNonNull(propertyName);

		if (databaseColumn == null || databaseColumn.value() == null || databaseColumn.value().length == 0)
			return databaseColumnNamesForPropertyName(propertyName);

		Set<String> columnLabels = new LinkedHashSet<>(databaseColumn.value().length);

		for (String columnLabel : databaseColumn.value())
			columnLabels.add(normalizeColumnLabel(columnLabel));

		return columnLabels;
	}

	/**
	 * Massages a {@link ResultSet} column label so it's easier to match against a property name.
	 *
	 * @param columnLabel the {@link ResultSet} column label to massage
	 * @return the massaged label
	 */
	@NonNull
	protected String normalizeColumnLabel(@NonNull String columnLabel) {
		requireNonNull(columnLabel);
		return columnLabel.toLowerCase(getNormalizationLocale());
	}

	/**
	 * Massages a property name to match standard database column names (camelCase -> camel_case).
	 * <p>
	 * There may be multiple database column name mappings, for example property {@code address1} might map to both
	 * {@code address1} and {@code address_1} column names.
	 *
	 * @param propertyName the property name to massage
	 * @return the column names that match the property name
	 */
	@NonNull
	protected Set<String> databaseColumnNamesForPropertyName(@NonNull String propertyName) {
		requireNonNull(propertyName);

		Set<String> normalizedPropertyNames = new HashSet<>(2);

		// Converts camelCase to camel_case
		String camelCaseRegex = "([a-z])([A-Z]+)";
		String replacement = "$1_$2";

		String normalizedPropertyName =
				propertyName.replaceAll(camelCaseRegex, replacement).toLowerCase(getNormalizationLocale());
		normalizedPropertyNames.add(normalizedPropertyName);

		// Converts address1 to address_1
		String letterFollowedByNumberRegex = "(\\D)(\\d)";
		String normalizedNumberPropertyName = normalizedPropertyName.replaceAll(letterFollowedByNumberRegex, replacement);
		normalizedPropertyNames.add(normalizedNumberPropertyName);

		return normalizedPropertyNames;
	}

	@NonNull
	protected Class<?> boxedClass(@NonNull Class<?> type) {
		requireNonNull(type);

		if (!type.isPrimitive())
			return type;
		if (type == int.class)
			return Integer.class;
		if (type == long.class)
			return Long.class;
		if (type == double.class)
			return Double.class;
		if (type == float.class)
			return Float.class;
		if (type == boolean.class)
			return Boolean.class;
		if (type == short.class)
			return Short.class;
		if (type == byte.class)
			return Byte.class;
		if (type == char.class)
			return Character.class;

		return type;
	}

	@NonNull
	protected Object defaultPrimitiveValue(@NonNull Class<?> primitiveType) {
		requireNonNull(primitiveType);

		if (primitiveType == boolean.class)
			return false;
		if (primitiveType == char.class)
			return '\0';
		if (primitiveType == byte.class)
			return (byte) 0;
		if (primitiveType == short.class)
			return (short) 0;
		if (primitiveType == int.class)
			return 0;
		if (primitiveType == long.class)
			return 0L;
		if (primitiveType == float.class)
			return 0F;

		return 0D;
	}

	@NonNull
	protected Locale getNormalizationLocale() {
		return this.normalizationLocale;
	}

	@NonNull
	protected ConcurrentMap<Class<?>, PropertyDescriptor[]> getPropertyDescriptorsCache() {
		return this.propertyDescriptorsCache;
	}

	@NonNull
	protected ConcurrentMap<Class<?>, Map<String, Set<String>>> getColumnLabelAliasesByPropertyNameCache() {
		return this.columnLabelAliasesByPropertyNameCache;
	}
}
