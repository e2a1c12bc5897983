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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.ByteBuffer;
import java.sql.ParameterMetaData;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Currency;
import java.util.Date;
import java.util.Locale;
import java.util.Optional;
import java.util.TimeZone;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Basic implementation of {@link ParameterBinder}.
 * <p>
 * {@code null}s are bound with the type the driver reports for the marker, falling back to {@link Types#NULL}.
 * {@code java.time} values are bound natively where the driver supports it.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultParameterBinder implements ParameterBinder {
	@Override
	public void bindParameter(@Nonnull CommandContext commandContext,
														@Nonnull PreparedStatement preparedStatement,
														@Nonnull Integer parameterIndex,
														@Nullable Object parameter) throws SQLException {
		requireNonNull(commandContext);
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);

		Optional<Integer> sqlTypeOptional = determineParameterSqlType(preparedStatement, parameterIndex);

		if (parameter == null) {
			preparedStatement.setNull(parameterIndex, sqlTypeOptional.orElse(Types.NULL));
			return;
		}

		Integer sqlType = sqlTypeOptional.orElse(Types.OTHER);
		Object normalizedParameter = normalizeParameter(commandContext, parameter);

		if (normalizedParameter instanceof byte[] bytes) {
			preparedStatement.setBytes(parameterIndex, bytes);
			return;
		}

		if (normalizedParameter instanceof LocalDate localDate) {
			if (!trySetObject(preparedStatement, parameterIndex, localDate, Types.DATE))
				preparedStatement.setDate(parameterIndex, java.sql.Date.valueOf(localDate)); // fallback

			return;
		}

		if (normalizedParameter instanceof LocalTime localTime) {
			// Some drivers offset LocalTime; a tz-free string is safest
			preparedStatement.setString(parameterIndex, localTime.toString());
			return;
		}

		if (normalizedParameter instanceof LocalDateTime localDateTime) {
			if (!trySetObject(preparedStatement, parameterIndex, localDateTime, Types.TIMESTAMP))
				preparedStatement.setTimestamp(parameterIndex, java.sql.Timestamp.valueOf(localDateTime)); // fallback

			return;
		}

		if (normalizedParameter instanceof OffsetDateTime offsetDateTime) {
			if (sqlType == Types.TIMESTAMP) {
				// Coerce to the configured zone and drop the offset
				LocalDateTime localDateTime = offsetDateTime.atZoneSameInstant(commandContext.getTimeZone()).toLocalDateTime();

				if (!trySetObject(preparedStatement, parameterIndex, localDateTime, Types.TIMESTAMP))
					preparedStatement.setTimestamp(parameterIndex, java.sql.Timestamp.valueOf(localDateTime));

				return;
			}

			if (!trySetObject(preparedStatement, parameterIndex, offsetDateTime, Types.TIMESTAMP_WITH_TIMEZONE))
				preparedStatement.setTimestamp(parameterIndex, java.sql.Timestamp.from(offsetDateTime.toInstant()));

			return;
		}

		if (normalizedParameter instanceof Instant instant) {
			if (sqlType == Types.TIMESTAMP) {
				LocalDateTime localDateTime = LocalDateTime.ofInstant(instant, commandContext.getTimeZone());

				if (!trySetObject(preparedStatement, parameterIndex, localDateTime, Types.TIMESTAMP))
					preparedStatement.setTimestamp(parameterIndex, java.sql.Timestamp.valueOf(localDateTime));

				return;
			}

			if (!trySetObject(preparedStatement, parameterIndex, instant, Types.TIMESTAMP_WITH_TIMEZONE))
				preparedStatement.setTimestamp(parameterIndex, java.sql.Timestamp.from(instant));

			return;
		}

		// Everything else
		preparedStatement.setObject(parameterIndex, normalizedParameter);
	}

	protected boolean trySetObject(@Nonnull PreparedStatement preparedStatement,
																 @Nonnull Integer parameterIndex,
																 @Nullable Object parameter,
																 @Nonnull Integer sqlType) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);
		requireNonNull(sqlType);

		try {
			preparedStatement.setObject(parameterIndex, parameter, sqlType);
			return true;
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return false;
		}
	}

	@Nonnull
	protected Optional<Integer> determineParameterSqlType(@Nonnull PreparedStatement preparedStatement,
																												@Nonnull Integer parameterIndex) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);

		try {
			ParameterMetaData parameterMetaData = preparedStatement.getParameterMetaData();

			if (parameterMetaData == null)
				return Optional.empty();

			return Optional.of(parameterMetaData.getParameterType(parameterIndex));
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return Optional.empty();
		}
	}

	/**
	 * Massages a parameter into a JDBC-friendly format if needed.
	 * <p>
	 * For example, we need to do special work to prepare a {@link UUID} for Oracle.
	 *
	 * @param commandContext current command context
	 * @param parameter      the parameter to (possibly) massage
	 * @return the result of the massaging process
	 */
	@Nonnull
	protected Object normalizeParameter(@Nonnull CommandContext commandContext,
																			@Nonnull Object parameter) {
		requireNonNull(commandContext);
		requireNonNull(parameter);

		// Coerce to java.time whenever possible
		if (parameter instanceof java.sql.Timestamp timestamp)
			return timestamp.toInstant();
		if (parameter instanceof java.sql.Date date)
			return date.toLocalDate();
		if (parameter instanceof java.sql.Time time)
			return time.toLocalTime();
		if (parameter instanceof Date date)
			return Instant.ofEpochMilli(date.getTime());
		if (parameter instanceof ZonedDateTime zonedDateTime)
			return zonedDateTime.toOffsetDateTime();
		if (parameter instanceof Locale locale)
			return locale.toLanguageTag();
		if (parameter instanceof Currency currency)
			return currency.getCurrencyCode();
		if (parameter instanceof Enum<?> enumValue)
			return enumValue.name();
		if (parameter instanceof ZoneId zoneId)
			return zoneId.getId();
		if (parameter instanceof TimeZone timeZone)
			return timeZone.getID();

		if (commandContext.getDatabaseType() == DatabaseType.ORACLE && parameter instanceof UUID uuid) {
			ByteBuffer byteBuffer = ByteBuffer.wrap(new byte[16]);
			byteBuffer.putLong(uuid.getMostSignificantBits());
			byteBuffer.putLong(uuid.getLeastSignificantBits());
			return byteBuffer.array();
		}

		return parameter;
	}
}
