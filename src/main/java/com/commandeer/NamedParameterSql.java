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
import java.util.ArrayList;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * SQL text whose {@code @name} placeholders have been located and replaced with JDBC {@code ?} markers.
 * <p>
 * Placeholders inside quoted strings, quoted identifiers, dollar-quoted bodies and comments are left alone, as are
 * server variables written with a double prefix, e.g. {@code @@identity}.
 * <p>
 * A placeholder may appear more than once; each occurrence becomes its own {@code ?} marker.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class NamedParameterSql {
	@NonNull
	private final String originalSql;
	@NonNull
	private final String jdbcSql;
	@NonNull
	private final List<String> parameterNames;

	private NamedParameterSql(@NonNull String originalSql,
														@NonNull String jdbcSql,
														@NonNull List<String> parameterNames) {
		requireNonNull(originalSql);
		requireNonNull(jdbcSql);
		requireNonNull(parameterNames);

		this.originalSql = originalSql;
		this.jdbcSql = jdbcSql;
		this.parameterNames = List.copyOf(parameterNames);
	}

	/**
	 * Locates the {@code @name} placeholders in {@code sql}.
	 *
	 * @param sql SQL text containing {@code @name} placeholders
	 * @return the parsed SQL
	 * @throws IllegalArgumentException if {@code sql} contains positional {@code ?} markers
	 */
	@NonNull
	public static NamedParameterSql parse(@NonNull String sql) {
		requireNonNull(sql);

		StringBuilder jdbcSql = new StringBuilder(sql.length());
		List<String> parameterNames = new ArrayList<>();

		boolean inSingleQuote = false;
		boolean inSingleQuoteEscapesBackslash = false;
		boolean inDoubleQuote = false;
		boolean inBacktickQuote = false;
		boolean inBracketQuote = false;
		boolean inLineComment = false;
		boolean inBlockComment = false;
		String dollarQuoteDelimiter = null;

		for (int i = 0; i < sql.length(); ) {
			if (dollarQuoteDelimiter != null) {
				if (sql.startsWith(dollarQuoteDelimiter, i)) {
					jdbcSql.append(dollarQuoteDelimiter);
					i += dollarQuoteDelimiter.length();
					dollarQuoteDelimiter = null;
				} else {
					jdbcSql.append(sql.charAt(i));
					++i;
				}

				continue;
			}

			char c = sql.charAt(i);

			if (inLineComment) {
				jdbcSql.append(c);
				++i;

				if (c == '\n' || c == '\r')
					inLineComment = false;

				continue;
			}

			if (inBlockComment) {
				jdbcSql.append(c);

				if (c == '*' && i + 1 < sql.length() && sql.charAt(i + 1) == '/') {
					jdbcSql.append('/');
					i += 2;
					inBlockComment = false;
				} else {
					++i;
				}

				continue;
			}

			if (inSingleQuote) {
				jdbcSql.append(c);

				if (inSingleQuoteEscapesBackslash && c == '\\' && i + 1 < sql.length()) {
					jdbcSql.append(sql.charAt(i + 1));
					i += 2;
					continue;
				}

				if (c == '\'') {
					// Escaped quote: ''
					if (i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
						jdbcSql.append('\'');
						i += 2;
						continue;
					}

					inSingleQuote = false;
					inSingleQuoteEscapesBackslash = false;
				}

				++i;
				continue;
			}

			if (inDoubleQuote) {
				jdbcSql.append(c);

				if (c == '"') {
					// Escaped quote: ""
					if (i + 1 < sql.length() && sql.charAt(i + 1) == '"') {
						jdbcSql.append('"');
						i += 2;
						continue;
					}

					inDoubleQuote = false;
				}

				++i;
				continue;
			}

			if (inBacktickQuote) {
				jdbcSql.append(c);

				if (c == '`')
					inBacktickQuote = false;

				++i;
				continue;
			}

			if (inBracketQuote) {
				jdbcSql.append(c);

				if (c == ']')
					inBracketQuote = false;

				++i;
				continue;
			}

			// Not inside string/comment
			if (c == '-' && i + 1 < sql.length() && sql.charAt(i + 1) == '-') {
				jdbcSql.append("--");
				i += 2;
				inLineComment = true;
				continue;
			}

			if (c == '/' && i + 1 < sql.length() && sql.charAt(i + 1) == '*') {
				jdbcSql.append("/*");
				i += 2;
				inBlockComment = true;
				continue;
			}

			if ((c == 'E' || c == 'e') && i + 1 < sql.length() && sql.charAt(i + 1) == '\''
					&& (i == 0 || !Character.isJavaIdentifierPart(sql.charAt(i - 1)))) {
				inSingleQuote = true;
				inSingleQuoteEscapesBackslash = true;
				jdbcSql.append(c).append('\'');
				i += 2;
				continue;
			}

			if (c == '\'') {
				inSingleQuote = true;
				inSingleQuoteEscapesBackslash = false;
				jdbcSql.append(c);
				++i;
				continue;
			}

			if (c == '"') {
				inDoubleQuote = true;
				jdbcSql.append(c);
				++i;
				continue;
			}

			if (c == '`') {
				inBacktickQuote = true;
				jdbcSql.append(c);
				++i;
				continue;
			}

			if (c == '[') {
				inBracketQuote = true;
				jdbcSql.append(c);
				++i;
				continue;
			}

			if (c == '$') {
				String delimiter = parseDollarQuoteDelimiter(sql, i);

				if (delimiter != null) {
					jdbcSql.append(delimiter);
					i += delimiter.length();
					dollarQuoteDelimiter = delimiter;
					continue;
				}
			}

			if (c == '?')
				throw new IllegalArgumentException(format("Positional parameters ('?') are not supported. Use named parameters (e.g. '@id') instead. SQL: %s", sql));

			if (c == '@' && i + 1 < sql.length() && sql.charAt(i + 1) == '@') {
				// Server variable, e.g. @@identity; copy it through untouched
				int nameEndIndex = i + 2;

				while (nameEndIndex < sql.length() && Character.isJavaIdentifierPart(sql.charAt(nameEndIndex)))
					++nameEndIndex;

				jdbcSql.append(sql, i, nameEndIndex);
				i = nameEndIndex;
				continue;
			}

			if (c == '@' && i + 1 < sql.length() && Character.isJavaIdentifierStart(sql.charAt(i + 1))) {
				int nameStartIndex = i + 1;
				int nameEndIndex = nameStartIndex + 1;

				while (nameEndIndex < sql.length() && Character.isJavaIdentifierPart(sql.charAt(nameEndIndex)))
					++nameEndIndex;

				parameterNames.add(sql.substring(nameStartIndex, nameEndIndex));
				jdbcSql.append('?');
				i = nameEndIndex;
				continue;
			}

			jdbcSql.append(c);
			++i;
		}

		return new NamedParameterSql(sql, jdbcSql.toString(), parameterNames);
	}

	@Nullable
	private static String parseDollarQuoteDelimiter(@NonNull String sql,
																									int startIndex) {
		requireNonNull(sql);

		if (startIndex < 0 || startIndex >= sql.length())
			return null;

		if (sql.charAt(startIndex) != '$')
			return null;

		int i = startIndex + 1;

		while (i < sql.length()) {
			char c = sql.charAt(i);

			if (c == '$')
				return sql.substring(startIndex, i + 1);

			if (!Character.isJavaIdentifierPart(c))
				return null;

			++i;
		}

		return null;
	}

	@Override
	public String toString() {
		return format("%s{originalSql=%s, jdbcSql=%s, parameterNames=%s}", getClass().getSimpleName(),
				getOriginalSql(), getJdbcSql(), getParameterNames());
	}

	@NonNull
	public String getOriginalSql() {
		return this.originalSql;
	}

	/**
	 * @return the SQL with every placeholder replaced by {@code ?}
	 */
	@NonNull
	public String getJdbcSql() {
		return this.jdbcSql;
	}

	/**
	 * @return placeholder names in order of appearance, without the {@code @} prefix, one entry per occurrence
	 */
	@NonNull
	public List<String> getParameterNames() {
		return this.parameterNames;
	}
}
