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

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Identifies different types of databases, which allows for special platform-specific handling.
 * <p>
 * Most importantly, a database type knows how to ask for the identity value generated by the most recent insert
 * (see {@link Commandeer#executeScopeIdentity(Class)}).
 *
 * @since 1.0.0
 */
public enum DatabaseType {
	/**
	 * A database which requires no special handling.  Generated identities are read through JDBC generated keys.
	 */
	GENERIC(null),
	/**
	 * A Microsoft SQL Server database.
	 */
	SQL_SERVER("; select scope_identity()"),
	/**
	 * A MySQL or MariaDB database.
	 */
	MYSQL("; select last_insert_id()"),
	/**
	 * A PostgreSQL database.
	 */
	POSTGRESQL("; select lastval()"),
	/**
	 * An Oracle database.
	 */
	ORACLE(null);

	private final String identityClause;

	DatabaseType(String identityClause) {
		this.identityClause = identityClause;
	}

	/**
	 * SQL appended to a command's text to select the identity value generated by that command, if this database has one.
	 * <p>
	 * When empty, the identity is read through {@link java.sql.Statement#getGeneratedKeys()} instead.
	 *
	 * @return the identity clause, or empty if JDBC generated keys should be used
	 */
	@NonNull
	public Optional<String> getIdentityClause() {
		return Optional.ofNullable(this.identityClause);
	}

	/**
	 * Determines the type of database to which the given {@code dataSource} connects.
	 * <p>
	 * Note: this will establish a {@link Connection} to the database.
	 *
	 * @param dataSource the database connection factory
	 * @return the type of database
	 * @throws DatabaseException if an exception occurs while attempting to read database metadata
	 */
	@NonNull
	public static DatabaseType fromDataSource(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);

		try (Connection connection = dataSource.getConnection()) {
			return fromConnection(connection);
		} catch (SQLException e) {
			throw new DatabaseException("Unable to connect to database to determine its type", e);
		}
	}

	/**
	 * Determines the type of database by inspecting the metadata of an already-open {@code connection}.
	 * <p>
	 * The connection is not closed.
	 *
	 * @param connection an open connection
	 * @return the type of database
	 * @throws SQLException if database metadata cannot be read
	 */
	@NonNull
	public static DatabaseType fromConnection(@NonNull Connection connection) throws SQLException {
		requireNonNull(connection);

		DatabaseMetaData databaseMetaData = connection.getMetaData();
		String databaseProductName = databaseMetaData.getDatabaseProductName();
		String url = databaseMetaData.getURL();
		String driverName = databaseMetaData.getDriverName();

		// All of our checks are against databases with English names
		String databaseProductNameLowercase = databaseProductName == null ? "" : databaseProductName.toLowerCase(Locale.ENGLISH);
		String urlLowercase = url == null ? "" : url.toLowerCase(Locale.ENGLISH);
		String driverNameLowercase = driverName == null ? "" : driverName.toLowerCase(Locale.ENGLISH);

		// Prefer product name
		if (databaseProductNameLowercase.startsWith("oracle"))
			return DatabaseType.ORACLE;

		if (databaseProductNameLowercase.contains("postgresql") || databaseProductNameLowercase.equals("postgres"))  // some proxies shorten it
			return DatabaseType.POSTGRESQL;

		if (databaseProductNameLowercase.contains("microsoft sql server"))
			return DatabaseType.SQL_SERVER;

		if (databaseProductNameLowercase.startsWith("mysql") || databaseProductNameLowercase.startsWith("mariadb"))
			return DatabaseType.MYSQL;

		// Fallbacks if product name is absent/weird but the driver/URL is clear
		if (urlLowercase.startsWith("jdbc:postgresql:") || driverNameLowercase.contains("postgresql"))
			return DatabaseType.POSTGRESQL;
		if (urlLowercase.startsWith("jdbc:sqlserver:") || urlLowercase.startsWith("jdbc:jtds:sqlserver:"))
			return DatabaseType.SQL_SERVER;
		if (urlLowercase.startsWith("jdbc:mysql:") || urlLowercase.startsWith("jdbc:mariadb:"))
			return DatabaseType.MYSQL;

		return DatabaseType.GENERIC;
	}
}
