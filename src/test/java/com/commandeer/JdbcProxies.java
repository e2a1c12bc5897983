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

import org.hsqldb.jdbc.JDBCDataSource;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Test {@link DataSource}s built from JDK dynamic proxies, for failures and driver behavior HSQLDB does not produce.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class JdbcProxies {
	private JdbcProxies() {
		// Non-instantiable
	}

	@NonNull
	static DataSource createInMemoryDataSource(@NonNull String databaseName) {
		requireNonNull(databaseName);

		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(format("jdbc:hsqldb:mem:%s", databaseName));
		dataSource.setUser("sa");
		dataSource.setPassword("");

		return dataSource;
	}

	/**
	 * A data source whose connections can never be opened.
	 */
	@NonNull
	static DataSource failingDataSource(@NonNull String message,
																			@NonNull AtomicInteger connectionAttempts) {
		requireNonNull(message);
		requireNonNull(connectionAttempts);

		return proxy(DataSource.class, (proxy, method, args) -> {
			if (method.getName().equals("getConnection")) {
				connectionAttempts.incrementAndGet();
				throw new SQLException(message, "08001");
			}

			return defaultValue(method.getReturnType());
		});
	}

	/**
	 * Wraps {@code delegate} so that every prepared statement reports the given warnings after it runs.
	 */
	@NonNull
	static DataSource warningDataSource(@NonNull DataSource delegate,
																			@NonNull String... warnings) {
		requireNonNull(delegate);
		requireNonNull(warnings);

		return proxy(DataSource.class, (dataSourceProxy, dataSourceMethod, dataSourceArgs) -> {
			Object dataSourceResult = invoke(delegate, dataSourceMethod, dataSourceArgs);

			if (!(dataSourceResult instanceof Connection connection))
				return dataSourceResult;

			return proxy(Connection.class, (connectionProxy, connectionMethod, connectionArgs) -> {
				Object connectionResult = invoke(connection, connectionMethod, connectionArgs);

				if (!(connectionResult instanceof PreparedStatement preparedStatement))
					return connectionResult;

				return proxy(PreparedStatement.class, (statementProxy, statementMethod, statementArgs) -> {
					if (statementMethod.getName().equals("getWarnings")) {
						SQLWarning head = null;

						for (int i = warnings.length - 1; i >= 0; --i) {
							SQLWarning warning = new SQLWarning(warnings[i], "01000", i);

							if (head != null)
								warning.setNextWarning(head);

							head = warning;
						}

						return head;
					}

					return invoke(preparedStatement, statementMethod, statementArgs);
				});
			});
		});
	}

	/**
	 * A data source whose callable statements produce a fixed return value and record every call made on them.
	 */
	@NonNull
	static DataSource storedProcedureDataSource(@Nullable Object returnValue,
																							@NonNull List<String> statementCalls) {
		requireNonNull(statementCalls);

		return proxy(DataSource.class, (dataSourceProxy, dataSourceMethod, dataSourceArgs) -> {
			if (!dataSourceMethod.getName().equals("getConnection"))
				return defaultValue(dataSourceMethod.getReturnType());

			return proxy(Connection.class, (connectionProxy, connectionMethod, connectionArgs) -> {
				if (connectionMethod.getName().equals("prepareCall")) {
					statementCalls.add(format("prepareCall %s", connectionArgs[0]));

					return proxy(CallableStatement.class, (statementProxy, statementMethod, statementArgs) -> {
						String name = statementMethod.getName();

						if (name.startsWith("set") || name.equals("registerOutParameter"))
							statementCalls.add(format("%s %s %s", name, statementArgs[0], statementArgs[1]));

						if (name.equals("getUpdateCount"))
							return -1;

						if (name.equals("getObject") && Integer.valueOf(1).equals(statementArgs[0]))
							return returnValue;

						return defaultValue(statementMethod.getReturnType());
					});
				}

				return defaultValue(connectionMethod.getReturnType());
			});
		});
	}

	@SuppressWarnings("unchecked")
	@NonNull
	private static <T> T proxy(@NonNull Class<T> type,
														 @NonNull InvocationHandler invocationHandler) {
		return (T) Proxy.newProxyInstance(JdbcProxies.class.getClassLoader(), new Class<?>[]{type}, invocationHandler);
	}

	@Nullable
	private static Object invoke(@NonNull Object target,
															 @NonNull Method method,
															 @Nullable Object[] args) throws Throwable {
		try {
			return method.invoke(target, args);
		} catch (InvocationTargetException e) {
			throw e.getCause();
		}
	}

	@Nullable
	private static Object defaultValue(@NonNull Class<?> returnType) {
		if (returnType == boolean.class)
			return false;
		if (returnType == int.class)
			return 0;
		if (returnType == long.class)
			return 0L;
		if (returnType == short.class)
			return (short) 0;
		if (returnType == byte.class)
			return (byte) 0;
		if (returnType == double.class)
			return 0D;
		if (returnType == float.class)
			return 0F;
		if (returnType == char.class)
			return (char) 0;

		return null;
	}
}
