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
import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.JDBCType;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLWarning;
import java.sql.Statement;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * Fluent builder and executor for a single database command.
 * <p>
 * A {@code Commandeer} owns one connection and one live command at a time.  Callers assemble a SQL text command, a
 * stored-procedure call, a generated {@code INSERT}/{@code UPDATE} or a table-direct read, attach named parameters,
 * then execute it through one of the {@code execute*} methods:
 * <pre>
 * try (Commandeer commandeer = Commandeer.withDataSource(dataSource).build()) {
 *   List&lt;Car&gt; cars = commandeer.createTextCommand("select * from car where color = @color", Map.of("color", "blue"))
 *     .executeAndAutoMap(Car.class);
 *
 *   Long id = commandeer.createInsertCommand("car", new Car(null, "red"))
 *     .executeScopeIdentity(Long.class);
 * }</pre>
 * Parameter names are normalized on the way in ({@code @firstName} and {@code first_name} are the same parameter) and
 * referenced in SQL text as {@code @name}.
 * <p>
 * Database errors are thrown as {@link DatabaseExecutionException} unless at least one handler has been registered
 * via {@link #error(CommandeerHandler)}, in which case every handler is invoked, the error is swallowed and the
 * {@code execute*} method returns its default value.  See {@link #isLastCallFaulted()}.
 * <p>
 * Instances are not threadsafe; use one per logical operation.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class Commandeer implements AutoCloseable {
	/**
	 * Default chunk size for {@link #executeBinaryStream(String, OutputStream)}.
	 */
	public static final int DEFAULT_BINARY_STREAM_BUFFER_SIZE = 1 << 18;

	@NonNull
	private static final String RETURN_VALUE_PARAMETER_NAME = "return_value";

	@NonNull
	private final DataSource dataSource;
	@NonNull
	private final ZoneId timeZone;
	@NonNull
	private final ParameterBinder parameterBinder;
	@NonNull
	private final ResultSetMapper resultSetMapper;
	@NonNull
	private final InstanceProvider instanceProvider;
	@NonNull
	private final ParameterStore parameterStore;
	@NonNull
	private final Boolean autoClose;
	@NonNull
	private final Boolean procedureReturnValues;
	@NonNull
	private final Map<String, OutputParameter> outputParameters;
	@NonNull
	private final List<CommandeerHandler<SQLException>> errorHandlers;
	@NonNull
	private final List<CommandeerHandler<InfoMessage>> infoHandlers;
	@NonNull
	private final List<CommandeerHandler<ConnectionStateChange>> connectionStateChangeHandlers;
	@NonNull
	private final List<ExecutionListener> executionListeners;
	@NonNull
	private final Logger logger;

	@Nullable
	private DatabaseType databaseType;
	@Nullable
	private Connection connection;
	@Nullable
	private String catalog;
	@Nullable
	private String commandText;
	@NonNull
	private CommandType commandType;
	@NonNull
	private CrudMode crudMode;
	@Nullable
	private String crudTable;
	@Nullable
	private String crudWhere;
	@Nullable
	private OutputParameter returnValueParameter;
	@NonNull
	private DatabaseOperationSupportStatus executeLargeUpdateSupported;

	private long commandExecutionCount;
	@Nullable
	private Long recordsAffected;
	@Nullable
	private Duration lastElapsed;
	private boolean lastCallFaulted;
	@Nullable
	private SQLException lastFault;

	private Commandeer(@NonNull Builder builder) {
		requireNonNull(builder);

		FieldMapAdapter fieldMapAdapter = builder.fieldMapAdapter == null ? FieldMapAdapter.defaultInstance() : builder.fieldMapAdapter;

		this.dataSource = requireNonNull(builder.dataSource);
		this.databaseType = builder.databaseType;
		this.timeZone = builder.timeZone == null ? ZoneId.systemDefault() : builder.timeZone;
		this.parameterBinder = builder.parameterBinder == null ? ParameterBinder.defaultInstance() : builder.parameterBinder;
		this.resultSetMapper = builder.resultSetMapper == null ? ResultSetMapper.defaultInstance() : builder.resultSetMapper;
		this.instanceProvider = builder.instanceProvider == null ? new InstanceProvider() {} : builder.instanceProvider;
		this.parameterStore = new ParameterStore(fieldMapAdapter);
		this.autoClose = builder.autoClose == null ? true : builder.autoClose;
		this.procedureReturnValues = builder.procedureReturnValues == null ? true : builder.procedureReturnValues;
		this.outputParameters = new LinkedHashMap<>();
		this.errorHandlers = new ArrayList<>();
		this.infoHandlers = new ArrayList<>();
		this.connectionStateChangeHandlers = new ArrayList<>();
		this.executionListeners = new ArrayList<>();
		this.logger = Logger.getLogger(getClass().getName());
		this.commandType = CommandType.TEXT;
		this.crudMode = CrudMode.NONE;
		this.executeLargeUpdateSupported = DatabaseOperationSupportStatus.UNKNOWN;

		if (builder.executionListener != null)
			this.executionListeners.add(builder.executionListener);
	}

	/**
	 * Provides a {@link Commandeer} builder for the given {@link DataSource}.
	 *
	 * @param dataSource data source used to open connections
	 * @return a {@link Commandeer} builder
	 */
	@NonNull
	public static Builder withDataSource(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);
		return new Builder(dataSource);
	}

	// Handler registration

	/**
	 * Registers a handler for database errors.
	 * <p>
	 * Once at least one error handler is registered, database errors no longer propagate: each handler is invoked
	 * in registration order and the failed {@code execute*} call returns its default value.
	 *
	 * @param handler the handler to invoke
	 * @return this {@code Commandeer}, for chaining
	 */
	@NonNull
	public Commandeer error(@NonNull CommandeerHandler<SQLException> handler) {
		requireNonNull(handler);
		getErrorHandlers().add(handler);
		return this;
	}

	/**
	 * Registers a handler for informational messages (driver warnings) raised while a command executes.
	 *
	 * @param handler the handler to invoke
	 * @return this {@code Commandeer}, for chaining
	 */
	@NonNull
	public Commandeer info(@NonNull CommandeerHandler<InfoMessage> handler) {
		requireNonNull(handler);
		getInfoHandlers().add(handler);
		return this;
	}

	/**
	 * Registers a handler for connection open/close transitions.
	 *
	 * @param handler the handler to invoke
	 * @return this {@code Commandeer}, for chaining
	 */
	@NonNull
	public Commandeer connectionStateChange(@NonNull CommandeerHandler<ConnectionStateChange> handler) {
		requireNonNull(handler);
		getConnectionStateChangeHandlers().add(handler);
		return this;
	}

	/**
	 * Registers a listener invoked after every execution, successful or not.
	 *
	 * @param executionListener the listener to invoke
	 * @return this {@code Commandeer}, for chaining
	 */
	@NonNull
	public Commandeer executedHandler(@NonNull ExecutionListener executionListener) {
		requireNonNull(executionListener);
		getExecutionListeners().add(executionListener);
		return this;
	}

	/**
	 * Opens the connection if needed and switches it to the given catalog.
	 * <p>
	 * The catalog is remembered and re-applied whenever the connection is reopened.
	 *
	 * @param catalog the catalog (database) name
	 * @return this {@code Commandeer}, for chaining
	 */
	@NonNull
	public Commandeer changeDatabase(@NonNull String catalog) {
		requireNonNull(catalog);

		resetFaultState();
		this.catalog = catalog;

		try {
			openConnection();
			requireNonNull(this.connection).setCatalog(catalog);
		} catch (SQLException e) {
			handleFault(e);
		}

		return this;
	}

	// Parameters

	/**
	 * Adds a named parameter.
	 *
	 * @param name  parameter name, with or without a leading {@code @}
	 * @param value parameter value, may be {@code null}
	 * @return this {@code Commandeer}, for chaining
	 * @throws DuplicateParameterException if the parameter has already been added
	 */
	@NonNull
	public Commandeer addParameter(@NonNull String name,
																 @Nullable Object value) {
		requireNonNull(name);

		getParameterStore().add(name, value);
		regenerateCommandText();
		return this;
	}

	/**
	 * Adds every entry of a {@link Map}, or every component/property of a record or JavaBean, as named parameters.
	 *
	 * @param parameters the parameters to add, or {@code null} for no-op
	 * @return this {@code Commandeer}, for chaining
	 * @throws DuplicateParameterException if any parameter has already been added; parameters before it remain added
	 */
	@NonNull
	public Commandeer addParameters(@Nullable Object parameters) {
		try {
			getParameterStore().addAll(parameters);
		} finally {
			regenerateCommandText();
		}

		return this;
	}

	@NonNull
	public Commandeer removeParameter(@NonNull String name) {
		requireNonNull(name);

		getParameterStore().remove(name);
		regenerateCommandText();
		return this;
	}

	@NonNull
	public Commandeer removeNullParameters() {
		getParameterStore().removeNulls();
		regenerateCommandText();
		return this;
	}

	/**
	 * Removes parameters whose value is the empty string.
	 *
	 * @return this {@code Commandeer}, for chaining
	 */
	@NonNull
	public Commandeer removeBlankParameters() {
		getParameterStore().removeBlanks();
		regenerateCommandText();
		return this;
	}

	@NonNull
	public Commandeer removeNullAndBlankParameters() {
		getParameterStore().removeNullsAndBlanks();
		regenerateCommandText();
		return this;
	}

	/**
	 * Declares a stored-procedure output parameter.
	 * <p>
	 * Output parameters follow the input parameters in the procedure's argument list, in declaration order, and stay
	 * declared for the lifetime of this {@code Commandeer}.
	 *
	 * @param name     parameter name
	 * @param jdbcType the SQL type the procedure produces
	 * @return this {@code Commandeer}, for chaining
	 * @throws DuplicateParameterException if an output parameter with that name is already declared
	 */
	@NonNull
	public Commandeer addOutputParameter(@NonNull String name,
																			 @NonNull JDBCType jdbcType) {
		requireNonNull(name);
		requireNonNull(jdbcType);

		String normalizedName = getParameterStore().getFieldMapAdapter().normalizeName(name);

		if (getOutputParameters().containsKey(normalizedName))
			throw new DuplicateParameterException(normalizedName);

		getOutputParameters().put(normalizedName, new OutputParameter(normalizedName, jdbcType, OutputParameter.Direction.OUTPUT));
		return this;
	}

	/**
	 * Reads an output parameter produced by the most recent stored-procedure execution.
	 *
	 * @param name parameter name
	 * @param type the type to convert the value to
	 * @param <T>  result type token
	 * @return the value, or {@code null} if the procedure produced SQL {@code NULL}
	 * @throws MissingOutputParameterException if no output parameter with that name was declared
	 * @throws IllegalStateException           if no stored-procedure execution has completed yet
	 */
	@Nullable
	public <T> T getOutputParameter(@NonNull String name,
																	@NonNull Class<T> type) {
		requireNonNull(name);
		requireNonNull(type);

		String normalizedName = getParameterStore().getFieldMapAdapter().normalizeName(name);
		OutputParameter outputParameter = getOutputParameters().get(normalizedName);

		if (outputParameter == null)
			throw new MissingOutputParameterException(normalizedName);

		if (!outputParameter.isPopulated())
			throw new IllegalStateException(format("Output parameter '%s' is not available until a stored procedure has been executed",
					normalizedName));

		return getResultSetMapper().convert(createCommandContext(), outputParameter.getValue(), type);
	}

	/**
	 * Reads the return value produced by the most recent stored-procedure execution.
	 *
	 * @param type the type to convert the value to
	 * @param <T>  result type token
	 * @return the return value
	 * @throws NoReturnValueException if the current command is not a stored procedure with a return value
	 * @throws IllegalStateException  if the stored procedure has not been executed yet
	 */
	@Nullable
	public <T> T getReturnValue(@NonNull Class<T> type) {
		requireNonNull(type);

		OutputParameter returnValueParameter = this.returnValueParameter;

		if (returnValueParameter == null)
			throw new NoReturnValueException();

		if (!returnValueParameter.isPopulated())
			throw new IllegalStateException("The return value is not available until the stored procedure has been executed");

		return getResultSetMapper().convert(createCommandContext(), returnValueParameter.getValue(), type);
	}

	/**
	 * Renders the current command the way it would be typed into a console, e.g.
	 * {@code exec update_car @id = 1, @color = red}.
	 *
	 * @return a human-readable description of the current command
	 */
	@NonNull
	public String describeCommand() {
		return CommandAssembler.describe(getCommand());
	}

	// Command setup

	@NonNull
	public Commandeer createProcedureCommand(@NonNull String procedureName) {
		return createProcedureCommand(procedureName, null);
	}

	/**
	 * Replaces the current command with a stored-procedure call.
	 * <p>
	 * Input parameters are passed positionally in the order they were added, followed by declared output parameters.
	 *
	 * @param procedureName the procedure to call
	 * @param parameters    parameters to add ({@link Map}, record or JavaBean), may be {@code null}
	 * @return this {@code Commandeer}, for chaining
	 */
	@NonNull
	public Commandeer createProcedureCommand(@NonNull String procedureName,
																					 @Nullable Object parameters) {
		requireNonNull(procedureName);

		replaceCommand(procedureName, CommandType.STORED_PROCEDURE, CrudMode.NONE);

		if (getProcedureReturnValues())
			this.returnValueParameter = new OutputParameter(RETURN_VALUE_PARAMETER_NAME, JDBCType.INTEGER, OutputParameter.Direction.RETURN_VALUE);

		return addParameters(parameters);
	}

	@NonNull
	public Commandeer createTextCommand(@NonNull String text) {
		return createTextCommand(text, null);
	}

	/**
	 * Replaces the current command with SQL text containing {@code @name} placeholders.
	 *
	 * @param text       the SQL text
	 * @param parameters parameters to add ({@link Map}, record or JavaBean), may be {@code null}
	 * @return this {@code Commandeer}, for chaining
	 */
	@NonNull
	public Commandeer createTextCommand(@NonNull String text,
																			@Nullable Object parameters) {
		requireNonNull(text);

		replaceCommand(text, CommandType.TEXT, CrudMode.NONE);
		return addParameters(parameters);
	}

	/**
	 * Replaces the current command with a read of every row and column of {@code table}.
	 *
	 * @param table the table to read
	 * @return this {@code Commandeer}, for chaining
	 */
	@NonNull
	public Commandeer createTableDirectCommand(@NonNull String table) {
		requireNonNull(table);

		replaceCommand(table, CommandType.TABLE_DIRECT, CrudMode.NONE);
		return this;
	}

	/**
	 * Replaces the current command with an {@code INSERT} whose columns are the current parameters.
	 * <p>
	 * {@code fields} are merged into the parameters: names already present take the new value.  The text is
	 * regenerated whenever parameters are added or removed afterwards.
	 *
	 * @param table  the table to insert into
	 * @param fields column values ({@link Map}, record or JavaBean)
	 * @return this {@code Commandeer}, for chaining
	 */
	@NonNull
	public Commandeer createInsertCommand(@NonNull String table,
																				@NonNull Object fields) {
		requireNonNull(table);
		requireNonNull(fields);

		// Decompose first so a failing getter leaves the current command untouched
		Map<String, Object> fieldMap = getParameterStore().getFieldMapAdapter().toFieldMap(fields);

		this.crudTable = table;
		this.crudWhere = null;
		replaceCommand("", CommandType.TEXT, CrudMode.INSERT);
		getParameterStore().merge(fieldMap);
		regenerateCommandText();

		return this;
	}

	/**
	 * Replaces the current command with an {@code UPDATE} which sets every current parameter.
	 * <p>
	 * {@code fields} are merged into the parameters: names already present take the new value.  The text is
	 * regenerated whenever parameters are added or removed afterwards.
	 *
	 * @param table  the table to update
	 * @param fields column values ({@link Map}, record or JavaBean)
	 * @param where  where-clause body, passed through verbatim; may reference parameters as {@code @name}
	 * @return this {@code Commandeer}, for chaining
	 */
	@NonNull
	public Commandeer createUpdateCommand(@NonNull String table,
																				@NonNull Object fields,
																				@NonNull String where) {
		requireNonNull(table);
		requireNonNull(fields);
		requireNonNull(where);

		Map<String, Object> fieldMap = getParameterStore().getFieldMapAdapter().toFieldMap(fields);

		this.crudTable = table;
		this.crudWhere = where;
		replaceCommand("", CommandType.TEXT, CrudMode.UPDATE);
		getParameterStore().merge(fieldMap);
		regenerateCommandText();

		return this;
	}

	protected void replaceCommand(@NonNull String commandText,
																@NonNull CommandType commandType,
																@NonNull CrudMode crudMode) {
		requireNonNull(commandText);
		requireNonNull(commandType);
		requireNonNull(crudMode);

		this.commandText = commandText;
		this.commandType = commandType;
		this.crudMode = crudMode;
		this.returnValueParameter = null;

		for (OutputParameter outputParameter : getOutputParameters().values())
			outputParameter.reset();
	}

	protected void regenerateCommandText() {
		if (this.crudMode == CrudMode.INSERT)
			this.commandText = CommandAssembler.insertText(requireNonNull(this.crudTable), getParameterStore().names());
		else if (this.crudMode == CrudMode.UPDATE)
			this.commandText = CommandAssembler.updateText(requireNonNull(this.crudTable), getParameterStore().names(),
					requireNonNull(this.crudWhere));
	}

	// Execution

	/**
	 * Executes the command, discarding any results.
	 *
	 * @return this {@code Commandeer}, for chaining
	 */
	@NonNull
	public Commandeer executeNonQuery() {
		this.recordsAffected = execute(true, 0L, (preparedStatement, commandContext) -> executeUpdate(preparedStatement));
		return this;
	}

	/**
	 * Executes the command and returns the number of rows it inserted, updated or deleted.
	 *
	 * @return the number of affected rows, or {@code 0} if the call faulted and the error was handled
	 */
	public int executeRecordsAffected() {
		executeNonQuery();
		return Math.toIntExact(requireNonNull(this.recordsAffected));
	}

	/**
	 * Executes a stored procedure and returns its return value.
	 *
	 * @param type the type to convert the return value to
	 * @param <T>  result type token
	 * @return the return value, or {@code null} if the call faulted and the error was handled
	 * @throws NoReturnValueException if the current command is not a stored procedure with a return value; the
	 *                                command has still been executed
	 */
	@Nullable
	public <T> T executeReturnValue(@NonNull Class<T> type) {
		requireNonNull(type);

		executeNonQuery();

		if (this.returnValueParameter == null)
			throw new NoReturnValueException();

		return isLastCallFaulted() ? null : getReturnValue(type);
	}

	/**
	 * Executes the command and returns the first column of the first row of the first result.
	 *
	 * @param type the type to convert the value to
	 * @param <T>  result type token
	 * @return the value, or {@code null} if there were no rows, the value was SQL {@code NULL} or the call faulted
	 */
	@Nullable
	public <T> T executeScalar(@NonNull Class<T> type) {
		requireNonNull(type);

		return execute(true, null, (preparedStatement, commandContext) -> {
			try (ResultSet resultSet = firstResultSet(preparedStatement)) {
				if (resultSet == null || !resultSet.next())
					return null;

				return getResultSetMapper().mapColumn(commandContext, resultSet, 1, type);
			}
		});
	}

	/**
	 * Replaces the current command with {@code text} and returns its scalar result.
	 *
	 * @param type the type to convert the value to
	 * @param text the SQL text
	 * @param <T>  result type token
	 * @return the value, or {@code null}
	 */
	@Nullable
	public <T> T executeScalar(@NonNull Class<T> type,
														 @NonNull String text) {
		return executeScalar(type, text, null);
	}

	@Nullable
	public <T> T executeScalar(@NonNull Class<T> type,
														 @NonNull String text,
														 @Nullable Object parameters) {
		requireNonNull(type);
		requireNonNull(text);

		createTextCommand(text, parameters);
		return executeScalar(type);
	}

	/**
	 * Executes the command and returns each row as a map of column label to value, in column order.
	 *
	 * @return the rows, or an empty list if the call faulted and the error was handled
	 */
	@NonNull
	public List<Map<String, Object>> executeDictionaries() {
		return executeDictionaries(Object.class, null);
	}

	@NonNull
	public List<Map<String, Object>> executeDictionaries(@Nullable UnaryOperator<String> fieldNameConverter) {
		return executeDictionaries(Object.class, fieldNameConverter);
	}

	@NonNull
	public <V> List<Map<String, V>> executeDictionaries(@NonNull Class<V> valueType) {
		return executeDictionaries(valueType, null);
	}

	/**
	 * Executes the command and returns each row as a map of column label to value, in column order.
	 *
	 * @param valueType          the type to convert every value to
	 * @param fieldNameConverter converts column labels to map keys, e.g. {@link FieldNameConverters#camelCase(String)};
	 *                           {@code null} keeps labels as the driver reports them
	 * @param <V>                value type token
	 * @return the rows, or an empty list if the call faulted and the error was handled
	 */
	@NonNull
	public <V> List<Map<String, V>> executeDictionaries(@NonNull Class<V> valueType,
																											@Nullable UnaryOperator<String> fieldNameConverter) {
		requireNonNull(valueType);

		return transform((resultSet, commandContext) -> {
			ResultSetMetaData resultSetMetaData = resultSet.getMetaData();
			int columnCount = resultSetMetaData.getColumnCount();
			Map<String, V> row = new LinkedHashMap<>(columnCount);

			for (int i = 1; i <= columnCount; ++i) {
				String label = resultSetMetaData.getColumnLabel(i);
				row.put(fieldNameConverter == null ? label : fieldNameConverter.apply(label),
						getResultSetMapper().mapColumn(commandContext, resultSet, i, valueType));
			}

			return row;
		});
	}

	/**
	 * Executes the command and builds a map from the first column to the second column of each row.
	 *
	 * @param keyType   key type
	 * @param valueType value type
	 * @param <K>       key type token
	 * @param <V>       value type token
	 * @return the map in row order, or an empty map if the call faulted and the error was handled
	 * @throws DuplicateKeyException if a key appears in more than one row
	 */
	@NonNull
	public <K, V> Map<K, V> executeVerticalDictionary(@NonNull Class<K> keyType,
																										@NonNull Class<V> valueType) {
		return executeVerticalDictionary(keyType, valueType, 0, 1);
	}

	/**
	 * Executes the command and builds a map from one column to another of each row.
	 *
	 * @param keyType     key type
	 * @param valueType   value type
	 * @param keyColumn   zero-based index of the key column
	 * @param valueColumn zero-based index of the value column
	 * @param <K>         key type token
	 * @param <V>         value type token
	 * @return the map in row order, or an empty map if the call faulted and the error was handled
	 * @throws DuplicateKeyException if a key appears in more than one row
	 */
	@NonNull
	public <K, V> Map<K, V> executeVerticalDictionary(@NonNull Class<K> keyType,
																										@NonNull Class<V> valueType,
																										int keyColumn,
																										int valueColumn) {
		requireNonNull(keyType);
		requireNonNull(valueType);

		return verticalDictionary(keyType, valueType, resultSet -> keyColumn + 1, resultSet -> valueColumn + 1);
	}

	@NonNull
	public <K, V> Map<K, V> executeVerticalDictionary(@NonNull Class<K> keyType,
																										@NonNull Class<V> valueType,
																										@NonNull String keyColumn,
																										@NonNull String valueColumn) {
		requireNonNull(keyType);
		requireNonNull(valueType);
		requireNonNull(keyColumn);
		requireNonNull(valueColumn);

		return verticalDictionary(keyType, valueType, resultSet -> resultSet.findColumn(keyColumn),
				resultSet -> resultSet.findColumn(valueColumn));
	}

	@NonNull
	private <K, V> Map<K, V> verticalDictionary(@NonNull Class<K> keyType,
																						 @NonNull Class<V> valueType,
																						 @NonNull ColumnLocator keyColumnLocator,
																						 @NonNull ColumnLocator valueColumnLocator) {
		return execute(true, new LinkedHashMap<>(), (preparedStatement, commandContext) -> {
			Map<K, V> dictionary = new LinkedHashMap<>();

			try (ResultSet resultSet = firstResultSet(preparedStatement)) {
				if (resultSet == null)
					return dictionary;

				while (resultSet.next()) {
					K key = getResultSetMapper().mapColumn(commandContext, resultSet, keyColumnLocator.locate(resultSet), keyType);

					if (dictionary.containsKey(key))
						throw new DuplicateKeyException(key);

					dictionary.put(key, getResultSetMapper().mapColumn(commandContext, resultSet, valueColumnLocator.locate(resultSet), valueType));
				}
			}

			return dictionary;
		});
	}

	/**
	 * Executes the command and groups the first column of each row by itself.
	 * <p>
	 * Usually one of the column-specifying overloads is what you want.
	 *
	 * @param keyType   key type
	 * @param valueType value type
	 * @param <K>       key type token
	 * @param <V>       value type token
	 * @return values grouped by key, in row order
	 */
	@NonNull
	public <K, V> Map<K, List<V>> executeVerticalLookup(@NonNull Class<K> keyType,
																											@NonNull Class<V> valueType) {
		return executeVerticalLookup(keyType, valueType, 0, 0);
	}

	/**
	 * Executes the command and groups one column's values by another column, allowing repeated keys.
	 *
	 * @param keyType     key type
	 * @param valueType   value type
	 * @param keyColumn   zero-based index of the key column
	 * @param valueColumn zero-based index of the value column
	 * @param <K>         key type token
	 * @param <V>         value type token
	 * @return values grouped by key, keys and values in row order
	 */
	@NonNull
	public <K, V> Map<K, List<V>> executeVerticalLookup(@NonNull Class<K> keyType,
																											@NonNull Class<V> valueType,
																											int keyColumn,
																											int valueColumn) {
		requireNonNull(keyType);
		requireNonNull(valueType);

		return verticalLookup(keyType, valueType, resultSet -> keyColumn + 1, resultSet -> valueColumn + 1);
	}

	@NonNull
	public <K, V> Map<K, List<V>> executeVerticalLookup(@NonNull Class<K> keyType,
																											@NonNull Class<V> valueType,
																											@NonNull String keyColumn,
																											@NonNull String valueColumn) {
		requireNonNull(keyType);
		requireNonNull(valueType);
		requireNonNull(keyColumn);
		requireNonNull(valueColumn);

		return verticalLookup(keyType, valueType, resultSet -> resultSet.findColumn(keyColumn),
				resultSet -> resultSet.findColumn(valueColumn));
	}

	@NonNull
	private <K, V> Map<K, List<V>> verticalLookup(@NonNull Class<K> keyType,
																							 @NonNull Class<V> valueType,
																							 @NonNull ColumnLocator keyColumnLocator,
																							 @NonNull ColumnLocator valueColumnLocator) {
		return execute(true, new LinkedHashMap<>(), (preparedStatement, commandContext) -> {
			Map<K, List<V>> lookup = new LinkedHashMap<>();

			try (ResultSet resultSet = firstResultSet(preparedStatement)) {
				if (resultSet == null)
					return lookup;

				while (resultSet.next()) {
					K key = getResultSetMapper().mapColumn(commandContext, resultSet, keyColumnLocator.locate(resultSet), keyType);
					V value = getResultSetMapper().mapColumn(commandContext, resultSet, valueColumnLocator.locate(resultSet), valueType);
					lookup.computeIfAbsent(key, ignored -> new ArrayList<>()).add(value);
				}
			}

			return lookup;
		});
	}

	/**
	 * Executes the command and returns the first column of every row.
	 *
	 * @param type the element type
	 * @param <T>  element type token
	 * @return a fixed-size list of values, or an empty list if the call faulted and the error was handled
	 */
	@NonNull
	public <T> List<T> executeArray(@NonNull Class<T> type) {
		return executeArray(type, 0);
	}

	/**
	 * @param type   the element type
	 * @param column zero-based column index
	 * @param <T>    element type token
	 * @return a fixed-size list of values
	 */
	@NonNull
	public <T> List<T> executeArray(@NonNull Class<T> type,
																	int column) {
		requireNonNull(type);
		return toFixedSizeList(transform((resultSet, commandContext) ->
				getResultSetMapper().mapColumn(commandContext, resultSet, column + 1, type)));
	}

	@NonNull
	public <T> List<T> executeArray(@NonNull Class<T> type,
																	@NonNull String column) {
		requireNonNull(type);
		requireNonNull(column);

		return toFixedSizeList(transform((resultSet, commandContext) ->
				getResultSetMapper().mapColumn(commandContext, resultSet, resultSet.findColumn(column), type)));
	}

	@SuppressWarnings("unchecked")
	@NonNull
	private <T> List<T> toFixedSizeList(@NonNull List<T> values) {
		return (List<T>) Arrays.asList(values.toArray());
	}

	/**
	 * Executes the command and converts every row of the first result.
	 * <p>
	 * The cursor is closed before this method returns, whether or not conversion succeeds.
	 *
	 * @param rowConverter converts the current row; must not advance the cursor
	 * @param <T>          row type token
	 * @return converted rows, or an empty list if the call faulted and the error was handled
	 */
	@NonNull
	public <T> List<T> executeAndTransform(@NonNull RowConverter<T> rowConverter) {
		requireNonNull(rowConverter);
		return transform((resultSet, commandContext) -> rowConverter.convert(resultSet));
	}

	/**
	 * Executes the command and maps every row onto {@code type} by matching column labels to record components or
	 * JavaBean properties ({@code first_name} matches {@code firstName}; see also {@link DatabaseColumn}).
	 *
	 * @param type a record, JavaBean or standard single-column type
	 * @param <T>  row type token
	 * @return mapped rows, or an empty list if the call faulted and the error was handled
	 */
	@NonNull
	public <T> List<T> executeAndAutoMap(@NonNull Class<T> type) {
		requireNonNull(type);
		return transform((resultSet, commandContext) ->
				getResultSetMapper().mapRow(commandContext, resultSet, type, getInstanceProvider()));
	}

	@NonNull
	private <T> List<T> transform(@NonNull ContextualRowConverter<T> rowConverter) {
		requireNonNull(rowConverter);

		return execute(true, new ArrayList<>(), (preparedStatement, commandContext) -> {
			List<T> rows = new ArrayList<>();

			try (ResultSet resultSet = firstResultSet(preparedStatement)) {
				if (resultSet == null)
					return rows;

				while (resultSet.next())
					rows.add(rowConverter.convert(resultSet, commandContext));
			}

			return rows;
		});
	}

	/**
	 * Executes an insert and returns the identity value it generated.
	 * <p>
	 * Where the database has an identity query (see {@link DatabaseType#getIdentityClause()}), it is appended to the
	 * command text and the result read as a scalar.  Otherwise JDBC generated keys are used and the text is untouched.
	 *
	 * @param type the identity type
	 * @param <T>  identity type token
	 * @return the generated identity, or {@code null} if none was generated or the call faulted
	 */
	@Nullable
	public <T> T executeScopeIdentity(@NonNull Class<T> type) {
		requireNonNull(type);

		return execute(new Execution<T>(true, null) {
			private boolean generatedKeys;

			@Override
			protected void beforePrepare(@NonNull DatabaseType databaseType) {
				Optional<String> identityClause = databaseType.getIdentityClause();

				if (identityClause.isPresent())
					commandText = requireNonNull(commandText) + identityClause.get();
				else
					this.generatedKeys = commandType == CommandType.TEXT;
			}

			@Override
			@NonNull
			protected PreparedStatement prepare(@NonNull Connection connection,
																					@NonNull String jdbcSql) throws SQLException {
				if (this.generatedKeys)
					return connection.prepareStatement(jdbcSql, Statement.RETURN_GENERATED_KEYS);

				return super.prepare(connection, jdbcSql);
			}

			@Override
			@Nullable
			protected T perform(@NonNull PreparedStatement preparedStatement,
													@NonNull CommandContext commandContext) throws SQLException {
				if (this.generatedKeys) {
					preparedStatement.executeUpdate();

					try (ResultSet resultSet = preparedStatement.getGeneratedKeys()) {
						if (resultSet == null || !resultSet.next())
							return null;

						return getResultSetMapper().mapColumn(commandContext, resultSet, 1, type);
					}
				}

				try (ResultSet resultSet = firstResultSet(preparedStatement)) {
					if (resultSet == null || !resultSet.next())
						return null;

					return getResultSetMapper().mapColumn(commandContext, resultSet, 1, type);
				}
			}
		});
	}

	/**
	 * Streams one binary column of the first row to {@code outputStream} using a
	 * {@value #DEFAULT_BINARY_STREAM_BUFFER_SIZE}-byte buffer.
	 *
	 * @param column       the binary column's label
	 * @param outputStream where to copy the bytes; not closed by this method
	 * @return the number of bytes copied
	 */
	public long executeBinaryStream(@NonNull String column,
																	@NonNull OutputStream outputStream) {
		return executeBinaryStream(column, outputStream, DEFAULT_BINARY_STREAM_BUFFER_SIZE);
	}

	/**
	 * Streams one binary column of the first row to {@code outputStream}, {@code bufferSize} bytes at a time.
	 * <p>
	 * The value is never held in memory as a whole.  The cursor is closed before this method returns, but the
	 * connection is left open regardless of {@link #isAutoClose()}; call {@link #close()} when done.
	 *
	 * @param column       the binary column's label
	 * @param outputStream where to copy the bytes; not closed by this method
	 * @param bufferSize   chunk size in bytes
	 * @return the number of bytes copied, {@code 0} if there was no row, the value was SQL {@code NULL} or the call faulted
	 * @throws UncheckedIOException if writing to {@code outputStream} fails
	 */
	public long executeBinaryStream(@NonNull String column,
																	@NonNull OutputStream outputStream,
																	int bufferSize) {
		requireNonNull(column);
		requireNonNull(outputStream);

		if (bufferSize <= 0)
			throw new IllegalArgumentException("Buffer size must be > 0");

		Long bytesCopied = execute(new Execution<Long>(false, 0L) {
			@Override
			@NonNull
			protected PreparedStatement prepare(@NonNull Connection connection,
																					@NonNull String jdbcSql) throws SQLException {
				PreparedStatement preparedStatement = commandType == CommandType.STORED_PROCEDURE
						? connection.prepareCall(jdbcSql, ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY)
						: connection.prepareStatement(jdbcSql, ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);

				preparedStatement.setFetchSize(1);
				return preparedStatement;
			}

			@Override
			@NonNull
			protected Long perform(@NonNull PreparedStatement preparedStatement,
														 @NonNull CommandContext commandContext) throws SQLException {
				try (ResultSet resultSet = firstResultSet(preparedStatement)) {
					if (resultSet == null || !resultSet.next())
						return 0L;

					int columnIndex = resultSet.findColumn(column);

					try (InputStream inputStream = resultSet.getBinaryStream(columnIndex)) {
						if (inputStream == null)
							return 0L;

						byte[] buffer = new byte[bufferSize];
						long totalBytesCopied = 0;
						int bytesRead;

						while ((bytesRead = inputStream.readNBytes(buffer, 0, bufferSize)) > 0) {
							outputStream.write(buffer, 0, bytesRead);
							totalBytesCopied += bytesRead;
						}

						return totalBytesCopied;
					} catch (IOException e) {
						throw new UncheckedIOException(format("Unable to stream column '%s'", column), e);
					}
				}
			}
		});

		return bytesCopied == null ? 0L : bytesCopied;
	}

	// Pipeline

	@Nullable
	private <T> T execute(boolean dataReadComplete,
												@Nullable T defaultValue,
												@NonNull StatementOperation<T> statementOperation) {
		requireNonNull(statementOperation);

		return execute(new Execution<T>(dataReadComplete, defaultValue) {
			@Override
			@Nullable
			protected T perform(@NonNull PreparedStatement preparedStatement,
													@NonNull CommandContext commandContext) throws SQLException {
				return statementOperation.perform(preparedStatement, commandContext);
			}
		});
	}

	@Nullable
	private <T> T execute(@NonNull Execution<T> execution) {
		requireNonNull(execution);

		if (this.commandText == null)
			throw new IllegalStateException("No command has been created. Use one of the create*Command methods first");

		resetFaultState();

		for (OutputParameter outputParameter : getOutputParameters().values())
			outputParameter.reset();

		if (this.returnValueParameter != null)
			this.returnValueParameter.reset();

		CommandDescriptor command = getCommand();
		String jdbcSql = null;
		Duration connectionAcquisitionDuration = null;
		Long executionStartTime = null;
		SQLException fault = null;

		Throwable primaryFailure = null;

		try {
			try {
				if (this.connection == null) {
					long connectionAcquisitionStartTime = nanoTime();
					openConnection();
					connectionAcquisitionDuration = Duration.ofNanos(nanoTime() - connectionAcquisitionStartTime);
				}

				execution.beforePrepare(getDatabaseType().orElse(DatabaseType.GENERIC));
				command = getCommand();

				CommandContext commandContext = createCommandContext(command);
				NamedParameterSql namedParameterSql = null;

				if (command.getCommandType() == CommandType.TEXT) {
					namedParameterSql = NamedParameterSql.parse(command.getText());
					jdbcSql = namedParameterSql.getJdbcSql();
				} else if (command.getCommandType() == CommandType.TABLE_DIRECT) {
					jdbcSql = CommandAssembler.tableDirectText(command.getText());
				} else {
					jdbcSql = CommandAssembler.procedureCallText(command.getText(),
							command.getParameters().size() + command.getOutputParameters().size(), command.hasReturnValue());
				}

				try (PreparedStatement preparedStatement = execution.prepare(requireNonNull(this.connection), jdbcSql)) {
					if (namedParameterSql != null)
						bindNamedParameters(commandContext, preparedStatement, namedParameterSql);
					else if (command.getCommandType() == CommandType.STORED_PROCEDURE)
						bindProcedureParameters(commandContext, (CallableStatement) preparedStatement);

					executionStartTime = nanoTime();
					T result;

					// Warnings raised before a fault are still delivered
					try {
						result = execution.perform(preparedStatement, commandContext);
					} finally {
						dispatchWarnings(preparedStatement.getWarnings());
					}

					if (command.getCommandType() == CommandType.STORED_PROCEDURE)
						readProcedureOutputs((CallableStatement) preparedStatement);

					return result;
				}
			} catch (SQLException e) {
				fault = e;
				handleFault(e);
				return execution.getDefaultValue();
			}
		} catch (RuntimeException | Error e) {
			primaryFailure = e;
			throw e;
		} finally {
			Duration executionDuration = executionStartTime == null ? Duration.ZERO : Duration.ofNanos(nanoTime() - executionStartTime);
			this.lastElapsed = executionDuration;
			++this.commandExecutionCount;

			ExecutionLog executionLog = ExecutionLog.withCommand(command, this.commandExecutionCount)
					.jdbcSql(jdbcSql)
					.connectionAcquisitionDuration(connectionAcquisitionDuration)
					.executionDuration(executionDuration)
					.exception(fault)
					.build();

			try {
				for (ExecutionListener executionListener : new ArrayList<>(getExecutionListeners()))
					executionListener.executed(this, executionLog);
			} catch (RuntimeException e) {
				// A listener failure must not mask the failure that ended the execution
				if (primaryFailure == null)
					throw e;

				primaryFailure.addSuppressed(e);
			} finally {
				if (execution.isDataReadComplete())
					onDataRead();
			}
		}
	}

	protected void bindNamedParameters(@NonNull CommandContext commandContext,
																		 @NonNull PreparedStatement preparedStatement,
																		 @NonNull NamedParameterSql namedParameterSql) throws SQLException {
		requireNonNull(commandContext);
		requireNonNull(preparedStatement);
		requireNonNull(namedParameterSql);

		int parameterIndex = 1;

		for (String parameterName : namedParameterSql.getParameterNames())
			getParameterBinder().bindParameter(commandContext, preparedStatement, parameterIndex++, getParameterStore().get(parameterName));
	}

	protected void bindProcedureParameters(@NonNull CommandContext commandContext,
																				 @NonNull CallableStatement callableStatement) throws SQLException {
		requireNonNull(commandContext);
		requireNonNull(callableStatement);

		int parameterIndex = 1;

		if (this.returnValueParameter != null)
			callableStatement.registerOutParameter(parameterIndex++, this.returnValueParameter.getJdbcType().getVendorTypeNumber());

		for (Object value : commandContext.getCommand().getParameters().values())
			getParameterBinder().bindParameter(commandContext, callableStatement, parameterIndex++, value);

		for (OutputParameter outputParameter : getOutputParameters().values())
			callableStatement.registerOutParameter(parameterIndex++, outputParameter.getJdbcType().getVendorTypeNumber());
	}

	protected void readProcedureOutputs(@NonNull CallableStatement callableStatement) throws SQLException {
		requireNonNull(callableStatement);

		int parameterIndex = 1;

		if (this.returnValueParameter != null)
			this.returnValueParameter.populate(callableStatement.getObject(parameterIndex++));

		parameterIndex += getParameterStore().size();

		for (OutputParameter outputParameter : getOutputParameters().values())
			outputParameter.populate(callableStatement.getObject(parameterIndex++));
	}

	protected void dispatchWarnings(@Nullable SQLWarning warning) {
		for (SQLWarning currentWarning = warning; currentWarning != null; currentWarning = currentWarning.getNextWarning()) {
			InfoMessage infoMessage = new InfoMessage(currentWarning);

			for (CommandeerHandler<InfoMessage> infoHandler : new ArrayList<>(getInfoHandlers()))
				infoHandler.handle(this, infoMessage);
		}
	}

	/**
	 * Finds the first result set a statement produced, skipping over update counts.
	 */
	@Nullable
	protected ResultSet firstResultSet(@NonNull PreparedStatement preparedStatement) throws SQLException {
		requireNonNull(preparedStatement);

		boolean hasResultSet = preparedStatement.execute();

		while (!hasResultSet && preparedStatement.getUpdateCount() != -1)
			hasResultSet = preparedStatement.getMoreResults();

		return hasResultSet ? preparedStatement.getResultSet() : null;
	}

	@NonNull
	protected Long executeUpdate(@NonNull PreparedStatement preparedStatement) throws SQLException {
		requireNonNull(preparedStatement);

		if (preparedStatement instanceof CallableStatement) {
			preparedStatement.execute();
			return (long) Math.max(preparedStatement.getUpdateCount(), 0);
		}

		// Use the appropriate "large" value if we know it.
		// If we don't know it, detect it and store it.
		if (this.executeLargeUpdateSupported == DatabaseOperationSupportStatus.YES)
			return preparedStatement.executeLargeUpdate();

		if (this.executeLargeUpdateSupported == DatabaseOperationSupportStatus.NO)
			return (long) preparedStatement.executeUpdate();

		try {
			long updateCount = preparedStatement.executeLargeUpdate();
			this.executeLargeUpdateSupported = DatabaseOperationSupportStatus.YES;
			return updateCount;
		} catch (SQLFeatureNotSupportedException | UnsupportedOperationException | AbstractMethodError e) {
			this.executeLargeUpdateSupported = DatabaseOperationSupportStatus.NO;
			return (long) preparedStatement.executeUpdate();
		}
	}

	protected void handleFault(@NonNull SQLException e) {
		requireNonNull(e);

		if (getErrorHandlers().size() == 0)
			throw new DatabaseExecutionException(this.commandText == null ? "[no command]" : describeCommand(), e);

		this.lastCallFaulted = true;
		this.lastFault = e;

		getLogger().log(FINE, format("Passing database error to %d handler[s]: %s", getErrorHandlers().size(), e.getMessage()));

		for (CommandeerHandler<SQLException> errorHandler : new ArrayList<>(getErrorHandlers()))
			errorHandler.handle(this, e);
	}

	protected void resetFaultState() {
		this.lastCallFaulted = false;
		this.lastFault = null;
	}

	// Connection lifecycle

	protected void openConnection() throws SQLException {
		if (this.connection != null)
			return;

		Connection connection = getDataSource().getConnection();
		this.connection = connection;

		getLogger().log(FINE, "Opened connection");
		fireConnectionStateChange(ConnectionState.CLOSED, ConnectionState.OPEN);

		if (this.databaseType == null)
			this.databaseType = DatabaseType.fromConnection(connection);

		if (this.catalog != null)
			connection.setCatalog(this.catalog);
	}

	protected void closeConnection() {
		Connection connection = this.connection;

		if (connection == null)
			return;

		this.connection = null;

		try {
			connection.close();
			getLogger().log(FINE, "Closed connection");
		} catch (SQLException e) {
			getLogger().log(WARNING, "Unable to close connection", e);
		}

		fireConnectionStateChange(ConnectionState.OPEN, ConnectionState.CLOSED);
	}

	/**
	 * Closes the connection once a read has been fully consumed, if auto-close is enabled.
	 */
	protected void onDataRead() {
		if (isAutoClose() && getConnectionState() == ConnectionState.OPEN)
			closeConnection();
	}

	protected void fireConnectionStateChange(@NonNull ConnectionState originalState,
																					 @NonNull ConnectionState currentState) {
		requireNonNull(originalState);
		requireNonNull(currentState);

		ConnectionStateChange connectionStateChange = new ConnectionStateChange(originalState, currentState);

		for (CommandeerHandler<ConnectionStateChange> connectionStateChangeHandler : new ArrayList<>(getConnectionStateChangeHandlers()))
			connectionStateChangeHandler.handle(this, connectionStateChange);
	}

	/**
	 * Closes the connection, if open.  This {@code Commandeer} may still be used afterwards; the next execution
	 * reopens it.
	 */
	@Override
	public void close() {
		closeConnection();
	}

	/**
	 * A handler-friendly error message including the procedure name and its parameters, for example
	 * {@code Error executing procedure update_car (@id = 1, @color = red): ...}.
	 *
	 * @param commandeer the executor whose command failed
	 * @param e          the failure
	 * @return the formatted message
	 */
	@NonNull
	public static String formatProcedureError(@NonNull Commandeer commandeer,
																						@NonNull SQLException e) {
		requireNonNull(commandeer);
		requireNonNull(e);

		CommandDescriptor command = commandeer.getCommand();
		List<String> arguments = new ArrayList<>(command.getParameters().size());

		for (Map.Entry<String, Object> entry : command.getParameters().entrySet())
			arguments.add(format("@%s = %s", entry.getKey(), entry.getValue()));

		return format("Error executing procedure %s (%s): %s", command.getText(), String.join(", ", arguments), e.getMessage());
	}

	// Accessors

	/**
	 * @return a snapshot of the current command
	 * @throws IllegalStateException if no command has been created
	 */
	@NonNull
	public CommandDescriptor getCommand() {
		if (this.commandText == null)
			throw new IllegalStateException("No command has been created. Use one of the create*Command methods first");

		return new CommandDescriptor(this.commandText, this.commandType, getParameterStore().snapshot(),
				new ArrayList<>(getOutputParameters().values()), this.returnValueParameter != null);
	}

	@NonNull
	public CrudMode getCrudMode() {
		return this.crudMode;
	}

	/**
	 * @return the number of executions performed, successful or not
	 */
	@NonNull
	public Long getCommandExecutionCount() {
		return this.commandExecutionCount;
	}

	/**
	 * @return rows affected by the most recent {@link #executeNonQuery()} or {@link #executeRecordsAffected()}, if any
	 */
	@NonNull
	public Optional<Long> getRecordsAffected() {
		return Optional.ofNullable(this.recordsAffected);
	}

	/**
	 * @return time spent executing and reading the most recent command, if any
	 */
	@NonNull
	public Optional<Duration> getLastElapsed() {
		return Optional.ofNullable(this.lastElapsed);
	}

	/**
	 * Whether the most recent call failed with a database error that error handlers swallowed.
	 *
	 * @return {@code true} if the most recent call's error was handled and a default value returned
	 */
	public boolean isLastCallFaulted() {
		return this.lastCallFaulted;
	}

	@NonNull
	public Optional<SQLException> getLastFault() {
		return Optional.ofNullable(this.lastFault);
	}

	@NonNull
	public ConnectionState getConnectionState() {
		return this.connection == null ? ConnectionState.CLOSED : ConnectionState.OPEN;
	}

	/**
	 * @return the configured or detected database type; empty until the first connection is opened if not configured
	 */
	@NonNull
	public Optional<DatabaseType> getDatabaseType() {
		return Optional.ofNullable(this.databaseType);
	}

	@NonNull
	public Boolean isAutoClose() {
		return this.autoClose;
	}

	@NonNull
	protected CommandContext createCommandContext() {
		return createCommandContext(getCommand());
	}

	@NonNull
	protected CommandContext createCommandContext(@NonNull CommandDescriptor command) {
		requireNonNull(command);
		return new CommandContext(command, getDatabaseType().orElse(DatabaseType.GENERIC), getTimeZone());
	}

	@NonNull
	protected DataSource getDataSource() {
		return this.dataSource;
	}

	@NonNull
	protected ZoneId getTimeZone() {
		return this.timeZone;
	}

	@NonNull
	protected ParameterBinder getParameterBinder() {
		return this.parameterBinder;
	}

	@NonNull
	protected ResultSetMapper getResultSetMapper() {
		return this.resultSetMapper;
	}

	@NonNull
	protected InstanceProvider getInstanceProvider() {
		return this.instanceProvider;
	}

	@NonNull
	protected ParameterStore getParameterStore() {
		return this.parameterStore;
	}

	@NonNull
	protected Boolean getProcedureReturnValues() {
		return this.procedureReturnValues;
	}

	@NonNull
	protected Map<String, OutputParameter> getOutputParameters() {
		return this.outputParameters;
	}

	@NonNull
	protected List<CommandeerHandler<SQLException>> getErrorHandlers() {
		return this.errorHandlers;
	}

	@NonNull
	protected List<CommandeerHandler<InfoMessage>> getInfoHandlers() {
		return this.infoHandlers;
	}

	@NonNull
	protected List<CommandeerHandler<ConnectionStateChange>> getConnectionStateChangeHandlers() {
		return this.connectionStateChangeHandlers;
	}

	@NonNull
	protected List<ExecutionListener> getExecutionListeners() {
		return this.executionListeners;
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	/**
	 * One pass through the execution pipeline: how to prepare the statement and what to do with it.
	 */
	private abstract class Execution<T> {
		private final boolean dataReadComplete;
		@Nullable
		private final T defaultValue;

		protected Execution(boolean dataReadComplete,
												@Nullable T defaultValue) {
			this.dataReadComplete = dataReadComplete;
			this.defaultValue = defaultValue;
		}

		/**
		 * Called once the connection is open and the database type is known, before the command is snapshotted.
		 */
		protected void beforePrepare(@NonNull DatabaseType databaseType) {
			// No-op by default
		}

		@NonNull
		protected PreparedStatement prepare(@NonNull Connection connection,
																				@NonNull String jdbcSql) throws SQLException {
			if (commandType == CommandType.STORED_PROCEDURE)
				return connection.prepareCall(jdbcSql);

			return connection.prepareStatement(jdbcSql);
		}

		@Nullable
		protected abstract T perform(@NonNull PreparedStatement preparedStatement,
																 @NonNull CommandContext commandContext) throws SQLException;

		protected boolean isDataReadComplete() {
			return this.dataReadComplete;
		}

		@Nullable
		protected T getDefaultValue() {
			return this.defaultValue;
		}
	}

	@FunctionalInterface
	private interface StatementOperation<T> {
		@Nullable
		T perform(@NonNull PreparedStatement preparedStatement,
							@NonNull CommandContext commandContext) throws SQLException;
	}

	@FunctionalInterface
	private interface ContextualRowConverter<T> {
		@Nullable
		T convert(@NonNull ResultSet resultSet,
							@NonNull CommandContext commandContext) throws SQLException;
	}

	@FunctionalInterface
	private interface ColumnLocator {
		int locate(@NonNull ResultSet resultSet) throws SQLException;
	}

	enum DatabaseOperationSupportStatus {
		UNKNOWN,
		YES,
		NO
	}

	/**
	 * Builder used to construct instances of {@link Commandeer}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final DataSource dataSource;
		@Nullable
		private DatabaseType databaseType;
		@Nullable
		private ZoneId timeZone;
		@Nullable
		private Boolean autoClose;
		@Nullable
		private Boolean procedureReturnValues;
		@Nullable
		private ParameterBinder parameterBinder;
		@Nullable
		private ResultSetMapper resultSetMapper;
		@Nullable
		private FieldMapAdapter fieldMapAdapter;
		@Nullable
		private InstanceProvider instanceProvider;
		@Nullable
		private ExecutionListener executionListener;

		private Builder(@NonNull DataSource dataSource) {
			this.dataSource = requireNonNull(dataSource);
		}

		/**
		 * Overrides automatic database type detection.
		 *
		 * @param databaseType the database type to use (null to detect from connection metadata on first open)
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder databaseType(@Nullable DatabaseType databaseType) {
			this.databaseType = databaseType;
			return this;
		}

		@NonNull
		public Builder timeZone(@Nullable ZoneId timeZone) {
			this.timeZone = timeZone;
			return this;
		}

		/**
		 * Whether to close the connection once each read has been fully consumed.  Defaults to {@code true}.
		 *
		 * @param autoClose whether to auto-close
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder autoClose(@Nullable Boolean autoClose) {
			this.autoClose = autoClose;
			return this;
		}

		/**
		 * Whether stored-procedure calls take a leading {@code ? =} return-value slot.  Defaults to {@code true}.
		 * <p>
		 * Disable for databases whose procedures cannot return values, such as HSQLDB or PostgreSQL procedures.
		 *
		 * @param procedureReturnValues whether to allocate return-value parameters
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder procedureReturnValues(@Nullable Boolean procedureReturnValues) {
			this.procedureReturnValues = procedureReturnValues;
			return this;
		}

		@NonNull
		public Builder parameterBinder(@Nullable ParameterBinder parameterBinder) {
			this.parameterBinder = parameterBinder;
			return this;
		}

		@NonNull
		public Builder resultSetMapper(@Nullable ResultSetMapper resultSetMapper) {
			this.resultSetMapper = resultSetMapper;
			return this;
		}

		@NonNull
		public Builder fieldMapAdapter(@Nullable FieldMapAdapter fieldMapAdapter) {
			this.fieldMapAdapter = fieldMapAdapter;
			return this;
		}

		@NonNull
		public Builder instanceProvider(@Nullable InstanceProvider instanceProvider) {
			this.instanceProvider = instanceProvider;
			return this;
		}

		/**
		 * Registers a listener invoked after every execution, ahead of any added via
		 * {@link Commandeer#executedHandler(ExecutionListener)}.  For example, {@link DefaultExecutionLogger}.
		 *
		 * @param executionListener the listener
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder executionListener(@Nullable ExecutionListener executionListener) {
			this.executionListener = executionListener;
			return this;
		}

		@NonNull
		public Commandeer build() {
			return new Commandeer(this);
		}
	}
}
