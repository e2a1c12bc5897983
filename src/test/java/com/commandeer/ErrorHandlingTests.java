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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.io.ByteArrayOutputStream;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static com.commandeer.JdbcProxies.createInMemoryDataSource;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class ErrorHandlingTests {
	public record Widget(Long widgetId, String name) {}

	@Test
	public void testErrorsThrownWithoutHandlers() {
		try (Commandeer commandeer = Commandeer.withDataSource(createInMemoryDataSource("testErrorsThrownWithoutHandlers")).build()) {
			DatabaseExecutionException e = Assertions.assertThrows(DatabaseExecutionException.class, () ->
					commandeer.createTextCommand("select * from missing_table").executeAndAutoMap(Widget.class));

			Assertions.assertEquals("select * from missing_table", e.getCommandDescription());
			Assertions.assertNotNull(e.getCause());
			Assertions.assertFalse(commandeer.isLastCallFaulted());
			Assertions.assertEquals(1L, commandeer.getCommandExecutionCount());
			Assertions.assertEquals(ConnectionState.CLOSED, commandeer.getConnectionState());
		}
	}

	@Test
	public void testErrorsSuppressedWithHandlers() {
		List<String> handlerInvocations = new ArrayList<>();
		CommandeerHandler<SQLException> errorHandler = (source, e) -> handlerInvocations.add(e.getSQLState());

		try (Commandeer commandeer = Commandeer.withDataSource(createInMemoryDataSource("testErrorsSuppressedWithHandlers")).build()) {
			// Registering the same handler twice means it is invoked twice
			commandeer.error(errorHandler).error(errorHandler);

			List<Widget> widgets = commandeer.createTextCommand("select * from missing_table").executeAndAutoMap(Widget.class);

			Assertions.assertEquals(List.of(), widgets);
			Assertions.assertTrue(commandeer.isLastCallFaulted());
			Assertions.assertTrue(commandeer.getLastFault().isPresent());
			Assertions.assertEquals(2, handlerInvocations.size());

			Assertions.assertNull(commandeer.executeScalar(Long.class));
			Assertions.assertEquals(Map.of(), commandeer.executeVerticalDictionary(Long.class, String.class));
			Assertions.assertEquals(Map.of(), commandeer.executeVerticalLookup(Long.class, String.class));
			Assertions.assertEquals(List.of(), commandeer.executeArray(String.class));
			Assertions.assertEquals(List.of(), commandeer.executeDictionaries());
			Assertions.assertEquals(0L, commandeer.executeBinaryStream("name", new ByteArrayOutputStream()));
			Assertions.assertEquals(0, commandeer.executeRecordsAffected());
			Assertions.assertEquals(Optional.of(0L), commandeer.getRecordsAffected());
			Assertions.assertEquals(8L, commandeer.getCommandExecutionCount());

			// A successful call clears the fault
			Assertions.assertEquals(1L, commandeer.executeScalar(Long.class, "select count(*) from information_schema.schemata where schema_name = 'PUBLIC'"));
			Assertions.assertFalse(commandeer.isLastCallFaulted());
			Assertions.assertEquals(Optional.empty(), commandeer.getLastFault());
		}
	}

	@Test
	public void testOpenFailureThrownWithoutHandlers() {
		AtomicInteger connectionAttempts = new AtomicInteger();
		DataSource dataSource = JdbcProxies.failingDataSource("database is down", connectionAttempts);

		try (Commandeer commandeer = Commandeer.withDataSource(dataSource).build()) {
			DatabaseExecutionException e = Assertions.assertThrows(DatabaseExecutionException.class, () ->
					commandeer.executeScalar(Long.class, "select 1 from widget"));

			Assertions.assertEquals("database is down", e.getCause().getMessage());
			Assertions.assertEquals(Optional.of("08001"), e.getSqlState());
			Assertions.assertEquals(1, connectionAttempts.get());
		}
	}

	@Test
	public void testOpenFailureSuppressedWithHandlers() {
		AtomicInteger connectionAttempts = new AtomicInteger();
		List<SQLException> faults = new ArrayList<>();
		List<ExecutionLog> executionLogs = new ArrayList<>();

		try (Commandeer commandeer = Commandeer.withDataSource(JdbcProxies.failingDataSource("database is down", connectionAttempts)).build()) {
			commandeer.error((source, e) -> faults.add(e));
			commandeer.executedHandler((source, executionLog) -> executionLogs.add(executionLog));

			Assertions.assertNull(commandeer.executeScalar(Long.class, "select 1 from widget"));
			Assertions.assertTrue(commandeer.isLastCallFaulted());
			Assertions.assertEquals(1, faults.size());
			Assertions.assertEquals(1L, commandeer.getCommandExecutionCount());
			Assertions.assertEquals(ConnectionState.CLOSED, commandeer.getConnectionState());

			ExecutionLog executionLog = executionLogs.get(0);

			Assertions.assertEquals(Optional.empty(), executionLog.getJdbcSql(), "Nothing was prepared");
			Assertions.assertSame(faults.get(0), executionLog.getException().orElse(null));

			commandeer.changeDatabase("inventory");

			Assertions.assertTrue(commandeer.isLastCallFaulted());
			Assertions.assertEquals(2, faults.size());
			Assertions.assertEquals(2, connectionAttempts.get());
		}
	}

	@Test
	public void testScopeIdentityAppendsDialectClause() {
		DataSource dataSource = createInMemoryDataSource("testScopeIdentityAppendsDialectClause");
		List<SQLException> faults = new ArrayList<>();

		try (Commandeer commandeer = Commandeer.withDataSource(dataSource).databaseType(DatabaseType.SQL_SERVER).build()) {
			commandeer.error((source, e) -> faults.add(e));

			// HSQLDB cannot run the SQL Server identity query, so the call faults after the text is rewritten
			Long widgetId = commandeer.createTextCommand("insert into widget (name) values (@name)")
					.addParameter("name", "sprocket")
					.executeScopeIdentity(Long.class);

			Assertions.assertNull(widgetId);
			Assertions.assertEquals(1, faults.size());
			Assertions.assertEquals("insert into widget (name) values (@name); select scope_identity()", commandeer.getCommand().getText());
		}
	}

	@Test
	public void testInfoMessagesDispatchedInOrder() {
		DataSource dataSource = JdbcProxies.warningDataSource(createInMemoryDataSource("testInfoMessagesDispatchedInOrder"),
				"first warning", "second warning");
		List<String> messages = new ArrayList<>();

		try (Commandeer commandeer = Commandeer.withDataSource(dataSource).build()) {
			commandeer.info((source, infoMessage) -> messages.add(infoMessage.getMessage()));

			commandeer.executeScalar(Long.class, "select count(*) from information_schema.schemata");

			Assertions.assertEquals(List.of("first warning", "second warning"), messages);
		}
	}

	@Test
	public void testInfoMessagesDispatchedWhenExecutionFails() {
		DataSource dataSource = createInMemoryDataSource("testInfoMessagesDispatchedWhenExecutionFails");

		try (Commandeer commandeer = Commandeer.withDataSource(dataSource).build()) {
			commandeer.createTextCommand("create table gadget (gadget_id bigint primary key)").executeNonQuery();
			commandeer.createTextCommand("insert into gadget values (1)").executeNonQuery();
		}

		List<String> messages = new ArrayList<>();
		List<SQLException> errors = new ArrayList<>();

		try (Commandeer commandeer = Commandeer.withDataSource(JdbcProxies.warningDataSource(dataSource, "duplicate ahead")).build()) {
			commandeer.error((source, e) -> errors.add(e));
			commandeer.info((source, infoMessage) -> messages.add(infoMessage.getMessage()));

			commandeer.createTextCommand("insert into gadget values (1)").executeNonQuery();

			Assertions.assertTrue(commandeer.isLastCallFaulted());
			Assertions.assertEquals(1, errors.size());
			Assertions.assertEquals(List.of("duplicate ahead"), messages);
		}
	}

	@Test
	public void testInfoHandlerFailuresPropagate() {
		DataSource dataSource = JdbcProxies.warningDataSource(createInMemoryDataSource("testInfoHandlerFailuresPropagate"), "careful");

		try (Commandeer commandeer = Commandeer.withDataSource(dataSource).build()) {
			commandeer.error((source, e) -> {
				// Database errors only
			});
			commandeer.info((source, infoMessage) -> {
				throw new IllegalStateException("info handler failed");
			});

			IllegalStateException e = Assertions.assertThrows(IllegalStateException.class, () ->
					commandeer.executeScalar(Long.class, "select count(*) from information_schema.schemata"));

			Assertions.assertEquals("info handler failed", e.getMessage());
			Assertions.assertEquals(ConnectionState.CLOSED, commandeer.getConnectionState());
		}
	}

	@Test
	public void testMissingParameterIsNotSuppressed() {
		try (Commandeer commandeer = Commandeer.withDataSource(createInMemoryDataSource("testMissingParameterIsNotSuppressed")).build()) {
			commandeer.error((source, e) -> Assertions.fail("Missing parameters are programming errors"));

			Assertions.assertThrows(IllegalArgumentException.class, () ->
					commandeer.createTextCommand("select * from information_schema.schemata where schema_name = @schema_name")
							.executeDictionaries());
		}
	}

	@Test
	public void testExecutionListenerFailureSuppressedWhenExecutionFails() {
		ExecutionListener executionListener = (source, executionLog) -> {
			throw new RuntimeException("listener failed");
		};

		try (Commandeer commandeer = Commandeer.withDataSource(createInMemoryDataSource("testExecutionListenerFailureSuppressedWhenExecutionFails"))
				.executionListener(executionListener)
				.build()) {
			DatabaseExecutionException e = Assertions.assertThrows(DatabaseExecutionException.class, () ->
					commandeer.createTextCommand("select * from missing_table").executeDictionaries());

			Assertions.assertTrue(
					Arrays.stream(e.getSuppressed()).anyMatch(suppressed -> "listener failed".equals(suppressed.getMessage())),
					"Expected execution listener failure to be suppressed");
		}
	}

	@Test
	public void testFormatProcedureError() {
		try (Commandeer commandeer = Commandeer.withDataSource(createInMemoryDataSource("testFormatProcedureError")).build()) {
			Map<String, Object> parameters = new LinkedHashMap<>();
			parameters.put("id", 1);
			parameters.put("color", "red");

			commandeer.createProcedureCommand("update_car", parameters);

			Assertions.assertEquals("Error executing procedure update_car (@id = 1, @color = red): constraint violated",
					Commandeer.formatProcedureError(commandeer, new SQLException("constraint violated")));
			Assertions.assertEquals("exec update_car @id = 1, @color = red", commandeer.describeCommand());
		}
	}
}
