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
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static com.commandeer.JdbcProxies.createInMemoryDataSource;
import static java.lang.String.format;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class ExecutionLoggerTests {
	@Test
	public void testFormatsParametersAndTimings() {
		Map<String, Object> parameters = new LinkedHashMap<>();
		parameters.put("id", 7);
		parameters.put("notes", "x".repeat(150));
		parameters.put("photo", new byte[16]);
		parameters.put("owner", null);

		CommandDescriptor command = new CommandDescriptor("select * from car where id = @id", CommandType.TEXT, parameters, List.of(), false);
		ExecutionLog executionLog = ExecutionLog.withCommand(command, 3L)
				.jdbcSql("select * from car where id = ?")
				.connectionAcquisitionDuration(Duration.ofMillis(2))
				.executionDuration(Duration.ofMillis(5))
				.exception(new DatabaseExecutionException("select * from car where id = @id", new SQLException("boom")))
				.build();

		String formatted = new DefaultExecutionLogger().formatExecutionLog(executionLog);
		String[] lines = formatted.split("\n");

		Assertions.assertEquals("select * from car where id = ?", lines[0]);
		Assertions.assertEquals(format("Parameters: @id = 7, @notes = '%s...', @photo = [byte array of length 16], @owner = null", "x".repeat(100)),
				lines[1]);
		Assertions.assertEquals("PT0.002S acquiring connection, PT0.005S executing command", lines[2]);
		Assertions.assertEquals("Failed due to java.sql.SQLException: boom", lines[3]);
	}

	@Test
	public void testLogsEachExecution() {
		String loggerName = "com.commandeer.SQL.testLogsEachExecution";
		Logger logger = Logger.getLogger(loggerName);
		List<LogRecord> logRecords = new ArrayList<>();

		Handler handler = new Handler() {
			@Override
			public void publish(LogRecord logRecord) {
				logRecords.add(logRecord);
			}

			@Override
			public void flush() {
				// Nothing buffered
			}

			@Override
			public void close() {
				// Nothing to release
			}
		};

		logger.addHandler(handler);

		try (Commandeer commandeer = Commandeer.withDataSource(createInMemoryDataSource("testLogsEachExecution"))
				.executionListener(new DefaultExecutionLogger(loggerName, Level.INFO))
				.build()) {
			commandeer.executeScalar(Long.class, "select count(*) from information_schema.schemata");
			commandeer.executeScalar(Long.class, "select count(*) from information_schema.tables");

			Assertions.assertEquals(2, logRecords.size());
			Assertions.assertEquals(Level.INFO, logRecords.get(0).getLevel());
			Assertions.assertTrue(logRecords.get(1).getMessage().startsWith("select count(*) from information_schema.tables"));
		} finally {
			logger.removeHandler(handler);
		}
	}
}
