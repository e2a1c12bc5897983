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
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.commandeer.JdbcProxies.createInMemoryDataSource;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class ResultMappingTests {
	public enum Grade {
		JUNIOR,
		SENIOR
	}

	public record Employee(@DatabaseColumn("name") String displayName, String emailAddress, Locale locale, Grade grade,
												 LocalDate hiredOn, BigDecimal salary) {}

	public record EmployeeInsert(String name, String emailAddress, Locale locale, Grade grade, LocalDate hiredOn,
															 BigDecimal salary) {}

	@Test
	public void testRecordMappingWithAliasesAndConversions() {
		try (Commandeer commandeer = Commandeer.withDataSource(createInMemoryDataSource("testRecordMappingWithAliasesAndConversions")).build()) {
			commandeer.createTextCommand("""
					CREATE TABLE employee (
					  name VARCHAR(255) NOT NULL,
					  email_address VARCHAR(255),
					  locale VARCHAR(255),
					  grade VARCHAR(20),
					  hired_on DATE,
					  salary DECIMAL(10, 2)
					)
					""").executeNonQuery();

			commandeer.createInsertCommand("employee", new EmployeeInsert("Jane", "jane@example.com", Locale.CANADA_FRENCH,
					Grade.SENIOR, LocalDate.of(2020, 1, 15), new BigDecimal("1234.50"))).executeNonQuery();

			List<Employee> employees = commandeer.createTextCommand("select * from employee").executeAndAutoMap(Employee.class);

			Assertions.assertEquals(1, employees.size());

			Employee employee = employees.get(0);

			Assertions.assertEquals("Jane", employee.displayName());
			Assertions.assertEquals("jane@example.com", employee.emailAddress());
			Assertions.assertEquals(Locale.CANADA_FRENCH, employee.locale());
			Assertions.assertEquals(Grade.SENIOR, employee.grade());
			Assertions.assertEquals(LocalDate.of(2020, 1, 15), employee.hiredOn());
			Assertions.assertEquals(0, new BigDecimal("1234.50").compareTo(employee.salary()));

			Assertions.assertEquals(List.of(Grade.SENIOR), commandeer.createTextCommand("select grade from employee").executeArray(Grade.class));
			Assertions.assertEquals(LocalDate.of(2020, 1, 15), commandeer.executeScalar(LocalDate.class, "select hired_on from employee"));
		}
	}

	@Test
	public void testStandardTypesRequireSingleColumn() {
		try (Commandeer commandeer = Commandeer.withDataSource(createInMemoryDataSource("testStandardTypesRequireSingleColumn")).build()) {
			Assertions.assertThrows(DatabaseException.class, () ->
					commandeer.createTextCommand("select schema_name, schema_owner from information_schema.schemata")
							.executeAndAutoMap(String.class));
		}
	}

	@Test
	public void testDatabaseTypeDetection() {
		Assertions.assertEquals(DatabaseType.GENERIC, DatabaseType.fromDataSource(createInMemoryDataSource("testDatabaseTypeDetection")));
		Assertions.assertEquals(Optional.of("; select scope_identity()"), DatabaseType.SQL_SERVER.getIdentityClause());
		Assertions.assertEquals(Optional.empty(), DatabaseType.ORACLE.getIdentityClause());
	}
}
