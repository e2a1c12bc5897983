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

/**
 * Commandeer is a fluent command builder and executor for JDBC.
 * <p>
 * A {@link com.commandeer.Commandeer} assembles one command at a time from SQL text with {@code @name} placeholders,
 * a stored-procedure name, a generated {@code INSERT}/{@code UPDATE} or a table name, then executes it and
 * materializes the results.
 *
 * <pre>
 * // Minimal setup, uses defaults
 * DataSource dataSource = ...
 *
 * try (Commandeer commandeer = Commandeer.withDataSource(dataSource).build()) {
 *   // Queries
 *   List&lt;Car&gt; blueCars = commandeer.createTextCommand("select * from car where color = @color")
 *     .addParameter("color", Color.BLUE)
 *     .executeAndAutoMap(Car.class);
 *   Map&lt;Long, String&gt; colorsById = commandeer.createTextCommand("select id, color from car")
 *     .executeVerticalDictionary(Long.class, String.class);
 *
 *   // Generated statements
 *   Long id = commandeer.createInsertCommand("car", new Car(null, Color.RED)).executeScopeIdentity(Long.class);
 *
 *   // Stored procedures
 *   Integer status = commandeer.createProcedureCommand("retire_car", Map.of("id", id))
 *     .executeReturnValue(Integer.class);
 * }</pre>
 *
 * @since 1.0.0
 */
package com.commandeer;
