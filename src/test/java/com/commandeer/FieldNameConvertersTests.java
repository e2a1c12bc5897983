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

/**
 * @since 1.0.0
 */
@ThreadSafe
public class FieldNameConvertersTests {
	@Test
	public void testTitleCase() {
		Assertions.assertEquals("FirstName", FieldNameConverters.titleCase("first_name"));
		Assertions.assertEquals("FirstName", FieldNameConverters.titleCase("FIRST_NAME"));
		Assertions.assertEquals("Id", FieldNameConverters.titleCase("id"));
	}

	@Test
	public void testCamelCase() {
		Assertions.assertEquals("firstName", FieldNameConverters.camelCase("first_name"));
		Assertions.assertEquals("emailAddress", FieldNameConverters.camelCase("EMAIL_ADDRESS"));
		Assertions.assertEquals("id", FieldNameConverters.camelCase("_id"));
	}
}
