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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class ParameterStoreTests {
	public record Car(Long carId, String color) {}

	public record Driver(String firstName, @DatabaseColumn("first_name") String nickname) {}

	@Test
	public void testAddNormalizesNames() {
		ParameterStore parameterStore = new ParameterStore();

		parameterStore.add("@firstName", "Jane");
		parameterStore.add("last_name", "Doe");

		Assertions.assertEquals(List.of("first_name", "last_name"), parameterStore.names());
		Assertions.assertEquals("Jane", parameterStore.get("firstName"));
		Assertions.assertEquals("Doe", parameterStore.get("@last_name"));
	}

	@Test
	public void testDuplicateAddThrowsAndLeavesStoreUnchanged() {
		ParameterStore parameterStore = new ParameterStore();
		parameterStore.add("id", 1);

		DuplicateParameterException e = Assertions.assertThrows(DuplicateParameterException.class,
				() -> parameterStore.add("@id", 2));

		Assertions.assertEquals("id", e.getParameterName());
		Assertions.assertEquals(1, parameterStore.get("id"));
		Assertions.assertEquals(1, parameterStore.size());
	}

	@Test
	public void testAddAllKeepsEntriesBeforeDuplicate() {
		ParameterStore parameterStore = new ParameterStore();
		parameterStore.add("b", "existing");

		Map<String, Object> parameters = new LinkedHashMap<>();
		parameters.put("a", 1);
		parameters.put("b", 2);
		parameters.put("c", 3);

		Assertions.assertThrows(DuplicateParameterException.class, () -> parameterStore.addAll(parameters));

		Assertions.assertEquals(List.of("b", "a"), parameterStore.names());
		Assertions.assertEquals("existing", parameterStore.get("b"));
	}

	@Test
	public void testAddAllRejectsKeysNormalizingToSameName() {
		ParameterStore parameterStore = new ParameterStore();

		Map<String, Object> parameters = new LinkedHashMap<>();
		parameters.put("firstName", "A");
		parameters.put("first_name", "B");
		parameters.put("last_name", "C");

		DuplicateParameterException e = Assertions.assertThrows(DuplicateParameterException.class,
				() -> parameterStore.addAll(parameters));

		Assertions.assertEquals("first_name", e.getParameterName());
		Assertions.assertEquals(List.of("first_name"), parameterStore.names());
		Assertions.assertEquals("A", parameterStore.get("first_name"));
	}

	@Test
	public void testFieldNameCollisionsRejected() {
		ParameterStore parameterStore = new ParameterStore();

		Map<String, Object> fields = new LinkedHashMap<>();
		fields.put("@ownerName", "Ann");
		fields.put("owner_name", "Bob");

		Assertions.assertThrows(DuplicateParameterException.class, () -> parameterStore.merge(fields));
		Assertions.assertThrows(DuplicateParameterException.class, () -> parameterStore.addAll(new Driver("Ann", "Annie")));
		Assertions.assertTrue(parameterStore.isEmpty());
	}

	@Test
	public void testAddAllNullIsNoOp() {
		ParameterStore parameterStore = new ParameterStore();
		parameterStore.addAll(null);
		Assertions.assertTrue(parameterStore.isEmpty());
	}

	@Test
	public void testAddAllDecomposesRecords() {
		ParameterStore parameterStore = new ParameterStore();
		parameterStore.addAll(new Car(7L, "red"));

		Assertions.assertEquals(List.of("car_id", "color"), parameterStore.names());
		Assertions.assertEquals(7L, parameterStore.get("carId"));
	}

	@Test
	public void testMergeOverwritesInPlaceAndAppendsNewNames() {
		ParameterStore parameterStore = new ParameterStore();
		parameterStore.add("color", "blue");
		parameterStore.add("owner", "Ann");

		parameterStore.merge(new Car(7L, "red"));

		Assertions.assertEquals(List.of("color", "owner", "car_id"), parameterStore.names());
		Assertions.assertEquals("red", parameterStore.get("color"));
	}

	@Test
	public void testRemovals() {
		ParameterStore parameterStore = new ParameterStore();
		parameterStore.add("a", null);
		parameterStore.add("b", "");
		parameterStore.add("c", " ");
		parameterStore.add("d", 0);

		Assertions.assertFalse(parameterStore.remove("missing"));
		Assertions.assertEquals(1, parameterStore.removeBlanks());
		Assertions.assertEquals(List.of("a", "c", "d"), parameterStore.names());
		Assertions.assertEquals(1, parameterStore.removeNulls());
		Assertions.assertEquals(List.of("c", "d"), parameterStore.names());
		Assertions.assertTrue(parameterStore.remove("@c"));
		Assertions.assertEquals(List.of("d"), parameterStore.names());
	}

	@Test
	public void testRemoveNullsAndBlanks() {
		ParameterStore parameterStore = new ParameterStore();
		parameterStore.add("a", null);
		parameterStore.add("b", "");
		parameterStore.add("c", "value");

		Assertions.assertEquals(2, parameterStore.removeNullsAndBlanks());
		Assertions.assertEquals(List.of("c"), parameterStore.names());
	}

	@Test
	public void testGetUnknownParameterThrows() {
		ParameterStore parameterStore = new ParameterStore();
		Assertions.assertThrows(IllegalArgumentException.class, () -> parameterStore.get("nope"));
	}

	@Test
	public void testBlankNameRejected() {
		ParameterStore parameterStore = new ParameterStore();
		Assertions.assertThrows(IllegalArgumentException.class, () -> parameterStore.add("@", 1));
	}
}
