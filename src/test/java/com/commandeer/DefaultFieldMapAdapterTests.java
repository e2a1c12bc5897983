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
public class DefaultFieldMapAdapterTests {
	public record Employee(Long employeeId, @DatabaseColumn("name") String displayName, String emailAddress) {}

	public static class Vehicle {
		private String make;

		public String getMake() {
			return this.make;
		}

		public void setMake(String make) {
			this.make = make;
		}
	}

	public static class Truck extends Vehicle {
		private Integer axleCount;
		@DatabaseColumn("load_kg")
		private Integer maximumLoad;

		public Integer getAxleCount() {
			return this.axleCount;
		}

		public void setAxleCount(Integer axleCount) {
			this.axleCount = axleCount;
		}

		public Integer getMaximumLoad() {
			return this.maximumLoad;
		}

		public void setMaximumLoad(Integer maximumLoad) {
			this.maximumLoad = maximumLoad;
		}

		public String getDescription() {
			return getMake() + " with " + getAxleCount() + " axles";
		}
	}

	@Test
	public void testNormalizeName() {
		FieldMapAdapter fieldMapAdapter = FieldMapAdapter.defaultInstance();

		Assertions.assertEquals("first_name", fieldMapAdapter.normalizeName("@firstName"));
		Assertions.assertEquals("first_name", fieldMapAdapter.normalizeName("first_name"));
		Assertions.assertEquals("id", fieldMapAdapter.normalizeName("ID"));
		Assertions.assertEquals("employee_id", fieldMapAdapter.normalizeName(" employeeId "));
	}

	@Test
	public void testRecordComponentsInOrder() {
		Map<String, Object> fieldMap = FieldMapAdapter.defaultInstance()
				.toFieldMap(new Employee(1L, "Jane", "jane@example.com"));

		Assertions.assertEquals(List.of("employee_id", "name", "email_address"), List.copyOf(fieldMap.keySet()));
		Assertions.assertEquals("Jane", fieldMap.get("name"));
	}

	@Test
	public void testBeanPropertiesInFieldOrder() {
		Truck truck = new Truck();
		truck.setMake("Volvo");
		truck.setAxleCount(3);
		truck.setMaximumLoad(12000);

		Map<String, Object> fieldMap = FieldMapAdapter.defaultInstance().toFieldMap(truck);

		Assertions.assertEquals(List.of("make", "axle_count", "load_kg", "description"), List.copyOf(fieldMap.keySet()));
		Assertions.assertEquals(12000, fieldMap.get("load_kg"));
		Assertions.assertEquals("Volvo with 3 axles", fieldMap.get("description"));
	}

	@Test
	public void testMapKeysNormalized() {
		Map<String, Object> source = new LinkedHashMap<>();
		source.put("@carId", 1);
		source.put("color", null);

		Map<String, Object> fieldMap = FieldMapAdapter.defaultInstance().toFieldMap(source);

		Assertions.assertEquals(List.of("car_id", "color"), List.copyOf(fieldMap.keySet()));
		Assertions.assertNull(fieldMap.get("color"));
	}
}
