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

/**
 * Thrown when a return value is requested but no stored-procedure return-value parameter was ever created.
 *
 * @since 1.0.0
 */
public class NoReturnValueException extends IllegalStateException {
	public NoReturnValueException() {
		super("No return value parameter has been initialized. Return values are only available for stored procedure commands");
	}
}
