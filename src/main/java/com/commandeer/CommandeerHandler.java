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

/**
 * Callback registered on a {@link Commandeer} for errors, informational messages or connection state changes.
 *
 * @param <T> the event payload type
 * @since 1.0.0
 */
@FunctionalInterface
public interface CommandeerHandler<T> {
	/**
	 * Handles an event raised by {@code commandeer}.
	 *
	 * @param commandeer the executor that raised the event
	 * @param event      the event payload
	 */
	void handle(@NonNull Commandeer commandeer,
							@NonNull T event);
}
