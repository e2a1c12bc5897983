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

import javax.annotation.concurrent.ThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Connection state transition reported to handlers registered via
 * {@link Commandeer#connectionStateChange(CommandeerHandler)}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ConnectionStateChange {
	@NonNull
	private final ConnectionState originalState;
	@NonNull
	private final ConnectionState currentState;

	public ConnectionStateChange(@NonNull ConnectionState originalState,
															 @NonNull ConnectionState currentState) {
		requireNonNull(originalState);
		requireNonNull(currentState);

		this.originalState = originalState;
		this.currentState = currentState;
	}

	@NonNull
	public ConnectionState getOriginalState() {
		return this.originalState;
	}

	@NonNull
	public ConnectionState getCurrentState() {
		return this.currentState;
	}

	@Override
	public String toString() {
		return format("%s{%s -> %s}", getClass().getSimpleName(), getOriginalState(), getCurrentState());
	}
}
