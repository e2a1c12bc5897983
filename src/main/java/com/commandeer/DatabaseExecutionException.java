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

import javax.annotation.concurrent.NotThreadSafe;
import java.sql.SQLException;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when opening a connection or executing a command fails and no error handlers are registered
 * via {@link Commandeer#error(CommandeerHandler)}.
 * <p>
 * The original {@link SQLException} is available as the cause; the message includes a human-readable
 * rendering of the command that failed (see {@link Commandeer#describeCommand()}).
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class DatabaseExecutionException extends DatabaseException {
	@NonNull
	private final String commandDescription;

	public DatabaseExecutionException(@NonNull String commandDescription,
																		@NonNull SQLException cause) {
		super(format("Error executing %s: %s", requireNonNull(commandDescription), requireNonNull(cause).getMessage()), cause);
		this.commandDescription = commandDescription;
	}

	/**
	 * @return a human-readable rendering of the command that failed
	 */
	@NonNull
	public String getCommandDescription() {
		return this.commandDescription;
	}

	@Override
	@NonNull
	public synchronized SQLException getCause() {
		return (SQLException) super.getCause();
	}
}
