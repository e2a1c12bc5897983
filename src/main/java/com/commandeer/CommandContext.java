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
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Data that represents a command being bound or read, handed to {@link ParameterBinder},
 * {@link ResultSetMapper} and {@link InstanceProvider} implementations.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class CommandContext {
	@NonNull
	private final CommandDescriptor command;
	@NonNull
	private final DatabaseType databaseType;
	@NonNull
	private final ZoneId timeZone;

	public CommandContext(@NonNull CommandDescriptor command,
												@NonNull DatabaseType databaseType,
												@NonNull ZoneId timeZone) {
		requireNonNull(command);
		requireNonNull(databaseType);
		requireNonNull(timeZone);

		this.command = command;
		this.databaseType = databaseType;
		this.timeZone = timeZone;
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(3);

		components.add(format("command=%s", getCommand()));
		components.add(format("databaseType=%s", getDatabaseType().name()));
		components.add(format("timeZone=%s", getTimeZone().getId()));

		return format("%s{%s}", getClass().getSimpleName(), String.join(", ", components));
	}

	@NonNull
	public CommandDescriptor getCommand() {
		return this.command;
	}

	@NonNull
	public DatabaseType getDatabaseType() {
		return this.databaseType;
	}

	@NonNull
	public ZoneId getTimeZone() {
		return this.timeZone;
	}
}
