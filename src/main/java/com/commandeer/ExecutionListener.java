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
 * Contract for reacting to completed command executions, for example to log them or to alert on slow commands.
 * <p>
 * Listeners are invoked after every execution, successful or not, in registration order.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ExecutionListener {
	/**
	 * Called after a command has executed.
	 *
	 * @param commandeer   the executor that ran the command
	 * @param executionLog timing and outcome of the execution
	 */
	void executed(@NonNull Commandeer commandeer,
								@NonNull ExecutionLog executionLog);
}
