/*
 * Copyright (c) 2011-2016 Pivotal Software Inc, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package sluice.core.error;

/**
 * Raised when a pipeline is assembled or wired in a way it does not support: extending a closed flow, or
 * subscribing twice to a single-subscriber publisher.
 */
public class CompositionException extends RuntimeException {

	private static final long serialVersionUID = 4187205718412367542L;

	public CompositionException(String message) {
		super(message);
	}

	public static CompositionException alreadyClosed() {
		return new CompositionException("A runnable flow is closed and cannot be connected further, " +
				"materialize it instead");
	}

	public static CompositionException duplicateSubscriber(String name) {
		return new CompositionException("'" + name + "' only supports a single subscriber");
	}

	public static CompositionException shutDown(String name) {
		return new CompositionException("'" + name + "' has shut down after all its subscribers cancelled");
	}
}
