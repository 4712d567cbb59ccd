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
 * Signalled to a fan-out subscriber that fell further behind its siblings than the fan-out buffer allows.
 */
public final class InsufficientCapacityException extends RuntimeException {

	private static final long serialVersionUID = 2491425227432776146L;

	public InsufficientCapacityException(String name, long capacity) {
		super("Subscriber of '" + name + "' fell behind by more than " + capacity + " elements and was dropped");
	}
}
