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
package sluice.stream;

/**
 * The closed set of tap variants.
 */
public enum TapKind {
	/**
	 * Re-iterates an {@link Iterable} on every materialization.
	 */
	COLLECTION,
	/**
	 * Drains one shared {@link java.util.Iterator}, exhausted once across materializations.
	 */
	ITERATOR,
	/**
	 * Calls a thunk once per unit of demand until it returns nothing.
	 */
	THUNK,
	/**
	 * Emits the value of one future.
	 */
	FUTURE,
	/**
	 * Emits on a timer, dropping ticks nobody asked for.
	 */
	TICK,
	/**
	 * Relays a producer or a subscriber owned by the caller.
	 */
	EXTERNAL
}
