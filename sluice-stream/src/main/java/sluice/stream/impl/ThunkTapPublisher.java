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
package sluice.stream.impl;

import java.util.Optional;
import java.util.concurrent.Executor;

import sluice.fn.Supplier;

/**
 * Calls a thunk once per unit of demand. An empty result completes the stream and the thunk is never called
 * again.
 *
 * @param <T> the element type
 */
public final class ThunkTapPublisher<T> extends TapPublisher<T> {

	private final Supplier<Optional<T>> thunk;

	public ThunkTapPublisher(String name, Executor executor, Supplier<Optional<T>> thunk) {
		super(name, executor);
		this.thunk = thunk;
	}

	@Override
	protected void produce(long n) {
		for (long i = 0L; i < n && !isCancelled(); i++) {
			Optional<T> next = thunk.get();
			if (next == null || !next.isPresent()) {
				complete();
				return;
			}
			if (!emit(next.get())) {
				return;
			}
		}
	}
}
