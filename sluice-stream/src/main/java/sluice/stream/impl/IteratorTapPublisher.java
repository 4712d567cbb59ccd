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

import java.util.Iterator;
import java.util.concurrent.Executor;

/**
 * Emits the elements of an iterator on demand and completes as soon as it is exhausted, without waiting for more
 * demand. The iterator may be shared by several materializations, so every access is synchronized on it.
 *
 * @param <T> the element type
 */
public final class IteratorTapPublisher<T> extends TapPublisher<T> {

	private final Iterator<? extends T> iterator;

	public IteratorTapPublisher(String name, Executor executor, Iterator<? extends T> iterator) {
		super(name, executor);
		this.iterator = iterator;
	}

	@Override
	protected void produce(long n) {
		if (!hasNext()) {
			complete();
			return;
		}
		for (long i = 0L; i < n && !isCancelled(); i++) {
			T next;
			synchronized (iterator) {
				if (!iterator.hasNext()) {
					break;
				}
				next = iterator.next();
			}
			if (!emit(next)) {
				return;
			}
		}
		if (!isCancelled() && !hasNext()) {
			complete();
		}
	}

	private boolean hasNext() {
		synchronized (iterator) {
			return iterator.hasNext();
		}
	}
}
