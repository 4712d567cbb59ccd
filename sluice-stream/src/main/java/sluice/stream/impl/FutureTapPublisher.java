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

import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

import sluice.core.error.Exceptions;

/**
 * Emits the value of a {@link CompletionStage} once demanded, then completes. A failed stage fails the stream as
 * soon as it is known, demand or not. A {@code null} value completes the stream without any element.
 *
 * @param <T> the element type
 */
public final class FutureTapPublisher<T> extends TapPublisher<T> {

	private final CompletionStage<? extends T> future;

	private volatile boolean   resolved;
	private volatile T         value;
	private volatile Throwable error;

	public FutureTapPublisher(String name, Executor executor, CompletionStage<? extends T> future) {
		super(name, executor);
		this.future = future;
	}

	@Override
	protected void onStart() {
		future.whenComplete((v, e) -> {
			value = v;
			error = e;
			resolved = true;
			signal();
		});
	}

	@Override
	protected void produce(long n) {
		if (!resolved) {
			return;
		}
		Throwable e = error;
		if (e != null) {
			fail(Exceptions.unwrap(e));
			return;
		}
		T v = value;
		if (v == null) {
			complete();
		}
		else if (n > 0L && emit(v)) {
			complete();
		}
	}
}
