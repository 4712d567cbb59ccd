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
package sluice.stream.sink;

import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;

import org.reactivestreams.Publisher;
import sluice.stream.KeyedSink;
import sluice.stream.MaterializationContext;

/**
 * Completes with the first element and cancels upstream. An empty stream fails the result with
 * {@link NoSuchElementException}.
 *
 * @param <T> the element type
 */
public final class HeadSink<T> extends KeyedSink<T, CompletableFuture<T>> {

	@Override
	protected CompletableFuture<T> attach(Publisher<T> publisher, MaterializationContext context) {
		ConsumingSubscriber<T, T> subscriber = new ConsumingSubscriber<T, T>(context, 1L) {
			@Override
			protected void doNext(T x) {
				finish(x);
			}

			@Override
			protected T doComplete() {
				throw new NoSuchElementException("Stream completed without any element");
			}
		};
		publisher.subscribe(subscriber);
		return subscriber.result();
	}
}
