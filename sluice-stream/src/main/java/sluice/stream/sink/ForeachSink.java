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

import java.util.concurrent.CompletableFuture;

import org.reactivestreams.Publisher;
import sluice.core.support.Assert;
import sluice.fn.Consumer;
import sluice.stream.KeyedSink;
import sluice.stream.MaterializationContext;

/**
 * Calls a consumer for every element. The materialized future completes with the stream, or fails with the stream
 * or the first consumer failure.
 *
 * @param <T> the element type
 */
public final class ForeachSink<T> extends KeyedSink<T, CompletableFuture<Void>> {

	private final Consumer<? super T> consumer;

	public ForeachSink(Consumer<? super T> consumer) {
		Assert.notNull(consumer, "A consumer is required");
		this.consumer = consumer;
	}

	@Override
	protected CompletableFuture<Void> attach(Publisher<T> publisher, MaterializationContext context) {
		ConsumingSubscriber<T, Void> subscriber =
				new ConsumingSubscriber<T, Void>(context, context.settings().getMaximumInputBufferSize()) {
					@Override
					protected void doNext(T x) {
						consumer.accept(x);
					}

					@Override
					protected Void doComplete() {
						return null;
					}
				};
		publisher.subscribe(subscriber);
		return subscriber.result();
	}
}
