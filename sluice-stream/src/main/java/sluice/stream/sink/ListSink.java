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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.reactivestreams.Publisher;
import sluice.stream.KeyedSink;
import sluice.stream.MaterializationContext;

/**
 * Collects every element, in order, into an unmodifiable list.
 *
 * @param <T> the element type
 */
public final class ListSink<T> extends KeyedSink<T, CompletableFuture<List<T>>> {

	@Override
	protected CompletableFuture<List<T>> attach(Publisher<T> publisher, MaterializationContext context) {
		ConsumingSubscriber<T, List<T>> subscriber =
				new ConsumingSubscriber<T, List<T>>(context, context.settings().getMaximumInputBufferSize()) {
					private final List<T> elements = new ArrayList<>();

					@Override
					protected void doNext(T x) {
						elements.add(x);
					}

					@Override
					protected List<T> doComplete() {
						return Collections.unmodifiableList(elements);
					}
				};
		publisher.subscribe(subscriber);
		return subscriber.result();
	}
}
