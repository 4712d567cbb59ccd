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

import org.reactivestreams.Publisher;
import sluice.core.support.Assert;
import sluice.stream.KeyedSink;
import sluice.stream.MaterializationContext;
import sluice.stream.impl.FanoutProcessor;

/**
 * Exposes the output of a flow as a {@link Publisher} accepting any number of subscribers. Upstream is pulled at the
 * pace of the fastest subscriber, a subscriber lagging more than the maximum buffer size behind is dropped with
 * {@link sluice.core.error.InsufficientCapacityException}.
 *
 * @param <T> the element type
 */
public final class FanoutPublisherSink<T> extends KeyedSink<T, Publisher<T>> {

	private final int initialBufferSize;
	private final int maximumBufferSize;

	public FanoutPublisherSink(int initialBufferSize, int maximumBufferSize) {
		Assert.isTrue(initialBufferSize > 0, "The initial buffer size must be strictly positive");
		Assert.isTrue(maximumBufferSize >= initialBufferSize,
				"The maximum buffer size must not be lower than the initial buffer size");
		this.initialBufferSize = initialBufferSize;
		this.maximumBufferSize = maximumBufferSize;
	}

	@Override
	protected Publisher<T> attach(Publisher<T> publisher, MaterializationContext context) {
		FanoutProcessor<T> fanout = new FanoutProcessor<>(context.nameFor("fanout"),
				context.executor(),
				initialBufferSize,
				maximumBufferSize);
		publisher.subscribe(fanout);
		return fanout;
	}

	@Override
	public String toString() {
		return "FanoutPublisherSink{initial=" + initialBufferSize + ", maximum=" + maximumBufferSize + '}';
	}
}
