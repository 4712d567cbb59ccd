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
import sluice.stream.KeyedSink;
import sluice.stream.MaterializationContext;

/**
 * Requests everything and discards it. Completion is observed through
 * {@link sluice.stream.MaterializedFlow#completion()}.
 *
 * @param <T> the element type
 */
public final class BlackholeSink<T> extends KeyedSink<T, Void> {

	@Override
	protected Void attach(Publisher<T> publisher, MaterializationContext context) {
		publisher.subscribe(new ConsumingSubscriber<T, Void>(context, Long.MAX_VALUE) {
			@Override
			protected void doNext(T x) {
			}

			@Override
			protected Void doComplete() {
				return null;
			}
		});
		return null;
	}
}
