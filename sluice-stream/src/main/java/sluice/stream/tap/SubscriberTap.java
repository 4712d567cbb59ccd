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
package sluice.stream.tap;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import sluice.stream.KeyedTap;
import sluice.stream.MaterializationContext;
import sluice.stream.TapKind;
import sluice.stream.impl.PassThroughProcessor;

/**
 * A tap fed by the caller: each materialization produces a {@link Subscriber}, obtained from
 * {@link sluice.stream.MaterializedFlow#get(KeyedTap)}, that the caller subscribes to its own producer.
 *
 * @param <T> the element type
 */
public final class SubscriberTap<T> extends KeyedTap<T, Subscriber<T>> {

	@Override
	public TapKind kind() {
		return TapKind.EXTERNAL;
	}

	@Override
	protected Publisher<T> create(MaterializationContext context) {
		return new PassThroughProcessor<>(context.nameFor("tap"));
	}

	@Override
	protected Subscriber<T> materializedValue(Publisher<T> created) {
		return (PassThroughProcessor<T>) created;
	}
}
