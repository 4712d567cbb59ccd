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
import sluice.core.support.Assert;
import sluice.stream.MaterializationContext;
import sluice.stream.Tap;
import sluice.stream.TapKind;
import sluice.stream.impl.PassThroughProcessor;

/**
 * Relays an external {@link Publisher}, subscribed to once per materialization. Demand is only forwarded to it once
 * the flow downstream asks for elements.
 *
 * @param <T> the element type
 */
public final class PublisherTap<T> extends Tap<T> {

	private final Publisher<? extends T> publisher;

	public PublisherTap(Publisher<? extends T> publisher) {
		Assert.notNull(publisher, "A publisher is required");
		this.publisher = publisher;
	}

	@Override
	public TapKind kind() {
		return TapKind.EXTERNAL;
	}

	@Override
	protected Publisher<T> create(MaterializationContext context) {
		PassThroughProcessor<T> relay = new PassThroughProcessor<>(context.nameFor("tap"));
		publisher.subscribe(relay);
		return relay;
	}
}
