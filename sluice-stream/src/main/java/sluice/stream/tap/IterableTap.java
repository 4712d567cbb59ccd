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
import sluice.stream.impl.IteratorTapPublisher;

/**
 * Emits the elements of an {@link Iterable}, calling {@link Iterable#iterator()} on every materialization so that
 * every run sees the whole collection.
 *
 * @param <T> the element type
 */
public final class IterableTap<T> extends Tap<T> {

	private final Iterable<? extends T> iterable;

	public IterableTap(Iterable<? extends T> iterable) {
		Assert.notNull(iterable, "An iterable is required");
		this.iterable = iterable;
	}

	@Override
	public TapKind kind() {
		return TapKind.COLLECTION;
	}

	@Override
	protected Publisher<T> create(MaterializationContext context) {
		return new IteratorTapPublisher<>(context.nameFor("tap"), context.executor(), iterable.iterator());
	}
}
