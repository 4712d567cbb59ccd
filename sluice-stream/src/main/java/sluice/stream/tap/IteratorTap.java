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

import java.util.Iterator;

import org.reactivestreams.Publisher;
import sluice.core.support.Assert;
import sluice.stream.MaterializationContext;
import sluice.stream.Tap;
import sluice.stream.TapKind;
import sluice.stream.impl.IteratorTapPublisher;

/**
 * Emits the elements of one {@link Iterator}. Every materialization pulls from the same iterator, so its elements
 * are seen once in total.
 *
 * @param <T> the element type
 */
public final class IteratorTap<T> extends Tap<T> {

	private final Iterator<? extends T> iterator;

	public IteratorTap(Iterator<? extends T> iterator) {
		Assert.notNull(iterator, "An iterator is required");
		this.iterator = iterator;
	}

	@Override
	public TapKind kind() {
		return TapKind.ITERATOR;
	}

	@Override
	protected Publisher<T> create(MaterializationContext context) {
		return new IteratorTapPublisher<>(context.nameFor("tap"), context.executor(), iterator);
	}
}
