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

import java.util.concurrent.CompletionStage;

import org.reactivestreams.Publisher;
import sluice.core.support.Assert;
import sluice.stream.MaterializationContext;
import sluice.stream.Tap;
import sluice.stream.TapKind;
import sluice.stream.impl.FutureTapPublisher;

/**
 * Emits the value of a {@link CompletionStage} then completes, or fails with its failure.
 *
 * @param <T> the element type
 */
public final class FutureTap<T> extends Tap<T> {

	private final CompletionStage<? extends T> future;

	public FutureTap(CompletionStage<? extends T> future) {
		Assert.notNull(future, "A future is required");
		this.future = future;
	}

	@Override
	public TapKind kind() {
		return TapKind.FUTURE;
	}

	@Override
	protected Publisher<T> create(MaterializationContext context) {
		return new FutureTapPublisher<>(context.nameFor("tap"), context.executor(), future);
	}
}
