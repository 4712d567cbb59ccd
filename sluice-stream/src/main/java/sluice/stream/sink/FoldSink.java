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
import sluice.fn.BiFunction;
import sluice.stream.KeyedSink;
import sluice.stream.MaterializationContext;

/**
 * Folds the elements into an accumulator, starting from a zero value shared by every materialization.
 *
 * @param <T> the element type
 * @param <U> the accumulator type
 */
public final class FoldSink<T, U> extends KeyedSink<T, CompletableFuture<U>> {

	private final U                                               zero;
	private final BiFunction<? super U, ? super T, ? extends U> function;

	public FoldSink(U zero, BiFunction<? super U, ? super T, ? extends U> function) {
		Assert.notNull(function, "A fold function is required");
		this.zero = zero;
		this.function = function;
	}

	@Override
	protected CompletableFuture<U> attach(Publisher<T> publisher, MaterializationContext context) {
		Folder folder = new Folder(context);
		publisher.subscribe(folder);
		return folder.result();
	}

	private final class Folder extends ConsumingSubscriber<T, U> {

		private U accumulator = zero;

		Folder(MaterializationContext context) {
			super(context, context.settings().getMaximumInputBufferSize());
		}

		@Override
		protected void doNext(T x) {
			accumulator = function.apply(accumulator, x);
		}

		@Override
		protected U doComplete() {
			return accumulator;
		}
	}
}
