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

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import sluice.core.error.Exceptions;
import sluice.core.support.BackpressureUtils;
import sluice.stream.MaterializationContext;

/**
 * Base subscriber of the sinks materialized as a {@link CompletableFuture}. Requests in batches, asking for more once
 * half of the batch has been consumed. A failing {@link #doNext} fails both the result and the run.
 *
 * @param <T> the element type
 * @param <R> the result type
 */
abstract class ConsumingSubscriber<T, R> implements Subscriber<T> {

	private final CompletableFuture<R>   result = new CompletableFuture<>();
	private final MaterializationContext context;
	private final long                   batchSize;

	private Subscription subscription;
	private long         remaining;
	private boolean      done;

	ConsumingSubscriber(MaterializationContext context, long batchSize) {
		this.context = context;
		this.batchSize = Math.max(1L, batchSize);
	}

	/**
	 * @param x the next element
	 */
	protected abstract void doNext(T x);

	/**
	 * @return the result of a completed stream
	 */
	protected abstract R doComplete();

	@Override
	public final void onSubscribe(Subscription s) {
		if (BackpressureUtils.checkSubscription(subscription, s)) {
			this.subscription = s;
			this.remaining = batchSize;
			s.request(batchSize);
		}
	}

	@Override
	public final void onNext(T x) {
		if (done) {
			return;
		}
		try {
			doNext(x);
		}
		catch (Throwable t) {
			Exceptions.throwIfFatal(t);
			Throwable failure = Exceptions.addValueAsLastCause(t, x);
			context.failRun(failure);
			cancel();
			result.completeExceptionally(failure);
			return;
		}
		if (done || batchSize == Long.MAX_VALUE) {
			return;
		}
		if (--remaining <= batchSize / 2) {
			long n = batchSize - remaining;
			remaining = batchSize;
			subscription.request(n);
		}
	}

	@Override
	public final void onError(Throwable t) {
		if (done) {
			return;
		}
		done = true;
		subscription = null;
		result.completeExceptionally(t);
	}

	@Override
	public final void onComplete() {
		if (done) {
			return;
		}
		done = true;
		subscription = null;
		try {
			result.complete(doComplete());
		}
		catch (Throwable t) {
			Exceptions.throwIfFatal(t);
			result.completeExceptionally(t);
		}
	}

	/**
	 * Stop consuming and complete the result with the given value.
	 *
	 * @param value the result
	 */
	protected final void finish(R value) {
		cancel();
		result.complete(value);
	}

	private void cancel() {
		done = true;
		Subscription s = subscription;
		if (s != null) {
			subscription = null;
			s.cancel();
		}
	}

	final CompletableFuture<R> result() {
		return result;
	}
}
