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
package sluice.stream.impl;

import java.util.concurrent.atomic.AtomicLongFieldUpdater;

import org.reactivestreams.Processor;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import sluice.core.error.CompositionException;
import sluice.core.error.SpecificationExceptions;
import sluice.core.subscription.DemandChannel;
import sluice.core.subscription.DemandListener;
import sluice.core.subscription.EmptySubscription;
import sluice.core.support.BackpressureUtils;

/**
 * Relays an upstream subscription to a single downstream {@link DemandChannel} without buffering. Demand signalled
 * before the upstream subscription arrives is accumulated and requested as soon as it does.
 *
 * @param <T> the element type
 */
public class PassThroughProcessor<T> implements Processor<T, T>, DemandListener {

	protected final String           name;
	protected final DemandChannel<T> downstream;

	private volatile Subscription upstream;

	private volatile long missedRequested;
	@SuppressWarnings("rawtypes")
	private static final AtomicLongFieldUpdater<PassThroughProcessor> MISSED_REQUESTED =
			AtomicLongFieldUpdater.newUpdater(PassThroughProcessor.class, "missedRequested");

	public PassThroughProcessor(String name) {
		this.name = name;
		this.downstream = new DemandChannel<>(name, this);
	}

	@Override
	public void subscribe(Subscriber<? super T> s) {
		if (!downstream.attach(s)) {
			EmptySubscription.error(s, CompositionException.duplicateSubscriber(name));
		}
	}

	@Override
	public void onSubscribe(Subscription s) {
		if (!BackpressureUtils.checkSubscription(upstream, s)) {
			return;
		}
		upstream = s;
		if (downstream.isCancelled()) {
			s.cancel();
			return;
		}
		long r = MISSED_REQUESTED.getAndSet(this, 0L);
		if (r > 0L) {
			s.request(r);
		}
	}

	@Override
	public void onNext(T t) {
		try {
			downstream.emit(t);
		}
		catch (SpecificationExceptions.Spec101_UnrequestedOnNext overflow) {
			cancelUpstream();
			downstream.error(overflow);
		}
	}

	@Override
	public void onError(Throwable t) {
		if (t == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		downstream.error(t);
	}

	@Override
	public void onComplete() {
		downstream.complete();
	}

	@Override
	public void onRequest(DemandChannel<?> channel, long n) {
		Subscription s = upstream;
		if (s != null) {
			s.request(n);
			return;
		}
		BackpressureUtils.getAndAdd(MISSED_REQUESTED, this, n);
		s = upstream;
		if (s != null) {
			long r = MISSED_REQUESTED.getAndSet(this, 0L);
			if (r > 0L) {
				s.request(r);
			}
		}
	}

	@Override
	public void onCancel(DemandChannel<?> channel) {
		cancelUpstream();
	}

	protected final void cancelUpstream() {
		Subscription s = upstream;
		if (s != null) {
			s.cancel();
		}
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{name='" + name + "', channel=" + downstream + "}";
	}
}
