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
package sluice.stream;

import java.util.concurrent.atomic.AtomicLong;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import sluice.core.support.BackpressureUtils;

/**
 * A single-subscriber {@link Publisher} driven by the test, recording the demand it receives.
 *
 * @param <T> the element type
 */
public class ManualPublisher<T> implements Publisher<T>, Subscription {

	private final AtomicLong requested = new AtomicLong();

	private volatile Subscriber<? super T> subscriber;
	private volatile boolean               cancelled;

	@Override
	public void subscribe(Subscriber<? super T> s) {
		this.subscriber = s;
		s.onSubscribe(this);
	}

	@Override
	public void request(long n) {
		long r;
		do {
			r = requested.get();
		}
		while (!requested.compareAndSet(r, BackpressureUtils.addOrLongMax(r, n)));
	}

	@Override
	public void cancel() {
		cancelled = true;
	}

	public void next(T t) {
		subscriber.onNext(t);
	}

	public void complete() {
		subscriber.onComplete();
	}

	public void error(Throwable t) {
		subscriber.onError(t);
	}

	/**
	 * @return the sum of every request received
	 */
	public long requested() {
		return requested.get();
	}

	public boolean isCancelled() {
		return cancelled;
	}

	public boolean isSubscribed() {
		return subscriber != null;
	}
}
