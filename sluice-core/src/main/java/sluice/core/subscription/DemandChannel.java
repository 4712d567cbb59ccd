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
package sluice.core.subscription;

import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sluice.core.error.Exceptions;
import sluice.core.error.SpecificationExceptions;
import sluice.core.subscriber.SerializedSubscriber;
import sluice.core.support.BackpressureUtils;

/**
 * The producer end of one edge of a running pipeline. The producer owns the channel and pushes elements and at most
 * one terminal signal through it; the single consumer attached to it receives the channel as its
 * {@link Subscription} and pulls with {@link #request(long)}.
 * <p>
 * Guarantees:
 * <ul>
 * <li>outstanding demand is never negative and saturates at {@link Long#MAX_VALUE}, which means unbounded</li>
 * <li>an element is only delivered against outstanding demand, so delivered never exceeds requested</li>
 * <li>a terminal signal recorded before the consumer attached is held and delivered right after
 * {@code onSubscribe}, and is delivered at most once</li>
 * <li>after a terminal signal or a cancellation no element passes</li>
 * </ul>
 * {@link #emit}, {@link #complete} and {@link #error} must be called by one producer at a time. {@link #request}
 * and {@link #cancel} may come from any thread.
 *
 * @param <T> the element type
 */
public class DemandChannel<T> implements Subscription {

	private static final Logger log = LoggerFactory.getLogger(DemandChannel.class);

	private static final Object COMPLETED = new Object();

	private final String         name;
	private final DemandListener listener;

	private volatile SerializedSubscriber<T> subscriber;
	@SuppressWarnings("rawtypes")
	private static final AtomicReferenceFieldUpdater<DemandChannel, SerializedSubscriber> SUBSCRIBER =
			AtomicReferenceFieldUpdater.newUpdater(DemandChannel.class, SerializedSubscriber.class, "subscriber");

	private volatile long requested;
	@SuppressWarnings("rawtypes")
	private static final AtomicLongFieldUpdater<DemandChannel> REQUESTED =
			AtomicLongFieldUpdater.newUpdater(DemandChannel.class, "requested");

	private volatile long delivered;
	@SuppressWarnings("rawtypes")
	private static final AtomicLongFieldUpdater<DemandChannel> DELIVERED_COUNT =
			AtomicLongFieldUpdater.newUpdater(DemandChannel.class, "delivered");

	// null, COMPLETED or the failure
	private volatile Object outcome;
	@SuppressWarnings("rawtypes")
	private static final AtomicReferenceFieldUpdater<DemandChannel, Object> OUTCOME =
			AtomicReferenceFieldUpdater.newUpdater(DemandChannel.class, Object.class, "outcome");

	private volatile int outcomeDelivered;
	@SuppressWarnings("rawtypes")
	private static final AtomicIntegerFieldUpdater<DemandChannel> OUTCOME_DELIVERED =
			AtomicIntegerFieldUpdater.newUpdater(DemandChannel.class, "outcomeDelivered");

	private volatile int cancelled;
	@SuppressWarnings("rawtypes")
	private static final AtomicIntegerFieldUpdater<DemandChannel> CANCELLED =
			AtomicIntegerFieldUpdater.newUpdater(DemandChannel.class, "cancelled");

	private volatile boolean ready;

	private volatile Throwable consumerFailure;

	public DemandChannel(String name, DemandListener listener) {
		this.name = name;
		this.listener = listener;
	}

	/**
	 * Attach the single consumer of this channel, signalling {@code onSubscribe} and then any terminal signal
	 * recorded so far.
	 *
	 * @param s the consumer
	 * @return false if a consumer was already attached, in which case {@code s} has not been signalled
	 */
	@SuppressWarnings("unchecked")
	public boolean attach(Subscriber<? super T> s) {
		if (s == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		SerializedSubscriber<T> serialized = SerializedSubscriber.create(s);
		if (!SUBSCRIBER.compareAndSet(this, null, serialized)) {
			return false;
		}
		try {
			serialized.onSubscribe(this);
		}
		catch (Throwable e) {
			consumerFailed(e);
		}
		ready = true;
		deliverTerminal();
		return true;
	}

	/**
	 * Deliver one element against outstanding demand.
	 *
	 * @param t the element
	 * @return false if the element was discarded because the channel is cancelled or terminated
	 * @throws IllegalStateException if no demand is outstanding
	 */
	public boolean emit(T t) {
		if (t == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		if (cancelled != 0 || outcome != null) {
			return false;
		}
		SerializedSubscriber<T> s = subscriber;
		if (s == null || BackpressureUtils.getAndSub(REQUESTED, this, 1L) == 0L) {
			throw SpecificationExceptions.spec_1_01_exception();
		}
		DELIVERED_COUNT.incrementAndGet(this);
		try {
			s.onNext(t);
		}
		catch (Throwable e) {
			consumerFailed(e);
			return false;
		}
		return true;
	}

	/**
	 * Record completion. Delivered now if a consumer is attached, otherwise right after it attaches.
	 *
	 * @return false if a terminal signal was already recorded or the channel is cancelled
	 */
	public boolean complete() {
		return terminate(COMPLETED);
	}

	/**
	 * Record a failure. Delivered now if a consumer is attached, otherwise right after it attaches.
	 *
	 * @param e the failure
	 * @return false if a terminal signal was already recorded or the channel is cancelled
	 */
	public boolean error(Throwable e) {
		if (e == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		return terminate(e);
	}

	private boolean terminate(Object signal) {
		if (cancelled != 0 || !OUTCOME.compareAndSet(this, null, signal)) {
			return false;
		}
		if (ready) {
			deliverTerminal();
		}
		return true;
	}

	private void deliverTerminal() {
		Object o = outcome;
		if (o != null && OUTCOME_DELIVERED.compareAndSet(this, 0, 1)) {
			SerializedSubscriber<T> s = subscriber;
			try {
				if (o instanceof Throwable) {
					s.onError((Throwable) o);
				}
				else {
					s.onComplete();
				}
			}
			catch (Throwable e) {
				consumerFailed(e);
			}
		}
	}

	private void consumerFailed(Throwable e) {
		Exceptions.throwIfFatal(e);
		log.warn("Consumer of '{}' failed, cancelling", name, e);
		fail(e);
	}

	@Override
	public void request(long n) {
		if (cancelled != 0) {
			return;
		}
		if (n <= 0L) {
			error(SpecificationExceptions.spec_3_09_exception(n));
			cancel();
			return;
		}
		BackpressureUtils.getAndAdd(REQUESTED, this, n);
		listener.onRequest(this, n);
	}

	@Override
	public void cancel() {
		if (CANCELLED.compareAndSet(this, 0, 1)) {
			listener.onCancel(this);
		}
	}

	/**
	 * Cancel on behalf of a consumer that could not go on. The cause is kept for the producer to report, see
	 * {@link #getConsumerFailure()}.
	 *
	 * @param cause the consumer failure
	 */
	public void fail(Throwable cause) {
		if (cancelled == 0 && consumerFailure == null) {
			consumerFailure = cause;
		}
		cancel();
	}

	/**
	 * @return the outstanding demand, {@link Long#MAX_VALUE} meaning unbounded
	 */
	public long demand() {
		return requested;
	}

	public boolean isCancelled() {
		return cancelled != 0;
	}

	/**
	 * @return the recorded failure or null if none
	 */
	public Throwable getError() {
		Object o = outcome;
		return o instanceof Throwable ? (Throwable) o : null;
	}

	/**
	 * @return the failure that made the consumer cancel, null if it cancelled on purpose or is still consuming
	 */
	public Throwable getConsumerFailure() {
		return consumerFailure;
	}

	/**
	 * @return true if no element can pass anymore
	 */
	public boolean isClosed() {
		return cancelled != 0 || outcome != null;
	}

	public String getName() {
		return name;
	}

	@Override
	public String toString() {
		return "DemandChannel{" +
				"name='" + name + "'" +
				", requested=" + requested +
				", delivered=" + delivered +
				", terminated=" + (outcome != null) +
				", cancelled=" + (cancelled != 0) +
				'}';
	}
}
