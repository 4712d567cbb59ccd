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
package sluice.core.subscriber;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import sluice.core.support.Assert;
import sluice.core.support.BackpressureUtils;
import sluice.fn.Supplier;

/**
 * A {@link Subscriber} that records what it receives and exposes blocking assertions with a timeout. It requests
 * nothing on its own and also records protocol breaches: elements received without demand, elements after a
 * terminal signal and repeated terminal signals.
 *
 * @param <T> the element type
 */
public class TestSubscriber<T> implements Subscriber<T> {

	/**
	 * @param timeoutSecs how long assertions wait for a condition
	 * @param <T>         the element type
	 * @return a new subscriber
	 */
	public static <T> TestSubscriber<T> createWithTimeoutSecs(int timeoutSecs) {
		return new TestSubscriber<>(timeoutSecs);
	}

	/**
	 * Poll a condition until it holds or the timeout elapses.
	 *
	 * @param timeoutSecs          the timeout
	 * @param errorMessageSupplier the message of the {@link AssertionError} raised on timeout
	 * @param conditionSupplier    the condition
	 * @throws InterruptedException if interrupted while waiting
	 */
	public static void waitFor(long timeoutSecs,
			Supplier<String> errorMessageSupplier,
			Supplier<Boolean> conditionSupplier) throws InterruptedException {
		Assert.notNull(errorMessageSupplier, "errorMessageSupplier");
		Assert.notNull(conditionSupplier, "conditionSupplier");
		Assert.isTrue(timeoutSecs > 0, "timeoutSecs must be positive");

		long timeoutNs = TimeUnit.SECONDS.toNanos(timeoutSecs);
		long startTime = System.nanoTime();
		do {
			if (conditionSupplier.get()) {
				return;
			}
			Thread.sleep(10);
		}
		while (System.nanoTime() - startTime < timeoutNs);
		throw new AssertionError(errorMessageSupplier.get());
	}

	public static void waitFor(long timeoutSecs, String errorMessage, Supplier<Boolean> resultSupplier)
			throws InterruptedException {
		waitFor(timeoutSecs, () -> errorMessage, resultSupplier);
	}

	//
	// Instance
	//

	private final List<T>        received       = new ArrayList<>();
	private final List<String>   violations     = new ArrayList<>();
	private final CountDownLatch completeLatch  = new CountDownLatch(1);
	private final CountDownLatch errorLatch     = new CountDownLatch(1);
	private final AtomicInteger  terminalCount  = new AtomicInteger();
	private final int            timeoutSecs;

	private volatile Subscription subscription;
	private volatile Throwable    lastError;

	private volatile long requested;
	@SuppressWarnings("rawtypes")
	private static final AtomicLongFieldUpdater<TestSubscriber> REQUESTED =
			AtomicLongFieldUpdater.newUpdater(TestSubscriber.class, "requested");

	protected TestSubscriber(int timeoutSecs) {
		this.timeoutSecs = timeoutSecs;
	}

	@Override
	public void onSubscribe(Subscription s) {
		if (!BackpressureUtils.checkSubscription(subscription, s)) {
			addViolation("onSubscribe called twice");
			return;
		}
		this.subscription = s;
		long pending = requested;
		if (pending > 0L) {
			s.request(pending);
		}
	}

	@Override
	public void onNext(T t) {
		if (terminalCount.get() != 0) {
			addViolation("onNext after terminal signal: " + t);
		}
		if (BackpressureUtils.getAndSub(REQUESTED, this, 1L) == 0L) {
			addViolation("onNext without demand: " + t);
		}
		synchronized (received) {
			received.add(t);
		}
	}

	@Override
	public void onError(Throwable t) {
		if (terminalCount.incrementAndGet() > 1) {
			addViolation("more than one terminal signal, last onError(" + t + ")");
		}
		this.lastError = t;
		errorLatch.countDown();
	}

	@Override
	public void onComplete() {
		if (terminalCount.incrementAndGet() > 1) {
			addViolation("more than one terminal signal, last onComplete()");
		}
		completeLatch.countDown();
	}

	/**
	 * Request {@code n} elements, or remember them until {@code onSubscribe} if not subscribed yet.
	 *
	 * @param n the demand
	 */
	public void request(long n) {
		if (n > 0L) {
			BackpressureUtils.getAndAdd(REQUESTED, this, n);
		}
		Subscription s = subscription;
		if (s != null) {
			s.request(n);
		}
	}

	public void requestUnbounded() {
		request(Long.MAX_VALUE);
	}

	/**
	 * Wait for {@code onSubscribe} then request.
	 *
	 * @param n the demand
	 * @throws InterruptedException if interrupted while waiting
	 */
	public void requestWithTimeout(long n) throws InterruptedException {
		waitFor(timeoutSecs,
				String.format("onSubscribe wasn't called within %d secs", timeoutSecs),
				() -> subscription != null);
		request(n);
	}

	public void cancel() {
		Subscription s = subscription;
		if (s != null) {
			s.cancel();
		}
	}

	/**
	 * Assert the exact ordered sequence of elements received so far, waiting for their count to be reached.
	 *
	 * @param expected the expected elements
	 * @throws InterruptedException if interrupted while waiting
	 */
	@SafeVarargs
	public final void assertNextSignals(T... expected) throws InterruptedException {
		assertNumNextSignalsReceived(expected.length);
		List<T> snapshot = getReceived();
		if (!snapshot.equals(Arrays.asList(expected))) {
			throw new AssertionError("Expected " + Arrays.asList(expected) + " but received " + snapshot);
		}
	}

	public void assertNumNextSignalsReceived(int n) throws InterruptedException {
		Supplier<String> errorSupplier = () -> String.format("%d out of %d Next signals received within %d secs",
				receivedCount(),
				n,
				timeoutSecs);

		waitFor(timeoutSecs, errorSupplier, () -> receivedCount() == n);
	}

	public void assertCompleteReceived() throws InterruptedException {
		boolean result = completeLatch.await(timeoutSecs, TimeUnit.SECONDS);
		if (!result) {
			throw new AssertionError(String.format("Haven't received Complete signal within %d seconds", timeoutSecs));
		}
	}

	public void assertErrorReceived() throws InterruptedException {
		boolean result = errorLatch.await(timeoutSecs, TimeUnit.SECONDS);
		if (!result) {
			throw new AssertionError(String.format("Haven't received Error signal within %d seconds", timeoutSecs));
		}
	}

	/**
	 * Assert no terminal signal arrives during the given time.
	 *
	 * @param millis how long to watch
	 * @throws InterruptedException if interrupted while waiting
	 */
	public void assertNoTerminalSignal(long millis) throws InterruptedException {
		if (completeLatch.await(millis, TimeUnit.MILLISECONDS) || terminalCount.get() != 0) {
			throw new AssertionError("Unexpected terminal signal, error: " + lastError);
		}
	}

	public void assertNoViolation() {
		synchronized (violations) {
			if (!violations.isEmpty()) {
				throw new AssertionError("Reactive Streams protocol violated: " + violations);
			}
		}
	}

	public List<T> getReceived() {
		synchronized (received) {
			return new ArrayList<>(received);
		}
	}

	public int receivedCount() {
		synchronized (received) {
			return received.size();
		}
	}

	public Throwable getLastError() {
		return lastError;
	}

	public boolean isSubscribed() {
		return subscription != null;
	}

	public boolean isTerminated() {
		return terminalCount.get() != 0;
	}

	public long getRequested() {
		return requested;
	}

	private void addViolation(String violation) {
		synchronized (violations) {
			violations.add(violation);
		}
	}

	@Override
	public String toString() {
		return "TestSubscriber{received=" + receivedCount() + ", error=" + lastError + "}";
	}
}
