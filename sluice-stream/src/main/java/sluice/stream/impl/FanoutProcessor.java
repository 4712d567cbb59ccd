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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import org.reactivestreams.Processor;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sluice.core.error.CompositionException;
import sluice.core.error.Exceptions;
import sluice.core.error.InsufficientCapacityException;
import sluice.core.error.SpecificationExceptions;
import sluice.core.subscription.DemandChannel;
import sluice.core.subscription.DemandListener;
import sluice.core.support.Assert;
import sluice.core.support.BackpressureUtils;
import sluice.core.support.ReactiveState;
import sluice.core.support.Signal;

/**
 * Broadcasts one upstream to any number of subscribers, each behind its own {@link DemandChannel}.
 * <p>
 * Subscribers joining late start at the current end of the shared buffer and never see earlier elements. Upstream
 * is asked for what the most eager subscriber can take, capped to the initial buffer size. A subscriber whose
 * backlog exceeds the maximum buffer size receives an {@link InsufficientCapacityException} and is dropped, the
 * others keep going. Upstream is cancelled once every subscriber is gone.
 * <p>
 * Subscriptions, signals and demand changes are all arbitrated by one drain loop, so no two subscribers are ever
 * served concurrently.
 *
 * @param <T> the element type
 */
public class FanoutProcessor<T> implements Processor<T, T>, DemandListener, ReactiveState.Buffering {

	private static final Logger log = LoggerFactory.getLogger(FanoutProcessor.class);

	private final String   name;
	private final Executor executor;
	private final int      initialBufferSize;
	private final int      maximumBufferSize;

	private final Queue<Signal<T>>  inbox   = new ConcurrentLinkedQueue<>();
	private final Queue<Outlet<T>>  joining = new ConcurrentLinkedQueue<>();
	private final AtomicInteger     outletIds = new AtomicInteger();

	// owned by the drain loop
	private final List<Outlet<T>> outlets = new ArrayList<>();
	private final ArrayList<T>    buffer  = new ArrayList<>();
	private long      base;
	private long      outstanding;
	private boolean   upstreamDone;
	private Throwable upstreamError;
	private boolean   hadSubscribers;
	private boolean   shutDown;

	private volatile Subscription upstream;
	private volatile int          subscriberCount;
	private volatile int          pending;
	private volatile boolean      terminated;

	private volatile int wip;
	@SuppressWarnings("rawtypes")
	private static final AtomicIntegerFieldUpdater<FanoutProcessor> WIP =
			AtomicIntegerFieldUpdater.newUpdater(FanoutProcessor.class, "wip");

	static final class Outlet<T> {
		final DemandChannel<T>      channel;
		final Subscriber<? super T> subscriber;
		long cursor;

		Outlet(DemandChannel<T> channel, Subscriber<? super T> subscriber) {
			this.channel = channel;
			this.subscriber = subscriber;
		}
	}

	public FanoutProcessor(String name, Executor executor, int initialBufferSize, int maximumBufferSize) {
		Assert.notNull(executor, "An executor is required");
		Assert.isTrue(initialBufferSize > 0 && initialBufferSize <= maximumBufferSize,
				"Fan-out buffer sizes must satisfy 0 < initial <= maximum");
		this.name = name;
		this.executor = executor;
		this.initialBufferSize = initialBufferSize;
		this.maximumBufferSize = maximumBufferSize;
	}

	@Override
	public void subscribe(Subscriber<? super T> s) {
		if (s == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		DemandChannel<T> channel = new DemandChannel<>(name + "-" + outletIds.incrementAndGet(), this);
		joining.offer(new Outlet<>(channel, s));
		schedule();
	}

	@Override
	public void onSubscribe(Subscription s) {
		if (BackpressureUtils.checkSubscription(upstream, s)) {
			upstream = s;
			schedule();
		}
	}

	@Override
	public void onNext(T t) {
		inbox.offer(Signal.next(t));
		schedule();
	}

	@Override
	public void onError(Throwable t) {
		inbox.offer(Signal.error(t));
		schedule();
	}

	@Override
	public void onComplete() {
		inbox.offer(Signal.complete());
		schedule();
	}

	@Override
	public void onRequest(DemandChannel<?> channel, long n) {
		schedule();
	}

	@Override
	public void onCancel(DemandChannel<?> channel) {
		schedule();
	}

	private void schedule() {
		if (WIP.getAndIncrement(this) == 0) {
			try {
				executor.execute(this::drain);
			}
			catch (RejectedExecutionException ree) {
				log.debug("Fan-out '{}' executor rejected the drain, running it on the caller", name);
				drain();
			}
		}
	}

	private void drain() {
		int missed = 1;
		for (; ; ) {
			try {
				step();
			}
			catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				failAll(t);
			}
			subscriberCount = outlets.size();
			pending = buffer.size();
			missed = WIP.addAndGet(this, -missed);
			if (missed == 0) {
				break;
			}
		}
	}

	private void step() {
		Outlet<T> joiner;
		while ((joiner = joining.poll()) != null) {
			join(joiner);
		}

		Signal<T> signal;
		while ((signal = inbox.poll()) != null) {
			if (upstreamDone) {
				continue;
			}
			switch (signal.getType()) {
				case NEXT:
					if (outstanding == 0L) {
						upstreamDone = true;
						upstreamError = SpecificationExceptions.spec_1_01_exception();
						cancelUpstream();
						break;
					}
					outstanding--;
					buffer.add(signal.get());
					break;
				case ERROR:
					upstreamDone = true;
					upstreamError = signal.getThrowable();
					break;
				default:
					upstreamDone = true;
			}
		}

		long tail = base + buffer.size();
		Iterator<Outlet<T>> it = outlets.iterator();
		while (it.hasNext()) {
			if (!serve(it.next(), tail)) {
				it.remove();
			}
		}

		long minCursor = tail;
		for (Outlet<T> outlet : outlets) {
			minCursor = Math.min(minCursor, outlet.cursor);
		}
		if (minCursor > base) {
			buffer.subList(0, (int) (minCursor - base)).clear();
			base = minCursor;
		}

		if (outlets.isEmpty()) {
			if (!upstreamDone && hadSubscribers && joining.isEmpty()) {
				log.debug("Fan-out '{}' lost all its subscribers, cancelling upstream", name);
				upstreamDone = true;
				shutDown = true;
				cancelUpstream();
			}
			terminated = upstreamDone;
			return;
		}

		Subscription s = upstream;
		if (s != null && !upstreamDone) {
			long wanted = 0L;
			for (Outlet<T> outlet : outlets) {
				wanted = Math.max(wanted, BackpressureUtils.subOrZero(outlet.channel.demand(), tail - outlet.cursor));
			}
			long toRequest = Math.min(wanted, initialBufferSize) - outstanding;
			if (toRequest > 0L) {
				outstanding += toRequest;
				s.request(toRequest);
			}
		}
	}

	private void join(Outlet<T> outlet) {
		DemandChannel<T> channel = outlet.channel;
		channel.attach(outlet.subscriber);
		if (shutDown) {
			channel.error(CompositionException.shutDown(name));
		}
		else if (upstreamDone && upstreamError != null) {
			channel.error(upstreamError);
		}
		else if (upstreamDone) {
			channel.complete();
		}
		else {
			outlet.cursor = base + buffer.size();
			outlets.add(outlet);
			hadSubscribers = true;
		}
	}

	/**
	 * @return false if the outlet is done and must be removed
	 */
	private boolean serve(Outlet<T> outlet, long tail) {
		DemandChannel<T> channel = outlet.channel;
		if (channel.isClosed()) {
			return false;
		}
		if (upstreamError != null) {
			channel.error(upstreamError);
			return false;
		}
		while (outlet.cursor < tail && channel.demand() > 0L) {
			if (!channel.emit(buffer.get((int) (outlet.cursor - base)))) {
				return false;
			}
			outlet.cursor++;
		}
		if (channel.isClosed()) {
			return false;
		}
		if (upstreamDone && outlet.cursor == tail) {
			channel.complete();
			return false;
		}
		long backlog = tail - outlet.cursor;
		if (backlog > maximumBufferSize) {
			log.warn("Fan-out '{}' dropping subscriber '{}', {} elements behind", name, channel.getName(), backlog);
			channel.error(new InsufficientCapacityException(name, maximumBufferSize));
			return false;
		}
		return true;
	}

	private void failAll(Throwable t) {
		log.debug("Fan-out '{}' failed", name, t);
		if (!upstreamDone) {
			upstreamDone = true;
			cancelUpstream();
		}
		upstreamError = t;
		for (Outlet<T> outlet : outlets) {
			outlet.channel.error(t);
		}
		outlets.clear();
		buffer.clear();
		terminated = true;
	}

	private void cancelUpstream() {
		Subscription s = upstream;
		if (s != null) {
			s.cancel();
		}
	}

	/**
	 * @return the number of subscribers currently served
	 */
	public int subscriberCount() {
		return subscriberCount;
	}

	@Override
	public long pending() {
		return pending;
	}

	/**
	 * @return true once upstream terminated or cancelled
	 */
	public boolean isTerminated() {
		return terminated;
	}

	@Override
	public String toString() {
		return "FanoutProcessor{name='" + name + "', subscribers=" + subscriberCount + "}";
	}
}
