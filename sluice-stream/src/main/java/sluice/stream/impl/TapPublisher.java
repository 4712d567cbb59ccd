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

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sluice.core.error.CompositionException;
import sluice.core.error.Exceptions;
import sluice.core.subscription.DemandChannel;
import sluice.core.subscription.DemandListener;
import sluice.core.subscription.EmptySubscription;

/**
 * The live producer of a tap: a single-subscriber {@link Publisher} pushing through its {@link DemandChannel}.
 * <p>
 * Subclasses implement {@link #produce(long)}, which runs inside a drain loop scheduled on the executor each time
 * demand changes or {@link #signal()} is called, and may call {@link #emit}, {@link #complete} and {@link #fail}
 * from there only.
 *
 * @param <T> the produced element type
 */
public abstract class TapPublisher<T> implements Publisher<T>, DemandListener {

	private static final Logger log = LoggerFactory.getLogger(TapPublisher.class);

	protected final String name;

	private final Executor         executor;
	private final DemandChannel<T> channel;

	// owned by the drain loop
	private boolean terminated;

	private volatile int wip;
	@SuppressWarnings("rawtypes")
	private static final AtomicIntegerFieldUpdater<TapPublisher> WIP =
			AtomicIntegerFieldUpdater.newUpdater(TapPublisher.class, "wip");

	protected TapPublisher(String name, Executor executor) {
		this.name = name;
		this.executor = executor;
		this.channel = new DemandChannel<>(name, this);
	}

	@Override
	public final void subscribe(Subscriber<? super T> s) {
		if (!channel.attach(s)) {
			EmptySubscription.error(s, CompositionException.duplicateSubscriber(name));
			return;
		}
		onStart();
		signal();
	}

	/**
	 * Called once the consumer is attached, before the first drain.
	 */
	protected void onStart() {
	}

	/**
	 * Produce at most {@code n} elements.
	 *
	 * @param n the outstanding demand, possibly 0
	 */
	protected abstract void produce(long n);

	/**
	 * Called once when the producer terminates, whether it completed, failed or was cancelled.
	 */
	protected void onTerminate() {
	}

	@Override
	public void onRequest(DemandChannel<?> c, long n) {
		signal();
	}

	@Override
	public void onCancel(DemandChannel<?> c) {
		signal();
	}

	/**
	 * Schedule a drain pass.
	 */
	protected final void signal() {
		if (WIP.getAndIncrement(this) == 0) {
			try {
				executor.execute(this::drain);
			}
			catch (RejectedExecutionException ree) {
				log.debug("Tap '{}' executor rejected the drain, running it on the caller", name);
				drain();
			}
		}
	}

	private void drain() {
		int missed = 1;
		for (; ; ) {
			if (!terminated) {
				if (channel.isCancelled()) {
					log.debug("Tap '{}' cancelled", name);
					terminate();
				}
				else {
					try {
						produce(channel.demand());
					}
					catch (Throwable t) {
						Exceptions.throwIfFatal(t);
						fail(t);
					}
				}
			}
			missed = WIP.addAndGet(this, -missed);
			if (missed == 0) {
				break;
			}
		}
	}

	protected final boolean emit(T t) {
		return !terminated && channel.emit(t);
	}

	protected final void complete() {
		if (!terminated) {
			channel.complete();
			terminate();
		}
	}

	protected final void fail(Throwable t) {
		if (!terminated) {
			log.debug("Tap '{}' failed", name, t);
			channel.error(t);
			terminate();
		}
	}

	protected final boolean isCancelled() {
		return channel.isCancelled();
	}

	protected final long demand() {
		return channel.demand();
	}

	private void terminate() {
		terminated = true;
		onTerminate();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{name='" + name + "', channel=" + channel + "}";
	}
}
