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
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sluice.core.timer.Timer;
import sluice.fn.Cancellable;
import sluice.fn.Supplier;

/**
 * Emits the value of a supplier on every tick of a {@link Timer}. A tick that finds no outstanding demand is
 * dropped, never queued. The stream never completes on its own.
 *
 * @param <T> the element type
 */
public final class TickTapPublisher<T> extends TapPublisher<T> {

	private static final Logger log = LoggerFactory.getLogger(TickTapPublisher.class);

	private final Timer                 timer;
	private final long                  initialDelay;
	private final long                  interval;
	private final TimeUnit              unit;
	private final Supplier<? extends T> tick;

	private volatile Cancellable registration;

	private volatile int pendingTicks;
	@SuppressWarnings("rawtypes")
	private static final AtomicIntegerFieldUpdater<TickTapPublisher> PENDING_TICKS =
			AtomicIntegerFieldUpdater.newUpdater(TickTapPublisher.class, "pendingTicks");

	public TickTapPublisher(String name,
			Executor executor,
			Timer timer,
			long initialDelay,
			long interval,
			TimeUnit unit,
			Supplier<? extends T> tick) {
		super(name, executor);
		this.timer = timer;
		this.initialDelay = initialDelay;
		this.interval = interval;
		this.unit = unit;
		this.tick = tick;
	}

	@Override
	protected void onStart() {
		registration = timer.schedule(now -> onTick(), interval, unit, unit.toMillis(initialDelay));
	}

	void onTick() {
		if (isCancelled()) {
			onTerminate();
			return;
		}
		if (demand() > pendingTicks) {
			PENDING_TICKS.incrementAndGet(this);
			signal();
		}
		else if (log.isTraceEnabled()) {
			log.trace("Tap '{}' dropped a tick, no demand", name);
		}
	}

	@Override
	protected void produce(long n) {
		int ticks = PENDING_TICKS.getAndSet(this, 0);
		for (int i = 0; i < ticks; i++) {
			if (i >= n) {
				log.trace("Tap '{}' dropped a tick, demand was withdrawn", name);
				continue;
			}
			if (!emit(tick.get())) {
				return;
			}
		}
	}

	@Override
	protected void onTerminate() {
		Cancellable r = registration;
		if (r != null) {
			r.cancel();
		}
	}
}
