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
package sluice.core.timer;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sluice.core.support.Assert;
import sluice.core.support.NamedDaemonThreadFactory;
import sluice.fn.Cancellable;
import sluice.fn.Consumer;

/**
 * A {@link Timer} driven by a single daemon thread that wakes up every {@code resolution} milliseconds and runs the
 * registrations that are due. Registrations run on the timer thread and must hand long work off.
 * <p>
 * A failing task is logged and stays scheduled.
 */
public class SimpleTimer implements Timer {

	private static final Logger LOG = LoggerFactory.getLogger(SimpleTimer.class);

	private final CopyOnWriteArrayList<TimedRegistration> tasks = new CopyOnWriteArrayList<>();
	private final int    resolution;
	private final Thread loop;

	private volatile boolean cancelled;

	/**
	 * Create a new {@code SimpleTimer} using the default resolution of 10ms.
	 */
	public SimpleTimer() {
		this("sluice-timer", 10);
	}

	/**
	 * Create a new {@code SimpleTimer} using the given timer resolution. All times will be rounded up to the closest
	 * multiple of this resolution.
	 *
	 * @param name       the timer thread name prefix
	 * @param resolution the resolution of this timer, in milliseconds
	 */
	public SimpleTimer(String name, final int resolution) {
		Assert.isTrue(resolution > 0, "Timer resolution must be strictly positive");
		this.resolution = resolution;
		this.loop = new NamedDaemonThreadFactory(name).newThread(this::run);
		this.loop.start();
	}

	private void run() {
		while (!cancelled && !Thread.currentThread().isInterrupted()) {
			long now = now(resolution);
			for (TimedRegistration reg : tasks) {
				if (reg.cancelled) {
					tasks.remove(reg);
					continue;
				}
				if (now < reg.nextRun) {
					continue;
				}
				try {
					reg.consumer.accept(now);
				}
				catch (Throwable t) {
					LOG.error("Timer task {} failed", reg.consumer, t);
				}
				finally {
					reg.nextRun += reg.period;
					if (reg.nextRun < now) {
						// skip the periods missed while the loop was late
						reg.nextRun = now + reg.period;
					}
				}
			}
			try {
				Thread.sleep(resolution);
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return;
			}
		}
	}

	@Override
	public Cancellable schedule(Consumer<Long> consumer, long period, TimeUnit timeUnit, long delayInMilliseconds) {
		Assert.isTrue(!cancelled, "Cannot submit tasks to this timer as it has been cancelled.");
		Assert.notNull(consumer, "A task consumer is required");
		long periodMs = Math.max(resolution, TimeUnit.MILLISECONDS.convert(period, timeUnit));
		TimedRegistration registration =
				new TimedRegistration(consumer, periodMs, now(resolution) + Math.max(0L, delayInMilliseconds));
		tasks.add(registration);
		return registration;
	}

	@Override
	public void cancel() {
		this.cancelled = true;
		this.loop.interrupt();
		this.tasks.clear();
	}

	private static long now(int resolution) {
		long millis = System.currentTimeMillis();
		return ((millis + resolution - 1) / resolution) * resolution;
	}

	static final class TimedRegistration implements Cancellable {

		final Consumer<Long> consumer;
		final long           period;

		// only written by the timer thread
		long nextRun;

		volatile boolean cancelled;

		TimedRegistration(Consumer<Long> consumer, long period, long firstRun) {
			this.consumer = consumer;
			this.period = period;
			this.nextRun = firstRun;
		}

		@Override
		public Cancellable cancel() {
			cancelled = true;
			return this;
		}
	}
}
