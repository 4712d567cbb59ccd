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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import sluice.core.timer.Timer;
import sluice.fn.Cancellable;
import sluice.fn.Consumer;

/**
 * A {@link Timer} only firing when told to.
 */
public class ManualTimer implements Timer {

	private final List<Registration> registrations = new ArrayList<>();

	@Override
	public synchronized Cancellable schedule(Consumer<Long> consumer, long period, TimeUnit timeUnit,
			long delayInMilliseconds) {
		Registration registration = new Registration(consumer);
		registrations.add(registration);
		return registration;
	}

	/**
	 * Run every live registration once.
	 */
	public void fire() {
		List<Registration> live;
		synchronized (this) {
			live = new ArrayList<>(registrations);
		}
		for (Registration registration : live) {
			if (!registration.cancelled) {
				registration.consumer.accept(System.currentTimeMillis());
			}
		}
	}

	public synchronized int liveRegistrations() {
		int live = 0;
		for (Registration registration : registrations) {
			if (!registration.cancelled) {
				live++;
			}
		}
		return live;
	}

	@Override
	public synchronized void cancel() {
		for (Registration registration : registrations) {
			registration.cancel();
		}
	}

	static final class Registration implements Cancellable {

		final Consumer<Long> consumer;

		volatile boolean cancelled;

		Registration(Consumer<Long> consumer) {
			this.consumer = consumer;
		}

		@Override
		public Cancellable cancel() {
			cancelled = true;
			return this;
		}
	}
}
