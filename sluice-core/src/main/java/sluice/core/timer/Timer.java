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

import java.util.concurrent.TimeUnit;

import sluice.fn.Cancellable;
import sluice.fn.Consumer;

/**
 * Schedules recurring tasks. Tasks receive the current time in milliseconds, rounded to the timer resolution.
 */
public interface Timer {

	/**
	 * Schedule a recurring task. The given {@link Consumer} will be invoked once every N time units after the given
	 * delay.
	 *
	 * @param consumer            the {@code Consumer} to invoke each period
	 * @param period              the amount of time that should elapse between invocations of the given {@code
	 *                            Consumer}
	 * @param timeUnit            the unit of time the {@code period} is to be measured in
	 * @param delayInMilliseconds a number of milliseconds in which to delay any execution of the given {@code
	 *                            Consumer}
	 * @return a {@link Cancellable} that can be used to cancel the given task.
	 */
	Cancellable schedule(Consumer<Long> consumer, long period, TimeUnit timeUnit, long delayInMilliseconds);

	/**
	 * Cancel this timer. No more tasks can be submitted to this timer after cancellation.
	 */
	void cancel();

}
