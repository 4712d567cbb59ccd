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

import java.util.concurrent.Executor;

import sluice.core.support.Assert;
import sluice.core.timer.Timer;

/**
 * Turns a {@link RunnableFlow} into running stages. Materializations share the executor and the timer of their
 * materializer and nothing else.
 */
public abstract class Materializer {

	/**
	 * @return a materializer configured from {@link MaterializerSettings#fromConfiguration()}, owning its threads
	 */
	public static Materializer create() {
		return create(MaterializerSettings.fromConfiguration());
	}

	/**
	 * @param settings the settings
	 * @return a materializer owning a thread pool and a timer sized from the settings
	 */
	public static Materializer create(MaterializerSettings settings) {
		Assert.notNull(settings, "Settings are required");
		return new ExecutorMaterializer(settings);
	}

	/**
	 * @param settings the settings
	 * @param executor the executor running the stages, left running on {@link #shutdown()}
	 * @param timer    the timer driving tick taps, left running on {@link #shutdown()}
	 * @return a materializer using the given resources
	 */
	public static Materializer create(MaterializerSettings settings, Executor executor, Timer timer) {
		Assert.notNull(settings, "Settings are required");
		Assert.notNull(executor, "An executor is required");
		Assert.notNull(timer, "A timer is required");
		return new ExecutorMaterializer(settings, executor, timer);
	}

	/**
	 * Start a new independent run of a flow.
	 *
	 * @param flow the flow
	 * @return the running flow
	 * @throws IllegalStateException if this materializer was shut down
	 */
	public abstract MaterializedFlow materialize(RunnableFlow flow);

	public abstract MaterializerSettings settings();

	/**
	 * Release the threads this materializer owns. Running flows are not cancelled.
	 */
	public abstract void shutdown();

	public abstract boolean isShutdown();
}
