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

import sluice.core.timer.Timer;
import sluice.stream.impl.CompletionProcessor;

/**
 * What taps and sinks get to know about the materialization creating them.
 */
public final class MaterializationContext {

	private final long                 runId;
	private final Executor             executor;
	private final Timer                timer;
	private final MaterializerSettings        settings;
	private final CompletionProcessor<Object> tail;

	MaterializationContext(long runId, Executor executor, Timer timer, MaterializerSettings settings) {
		this.runId = runId;
		this.executor = executor;
		this.timer = timer;
		this.settings = settings;
		this.tail = new CompletionProcessor<>(nameFor("sink"));
	}

	public long runId() {
		return runId;
	}

	public Executor executor() {
		return executor;
	}

	public Timer timer() {
		return timer;
	}

	public MaterializerSettings settings() {
		return settings;
	}

	/**
	 * Fail the run on behalf of a sink that stopped consuming because of {@code cause}. No effect once the run has
	 * ended.
	 *
	 * @param cause the sink failure
	 */
	public void failRun(Throwable cause) {
		tail.fail(cause);
	}

	CompletionProcessor<Object> tail() {
		return tail;
	}

	/**
	 * @param component a component of the run
	 * @return a name unique to this run, used in logs and errors
	 */
	public String nameFor(String component) {
		return "flow-" + runId + "-" + component;
	}
}
