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

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a live processing stage.
 * <pre>
 * IDLE -&gt; DEMANDING -&gt; PROCESSING -&gt; IDLE | DEMANDING
 * any non terminal state -&gt; COMPLETING -&gt; COMPLETED
 * any non terminal state -&gt; FAILED | CANCELLED
 * </pre>
 */
public enum StageState {

	/**
	 * Nothing requested from upstream and nothing to process.
	 */
	IDLE,
	/**
	 * Waiting for elements requested from upstream.
	 */
	DEMANDING,
	/**
	 * Transforming a received element.
	 */
	PROCESSING,
	/**
	 * Upstream is done, flushing what is left before completing downstream.
	 */
	COMPLETING,
	COMPLETED,
	FAILED,
	CANCELLED;

	private static final Set<StageState> RUNNING = EnumSet.of(IDLE, DEMANDING, PROCESSING);

	public boolean isTerminal() {
		return this == COMPLETED || this == FAILED || this == CANCELLED;
	}

	/**
	 * @param next the candidate state
	 * @return true if a stage in this state may move to {@code next}
	 */
	public boolean canTransitionTo(StageState next) {
		switch (this) {
			case IDLE:
			case DEMANDING:
			case PROCESSING:
				return next != COMPLETED;
			case COMPLETING:
				return next == COMPLETED || next == FAILED || next == CANCELLED;
			default:
				return false;
		}
	}

	public boolean isRunning() {
		return RUNNING.contains(this);
	}
}
