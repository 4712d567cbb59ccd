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

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import sluice.stream.impl.CompletionProcessor;

/**
 * The handle of one running materialization: its materialized values, its completion and a way to stop it.
 */
public final class MaterializedFlow {

	private final long                   runId;
	private final CompletionProcessor<?> tail;
	private final Map<Object, Object>    values;

	MaterializedFlow(long runId, CompletionProcessor<?> tail, Map<Object, Object> values) {
		this.runId = runId;
		this.tail = tail;
		this.values = values;
	}

	/**
	 * @param sink the terminal sink of the materialized flow
	 * @param <M>  the materialized value type
	 * @return the value the sink materialized for this run
	 * @throws IllegalArgumentException if the sink is not part of this run
	 */
	@SuppressWarnings("unchecked")
	public <M> M get(KeyedSink<?, M> sink) {
		return (M) lookup(sink);
	}

	/**
	 * @param tap the tap of the materialized flow
	 * @param <M> the materialized value type
	 * @return the value the tap materialized for this run
	 * @throws IllegalArgumentException if the tap is not part of this run
	 */
	@SuppressWarnings("unchecked")
	public <M> M get(KeyedTap<?, M> tap) {
		return (M) lookup(tap);
	}

	private Object lookup(Object key) {
		if (!values.containsKey(key)) {
			throw new IllegalArgumentException(key + " is not part of materialized flow " + runId);
		}
		return values.get(key);
	}

	/**
	 * The returned future completes normally when the stream completes or the sink cancels, and exceptionally when
	 * the stream fails or {@link #cancel()} is called.
	 *
	 * @return the completion of this run
	 */
	public CompletableFuture<Void> completion() {
		return tail.completion();
	}

	public boolean isTerminated() {
		return tail.completion().isDone();
	}

	/**
	 * Cancel every stage of this run and fail its sink with a {@link java.util.concurrent.CancellationException}.
	 * Has no effect once the run terminated.
	 */
	public void cancel() {
		tail.abort();
	}

	public long runId() {
		return runId;
	}

	@Override
	public String toString() {
		return "MaterializedFlow{runId=" + runId + ", terminated=" + isTerminated() + "}";
	}
}
