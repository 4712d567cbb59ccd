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
import java.util.Collections;
import java.util.List;

import sluice.core.error.CompositionException;
import sluice.core.support.Assert;

/**
 * A closed pipeline: a tap, stages and a terminal sink. It cannot be extended, only materialized, any number of
 * times, each materialization running independently of the others.
 */
public final class RunnableFlow {

	private final Tap<?>                tap;
	private final List<StageDescriptor> stages;
	private final KeyedSink<?, ?>       sink;

	RunnableFlow(Tap<?> tap, List<StageDescriptor> stages, KeyedSink<?, ?> sink) {
		Assert.notNull(tap, "A tap is required");
		Assert.notNull(sink, "A sink is required");
		this.tap = tap;
		this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
		this.sink = sink;
	}

	/**
	 * Start a new independent run of this flow.
	 *
	 * @param materializer the materializer
	 * @return the running flow
	 */
	public MaterializedFlow run(Materializer materializer) {
		Assert.notNull(materializer, "A materializer is required");
		return materializer.materialize(this);
	}

	/**
	 * Always fails: a runnable flow is closed.
	 *
	 * @param flow ignored
	 * @return never
	 * @throws CompositionException always
	 */
	public RunnableFlow connect(Flow<?, ?> flow) {
		throw CompositionException.alreadyClosed();
	}

	/**
	 * Always fails: a runnable flow is closed.
	 *
	 * @param sink ignored
	 * @return never
	 * @throws CompositionException always
	 */
	public RunnableFlow connect(Sink<?> sink) {
		throw CompositionException.alreadyClosed();
	}

	public Tap<?> tap() {
		return tap;
	}

	public List<StageDescriptor> stages() {
		return stages;
	}

	public KeyedSink<?, ?> sink() {
		return sink;
	}

	@Override
	public String toString() {
		return "RunnableFlow{" + tap + " -> " + stages + " -> " + sink + "}";
	}
}
