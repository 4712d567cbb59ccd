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

import org.reactivestreams.Publisher;

/**
 * The originating end of a pipeline. Each materialization asks the tap for a fresh live {@link Publisher}.
 *
 * @param <Out> the type of elements produced
 */
public abstract class Tap<Out> implements Source<Out> {

	/**
	 * @return the variant of this tap
	 */
	public abstract TapKind kind();

	/**
	 * Create the live producer for one materialization.
	 *
	 * @param context the materialization
	 * @return a single-subscriber publisher
	 */
	protected abstract Publisher<Out> create(MaterializationContext context);

	@Override
	public <T> Source<T> connect(Flow<? super Out, T> flow) {
		return new SourcePipe<>(this, flow.stages());
	}

	@Override
	public RunnableFlow connect(Sink<? super Out> sink) {
		return new RunnableFlow(this, sink.stages(), sink.terminal());
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{" + kind() + "}";
	}
}
