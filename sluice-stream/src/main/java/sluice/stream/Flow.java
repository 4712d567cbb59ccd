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

import java.util.Collections;
import java.util.List;

import sluice.fn.Function;
import sluice.fn.Supplier;

/**
 * An open chain of processing stages with one input and one output. A flow describes work and runs nothing, and
 * every combinator returns a new flow leaving this one untouched.
 *
 * @param <In>  the type of elements accepted
 * @param <Out> the type of elements produced
 */
public interface Flow<In, Out> {

	/**
	 * @param <T> the element type
	 * @return an identity flow, without any stage
	 */
	static <T> Flow<T, T> create() {
		return new Pipe<>(Collections.<StageDescriptor>emptyList());
	}

	/**
	 * Append a flow after this one.
	 *
	 * @param flow the downstream flow
	 * @param <T>  the new output type
	 * @return a new flow
	 */
	<T> Flow<In, T> connect(Flow<? super Out, T> flow);

	/**
	 * Terminate this flow with a sink.
	 *
	 * @param sink the sink
	 * @return a sink accepting this flow's input
	 */
	Sink<In> connect(Sink<? super Out> sink);

	/**
	 * @return the ordered stage descriptors of this flow
	 */
	List<StageDescriptor> stages();

	default <T> Flow<In, T> transform(String name, Supplier<? extends Transformer<? super Out, ? extends T>> factory) {
		return connect(new Pipe<Out, T>(Collections.singletonList(new StageDescriptor(name, factory))));
	}

	default <T> Flow<In, T> map(Function<? super Out, ? extends T> mapper) {
		return transform("map", () -> new MapTransformer<Out, T>(mapper));
	}
}
