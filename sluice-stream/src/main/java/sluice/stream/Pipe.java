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

/**
 * The {@link Flow} implementation: an immutable list of stage descriptors.
 */
final class Pipe<In, Out> implements Flow<In, Out> {

	private final List<StageDescriptor> stages;

	Pipe(List<StageDescriptor> stages) {
		this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
	}

	@Override
	public <T> Flow<In, T> connect(Flow<? super Out, T> flow) {
		return new Pipe<>(concat(stages, flow.stages()));
	}

	@Override
	public Sink<In> connect(Sink<? super Out> sink) {
		return new SinkPipe<>(concat(stages, sink.stages()), sink.terminal());
	}

	@Override
	public List<StageDescriptor> stages() {
		return stages;
	}

	static List<StageDescriptor> concat(List<StageDescriptor> first, List<StageDescriptor> second) {
		List<StageDescriptor> all = new ArrayList<>(first.size() + second.size());
		all.addAll(first);
		all.addAll(second);
		return all;
	}

	@Override
	public String toString() {
		return "Flow" + stages;
	}
}
