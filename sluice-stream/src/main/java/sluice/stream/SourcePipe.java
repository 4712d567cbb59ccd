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
 * A {@link Source} made of a tap followed by stages.
 */
final class SourcePipe<Out> implements Source<Out> {

	private final Tap<?>                tap;
	private final List<StageDescriptor> stages;

	SourcePipe(Tap<?> tap, List<StageDescriptor> stages) {
		this.tap = tap;
		this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
	}

	@Override
	public <T> Source<T> connect(Flow<? super Out, T> flow) {
		return new SourcePipe<>(tap, Pipe.concat(stages, flow.stages()));
	}

	@Override
	public RunnableFlow connect(Sink<? super Out> sink) {
		return new RunnableFlow(tap, Pipe.concat(stages, sink.stages()), sink.terminal());
	}

	@Override
	public String toString() {
		return "Source(" + tap + ")" + stages;
	}
}
