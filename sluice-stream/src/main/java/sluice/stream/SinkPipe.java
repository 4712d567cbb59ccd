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
 * A {@link Sink} made of stages in front of a terminal sink.
 */
final class SinkPipe<In> implements Sink<In> {

	private final List<StageDescriptor> stages;
	private final KeyedSink<?, ?>       terminal;

	SinkPipe(List<StageDescriptor> stages, KeyedSink<?, ?> terminal) {
		this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
		this.terminal = terminal;
	}

	@Override
	public List<StageDescriptor> stages() {
		return stages;
	}

	@Override
	public KeyedSink<?, ?> terminal() {
		return terminal;
	}

	@Override
	public String toString() {
		return "Sink" + stages + " -> " + terminal;
	}
}
