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

import org.reactivestreams.Publisher;

/**
 * A terminal sink producing a value per materialization, retrieved with {@link MaterializedFlow#get(KeyedSink)}.
 *
 * @param <In> the type of elements accepted
 * @param <M>  the materialized value type
 */
public abstract class KeyedSink<In, M> implements Sink<In> {

	@Override
	public final List<StageDescriptor> stages() {
		return Collections.emptyList();
	}

	@Override
	public final KeyedSink<?, ?> terminal() {
		return this;
	}

	/**
	 * Subscribe this sink to the end of a materialized flow.
	 *
	 * @param publisher the single-subscriber output of the flow
	 * @param context   the materialization
	 * @return the materialized value
	 */
	protected abstract M attach(Publisher<In> publisher, MaterializationContext context);

	@Override
	public String toString() {
		return getClass().getSimpleName();
	}
}
