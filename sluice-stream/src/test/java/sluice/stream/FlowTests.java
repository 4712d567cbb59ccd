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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.Test;
import sluice.stream.sink.ListSink;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class FlowTests extends AbstractMaterializerTest {

	@Test
	public void combinatorsLeaveTheOriginalFlowUntouched() {
		Flow<Integer, Integer> identity = Flow.create();
		Flow<Integer, String> mapped = identity.map(i -> "#" + i);

		assertThat(identity.stages().size(), is(0));
		assertThat(mapped.stages().size(), is(1));
		assertThat(mapped.stages().get(0).name(), is("map"));
	}

	@Test
	public void flowsAreConcatenated() {
		Flow<Integer, Integer> doubled = Flow.<Integer>create().map(i -> i * 2);
		Flow<Integer, String> printed = Flow.<Integer>create().transform("print", PrintTransformer::new);

		Flow<Integer, String> both = doubled.connect(printed);

		assertThat(both.stages().size(), is(2));
		assertThat(both.stages().get(1).name(), is("print"));
	}

	@Test
	public void flowCanBeReusedAcrossSources() throws Exception {
		Flow<Integer, String> flow = Flow.<Integer>create().map(i -> i * 2).transform("print", PrintTransformer::new);

		ListSink<String> sink = Sink.toList();
		MaterializedFlow first = Source.from(Arrays.asList(1, 2)).connect(flow).connect(sink).run(materializer);
		MaterializedFlow second = Source.from(Arrays.asList(5)).connect(flow).connect(sink).run(materializer);

		assertThat(first.get(sink).get(1, TimeUnit.SECONDS), is(Arrays.asList("<2>", "<4>")));
		assertThat(second.get(sink).get(1, TimeUnit.SECONDS), is(Collections.singletonList("<10>")));
	}

	@Test
	public void flowCanBeConnectedToASink() throws Exception {
		ListSink<String> list = Sink.toList();
		Sink<Integer> sink = Flow.<Integer>create().transform("print", PrintTransformer::new).connect(list);

		MaterializedFlow run = Source.from(Arrays.asList(1, 2, 3)).connect(sink).run(materializer);

		assertThat(run.get(list).get(1, TimeUnit.SECONDS), is(Arrays.asList("<1>", "<2>", "<3>")));
	}

	@Test
	public void transformerCanEmitSeveralElementsAndTrailingOnes() throws Exception {
		ListSink<Integer> sink = Sink.toList();
		MaterializedFlow run = Source.from(Arrays.asList(1, 2, 3))
		                             .transform("repeat", RepeatTransformer::new)
		                             .connect(sink)
		                             .run(materializer);

		assertThat(run.get(sink).get(1, TimeUnit.SECONDS), is(Arrays.asList(1, 1, 2, 2, 3, 3, 0)));
	}

	@Test
	public void completeTransformerStopsTheStream() throws Exception {
		ListSink<Integer> sink = Sink.toList();
		MaterializedFlow run = Source.from(Arrays.asList(1, 2, 3, 4, 5, 6, 7, 8, 9, 10))
		                             .transform("take", () -> new TakeTransformer<Integer>(3))
		                             .connect(sink)
		                             .run(materializer);

		assertThat(run.get(sink).get(1, TimeUnit.SECONDS), is(Arrays.asList(1, 2, 3)));
		run.completion().get(1, TimeUnit.SECONDS);
	}

	static final class PrintTransformer extends Transformer<Integer, String> {

		@Override
		public List<String> onNext(Integer element) {
			return Collections.singletonList("<" + element + ">");
		}
	}

	static final class RepeatTransformer extends Transformer<Integer, Integer> {

		@Override
		public List<Integer> onNext(Integer element) {
			return Arrays.asList(element, element);
		}

		@Override
		public List<Integer> onTermination() {
			return Collections.singletonList(0);
		}
	}

	static final class TakeTransformer<T> extends Transformer<T, T> {

		private int remaining;

		TakeTransformer(int count) {
			this.remaining = count;
		}

		@Override
		public List<T> onNext(T element) {
			remaining--;
			return Collections.singletonList(element);
		}

		@Override
		public boolean isComplete() {
			return remaining <= 0;
		}
	}
}
