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
package sluice.stream.sink;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;
import sluice.core.error.Exceptions;
import sluice.stream.AbstractMaterializerTest;
import sluice.stream.ManualPublisher;
import sluice.stream.MaterializedFlow;
import sluice.stream.MaterializerSettings;
import sluice.stream.Sink;
import sluice.stream.Source;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SinkTests extends AbstractMaterializerTest {

	@Override
	protected MaterializerSettings settings() {
		return MaterializerSettings.create().withInputBuffer(2, 4);
	}

	@Test
	public void foldAccumulatesEveryElement() throws Exception {
		FoldSink<Integer, Integer> sink = Sink.fold(0, (sum, i) -> sum + i);
		MaterializedFlow run = Source.from(Arrays.asList(1, 2, 3, 4)).connect(sink).run(materializer);

		assertThat(run.get(sink).get(1, TimeUnit.SECONDS), is(10));
	}

	@Test
	public void foldStartsFromZeroOnEveryRun() throws Exception {
		FoldSink<String, String> sink = Sink.fold("", (acc, s) -> acc + s);
		Source<String> source = Source.from(Arrays.asList("a", "b"));

		assertThat(source.connect(sink).run(materializer).get(sink).get(1, TimeUnit.SECONDS), is("ab"));
		assertThat(source.connect(sink).run(materializer).get(sink).get(1, TimeUnit.SECONDS), is("ab"));
	}

	@Test
	public void foreachSeesEveryElement() throws Exception {
		List<Integer> seen = new CopyOnWriteArrayList<>();
		ForeachSink<Integer> sink = Sink.foreach(seen::add);
		MaterializedFlow run = Source.from(Arrays.asList(1, 2, 3)).connect(sink).run(materializer);

		run.get(sink).get(1, TimeUnit.SECONDS);
		assertThat(seen, is(Arrays.asList(1, 2, 3)));
	}

	@Test
	public void foreachFailureFailsTheRun() throws Exception {
		ManualPublisher<Integer> upstream = new ManualPublisher<>();
		ForeachSink<Integer> sink = Sink.foreach(i -> {
			throw new IllegalStateException("consumer failure");
		});
		MaterializedFlow run = Source.fromPublisher(upstream).connect(sink).run(materializer);

		upstream.next(1);

		try {
			run.get(sink).get(1, TimeUnit.SECONDS);
			fail("Consumer failure expected");
		}
		catch (ExecutionException ee) {
			assertThat(ee.getCause(), instanceOf(IllegalStateException.class));
			assertThat(Exceptions.getFinalValueCause(ee.getCause()), is((Object) 1));
		}
		assertTrue(upstream.isCancelled());
		try {
			run.completion().get(1, TimeUnit.SECONDS);
			fail("Consumer failure must fail the run");
		}
		catch (ExecutionException ee) {
			assertThat(ee.getCause(), instanceOf(IllegalStateException.class));
		}
	}

	@Test
	public void foldFailureFailsTheRunWithTheFailingElement() throws Exception {
		FoldSink<Integer, Integer> sink = Sink.fold(0, (sum, i) -> {
			if (i == 2) {
				throw new IllegalArgumentException("no twos");
			}
			return sum + i;
		});
		MaterializedFlow run = Source.from(Arrays.asList(1, 2, 3)).connect(sink).run(materializer);

		assertTrue(run.get(sink).isCompletedExceptionally());
		try {
			run.completion().get(1, TimeUnit.SECONDS);
			fail("Fold failure must fail the run");
		}
		catch (ExecutionException ee) {
			assertThat(ee.getCause(), instanceOf(IllegalArgumentException.class));
			assertThat(Exceptions.getFinalValueCause(ee.getCause()), is((Object) 2));
		}
	}

	@Test
	public void headCancellationEndsTheRunNormally() throws Exception {
		ManualPublisher<Integer> upstream = new ManualPublisher<>();
		HeadSink<Integer> sink = Sink.first();
		MaterializedFlow run = Source.fromPublisher(upstream).connect(sink).run(materializer);

		upstream.next(7);

		assertThat(run.get(sink).get(1, TimeUnit.SECONDS), is(7));
		assertTrue(upstream.isCancelled());
		run.completion().get(1, TimeUnit.SECONDS);
		assertFalse(run.completion().isCompletedExceptionally());
	}

	@Test
	public void headCompletesWithTheFirstElementAndCancels() throws Exception {
		AtomicInteger calls = new AtomicInteger();
		HeadSink<Integer> sink = Sink.first();
		MaterializedFlow run = Source.<Integer>fromThunk(() -> Optional.of(calls.incrementAndGet()))
		                             .connect(sink)
		                             .run(materializer);

		assertThat(run.get(sink).get(1, TimeUnit.SECONDS), is(1));
		run.completion().get(1, TimeUnit.SECONDS);
		assertThat("Only the requested element was produced", calls.get(), is(1));
	}

	@Test
	public void headOfAnEmptyStreamFails() throws Exception {
		HeadSink<Integer> sink = Sink.first();
		CompletableFuture<Integer> head = Source.from(Collections.<Integer>emptyList())
		                                        .connect(sink)
		                                        .run(materializer)
		                                        .get(sink);
		try {
			head.get(1, TimeUnit.SECONDS);
			fail("Empty stream has no head");
		}
		catch (ExecutionException ee) {
			assertThat(ee.getCause(), instanceOf(NoSuchElementException.class));
		}
	}

	@Test
	public void upstreamFailureFailsTheResult() throws Exception {
		ManualPublisher<Integer> upstream = new ManualPublisher<>();
		ListSink<Integer> sink = Sink.toList();
		MaterializedFlow run = Source.fromPublisher(upstream).connect(sink).run(materializer);

		upstream.next(1);
		upstream.error(new IllegalArgumentException("upstream failure"));

		assertTrue(run.get(sink).isCompletedExceptionally());
		assertTrue(run.completion().isCompletedExceptionally());
	}

	@Test
	public void demandIsReplenishedAtHalfTheBatch() {
		ManualPublisher<Integer> upstream = new ManualPublisher<>();
		ListSink<Integer> sink = Sink.toList();
		Source.fromPublisher(upstream).connect(sink).run(materializer);

		assertThat("First batch", upstream.requested(), is(4L));

		upstream.next(1);
		assertThat(upstream.requested(), is(4L));

		upstream.next(2);
		assertThat("Half the batch consumed", upstream.requested(), is(6L));
	}

	@Test
	public void blackholeRequestsEverything() throws Exception {
		ManualPublisher<Integer> upstream = new ManualPublisher<>();
		MaterializedFlow run = Source.fromPublisher(upstream).consume(materializer);

		assertThat(upstream.requested(), is(Long.MAX_VALUE));

		upstream.next(1);
		upstream.complete();

		run.completion().get(1, TimeUnit.SECONDS);
	}
}
