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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Test;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscription;
import sluice.core.subscriber.TestSubscriber;
import sluice.stream.sink.FoldSink;
import sluice.stream.sink.ListSink;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertTrue;

/**
 * Runs flows on the materializer's own threads.
 */
public class MaterializerTests {

	private final Materializer materializer = Materializer.create(MaterializerSettings.create()
	                                                                                  .withExecutor("test-flows", 4)
	                                                                                  .withTimerResolution(5));

	@After
	public void shutdown() {
		materializer.shutdown();
	}

	@Test
	public void largeStreamIsDeliveredInOrderAcrossThreads() throws Exception {
		List<Integer> numbers = new ArrayList<>();
		for (int i = 0; i < 10000; i++) {
			numbers.add(i);
		}
		FoldSink<Integer, Long> sum = Sink.fold(0L, (acc, i) -> acc + i);
		TestSubscriber<Integer> ts = TestSubscriber.createWithTimeoutSecs(5);

		MaterializedFlow folded = Source.from(numbers).map(i -> i * 2).connect(sum).run(materializer);
		Source.from(numbers).map(i -> i + 1).publishTo(ts, materializer);
		ts.requestUnbounded();

		assertThat(folded.get(sum).get(5, TimeUnit.SECONDS), is(99990000L));
		ts.assertNumNextSignalsReceived(10000);
		ts.assertCompleteReceived();
		ts.assertNoViolation();
		List<Integer> received = ts.getReceived();
		for (int i = 0; i < received.size(); i++) {
			assertThat(received.get(i), is(i + 1));
		}
	}

	@Test
	public void elementsWaitForOnSubscribeToReturn() throws InterruptedException {
		AtomicBoolean subscribing = new AtomicBoolean();
		AtomicInteger overlapping = new AtomicInteger();
		TestSubscriber<Integer> ts = new TestSubscriber<Integer>(5) {
			@Override
			public void onSubscribe(Subscription s) {
				subscribing.set(true);
				super.onSubscribe(s);
				request(10);
				try {
					Thread.sleep(200);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				subscribing.set(false);
			}

			@Override
			public void onNext(Integer i) {
				if (subscribing.get()) {
					overlapping.incrementAndGet();
				}
				super.onNext(i);
			}
		};

		Publisher<Integer> publisher = Source.from(Arrays.asList(1, 2, 3)).map(i -> i).toPublisher(materializer);
		publisher.subscribe(ts);

		ts.assertNextSignals(1, 2, 3);
		ts.assertCompleteReceived();
		ts.assertNoViolation();
		assertThat("onNext overlapped onSubscribe", overlapping.get(), is(0));
	}

	@Test
	public void concurrentRunsOfOneFlowAreIsolated() throws Exception {
		List<String> letters = new ArrayList<>();
		List<String> expected = new ArrayList<>();
		for (int i = 0; i < 50; i++) {
			letters.add("e" + i);
			expected.add(i + ":e" + i);
		}
		ListSink<String> sink = Sink.toList();
		RunnableFlow flow = Source.from(letters)
		                          .transform("index", SourceTests.IndexTransformer::new)
		                          .connect(sink);

		List<Callable<List<String>>> runs = new ArrayList<>();
		for (int i = 0; i < 200; i++) {
			runs.add(() -> flow.run(materializer).get(sink).get(5, TimeUnit.SECONDS));
		}

		ExecutorService callers = Executors.newFixedThreadPool(4);
		try {
			for (Future<List<String>> result : callers.invokeAll(runs)) {
				assertThat(result.get(), is(expected));
			}
		}
		finally {
			callers.shutdownNow();
		}
	}

	@Test
	public void tickerEmitsOnTheTimerThread() throws InterruptedException {
		TestSubscriber<String> ts = TestSubscriber.createWithTimeoutSecs(2);
		MaterializedFlow run = Source.<String>tick(0, 10, TimeUnit.MILLISECONDS, () -> "tick")
		                             .publishTo(ts, materializer);

		ts.request(3);
		ts.assertNextSignals("tick", "tick", "tick");
		ts.cancel();

		TestSubscriber.waitFor(2, "Flow did not end", () -> run.isTerminated());
		ts.assertNoViolation();
	}

	@Test
	public void shutdownRefusesNewFlows() {
		materializer.shutdown();

		assertTrue(materializer.isShutdown());
		try {
			Source.from(Collections.singletonList(1)).consume(materializer);
		}
		catch (IllegalStateException expected) {
			return;
		}
		throw new AssertionError("Shut down materializer must refuse flows");
	}
}
