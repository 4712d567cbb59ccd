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
package sluice.stream.tap;

import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.Test;
import sluice.core.subscriber.TestSubscriber;
import sluice.stream.AbstractMaterializerTest;
import sluice.stream.ManualPublisher;
import sluice.stream.Source;
import sluice.stream.Tap;
import sluice.stream.TapKind;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class TapTests extends AbstractMaterializerTest {

	@Test
	public void factoriesCreateTheMatchingTap() {
		assertThat(kind(Source.from(Collections.emptyList())), is(TapKind.COLLECTION));
		assertThat(kind(Source.fromIterator(Collections.emptyIterator())), is(TapKind.ITERATOR));
		assertThat(kind(Source.fromThunk(Optional::empty)), is(TapKind.THUNK));
		assertThat(kind(Source.fromFuture(new CompletableFuture<>())), is(TapKind.FUTURE));
		assertThat(kind(Source.tick(0, 1, TimeUnit.SECONDS, () -> 1)), is(TapKind.TICK));
		assertThat(kind(Source.fromPublisher(new ManualPublisher<>())), is(TapKind.EXTERNAL));
		assertThat(Source.subscriber().kind(), is(TapKind.EXTERNAL));
	}

	@Test
	public void nullFutureValueCompletesWithoutElement() throws InterruptedException {
		TestSubscriber<String> ts = TestSubscriber.createWithTimeoutSecs(1);
		Source.fromFuture(CompletableFuture.<String>completedFuture(null)).publishTo(ts, materializer);

		ts.assertCompleteReceived();
		assertThat(ts.receivedCount(), is(0));
	}

	@Test
	public void futureFailureIsSignalledWithoutDemand() throws InterruptedException {
		CompletableFuture<String> future = new CompletableFuture<>();
		TestSubscriber<String> ts = TestSubscriber.createWithTimeoutSecs(1);
		Source.fromFuture(future.thenApply(String::trim)).publishTo(ts, materializer);

		future.completeExceptionally(new IllegalArgumentException("failed"));

		ts.assertErrorReceived();
		assertThat("Completion wrapper stripped", ts.getLastError(), instanceOf(IllegalArgumentException.class));
	}

	@Test
	public void failingThunkFailsTheStream() throws InterruptedException {
		TestSubscriber<Integer> ts = TestSubscriber.createWithTimeoutSecs(1);
		Source.<Integer>fromThunk(() -> {
			throw new IllegalStateException("thunk failure");
		}).publishTo(ts, materializer);

		ts.request(1);

		ts.assertErrorReceived();
		assertThat(ts.getLastError(), instanceOf(IllegalStateException.class));
	}

	@Test
	public void publisherTapForwardsDemandOnlyWhenAsked() throws InterruptedException {
		ManualPublisher<Integer> external = new ManualPublisher<>();
		TestSubscriber<Integer> ts = TestSubscriber.createWithTimeoutSecs(1);
		Source.fromPublisher(external).publishTo(ts, materializer);

		assertThat(external.isSubscribed(), is(true));
		assertThat(external.requested(), is(0L));

		ts.request(3);
		assertThat(external.requested(), is(3L));

		external.next(1);
		external.next(2);
		external.complete();

		ts.assertNextSignals(1, 2);
		ts.assertCompleteReceived();
	}

	private static TapKind kind(Source<?> source) {
		return ((Tap<?>) source).kind();
	}
}
