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

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;
import sluice.core.subscriber.TestSubscriber;
import sluice.core.timer.Timer;
import sluice.stream.AbstractMaterializerTest;
import sluice.stream.ManualTimer;
import sluice.stream.Source;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class TickTapTests extends AbstractMaterializerTest {

	private ManualTimer ticks;

	@Override
	protected Timer createTimer() {
		ticks = new ManualTimer();
		return ticks;
	}

	@Test
	public void ticksWithoutDemandAreDropped() throws InterruptedException {
		AtomicInteger produced = new AtomicInteger();
		TestSubscriber<Integer> ts = TestSubscriber.createWithTimeoutSecs(1);
		Source.<Integer>tick(0, 10, TimeUnit.MILLISECONDS, produced::incrementAndGet).publishTo(ts, materializer);

		ticks.fire();
		assertThat("Dropped tick produced nothing", produced.get(), is(0));

		ts.request(2);
		ticks.fire();
		ticks.fire();
		ticks.fire();

		ts.assertNextSignals(1, 2);
		assertThat(produced.get(), is(2));

		ts.request(1);
		ticks.fire();

		ts.assertNextSignals(1, 2, 3);
		ts.assertNoTerminalSignal(20);
		ts.assertNoViolation();
	}

	@Test
	public void cancelStopsTheTimer() {
		TestSubscriber<String> ts = TestSubscriber.createWithTimeoutSecs(1);
		Source.<String>tick(0, 10, TimeUnit.MILLISECONDS, () -> "tick").publishTo(ts, materializer);
		assertThat(ticks.liveRegistrations(), is(1));

		ts.request(1);
		ticks.fire();
		ts.cancel();

		assertThat(ticks.liveRegistrations(), is(0));
		assertThat(ts.receivedCount(), is(1));
	}

	@Test
	public void nullTickFailsTheStream() throws InterruptedException {
		TestSubscriber<String> ts = TestSubscriber.createWithTimeoutSecs(1);
		Source.<String>tick(0, 10, TimeUnit.MILLISECONDS, () -> null).publishTo(ts, materializer);

		ts.request(1);
		ticks.fire();

		ts.assertErrorReceived();
		assertThat(ticks.liveRegistrations(), is(0));
	}
}
