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
package sluice.core.timer;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Test;
import sluice.fn.Cancellable;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertTrue;

public class SimpleTimerTests {

	private final SimpleTimer timer = new SimpleTimer("test-timer", 5);

	@After
	public void cleanup() {
		timer.cancel();
	}

	@Test
	public void periodicTaskRunsRepeatedly() throws InterruptedException {
		CountDownLatch ticks = new CountDownLatch(3);
		timer.schedule(now -> ticks.countDown(), 10, TimeUnit.MILLISECONDS, 0);

		assertTrue("Three ticks within a second", ticks.await(1, TimeUnit.SECONDS));
	}

	@Test
	public void failingTaskKeepsBeingScheduled() throws InterruptedException {
		CountDownLatch ticks = new CountDownLatch(2);
		timer.schedule(now -> {
			ticks.countDown();
			throw new IllegalStateException("task failure");
		}, 10, TimeUnit.MILLISECONDS, 0);

		assertTrue(ticks.await(1, TimeUnit.SECONDS));
	}

	@Test
	public void firstRunWaitsForTheDelay() throws InterruptedException {
		AtomicInteger runs = new AtomicInteger();
		CountDownLatch ran = new CountDownLatch(1);
		timer.schedule(now -> {
			runs.incrementAndGet();
			ran.countDown();
		}, 10, TimeUnit.MILLISECONDS, 200);

		Thread.sleep(50);
		assertThat("Still delayed", runs.get(), is(0));
		assertTrue(ran.await(1, TimeUnit.SECONDS));
	}

	@Test
	public void cancelledRegistrationStopsRunning() throws InterruptedException {
		AtomicInteger runs = new AtomicInteger();
		CountDownLatch first = new CountDownLatch(1);
		Cancellable registration = timer.schedule(now -> {
			runs.incrementAndGet();
			first.countDown();
		}, 10, TimeUnit.MILLISECONDS, 0);

		assertTrue(first.await(1, TimeUnit.SECONDS));
		registration.cancel();
		Thread.sleep(50);
		int afterCancel = runs.get();
		Thread.sleep(100);

		assertThat(runs.get(), is(afterCancel));
	}

	@Test(expected = IllegalArgumentException.class)
	public void cancelledTimerRefusesTasks() {
		timer.cancel();
		timer.schedule(now -> {
		}, 10, TimeUnit.MILLISECONDS, 0);
	}
}
