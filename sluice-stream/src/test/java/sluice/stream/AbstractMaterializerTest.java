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

import java.util.concurrent.Executor;

import org.junit.After;
import org.junit.Before;
import sluice.core.timer.SimpleTimer;
import sluice.core.timer.Timer;

/**
 * Runs every flow on the calling thread so that signals are delivered before the triggering call returns.
 */
public abstract class AbstractMaterializerTest {

	protected static final Executor SYNC = Runnable::run;

	protected Timer        timer;
	protected Materializer materializer;

	@Before
	public void setupMaterializer() {
		timer = createTimer();
		materializer = Materializer.create(settings(), SYNC, timer);
	}

	@After
	public void shutdownMaterializer() {
		materializer.shutdown();
		timer.cancel();
	}

	protected Timer createTimer() {
		return new SimpleTimer("test-timer", 5);
	}

	protected MaterializerSettings settings() {
		return MaterializerSettings.create();
	}
}
