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
package sluice.stream.impl;

import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class StageStateTests {

	@Test
	public void runningStatesCannotCompleteDirectly() {
		for (StageState state : new StageState[]{StageState.IDLE, StageState.DEMANDING, StageState.PROCESSING}) {
			assertTrue(state.isRunning());
			assertFalse(state + " must go through COMPLETING", state.canTransitionTo(StageState.COMPLETED));
			assertTrue(state.canTransitionTo(StageState.COMPLETING));
			assertTrue(state.canTransitionTo(StageState.FAILED));
			assertTrue(state.canTransitionTo(StageState.CANCELLED));
		}
	}

	@Test
	public void completingOnlyEnds() {
		assertTrue(StageState.COMPLETING.canTransitionTo(StageState.COMPLETED));
		assertTrue(StageState.COMPLETING.canTransitionTo(StageState.FAILED));
		assertFalse(StageState.COMPLETING.canTransitionTo(StageState.DEMANDING));
		assertFalse(StageState.COMPLETING.isRunning());
		assertFalse(StageState.COMPLETING.isTerminal());
	}

	@Test
	public void terminalStatesAreFinal() {
		for (StageState state : new StageState[]{StageState.COMPLETED, StageState.FAILED, StageState.CANCELLED}) {
			assertTrue(state.isTerminal());
			for (StageState next : StageState.values()) {
				assertFalse(state + " -> " + next, state.canTransitionTo(next));
			}
		}
	}
}
