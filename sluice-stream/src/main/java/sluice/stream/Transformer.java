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

/**
 * The per-materialization logic of a processing stage. A fresh instance is created for every materialization and
 * is only ever invoked by one thread at a time.
 * <p>
 * Any exception thrown by a callback fails the stage: the failure goes downstream and upstream is cancelled.
 *
 * @param <In>  the received element type
 * @param <Out> the emitted element type
 */
public abstract class Transformer<In, Out> {

	/**
	 * Transform one element into zero or more elements.
	 *
	 * @param element the received element
	 * @return the elements to emit, in order, never containing {@code null}
	 */
	public abstract List<Out> onNext(In element);

	/**
	 * Called once upstream completed, or this transformer reported {@link #isComplete()}. The returned elements are
	 * emitted before the stage completes.
	 *
	 * @return the trailing elements to emit
	 */
	public List<Out> onTermination() {
		return Collections.emptyList();
	}

	/**
	 * Checked after every {@link #onNext}: returning true cancels upstream and completes the stage once the
	 * pending output is flushed.
	 *
	 * @return true if no more input is wanted
	 */
	public boolean isComplete() {
		return false;
	}

	/**
	 * Called when the stage fails, before the failure is signalled downstream.
	 *
	 * @param cause the failure
	 */
	public void onError(Throwable cause) {
	}

	/**
	 * Called once when the stage terminates, whatever the reason.
	 */
	public void cleanup() {
	}
}
