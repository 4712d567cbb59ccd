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
package sluice.core.subscription;

/**
 * Producer side callbacks of a {@link DemandChannel}. Both may be invoked from any thread, including re-entrantly
 * from within a delivery, so implementations usually just schedule their own drain.
 */
public interface DemandListener {

	/**
	 * The consumer raised its demand by {@code n}.
	 *
	 * @param channel the channel whose demand changed
	 * @param n       the strictly positive amount requested
	 */
	void onRequest(DemandChannel<?> channel, long n);

	/**
	 * The consumer cancelled. Called at most once per channel.
	 *
	 * @param channel the cancelled channel
	 */
	void onCancel(DemandChannel<?> channel);
}
