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
package sluice.core.support;

/**
 * Introspection contracts implemented by the live components of a pipeline. They let tests and diagnostics read
 * buffers and demand without reaching into internals.
 */
public interface ReactiveState {

	/**
	 * A storing component
	 */
	interface Buffering extends ReactiveState {

		/**
		 * @return number of elements held and not yet delivered
		 */
		long pending();
	}

	/**
	 * An upstream aware component
	 */
	interface UpstreamDemand extends ReactiveState {

		/**
		 * @return elements requested from upstream and not yet received
		 */
		long expectedFromUpstream();
	}
}
