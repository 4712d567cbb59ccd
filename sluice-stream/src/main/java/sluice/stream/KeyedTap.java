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

import org.reactivestreams.Publisher;

/**
 * A tap producing a value per materialization, retrieved with {@link MaterializedFlow#get(KeyedTap)}.
 *
 * @param <Out> the type of elements produced
 * @param <M>   the materialized value type
 */
public abstract class KeyedTap<Out, M> extends Tap<Out> {

	/**
	 * @param created the publisher returned by {@link #create} for the same materialization
	 * @return the materialized value
	 */
	protected abstract M materializedValue(Publisher<Out> created);
}
