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

import sluice.fn.Function;

final class MapTransformer<In, Out> extends Transformer<In, Out> {

	private final Function<? super In, ? extends Out> mapper;

	MapTransformer(Function<? super In, ? extends Out> mapper) {
		this.mapper = mapper;
	}

	@Override
	public List<Out> onNext(In element) {
		return Collections.<Out>singletonList(mapper.apply(element));
	}
}
