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

import sluice.core.support.Assert;
import sluice.fn.Supplier;

/**
 * The immutable description of a processing stage: a name and the factory of the {@link Transformer} each
 * materialization runs. Descriptors are shared by every flow built from them.
 */
public final class StageDescriptor {

	private final String                                  name;
	private final Supplier<? extends Transformer<?, ?>> factory;

	public StageDescriptor(String name, Supplier<? extends Transformer<?, ?>> factory) {
		Assert.hasText(name, "A stage name is required");
		Assert.notNull(factory, "A transformer factory is required");
		this.name = name;
		this.factory = factory;
	}

	public String name() {
		return name;
	}

	/**
	 * @return a new transformer for one materialization
	 */
	@SuppressWarnings("unchecked")
	public Transformer<Object, Object> createTransformer() {
		Transformer<?, ?> transformer = factory.get();
		if (transformer == null) {
			throw new IllegalStateException("The transformer factory of stage '" + name + "' returned null");
		}
		return (Transformer<Object, Object>) transformer;
	}

	@Override
	public String toString() {
		return "StageDescriptor{" + name + "}";
	}
}
