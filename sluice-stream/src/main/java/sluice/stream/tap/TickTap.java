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

import org.reactivestreams.Publisher;
import sluice.core.support.Assert;
import sluice.fn.Supplier;
import sluice.stream.MaterializationContext;
import sluice.stream.Tap;
import sluice.stream.TapKind;
import sluice.stream.impl.TickTapPublisher;

/**
 * Emits the value of a supplier periodically, on the materializer timer. Ticks happening while the consumer has no
 * outstanding demand are dropped.
 *
 * @param <T> the element type
 */
public final class TickTap<T> extends Tap<T> {

	private final long                  initialDelay;
	private final long                  interval;
	private final TimeUnit              unit;
	private final Supplier<? extends T> tick;

	public TickTap(long initialDelay, long interval, TimeUnit unit, Supplier<? extends T> tick) {
		Assert.isTrue(initialDelay >= 0L, "The initial delay must not be negative");
		Assert.isTrue(interval > 0L, "The interval must be strictly positive");
		Assert.notNull(unit, "A time unit is required");
		Assert.notNull(tick, "A tick supplier is required");
		this.initialDelay = initialDelay;
		this.interval = interval;
		this.unit = unit;
		this.tick = tick;
	}

	@Override
	public TapKind kind() {
		return TapKind.TICK;
	}

	@Override
	protected Publisher<T> create(MaterializationContext context) {
		return new TickTapPublisher<>(context.nameFor("tap"),
				context.executor(),
				context.timer(),
				initialDelay,
				interval,
				unit,
				tick);
	}
}
