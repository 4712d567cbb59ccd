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

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sluice.core.support.NamedDaemonThreadFactory;
import sluice.core.timer.SimpleTimer;
import sluice.core.timer.Timer;
import sluice.stream.impl.CompletionProcessor;
import sluice.stream.impl.StageProcessor;

/**
 * The default {@link Materializer}: one {@link StageProcessor} per stage descriptor, all draining on a shared
 * {@link Executor}.
 */
final class ExecutorMaterializer extends Materializer {

	private static final Logger log = LoggerFactory.getLogger(ExecutorMaterializer.class);

	private static final AtomicLong RUN_IDS = new AtomicLong();

	private final MaterializerSettings settings;
	private final Executor             executor;
	private final Timer                timer;
	private final boolean              ownsResources;

	private volatile boolean shutdown;

	ExecutorMaterializer(MaterializerSettings settings) {
		this(settings,
				Executors.newFixedThreadPool(poolSize(settings),
						new NamedDaemonThreadFactory(settings.getExecutorName())),
				new SimpleTimer(settings.getExecutorName() + "-timer", settings.getTimerResolution()),
				true);
	}

	ExecutorMaterializer(MaterializerSettings settings, Executor executor, Timer timer) {
		this(settings, executor, timer, false);
	}

	private ExecutorMaterializer(MaterializerSettings settings, Executor executor, Timer timer,
			boolean ownsResources) {
		this.settings = settings;
		this.executor = executor;
		this.timer = timer;
		this.ownsResources = ownsResources;
	}

	private static int poolSize(MaterializerSettings settings) {
		int size = settings.getExecutorSize();
		return size > 0 ? size : Runtime.getRuntime().availableProcessors();
	}

	@Override
	@SuppressWarnings({"unchecked", "rawtypes"})
	public MaterializedFlow materialize(RunnableFlow flow) {
		if (shutdown) {
			throw new IllegalStateException("Materializer has been shut down");
		}
		long runId = RUN_IDS.incrementAndGet();
		MaterializationContext context = new MaterializationContext(runId, executor, timer, settings);
		List<StageDescriptor> stages = flow.stages();
		log.debug("Materializing run {}: {}", runId, flow);

		Map<Object, Object> values = new IdentityHashMap<>();

		Tap<Object> tap = (Tap<Object>) flow.tap();
		Publisher<Object> current = tap.create(context);
		if (tap instanceof KeyedTap) {
			values.put(tap, ((KeyedTap) tap).materializedValue(current));
		}

		for (int i = 0; i < stages.size(); i++) {
			StageDescriptor descriptor = stages.get(i);
			StageProcessor<Object, Object> stage = new StageProcessor<>(
					context.nameFor((i + 1) + "-" + descriptor.name()),
					descriptor.createTransformer(),
					executor,
					settings.getInitialInputBufferSize(),
					settings.getMaximumInputBufferSize());
			current.subscribe(stage);
			current = stage;
		}

		CompletionProcessor<Object> tail = context.tail();
		current.subscribe(tail);

		KeyedSink<Object, Object> sink = (KeyedSink<Object, Object>) flow.sink();
		values.put(sink, sink.attach(tail, context));

		return new MaterializedFlow(runId, tail, values);
	}

	@Override
	public MaterializerSettings settings() {
		return settings;
	}

	@Override
	public void shutdown() {
		if (shutdown) {
			return;
		}
		shutdown = true;
		if (ownsResources) {
			log.debug("Shutting down materializer threads '{}'", settings.getExecutorName());
			((ExecutorService) executor).shutdown();
			timer.cancel();
		}
	}

	@Override
	public boolean isShutdown() {
		return shutdown;
	}
}
