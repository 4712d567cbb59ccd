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

import java.util.ArrayDeque;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import org.reactivestreams.Processor;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sluice.core.error.CompositionException;
import sluice.core.error.Exceptions;
import sluice.core.error.SpecificationExceptions;
import sluice.core.subscription.DemandChannel;
import sluice.core.subscription.DemandListener;
import sluice.core.subscription.EmptySubscription;
import sluice.core.support.Assert;
import sluice.core.support.BackpressureUtils;
import sluice.core.support.ReactiveState;
import sluice.core.support.Signal;
import sluice.stream.Transformer;

/**
 * A live processing stage running a {@link Transformer} between one upstream subscription and one downstream
 * {@link DemandChannel}.
 * <p>
 * Every signal is queued and handled by a single drain loop scheduled on the executor, so the transformer and the
 * buffers are only ever touched by one thread at a time. The stage asks upstream for at most
 * {@code min(downstream demand - pending output, batch) - (buffered input + outstanding)} elements: without
 * downstream demand nothing is requested. The batch starts at the initial input buffer size and doubles, up to the
 * maximum, while downstream demand saturates it.
 *
 * @param <I> the received element type
 * @param <O> the emitted element type
 */
public class StageProcessor<I, O> implements Processor<I, O>, DemandListener, ReactiveState.Buffering,
                                             ReactiveState.UpstreamDemand {

	private static final Logger log = LoggerFactory.getLogger(StageProcessor.class);

	private final String            name;
	private final Transformer<I, O> transformer;
	private final Executor          executor;
	private final int               maximumBatch;
	private final DemandChannel<O>  downstream;
	private final Queue<Signal<I>>  inbox = new ConcurrentLinkedQueue<>();

	// owned by the drain loop
	private final ArrayDeque<I> inputBuffer  = new ArrayDeque<>();
	private final ArrayDeque<O> outputBuffer = new ArrayDeque<>();
	private long    outstanding;
	private int     requestBatch;
	private boolean upstreamDone;
	private boolean upstreamCancelRequested;
	private boolean upstreamCancelled;
	private boolean terminationFlushed;

	private volatile Subscription upstream;
	private volatile StageState   state = StageState.IDLE;

	private volatile int wip;
	@SuppressWarnings("rawtypes")
	private static final AtomicIntegerFieldUpdater<StageProcessor> WIP =
			AtomicIntegerFieldUpdater.newUpdater(StageProcessor.class, "wip");

	public StageProcessor(String name,
			Transformer<I, O> transformer,
			Executor executor,
			int initialBatch,
			int maximumBatch) {
		Assert.notNull(transformer, "A transformer is required");
		Assert.notNull(executor, "An executor is required");
		Assert.isTrue(initialBatch > 0 && initialBatch <= maximumBatch,
				"Batch sizes must satisfy 0 < initial <= maximum");
		this.name = name;
		this.transformer = transformer;
		this.executor = executor;
		this.requestBatch = initialBatch;
		this.maximumBatch = maximumBatch;
		this.downstream = new DemandChannel<>(name, this);
	}

	@Override
	public void subscribe(Subscriber<? super O> s) {
		if (!downstream.attach(s)) {
			EmptySubscription.error(s, CompositionException.duplicateSubscriber(name));
		}
	}

	@Override
	public void onSubscribe(Subscription s) {
		if (BackpressureUtils.checkSubscription(upstream, s)) {
			upstream = s;
			schedule();
		}
	}

	@Override
	public void onNext(I t) {
		inbox.offer(Signal.next(t));
		schedule();
	}

	@Override
	public void onError(Throwable t) {
		inbox.offer(Signal.error(t));
		schedule();
	}

	@Override
	public void onComplete() {
		inbox.offer(Signal.complete());
		schedule();
	}

	@Override
	public void onRequest(DemandChannel<?> channel, long n) {
		schedule();
	}

	@Override
	public void onCancel(DemandChannel<?> channel) {
		schedule();
	}

	private void schedule() {
		if (WIP.getAndIncrement(this) == 0) {
			try {
				executor.execute(this::drain);
			}
			catch (RejectedExecutionException ree) {
				log.debug("Stage '{}' executor rejected the drain, running it on the caller", name);
				drain();
			}
		}
	}

	private void drain() {
		int missed = 1;
		for (; ; ) {
			try {
				step();
			}
			catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				fail(t);
			}
			missed = WIP.addAndGet(this, -missed);
			if (missed == 0) {
				break;
			}
		}
	}

	private void step() {
		if (state.isTerminal()) {
			inbox.clear();
			if (upstreamCancelRequested) {
				cancelUpstream();
			}
			return;
		}
		if (downstream.isCancelled()) {
			transition(StageState.CANCELLED);
			log.debug("Stage '{}' cancelled by its consumer", name);
			upstreamDone = true;
			cancelUpstream();
			release();
			return;
		}

		Signal<I> signal;
		while ((signal = inbox.poll()) != null) {
			if (upstreamDone) {
				if (signal.getType() == Signal.Type.ERROR) {
					log.debug("Stage '{}' dropped an upstream error received after upstream was done", name,
							signal.getThrowable());
				}
				continue;
			}
			switch (signal.getType()) {
				case NEXT:
					if (outstanding == 0L) {
						fail(SpecificationExceptions.spec_1_01_exception());
						return;
					}
					outstanding--;
					inputBuffer.add(signal.get());
					break;
				case ERROR:
					upstreamDone = true;
					fail(signal.getThrowable());
					return;
				default:
					upstreamDone = true;
			}
		}

		if (!process()) {
			return;
		}

		if (upstreamDone && inputBuffer.isEmpty()) {
			if (!terminationFlushed) {
				transition(StageState.COMPLETING);
				terminationFlushed = true;
				enqueue(transformer.onTermination());
				flush();
			}
			if (outputBuffer.isEmpty() && !downstream.isCancelled()) {
				transition(StageState.COMPLETED);
				log.debug("Stage '{}' completed", name);
				downstream.complete();
				release();
			}
			return;
		}

		Subscription s = upstream;
		if (s != null && !upstreamDone) {
			long wanted = Math.min(BackpressureUtils.subOrZero(downstream.demand(), outputBuffer.size()),
					requestBatch);
			long toRequest = wanted - (inputBuffer.size() + outstanding);
			if (toRequest > 0L) {
				if (wanted == requestBatch && requestBatch < maximumBatch) {
					requestBatch = Math.min(requestBatch * 2, maximumBatch);
				}
				outstanding += toRequest;
				transition(StageState.DEMANDING);
				s.request(toRequest);
			}
		}
		if (state.isRunning()) {
			transition(outstanding > 0L ? StageState.DEMANDING : StageState.IDLE);
		}
	}

	/**
	 * Run the transformer while downstream can take its output.
	 *
	 * @return false if the stage terminated
	 */
	private boolean process() {
		for (; ; ) {
			flush();
			if (downstream.isClosed()) {
				// handled by the next drain pass
				return false;
			}
			if (!outputBuffer.isEmpty() || downstream.demand() == 0L || inputBuffer.isEmpty()) {
				return true;
			}
			I element = inputBuffer.poll();
			transition(StageState.PROCESSING);
			List<O> out;
			try {
				out = transformer.onNext(element);
			}
			catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				fail(Exceptions.addValueAsLastCause(t, element));
				return false;
			}
			enqueue(out);
			if (transformer.isComplete()) {
				log.debug("Stage '{}' transformer is complete, cancelling upstream", name);
				inputBuffer.clear();
				if (!upstreamDone) {
					upstreamDone = true;
					cancelUpstream();
				}
			}
		}
	}

	private void flush() {
		while (!outputBuffer.isEmpty() && downstream.demand() > 0L) {
			if (!downstream.emit(outputBuffer.poll())) {
				return;
			}
		}
	}

	private void enqueue(List<O> out) {
		if (out == null) {
			return;
		}
		for (O o : out) {
			if (o == null) {
				throw SpecificationExceptions.spec_2_13_exception();
			}
			outputBuffer.add(o);
		}
	}

	private void fail(Throwable t) {
		if (state.isTerminal()) {
			log.debug("Stage '{}' already terminated, dropping error", name, t);
			return;
		}
		state = StageState.FAILED;
		if (log.isDebugEnabled()) {
			log.debug("Stage '{}' failed on element {}", name, Exceptions.getFinalValueCause(t), t);
		}
		try {
			transformer.onError(t);
		}
		catch (Throwable e) {
			Exceptions.throwIfFatal(e);
			t.addSuppressed(e);
		}
		downstream.error(t);
		if (!upstreamDone) {
			upstreamDone = true;
			cancelUpstream();
		}
		release();
	}

	private void cancelUpstream() {
		upstreamCancelRequested = true;
		Subscription s = upstream;
		if (s != null && !upstreamCancelled) {
			upstreamCancelled = true;
			s.cancel();
		}
	}

	private void release() {
		inputBuffer.clear();
		outputBuffer.clear();
		inbox.clear();
		try {
			transformer.cleanup();
		}
		catch (Throwable t) {
			Exceptions.throwIfFatal(t);
			log.warn("Stage '{}' transformer cleanup failed", name, t);
		}
	}

	private void transition(StageState next) {
		StageState current = state;
		if (current == next) {
			return;
		}
		if (!current.canTransitionTo(next)) {
			throw new IllegalStateException("Stage '" + name + "' cannot move from " + current + " to " + next);
		}
		if (log.isTraceEnabled()) {
			log.trace("Stage '{}' {} -> {}", name, current, next);
		}
		state = next;
	}

	public StageState getState() {
		return state;
	}

	@Override
	public long pending() {
		return inputBuffer.size() + outputBuffer.size();
	}

	@Override
	public long expectedFromUpstream() {
		return outstanding;
	}

	@Override
	public String toString() {
		return "StageProcessor{name='" + name + "', state=" + state + "}";
	}
}
