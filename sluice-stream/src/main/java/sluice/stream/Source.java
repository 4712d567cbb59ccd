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

import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import sluice.fn.Function;
import sluice.fn.Supplier;
import sluice.stream.sink.FanoutPublisherSink;
import sluice.stream.sink.PublisherSink;
import sluice.stream.tap.FutureTap;
import sluice.stream.tap.IterableTap;
import sluice.stream.tap.IteratorTap;
import sluice.stream.tap.PublisherTap;
import sluice.stream.tap.SubscriberTap;
import sluice.stream.tap.ThunkTap;
import sluice.stream.tap.TickTap;

/**
 * An open pipeline with one output: a tap followed by processing stages. A source describes work and runs
 * nothing until connected to a sink and materialized, and every combinator returns a new source leaving this one
 * untouched.
 * <p>
 * <pre>
 *   Materializer materializer = Materializer.create();
 *   Publisher&lt;String&gt; out = Source.from(Arrays.asList(1, 2, 3))
 *                                .map(i -&gt; "#" + i)
 *                                .toPublisher(materializer);
 * </pre>
 *
 * @param <Out> the type of elements produced
 */
public interface Source<Out> {

	/**
	 * Append a flow after this source.
	 *
	 * @param flow the flow
	 * @param <T>  the new output type
	 * @return a new source
	 */
	<T> Source<T> connect(Flow<? super Out, T> flow);

	/**
	 * Close this source with a sink.
	 *
	 * @param sink the sink
	 * @return a flow ready to be materialized
	 */
	RunnableFlow connect(Sink<? super Out> sink);

	default <T> Source<T> transform(String name,
			Supplier<? extends Transformer<? super Out, ? extends T>> factory) {
		return connect(Flow.<Out>create().transform(name, factory));
	}

	default <T> Source<T> map(Function<? super Out, ? extends T> mapper) {
		return connect(Flow.<Out>create().map(mapper));
	}

	/**
	 * Materialize this source into a {@link Publisher} accepting a single subscriber. Any further subscriber is
	 * rejected with a {@link sluice.core.error.CompositionException} and does not disturb the first one.
	 *
	 * @param materializer the materializer
	 * @return the output of the running flow
	 */
	default Publisher<Out> toPublisher(Materializer materializer) {
		PublisherSink<Out> sink = Sink.publisher();
		return connect(sink).run(materializer).get(sink);
	}

	/**
	 * Materialize this source into a {@link Publisher} accepting any number of subscribers.
	 *
	 * @param initialBufferSize the upstream request size
	 * @param maximumBufferSize the backlog after which a slow subscriber is dropped
	 * @param materializer      the materializer
	 * @return the output of the running flow
	 */
	default Publisher<Out> toFanoutPublisher(int initialBufferSize, int maximumBufferSize,
			Materializer materializer) {
		FanoutPublisherSink<Out> sink = Sink.fanoutPublisher(initialBufferSize, maximumBufferSize);
		return connect(sink).run(materializer).get(sink);
	}

	/**
	 * Materialize this source into a {@link Publisher} accepting any number of subscribers, buffered as configured
	 * by the materializer settings.
	 *
	 * @param materializer the materializer
	 * @return the output of the running flow
	 */
	default Publisher<Out> toFanoutPublisher(Materializer materializer) {
		MaterializerSettings settings = materializer.settings();
		return toFanoutPublisher(settings.getInitialFanOutBufferSize(), settings.getMaximumFanOutBufferSize(),
				materializer);
	}

	/**
	 * Materialize this source and deliver its output to the given subscriber.
	 *
	 * @param subscriber   the subscriber
	 * @param materializer the materializer
	 * @return the running flow
	 */
	default MaterializedFlow publishTo(Subscriber<? super Out> subscriber, Materializer materializer) {
		return connect(Sink.subscriber(subscriber)).run(materializer);
	}

	/**
	 * Materialize this source and run it to completion, discarding its output.
	 *
	 * @param materializer the materializer
	 * @return the running flow, see {@link MaterializedFlow#completion()}
	 */
	default MaterializedFlow consume(Materializer materializer) {
		return connect(Sink.<Out>ignore()).run(materializer);
	}

	/**
	 * @param iterable the elements, iterated anew by every materialization
	 * @param <T>      the element type
	 * @return a collection source
	 */
	static <T> Source<T> from(Iterable<? extends T> iterable) {
		return new IterableTap<>(iterable);
	}

	/**
	 * @param iterator the elements, shared by every materialization
	 * @param <T>      the element type
	 * @return an iterator source
	 */
	static <T> Source<T> fromIterator(Iterator<? extends T> iterator) {
		return new IteratorTap<>(iterator);
	}

	/**
	 * @param thunk called once per unit of demand, an empty result completes the stream
	 * @param <T>   the element type
	 * @return a thunk source
	 */
	static <T> Source<T> fromThunk(Supplier<Optional<T>> thunk) {
		return new ThunkTap<>(thunk);
	}

	/**
	 * @param future the single value, a failed future fails the stream
	 * @param <T>    the element type
	 * @return a future source
	 */
	static <T> Source<T> fromFuture(CompletionStage<? extends T> future) {
		return new FutureTap<>(future);
	}

	/**
	 * @param initialDelay delay before the first tick
	 * @param interval     period between ticks
	 * @param unit         unit of both delay and interval
	 * @param tick         supplies the element of each tick
	 * @param <T>          the element type
	 * @return a tick source, never completing on its own
	 */
	static <T> Source<T> tick(long initialDelay, long interval, TimeUnit unit, Supplier<? extends T> tick) {
		return new TickTap<>(initialDelay, interval, unit, tick);
	}

	/**
	 * @param publisher an external producer, subscribed once per materialization
	 * @param <T>       the element type
	 * @return a publisher source
	 */
	static <T> Source<T> fromPublisher(Publisher<? extends T> publisher) {
		return new PublisherTap<>(publisher);
	}

	/**
	 * @param <T> the element type
	 * @return a source fed through a {@link Subscriber} obtained from the materialized flow
	 */
	static <T> SubscriberTap<T> subscriber() {
		return new SubscriberTap<>();
	}
}
