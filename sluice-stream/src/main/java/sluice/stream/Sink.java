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

import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import sluice.fn.BiFunction;
import sluice.fn.Consumer;
import sluice.stream.sink.BlackholeSink;
import sluice.stream.sink.FanoutPublisherSink;
import sluice.stream.sink.FoldSink;
import sluice.stream.sink.ForeachSink;
import sluice.stream.sink.HeadSink;
import sluice.stream.sink.ListSink;
import sluice.stream.sink.PublisherSink;
import sluice.stream.sink.SubscriberSink;

/**
 * The consuming end of a pipeline: optional processing stages in front of a terminal {@link KeyedSink}.
 *
 * @param <In> the type of elements accepted
 */
public interface Sink<In> {

	/**
	 * @return the stages run in front of the terminal sink, in order
	 */
	List<StageDescriptor> stages();

	/**
	 * @return the terminal sink
	 */
	KeyedSink<?, ?> terminal();

	/**
	 * @param <T> the element type
	 * @return a sink materialized as a single-subscriber {@link Publisher}
	 */
	static <T> PublisherSink<T> publisher() {
		return new PublisherSink<>();
	}

	/**
	 * @param initialBufferSize the upstream request size
	 * @param maximumBufferSize the backlog after which a slow subscriber is dropped
	 * @param <T>               the element type
	 * @return a sink materialized as a multi-subscriber {@link Publisher}
	 */
	static <T> FanoutPublisherSink<T> fanoutPublisher(int initialBufferSize, int maximumBufferSize) {
		return new FanoutPublisherSink<>(initialBufferSize, maximumBufferSize);
	}

	/**
	 * @param subscriber the subscriber fed by each materialization
	 * @param <T>        the element type
	 * @return a sink delivering to the given subscriber
	 */
	static <T> SubscriberSink<T> subscriber(Subscriber<? super T> subscriber) {
		return new SubscriberSink<>(subscriber);
	}

	/**
	 * @param <T> the element type
	 * @return a sink requesting everything and discarding it
	 */
	static <T> BlackholeSink<T> ignore() {
		return new BlackholeSink<>();
	}

	static <T> ForeachSink<T> foreach(Consumer<? super T> consumer) {
		return new ForeachSink<>(consumer);
	}

	static <T, U> FoldSink<T, U> fold(U zero, BiFunction<? super U, ? super T, ? extends U> function) {
		return new FoldSink<>(zero, function);
	}

	static <T> ListSink<T> toList() {
		return new ListSink<>();
	}

	/**
	 * @param <T> the element type
	 * @return a sink materialized as a {@link CompletableFuture} of the first element, cancelling upstream once
	 * received
	 */
	static <T> HeadSink<T> first() {
		return new HeadSink<>();
	}
}
