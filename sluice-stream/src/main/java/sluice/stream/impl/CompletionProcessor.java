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

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sluice.core.subscription.DemandChannel;

/**
 * The last edge of a materialized flow, in front of its sink. It observes how the flow ended: normally when the
 * stream completes or the sink cancels, exceptionally when the stream fails, the sink fails or the flow is aborted.
 *
 * @param <T> the element type
 */
public final class CompletionProcessor<T> extends PassThroughProcessor<T> {

	private static final Logger log = LoggerFactory.getLogger(CompletionProcessor.class);

	private final CompletableFuture<Void> completion = new CompletableFuture<>();

	public CompletionProcessor(String name) {
		super(name);
	}

	@Override
	public void onError(Throwable t) {
		super.onError(t);
		if (completion.completeExceptionally(t)) {
			log.debug("Flow '{}' failed", name, t);
		}
	}

	@Override
	public void onComplete() {
		super.onComplete();
		if (completion.complete(null)) {
			log.debug("Flow '{}' completed", name);
		}
	}

	@Override
	public void onCancel(DemandChannel<?> channel) {
		super.onCancel(channel);
		Throwable failure = channel.getError();
		if (failure == null) {
			failure = channel.getConsumerFailure();
		}
		if (failure != null) {
			if (completion.completeExceptionally(failure)) {
				log.debug("Flow '{}' failed in its sink", name, failure);
			}
		}
		else if (completion.complete(null)) {
			log.debug("Flow '{}' cancelled by its sink", name);
		}
	}

	/**
	 * Stop the flow because its sink failed: cancel upstream and fail the completion with {@code cause}.
	 *
	 * @param cause the sink failure
	 */
	public void fail(Throwable cause) {
		downstream.fail(cause);
	}

	/**
	 * Stop the flow: cancel upstream and fail the sink with a {@link CancellationException}.
	 */
	public void abort() {
		CancellationException cancelled = new CancellationException("Flow '" + name + "' was cancelled");
		if (completion.completeExceptionally(cancelled)) {
			log.debug("Flow '{}' aborted", name);
			cancelUpstream();
			downstream.error(cancelled);
		}
	}

	/**
	 * @return a future completed when the flow ends
	 */
	public CompletableFuture<Void> completion() {
		return completion;
	}
}
