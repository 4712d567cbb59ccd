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
package sluice.core.subscriber;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

/**
 * Enforces single-threaded, serialized, ordered delivery of {@link #onSubscribe}, {@link #onNext}, {@link #onComplete} and
 * {@link #onError} to a delegate {@link Subscriber}.
 * <p>
 * When multiple threads are signalling they will be serialized by:
 * </p><ul>
 * <li>Allowing only one thread at a time to emit</li>
 * <li>Adding signals to a queue if another thread is already emitting</li>
 * <li>Not holding any locks or blocking any threads while emitting</li>
 * </ul>
 * Once a terminal signal has been accepted every further signal is dropped.
 *
 * @param <T> the type of elements delivered
 */
public final class SerializedSubscriber<T> implements Subscriber<T>, Subscription {

	private static final Object COMPLETE_SENTINEL = new Object();

	private final Subscriber<? super T> delegate;

	private boolean      emitting;
	private boolean      terminated;
	private SignalQueue  queue;
	private Subscription subscription;

	static final class SignalQueue {
		Object[] array;
		int      size;

		void add(Object o) {
			int s = size;
			Object[] a = array;
			if (a == null) {
				a = new Object[16];
				array = a;
			}
			else if (s == a.length) {
				Object[] grown = new Object[s + (s >> 1)];
				System.arraycopy(a, 0, grown, 0, s);
				a = grown;
				array = a;
			}
			a[s] = o;
			size = s + 1;
		}
	}

	private static final class ErrorSentinel {
		final Throwable e;

		ErrorSentinel(Throwable e) {
			this.e = e;
		}
	}

	public static <T> SerializedSubscriber<T> create(Subscriber<? super T> s) {
		return new SerializedSubscriber<>(s);
	}

	private SerializedSubscriber(Subscriber<? super T> s) {
		this.delegate = s;
	}

	/**
	 * Signals {@code onSubscribe} as part of the serialized emission: any signal arriving while the delegate is still
	 * in {@code onSubscribe} is queued and drained by this thread once it returns.
	 */
	@Override
	public void onSubscribe(final Subscription s) {
		this.subscription = s;
		synchronized (this) {
			emitting = true;
		}
		boolean released = false;
		try {
			delegate.onSubscribe(this);
			released = drainLoop();
		}
		finally {
			if (!released) {
				synchronized (this) {
					emitting = false;
				}
			}
		}
	}

	@Override
	public void onNext(T t) {
		SignalQueue list;
		synchronized (this) {
			if (terminated) {
				return;
			}
			if (emitting) {
				if (queue == null) {
					queue = new SignalQueue();
				}
				queue.add(t);
				return;
			}
			emitting = true;
			list = queue;
			queue = null;
		}

		boolean released = false;
		try {
			drainQueue(list);
			delegate.onNext(t);
			released = drainLoop();
		}
		finally {
			if (!released) {
				synchronized (this) {
					emitting = false;
				}
			}
		}
	}

	@Override
	public void onError(final Throwable e) {
		terminate(new ErrorSentinel(e));
	}

	@Override
	public void onComplete() {
		terminate(COMPLETE_SENTINEL);
	}

	private void terminate(Object sentinel) {
		SignalQueue list;
		synchronized (this) {
			if (terminated) {
				return;
			}
			terminated = true;
			if (emitting) {
				if (queue == null) {
					queue = new SignalQueue();
				}
				queue.add(sentinel);
				return;
			}
			emitting = true;
			list = queue;
			queue = null;
		}
		drainQueue(list);
		dispatch(sentinel);
	}

	@Override
	public void request(long n) {
		Subscription s = subscription;
		if (s != null) {
			s.request(n);
		}
	}

	@Override
	public void cancel() {
		Subscription s = subscription;
		if (s != null) {
			s.cancel();
		}
	}

	// drains until the queue is empty, then leaves the emission
	private boolean drainLoop() {
		for (;;) {
			SignalQueue list;
			synchronized (this) {
				list = queue;
				queue = null;
				if (list == null) {
					emitting = false;
					return true;
				}
			}
			drainQueue(list);
		}
	}

	private void drainQueue(SignalQueue list) {
		if (list == null || list.size == 0) {
			return;
		}
		for (int i = 0; i < list.size; i++) {
			if (!dispatch(list.array[i])) {
				return;
			}
		}
	}

	@SuppressWarnings("unchecked")
	private boolean dispatch(Object v) {
		if (v == COMPLETE_SENTINEL) {
			delegate.onComplete();
			return false;
		}
		if (v instanceof ErrorSentinel) {
			delegate.onError(((ErrorSentinel) v).e);
			return false;
		}
		delegate.onNext((T) v);
		return true;
	}

	@Override
	public String toString() {
		return "SerializedSubscriber{" + delegate + "}";
	}
}
