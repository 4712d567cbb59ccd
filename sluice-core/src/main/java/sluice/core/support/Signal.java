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
package sluice.core.support;

import sluice.core.error.SpecificationExceptions;

/**
 * An upstream event queued for a live component: an element, a failure or a completion.
 *
 * @param <T> the element type
 */
public final class Signal<T> {

	public enum Type {
		NEXT, ERROR, COMPLETE
	}

	private static final Signal<Void> ON_COMPLETE = new Signal<>(Type.COMPLETE, null, null);

	private final Type      type;
	private final T         value;
	private final Throwable throwable;

	private Signal(Type type, T value, Throwable throwable) {
		this.type = type;
		this.value = value;
		this.throwable = throwable;
	}

	public static <T> Signal<T> next(T value) {
		if (value == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		return new Signal<>(Type.NEXT, value, null);
	}

	public static <T> Signal<T> error(Throwable throwable) {
		if (throwable == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		return new Signal<>(Type.ERROR, null, throwable);
	}

	@SuppressWarnings("unchecked")
	public static <T> Signal<T> complete() {
		return (Signal<T>) ON_COMPLETE;
	}

	public Type getType() {
		return type;
	}

	public T get() {
		return value;
	}

	public Throwable getThrowable() {
		return throwable;
	}

	public boolean isOnNext() {
		return type == Type.NEXT;
	}

	public boolean isTerminal() {
		return type != Type.NEXT;
	}

	@Override
	public String toString() {
		switch (type) {
			case NEXT:
				return "Signal{next=" + value + "}";
			case ERROR:
				return "Signal{error=" + throwable + "}";
			default:
				return "Signal{complete}";
		}
	}
}
