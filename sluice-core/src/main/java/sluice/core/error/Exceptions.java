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
package sluice.core.error;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Static helpers to decorate an error with the value being processed when it occurred, and to sort fatal JVM
 * errors from the ones a pipeline may route downstream.
 */
public final class Exceptions {

	private static final int MAX_DEPTH = 25;

	private Exceptions() {
	}

	/**
	 * Adds a {@code Throwable} to a causality-chain of Throwables, as an additional cause (if it does not
	 * already appear in the chain among the causes).
	 *
	 * @param e     the {@code Throwable} at the head of the causality chain
	 * @param cause the {@code Throwable} you want to add as a cause of the chain
	 */
	private static void addCause(Throwable e, Throwable cause) {
		Set<Throwable> seenCauses = new HashSet<Throwable>();

		int i = 0;
		while (e.getCause() != null) {
			if (i++ >= MAX_DEPTH) {
				// stack too deep to associate cause
				return;
			}
			e = e.getCause();
			if (seenCauses.contains(e.getCause())) {
				break;
			}
			else {
				seenCauses.add(e.getCause());
			}
		}
		try {
			e.initCause(cause);
		}
		catch (IllegalStateException | IllegalArgumentException alreadyInitialized) {
			// the cause of this throwable was fixed at construction, keep the value as suppressed instead
			e.addSuppressed(cause);
		}
	}

	/**
	 * Get the {@code Throwable} at the end of the causality-chain for a particular {@code Throwable}
	 *
	 * @param e the {@code Throwable} whose final cause you are curious about
	 * @return the last {@code Throwable} in the causality-chain of {@code e} (or a "Stack too deep to get
	 * final cause" {@code RuntimeException} if the chain is too long to traverse)
	 */
	private static Throwable getFinalCause(Throwable e) {
		int i = 0;
		while (e.getCause() != null) {
			if (i++ >= MAX_DEPTH) {
				return new RuntimeException("Stack too deep to get final cause");
			}
			e = e.getCause();
		}
		return e;
	}

	/**
	 * Try to find the value attached at the end of the causality-chain of a {@code Throwable}.
	 *
	 * @param e the {@code Throwable} to inspect
	 * @return the value or null if the final cause is not a {@link ValueCause}
	 */
	public static Object getFinalValueCause(Throwable e) {
		Throwable t = getFinalCause(e);
		if (t instanceof ValueCause) {
			return ((ValueCause) t).getValue();
		}
		for (Throwable suppressed : e.getSuppressed()) {
			if (suppressed instanceof ValueCause) {
				return ((ValueCause) suppressed).getValue();
			}
		}
		return null;
	}

	/**
	 * Adds the given item as the final cause of the given {@code Throwable}, wrapped in {@code ValueCause}
	 * (which extends {@code RuntimeException}).
	 *
	 * @param e     the {@link Throwable} to which you want to add a cause
	 * @param value the item you want to add to {@code e} as the cause of the {@code Throwable}
	 * @return the same {@code Throwable} ({@code e}) that was passed in, with {@code value} added to it as a
	 * cause
	 */
	public static Throwable addValueAsLastCause(Throwable e, Object value) {
		Throwable lastCause = getFinalCause(e);
		if (lastCause instanceof ValueCause) {
			// purposefully using == for object reference check
			if (((ValueCause) lastCause).getValue() == value) {
				return e;
			}
		}
		addCause(e, new ValueCause(value));
		return e;
	}

	/**
	 * Throws a particular {@code Throwable} only if it belongs to a set of "fatal" error varieties. These
	 * varieties are as follows:
	 * <ul>
	 * <li>{@code VirtualMachineError}</li>
	 * <li>{@code LinkageError}</li>
	 * </ul>
	 *
	 * @param t the error to check
	 */
	public static void throwIfFatal(Throwable t) {
		if (t instanceof VirtualMachineError) {
			throw (VirtualMachineError) t;
		}
		else if (t instanceof LinkageError) {
			throw (LinkageError) t;
		}
	}

	/**
	 * Strip the wrappers {@link java.util.concurrent.CompletionStage} callbacks and futures put around a failure.
	 *
	 * @param t the failure as observed
	 * @return the failure as raised
	 */
	public static Throwable unwrap(Throwable t) {
		Throwable current = t;
		int i = 0;
		while ((current instanceof CompletionException || current instanceof ExecutionException) &&
				current.getCause() != null && i++ < MAX_DEPTH) {
			current = current.getCause();
		}
		return current;
	}

	/**
	 * Represents an error that was encountered while processing an element, preserving that element for
	 * reporting.
	 */
	public static class ValueCause extends RuntimeException {

		private static final long serialVersionUID = -3454462756050397899L;

		private final transient Object value;

		/**
		 * Create a {@code ValueCause} error and include in its error message a string representation of
		 * the item that was being processed at the time the error was handled.
		 *
		 * @param value the item being processed at the time of the error
		 */
		public ValueCause(Object value) {
			super("Exception while processing value: " + renderValue(value));
			this.value = value;
		}

		/**
		 * @return the item being processed at the time of the error
		 */
		public Object getValue() {
			return value;
		}

		// avoid calling a potentially expensive or failing toString() on user types
		private static String renderValue(Object value) {
			if (value == null) {
				return "null";
			}
			if (value instanceof Number || value instanceof Boolean || value instanceof Character ||
					value instanceof String) {
				return value.toString();
			}
			if (value instanceof Enum) {
				return ((Enum<?>) value).name();
			}
			return value.getClass().getName() + ".class";
		}
	}
}
