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
package sluice.fn;

/**
 * Implementations of this class perform work on the given parameters and return a result.
 *
 * @param <T1> The type of the first input to the apply operation.
 * @param <T2> The type of the second input to the apply operation.
 * @param <R>  The type of the result of the apply operation.
 */
public interface BiFunction<T1, T2, R> {

	/**
	 * Invoke this function.
	 *
	 * @param t1 The first argument.
	 * @param t2 The second argument.
	 * @return The result of the function.
	 */
	R apply(T1 t1, T2 t2);

}
