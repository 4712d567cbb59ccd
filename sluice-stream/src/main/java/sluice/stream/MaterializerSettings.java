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

import sluice.core.configuration.PropertiesConfigurationReader;
import sluice.core.configuration.SluiceConfiguration;
import sluice.core.support.Assert;

/**
 * Immutable tuning of a {@link Materializer}: stage input buffers, fan-out buffers, the executor and the timer.
 * <p>
 * {@link #fromConfiguration()} reads the {@code sluice.materializer.*} properties of the
 * {@code META-INF/sluice/*.properties} profiles and the System properties.
 */
public final class MaterializerSettings {

	static final String INPUT_BUFFER_INITIAL  = "sluice.materializer.input-buffer.initial";
	static final String INPUT_BUFFER_MAX      = "sluice.materializer.input-buffer.max";
	static final String FANOUT_BUFFER_INITIAL = "sluice.materializer.fanout-buffer.initial";
	static final String FANOUT_BUFFER_MAX     = "sluice.materializer.fanout-buffer.max";
	static final String EXECUTOR_NAME         = "sluice.materializer.executor.name";
	static final String EXECUTOR_SIZE         = "sluice.materializer.executor.size";
	static final String TIMER_RESOLUTION      = "sluice.materializer.timer.resolution";

	public static final int    DEFAULT_INITIAL_BUFFER_SIZE = 4;
	public static final int    DEFAULT_MAXIMUM_BUFFER_SIZE = 16;
	public static final String DEFAULT_EXECUTOR_NAME       = "sluice-materializer";
	public static final int    DEFAULT_TIMER_RESOLUTION    = 10;

	private final int    initialInputBufferSize;
	private final int    maximumInputBufferSize;
	private final int    initialFanOutBufferSize;
	private final int    maximumFanOutBufferSize;
	private final String executorName;
	private final int    executorSize;
	private final int    timerResolution;

	private MaterializerSettings(int initialInputBufferSize,
			int maximumInputBufferSize,
			int initialFanOutBufferSize,
			int maximumFanOutBufferSize,
			String executorName,
			int executorSize,
			int timerResolution) {
		Assert.isTrue(initialInputBufferSize > 0, "initialInputBufferSize must be > 0");
		Assert.isTrue(maximumInputBufferSize >= initialInputBufferSize,
				"maximumInputBufferSize must be >= initialInputBufferSize");
		Assert.isTrue(initialFanOutBufferSize > 0, "initialFanOutBufferSize must be > 0");
		Assert.isTrue(maximumFanOutBufferSize >= initialFanOutBufferSize,
				"maximumFanOutBufferSize must be >= initialFanOutBufferSize");
		Assert.hasText(executorName, "executorName must not be empty");
		Assert.isTrue(executorSize >= 0, "executorSize must be >= 0, 0 meaning one thread per processor");
		Assert.isTrue(timerResolution > 0, "timerResolution must be > 0");
		this.initialInputBufferSize = initialInputBufferSize;
		this.maximumInputBufferSize = maximumInputBufferSize;
		this.initialFanOutBufferSize = initialFanOutBufferSize;
		this.maximumFanOutBufferSize = maximumFanOutBufferSize;
		this.executorName = executorName;
		this.executorSize = executorSize;
		this.timerResolution = timerResolution;
	}

	/**
	 * @return the built-in defaults, ignoring any configuration
	 */
	public static MaterializerSettings create() {
		return new MaterializerSettings(DEFAULT_INITIAL_BUFFER_SIZE,
				DEFAULT_MAXIMUM_BUFFER_SIZE,
				DEFAULT_INITIAL_BUFFER_SIZE,
				DEFAULT_MAXIMUM_BUFFER_SIZE,
				DEFAULT_EXECUTOR_NAME,
				0,
				DEFAULT_TIMER_RESOLUTION);
	}

	public static MaterializerSettings fromConfiguration() {
		return fromConfiguration(new PropertiesConfigurationReader().read());
	}

	public static MaterializerSettings fromConfiguration(SluiceConfiguration configuration) {
		return new MaterializerSettings(
				configuration.getInt(INPUT_BUFFER_INITIAL, DEFAULT_INITIAL_BUFFER_SIZE),
				configuration.getInt(INPUT_BUFFER_MAX, DEFAULT_MAXIMUM_BUFFER_SIZE),
				configuration.getInt(FANOUT_BUFFER_INITIAL, DEFAULT_INITIAL_BUFFER_SIZE),
				configuration.getInt(FANOUT_BUFFER_MAX, DEFAULT_MAXIMUM_BUFFER_SIZE),
				configuration.getString(EXECUTOR_NAME, DEFAULT_EXECUTOR_NAME),
				configuration.getInt(EXECUTOR_SIZE, 0),
				configuration.getInt(TIMER_RESOLUTION, DEFAULT_TIMER_RESOLUTION));
	}

	public MaterializerSettings withInputBuffer(int initialSize, int maximumSize) {
		return new MaterializerSettings(initialSize, maximumSize, initialFanOutBufferSize,
				maximumFanOutBufferSize, executorName, executorSize, timerResolution);
	}

	public MaterializerSettings withFanOutBuffer(int initialSize, int maximumSize) {
		return new MaterializerSettings(initialInputBufferSize, maximumInputBufferSize, initialSize,
				maximumSize, executorName, executorSize, timerResolution);
	}

	public MaterializerSettings withExecutor(String name, int size) {
		return new MaterializerSettings(initialInputBufferSize, maximumInputBufferSize, initialFanOutBufferSize,
				maximumFanOutBufferSize, name, size, timerResolution);
	}

	public MaterializerSettings withTimerResolution(int resolution) {
		return new MaterializerSettings(initialInputBufferSize, maximumInputBufferSize, initialFanOutBufferSize,
				maximumFanOutBufferSize, executorName, executorSize, resolution);
	}

	public int getInitialInputBufferSize() {
		return initialInputBufferSize;
	}

	public int getMaximumInputBufferSize() {
		return maximumInputBufferSize;
	}

	public int getInitialFanOutBufferSize() {
		return initialFanOutBufferSize;
	}

	public int getMaximumFanOutBufferSize() {
		return maximumFanOutBufferSize;
	}

	public String getExecutorName() {
		return executorName;
	}

	/**
	 * @return the number of executor threads, 0 meaning one per available processor
	 */
	public int getExecutorSize() {
		return executorSize;
	}

	public int getTimerResolution() {
		return timerResolution;
	}

	@Override
	public String toString() {
		return "MaterializerSettings{" +
				"inputBuffer=" + initialInputBufferSize + ".." + maximumInputBufferSize +
				", fanOutBuffer=" + initialFanOutBufferSize + ".." + maximumFanOutBufferSize +
				", executor='" + executorName + "'x" + executorSize +
				", timerResolution=" + timerResolution +
				'}';
	}
}
