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

import java.util.Properties;

import org.junit.Test;
import sluice.core.configuration.SluiceConfiguration;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class MaterializerSettingsTests {

	@Test
	public void defaultsAreUsedWithoutConfiguration() {
		MaterializerSettings settings = MaterializerSettings.fromConfiguration(new SluiceConfiguration(new Properties()));

		assertThat(settings.getInitialInputBufferSize(), is(4));
		assertThat(settings.getMaximumInputBufferSize(), is(16));
		assertThat(settings.getInitialFanOutBufferSize(), is(4));
		assertThat(settings.getMaximumFanOutBufferSize(), is(16));
		assertThat(settings.getExecutorName(), is("sluice-materializer"));
		assertThat(settings.getExecutorSize(), is(0));
		assertThat(settings.getTimerResolution(), is(10));
	}

	@Test
	public void bundledDefaultProfileMatchesTheBuiltInDefaults() {
		MaterializerSettings settings = MaterializerSettings.fromConfiguration();

		assertThat(settings.getMaximumInputBufferSize(), is(MaterializerSettings.DEFAULT_MAXIMUM_BUFFER_SIZE));
		assertThat(settings.getExecutorName(), is(MaterializerSettings.DEFAULT_EXECUTOR_NAME));
	}

	@Test
	public void configurationOverridesDefaults() {
		Properties properties = new Properties();
		properties.setProperty(MaterializerSettings.INPUT_BUFFER_INITIAL, "2");
		properties.setProperty(MaterializerSettings.INPUT_BUFFER_MAX, "8");
		properties.setProperty(MaterializerSettings.EXECUTOR_NAME, "flows");
		properties.setProperty(MaterializerSettings.EXECUTOR_SIZE, "3");

		MaterializerSettings settings = MaterializerSettings.fromConfiguration(new SluiceConfiguration(properties));

		assertThat(settings.getInitialInputBufferSize(), is(2));
		assertThat(settings.getMaximumInputBufferSize(), is(8));
		assertThat(settings.getExecutorName(), is("flows"));
		assertThat(settings.getExecutorSize(), is(3));
	}

	@Test
	public void withersReturnNewSettings() {
		MaterializerSettings defaults = MaterializerSettings.create();
		MaterializerSettings tuned = defaults.withInputBuffer(1, 2).withFanOutBuffer(8, 32).withTimerResolution(1);

		assertThat(defaults.getMaximumInputBufferSize(), is(16));
		assertThat(tuned.getMaximumInputBufferSize(), is(2));
		assertThat(tuned.getMaximumFanOutBufferSize(), is(32));
		assertThat(tuned.getTimerResolution(), is(1));
	}

	@Test(expected = IllegalArgumentException.class)
	public void initialBufferCannotExceedMaximum() {
		MaterializerSettings.create().withInputBuffer(8, 4);
	}

	@Test(expected = IllegalArgumentException.class)
	public void bufferMustBePositive() {
		MaterializerSettings.create().withFanOutBuffer(0, 4);
	}
}
