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
package sluice.core.configuration;

import org.junit.After;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class PropertiesConfigurationReaderTests {

	@After
	public void clearSystemProperties() {
		System.clearProperty(PropertiesConfigurationReader.PROPERTY_NAME_PROFILES_ACTIVE);
		System.clearProperty(PropertiesConfigurationReader.PROPERTY_NAME_PROFILES_DEFAULT);
		System.clearProperty("sluice.test.name");
	}

	@Test
	public void defaultProfileIsLoaded() {
		SluiceConfiguration configuration = new PropertiesConfigurationReader("test-default").read();

		assertThat(configuration.getString("sluice.test.name", null), is("default"));
		assertThat(configuration.getInt("sluice.test.size", 0), is(8));
		assertThat(configuration.getInt("sluice.test.timeout", 0), is(1000));
		assertThat(configuration.getInt("sluice.test.missing", 3), is(3));
	}

	@Test
	public void activeProfilesOverrideTheDefaultProfile() {
		System.setProperty(PropertiesConfigurationReader.PROPERTY_NAME_PROFILES_ACTIVE, "test-overrides, missing");
		SluiceConfiguration configuration = new PropertiesConfigurationReader("test-default").read();

		assertThat(configuration.getInt("sluice.test.size", 0), is(32));
		assertThat(configuration.getString("sluice.test.name", null), is("default"));
	}

	@Test
	public void defaultProfileNameCanBeOverridden() {
		System.setProperty(PropertiesConfigurationReader.PROPERTY_NAME_PROFILES_DEFAULT, "test-overrides");
		SluiceConfiguration configuration = new PropertiesConfigurationReader("test-default").read();

		assertThat(configuration.getInt("sluice.test.size", 0), is(32));
		assertThat(configuration.getString("sluice.test.name", "none"), is("none"));
	}

	@Test
	public void systemPropertiesWin() {
		System.setProperty("sluice.test.name", "system");
		SluiceConfiguration configuration = new PropertiesConfigurationReader("test-default").read();

		assertThat(configuration.getString("sluice.test.name", null), is("system"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void malformedNumberIsRejected() {
		System.setProperty(PropertiesConfigurationReader.PROPERTY_NAME_PROFILES_ACTIVE, "test-overrides");
		new PropertiesConfigurationReader("test-default").read().getInt("sluice.test.broken", 0);
	}
}
