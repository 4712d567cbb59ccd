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

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ConfigurationReader} that reads the configuration from properties files and System properties.
 * <p>
 * The default profile ({@code META-INF/sluice/default.properties}, renamed with {@code -Dsluice.profiles.default})
 * is applied first, then every profile listed in {@code -Dsluice.profiles.active}, then every System property
 * starting with {@code sluice.}.
 */
public class PropertiesConfigurationReader implements ConfigurationReader {

	private static final String FORMAT_RESOURCE_NAME = "/META-INF/sluice/%s.properties";

	private static final String PROPERTY_PREFIX_SLUICE = "sluice.";

	static final String PROPERTY_NAME_PROFILES_ACTIVE  = "sluice.profiles.active";
	static final String PROPERTY_NAME_PROFILES_DEFAULT = "sluice.profiles.default";

	private final Logger logger = LoggerFactory.getLogger(getClass());

	private final String defaultProfileNameDefault;

	/**
	 * Creates a new {@code PropertiesConfigurationReader} that, by default, will load its
	 * configuration from {@code META-INF/sluice/default.properties}.
	 */
	public PropertiesConfigurationReader() {
		this("default");
	}

	public PropertiesConfigurationReader(String defaultProfileNameDefault) {
		this.defaultProfileNameDefault = defaultProfileNameDefault;
	}

	@Override
	public SluiceConfiguration read() {
		Properties configuration = new Properties();

		configuration.putAll(loadDefaultProfile());

		for (Properties activeProfile : loadActiveProfiles()) {
			configuration.putAll(activeProfile);
		}

		applySystemProperties(configuration);

		return new SluiceConfiguration(configuration);
	}

	private Properties loadDefaultProfile() {
		String defaultProfileName = System.getProperty(PROPERTY_NAME_PROFILES_DEFAULT, defaultProfileNameDefault);
		return loadProfile(defaultProfileName);
	}

	private List<Properties> loadActiveProfiles() {
		List<Properties> activeProfiles = new ArrayList<Properties>();
		String active = System.getProperty(PROPERTY_NAME_PROFILES_ACTIVE);
		if (null != active) {
			for (String profileName : active.split(",")) {
				if (!profileName.trim().isEmpty()) {
					activeProfiles.add(loadProfile(profileName.trim()));
				}
			}
		}
		return activeProfiles;
	}

	private void applySystemProperties(Properties configuration) {
		for (String prop : System.getProperties().stringPropertyNames()) {
			if (prop.startsWith(PROPERTY_PREFIX_SLUICE)) {
				configuration.put(prop, System.getProperty(prop));
			}
		}
	}

	protected Properties loadProfile(String name) {
		Properties properties = new Properties();
		String resource = String.format(FORMAT_RESOURCE_NAME, name);
		try (InputStream inputStream = getClass().getResourceAsStream(resource)) {
			if (null != inputStream) {
				properties.load(inputStream);
			}
			else {
				logger.debug("No properties file found in the classpath at '{}' for profile '{}'", resource, name);
			}
		}
		catch (IOException e) {
			logger.error("Failed to load properties from '{}' for profile '{}'", resource, name, e);
		}
		return properties;
	}

}
