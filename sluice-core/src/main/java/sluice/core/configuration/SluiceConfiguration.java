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

import java.util.Properties;

import sluice.core.support.Assert;

/**
 * The merged configuration properties with typed accessors. Malformed values fail with
 * {@link IllegalArgumentException} naming the offending key.
 */
public class SluiceConfiguration {

	private final Properties properties;

	public SluiceConfiguration(Properties properties) {
		Assert.notNull(properties, "'properties' must not be null");
		this.properties = properties;
	}

	public String getString(String key, String defaultValue) {
		String value = properties.getProperty(key);
		return value != null ? value.trim() : defaultValue;
	}

	public int getInt(String key, int defaultValue) {
		String value = properties.getProperty(key);
		if (value == null) {
			return defaultValue;
		}
		try {
			return Integer.parseInt(value.trim());
		}
		catch (NumberFormatException nfe) {
			throw new IllegalArgumentException("Property '" + key + "' is not an integer: '" + value + "'", nfe);
		}
	}
}
