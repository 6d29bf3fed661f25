/*
 * Copyright 2026
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.sqlvault.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

public class Config {

    private final Properties properties = new Properties();

    private boolean useEnvironmentVariables;

    public Config() {
    }

    public Config(String file) throws IOException {
        try (InputStream inputStream = Files.newInputStream(Path.of(file))) {
            properties.loadFromXML(inputStream);
        }
        useEnvironmentVariables = Boolean.parseBoolean(System.getenv("CONFIG_USE_ENVIRONMENT_VARIABLES"))
                || Boolean.parseBoolean(properties.getProperty("config.useEnvironmentVariables"));
    }

    public boolean hasKey(ConfigKey<?> key) {
        return getValue(key.getKey()) != null;
    }

    public String getString(ConfigKey<String> key) {
        String value = getValue(key.getKey());
        return value != null ? value : key.getDefaultValue();
    }

    public String getString(ConfigKey<String> key, String defaultValue) {
        String value = getValue(key.getKey());
        return value != null ? value : defaultValue;
    }

    public boolean getBoolean(ConfigKey<Boolean> key) {
        String value = getValue(key.getKey());
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return key.getDefaultValue() != null && key.getDefaultValue();
    }

    public int getInteger(ConfigKey<Integer> key) {
        String value = getValue(key.getKey());
        if (value != null) {
            return Integer.parseInt(value.trim());
        }
        return key.getDefaultValue() != null ? key.getDefaultValue() : 0;
    }

    public long getLong(ConfigKey<Long> key) {
        String value = getValue(key.getKey());
        if (value != null) {
            return Long.parseLong(value.trim());
        }
        return key.getDefaultValue() != null ? key.getDefaultValue() : 0;
    }

    public void setString(ConfigKey<?> key, String value) {
        properties.put(key.getKey(), value);
    }

    private String getValue(String key) {
        if (useEnvironmentVariables) {
            String value = System.getenv(getEnvironmentVariableName(key));
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return properties.getProperty(key);
    }

    static String getEnvironmentVariableName(String key) {
        return key.replaceAll("\\.", "_").replaceAll("(\\p{Lu})", "_$1").toUpperCase(Locale.ROOT);
    }

}
