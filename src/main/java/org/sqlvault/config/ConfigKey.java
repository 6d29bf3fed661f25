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

public abstract class ConfigKey<T> {

    private final String key;
    private final T defaultValue;

    ConfigKey(String key, T defaultValue) {
        this.key = key;
        this.defaultValue = defaultValue;
    }

    public String getKey() {
        return key;
    }

    public T getDefaultValue() {
        return defaultValue;
    }

}

class StringConfigKey extends ConfigKey<String> {
    StringConfigKey(String key) {
        super(key, null);
    }
    StringConfigKey(String key, String defaultValue) {
        super(key, defaultValue);
    }
}

class BooleanConfigKey extends ConfigKey<Boolean> {
    BooleanConfigKey(String key, Boolean defaultValue) {
        super(key, defaultValue);
    }
}

class IntegerConfigKey extends ConfigKey<Integer> {
    IntegerConfigKey(String key, Integer defaultValue) {
        super(key, defaultValue);
    }
}

class LongConfigKey extends ConfigKey<Long> {
    LongConfigKey(String key, Long defaultValue) {
        super(key, defaultValue);
    }
}
