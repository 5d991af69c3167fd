/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.projectcalico.config;

import org.projectcalico.annotation.PublicEvolving;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.projectcalico.utils.Preconditions.checkNotNull;

/**
 * Lightweight configuration object which stores key/value pairs. Values are kept either in their
 * typed form (when set through {@link #set(ConfigOption, Object)}) or as strings (when loaded from
 * a property map) and are converted to the type of the {@link ConfigOption} on read.
 *
 * @since 0.1
 */
@PublicEvolving
public class Configuration {

    private static final Logger LOG = LoggerFactory.getLogger(Configuration.class);

    /** Stores the concrete key/value pairs of this configuration object. */
    @GuardedBy("confData")
    private final HashMap<String, Object> confData;

    /** Creates a new empty configuration. */
    public Configuration() {
        this.confData = new HashMap<>();
    }

    /** Creates a new configuration that is initialized with the options of the given map. */
    public static Configuration fromMap(Map<String, String> map) {
        final Configuration configuration = new Configuration();
        synchronized (configuration.confData) {
            configuration.confData.putAll(map);
        }
        return configuration;
    }

    /**
     * Returns the value associated with the given config option, or the option's default value if
     * the key is not present.
     *
     * @param option The configuration option
     * @return the (default) value associated with the given config option
     * @throws IllegalArgumentException if the stored value cannot be converted to the type of the
     *     option
     */
    public <T> T get(ConfigOption<T> option) {
        return getOptional(option).orElseGet(option::defaultValue);
    }

    /**
     * Returns the value associated with the given config option as an {@link Optional}. The
     * default value of the option is not taken into account.
     */
    public <T> Optional<T> getOptional(ConfigOption<T> option) {
        Object rawValue = getRawValue(option.key());
        if (rawValue == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(convertValue(rawValue, option.getClazz()));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    String.format(
                            "Could not parse value '%s' for key '%s'.", rawValue, option.key()),
                    e);
        }
    }

    /**
     * Updates the given key/value pair of the configuration.
     *
     * @param option The option to set.
     * @param value The value to set.
     * @return this configuration
     */
    public <T> Configuration set(ConfigOption<T> option, T value) {
        checkNotNull(value, "The value of option '%s' must not be null.", option.key());
        synchronized (this.confData) {
            this.confData.put(option.key(), value);
        }
        return this;
    }

    /** Converts the configuration into a map of string keys and values. */
    public Map<String, String> toMap() {
        synchronized (this.confData) {
            Map<String, String> ret = new HashMap<>(this.confData.size());
            for (Map.Entry<String, Object> entry : confData.entrySet()) {
                ret.put(entry.getKey(), convertToString(entry.getValue()));
            }
            return ret;
        }
    }

    // --------------------------------------------------------------------------------------------

    @Nullable
    private Object getRawValue(String key) {
        synchronized (this.confData) {
            return this.confData.get(key);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> T convertValue(Object rawValue, Class<?> clazz) {
        if (clazz.isInstance(rawValue)) {
            return (T) rawValue;
        }
        if (clazz.isEnum()) {
            return (T) convertToEnum(rawValue.toString().trim(), clazz);
        }
        throw new IllegalArgumentException("Unsupported type: " + clazz);
    }

    private static Object convertToEnum(String value, Class<?> enumClass) {
        for (Object constant : enumClass.getEnumConstants()) {
            if (((Enum<?>) constant).name().equalsIgnoreCase(value)) {
                return constant;
            }
        }
        LOG.debug("Value '{}' is not a constant of {}.", value, enumClass.getName());
        throw new IllegalArgumentException(
                String.format(
                        "Value for config option %s must be one of %s (was %s)",
                        enumClass.getSimpleName(),
                        Arrays.toString(enumClass.getEnumConstants()),
                        value));
    }

    private static String convertToString(Object value) {
        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        return value.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (obj instanceof Configuration) {
            return toMap().equals(((Configuration) obj).toMap());
        }
        return false;
    }

    @Override
    public int hashCode() {
        return toMap().hashCode();
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
