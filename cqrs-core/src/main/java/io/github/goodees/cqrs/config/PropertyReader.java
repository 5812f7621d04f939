package io.github.goodees.cqrs.config;

/*-
 * #%L
 * cqrs
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Properties;

/**
 * Typed access to prefixed properties. Durations are read either as ISO-8601 ({@code PT10S}) or as milliseconds.
 */
final class PropertyReader {
    private final Properties properties;
    private final String prefix;

    PropertyReader(Properties properties, String prefix) {
        this.properties = properties;
        this.prefix = prefix == null || prefix.isEmpty() || prefix.endsWith(".") ? nullToEmpty(prefix) : prefix + ".";
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private String get(String name) {
        String value = properties.getProperty(prefix + name);
        return value == null ? null : value.trim();
    }

    int getInt(String name, int defaultValue) {
        String value = get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw invalid(name, value, e);
        }
    }

    long getLong(String name, long defaultValue) {
        String value = get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw invalid(name, value, e);
        }
    }

    boolean getBoolean(String name, boolean defaultValue) {
        String value = get(name);
        if (value == null) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value)) {
            return true;
        } else if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw invalid(name, value, null);
    }

    Duration getDuration(String name, Duration defaultValue) {
        String value = get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            if (value.startsWith("P") || value.startsWith("p")) {
                return Duration.parse(value);
            }
            return Duration.ofMillis(Long.parseLong(value));
        } catch (DateTimeParseException | NumberFormatException e) {
            throw invalid(name, value, e);
        }
    }

    private IllegalArgumentException invalid(String name, String value, Exception cause) {
        return new IllegalArgumentException("Invalid value of property " + prefix + name + ": " + value, cause);
    }
}
