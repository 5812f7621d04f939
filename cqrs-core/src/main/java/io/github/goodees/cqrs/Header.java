package io.github.goodees.cqrs;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Names of the headers the runtime itself puts on commits and messages. Headers are plain string maps that are
 * forwarded from the inbound message into the command or event context, and from there into the stored commit.
 */
public final class Header {
    /**
     * Concrete aggregate class, stored on the very first commit of a stream.
     */
    public static final String AGGREGATE = "_aggregate";
    public static final String ORIGIN = "_origin";
    public static final String TIMESTAMP = "_timestamp";
    public static final String REMOTE_ADDRESS = "_remoteAddress";
    public static final String USER_ADDRESS = "_userAddress";
    public static final String USER_NAME = "_userName";

    private Header() {
    }

    /**
     * Create an unmodifiable copy of the headers, tolerating {@code null}.
     * @param headers headers to copy
     * @return unmodifiable copy with iteration order preserved
     */
    public static Map<String, String> copyOf(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    /**
     * Return new unmodifiable headers with one more value added, replacing an existing value of the same name.
     * @param headers original headers
     * @param name header name
     * @param value header value
     * @return new headers
     */
    public static Map<String, String> with(Map<String, String> headers, String name, String value) {
        Map<String, String> result = new LinkedHashMap<>();
        if (headers != null) {
            result.putAll(headers);
        }
        result.put(name, value);
        return Collections.unmodifiableMap(result);
    }
}
