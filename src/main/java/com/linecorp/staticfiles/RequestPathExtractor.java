/*
 * Copyright 2026 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package com.linecorp.staticfiles;

import com.linecorp.armeria.common.HttpMethod;
import com.linecorp.armeria.common.annotation.Nullable;

/**
 * Derives the candidate file path from the path of a request.
 */
final class RequestPathExtractor {

    static final String INDEX_FILE_NAME = "index.html";

    /**
     * Returns {@code true} if a request with the specified {@link HttpMethod} may be served from
     * the root directory.
     */
    static boolean isEligible(HttpMethod method) {
        switch (method) {
            case GET:
            case HEAD:
                return true;
            default:
                return false;
        }
    }

    /**
     * Returns the candidate file path relative to the root directory, or {@code null} if the request
     * should be passed to the next service as is.
     *
     * @param method the method of the request
     * @param path the absolute path of the request, without the query part
     */
    @Nullable
    static String extract(HttpMethod method, @Nullable String path) {
        if (!isEligible(method) || path == null) {
            return null;
        }

        if ("/".equals(path)) {
            return INDEX_FILE_NAME;
        }

        // Strip exactly one leading character, which is '/' for any valid request path.
        return path.substring(1);
    }

    private RequestPathExtractor() {}
}
