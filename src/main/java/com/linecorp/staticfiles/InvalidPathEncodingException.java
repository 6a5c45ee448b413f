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

import com.linecorp.armeria.common.annotation.Nullable;

/**
 * A {@link IllegalArgumentException} raised when a request path contains a malformed percent-encoded
 * sequence or does not decode into a valid UTF-8 string.
 */
public final class InvalidPathEncodingException extends IllegalArgumentException {

    private static final long serialVersionUID = -3470853154392561187L;

    /**
     * Creates a new instance with the specified {@code message}.
     */
    public InvalidPathEncodingException(String message) {
        super(message);
    }

    /**
     * Creates a new instance with the specified {@code message} and {@code cause}.
     */
    public InvalidPathEncodingException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
