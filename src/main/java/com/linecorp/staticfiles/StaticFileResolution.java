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

import static java.util.Objects.requireNonNull;

import java.nio.file.Path;
import java.util.Objects;

import com.google.common.base.MoreObjects;

import com.linecorp.armeria.common.HttpStatus;
import com.linecorp.armeria.common.annotation.Nullable;

/**
 * The result returned by {@link StaticFileResolver#resolve(com.linecorp.armeria.common.HttpMethod, String)}.
 */
public final class StaticFileResolution {

    private static final StaticFileResolution PASS_THROUGH =
            new StaticFileResolution(StaticFileResolutionType.PASS_THROUGH, null, null, null);

    /**
     * Returns a {@link StaticFileResolution} whose {@link #type()} is {@link StaticFileResolutionType#SERVE}.
     */
    public static StaticFileResolution serve(Path file) {
        requireNonNull(file, "file");
        return new StaticFileResolution(StaticFileResolutionType.SERVE, file, null, null);
    }

    /**
     * Returns the {@link StaticFileResolution} whose {@link #type()} is
     * {@link StaticFileResolutionType#PASS_THROUGH}.
     */
    public static StaticFileResolution passThrough() {
        return PASS_THROUGH;
    }

    /**
     * Returns a {@link StaticFileResolution} whose {@link #type()} is {@link StaticFileResolutionType#REJECT}.
     */
    public static StaticFileResolution reject(HttpStatus status, String reason) {
        requireNonNull(status, "status");
        requireNonNull(reason, "reason");
        return new StaticFileResolution(StaticFileResolutionType.REJECT, null, status, reason);
    }

    private final StaticFileResolutionType type;
    @Nullable
    private final Path file;
    @Nullable
    private final HttpStatus status;
    @Nullable
    private final String reason;

    private StaticFileResolution(StaticFileResolutionType type, @Nullable Path file,
                                 @Nullable HttpStatus status, @Nullable String reason) {
        assert type == StaticFileResolutionType.SERVE || file == null;
        assert type == StaticFileResolutionType.REJECT || status == null && reason == null;

        this.type = type;
        this.file = file;
        this.status = status;
        this.reason = reason;
    }

    /**
     * Returns the type of this resolution.
     */
    public StaticFileResolutionType type() {
        return type;
    }

    /**
     * Returns the file to serve.
     *
     * @throws IllegalStateException if the {@link #type()} is not {@link StaticFileResolutionType#SERVE}
     */
    public Path file() {
        ensureType(StaticFileResolutionType.SERVE);
        assert file != null;
        return file;
    }

    /**
     * Returns the {@link HttpStatus} of the error response.
     *
     * @throws IllegalStateException if the {@link #type()} is not {@link StaticFileResolutionType#REJECT}
     */
    public HttpStatus status() {
        ensureType(StaticFileResolutionType.REJECT);
        assert status != null;
        return status;
    }

    /**
     * Returns the human-readable reason of the rejection.
     *
     * @throws IllegalStateException if the {@link #type()} is not {@link StaticFileResolutionType#REJECT}
     */
    public String reason() {
        ensureType(StaticFileResolutionType.REJECT);
        assert reason != null;
        return reason;
    }

    private void ensureType(StaticFileResolutionType expected) {
        if (type != expected) {
            throw new IllegalStateException("type: " + type + " (expected: " + expected + ')');
        }
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StaticFileResolution)) {
            return false;
        }
        final StaticFileResolution that = (StaticFileResolution) o;
        return type == that.type &&
               Objects.equals(file, that.file) &&
               Objects.equals(status, that.status) &&
               Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, file, status, reason);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("type", type)
                          .add("file", file)
                          .add("status", status)
                          .add("reason", reason)
                          .toString();
    }
}
