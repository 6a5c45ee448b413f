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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;

import com.linecorp.armeria.common.HttpMethod;
import com.linecorp.armeria.common.HttpStatus;
import com.linecorp.armeria.common.annotation.Nullable;

/**
 * Resolves a request into a regular file beneath a root directory.
 *
 * <p>A {@link StaticFileResolver} holds no state other than its root directory, so a single instance
 * can be shared by any number of threads. Every invocation of
 * {@link #resolve(HttpMethod, String)} reads the attributes of at most one file and never reads
 * the content of the file.
 */
public final class StaticFileResolver {

    private static final Logger logger = LoggerFactory.getLogger(StaticFileResolver.class);

    /**
     * Returns a new {@link StaticFileResolver} which resolves files beneath the specified root directory.
     * A relative path is resolved against the current working directory when a file is looked up.
     */
    public static StaticFileResolver of(String rootDir) {
        requireNonNull(rootDir, "rootDir");
        return of(Paths.get(rootDir));
    }

    /**
     * Returns a new {@link StaticFileResolver} which resolves files beneath the specified root directory.
     */
    public static StaticFileResolver of(Path rootDir) {
        return new StaticFileResolver(rootDir);
    }

    private final Path rootDir;

    private StaticFileResolver(Path rootDir) {
        this.rootDir = requireNonNull(rootDir, "rootDir");
    }

    /**
     * Returns the root directory.
     */
    public Path rootDir() {
        return rootDir;
    }

    /**
     * Resolves the request with the specified {@link HttpMethod} and {@code path}.
     *
     * @param method the method of the request
     * @param path the absolute path of the request without the query part,
     *             or {@code null} if unavailable
     */
    public StaticFileResolution resolve(HttpMethod method, @Nullable String path) {
        requireNonNull(method, "method");
        final String candidate = RequestPathExtractor.extract(method, path);
        if (candidate == null) {
            return StaticFileResolution.passThrough();
        }

        logger.debug("{} {}{}", method, rootDir, path);

        final String decoded;
        try {
            decoded = PercentDecoder.decode(candidate);
        } catch (InvalidPathEncodingException e) {
            return StaticFileResolution.reject(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        return resolveDecoded(decoded);
    }

    @VisibleForTesting
    StaticFileResolution resolveDecoded(String relativePath) {
        if (!SafePathValidator.isSafe(relativePath, rootDir.getFileSystem())) {
            return StaticFileResolution.reject(HttpStatus.BAD_REQUEST,
                                               "The path '" + relativePath + "' was denied access.");
        }

        final Path file = rootDir.resolve(relativePath);
        final BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            return StaticFileResolution.passThrough();
        } catch (IOException e) {
            logger.debug("Failed to read the attributes of '{}'; passing to the next service:", file, e);
            return StaticFileResolution.passThrough();
        }

        if (attrs.isRegularFile()) {
            return StaticFileResolution.serve(file);
        }
        return StaticFileResolution.passThrough();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("rootDir", rootDir)
                          .toString();
    }
}
