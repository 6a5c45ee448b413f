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

import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;

/**
 * Decides whether a relative path can be resolved against a root directory without escaping from it.
 *
 * <p>A path is safe if and only if every component of it is either {@link PathComponentType#CURRENT_DIR}
 * or {@link PathComponentType#NORMAL}. A path is not normalized before the check, so
 * {@code "foo/../bar"} is unsafe even though it normalizes into {@code "bar"}.
 * This class never accesses the file system.
 */
public final class SafePathValidator {

    /**
     * Returns {@code true} if the specified {@code path} is safe under the rules of the default
     * {@link FileSystem}.
     */
    public static boolean isSafe(String path) {
        return isSafe(path, FileSystems.getDefault());
    }

    /**
     * Returns {@code true} if the specified {@code path} is safe under the rules of
     * the specified {@link FileSystem}. A path that cannot be parsed by the {@link FileSystem} is unsafe.
     */
    public static boolean isSafe(String path, FileSystem fileSystem) {
        requireNonNull(path, "path");
        requireNonNull(fileSystem, "fileSystem");

        final List<PathComponentType> components;
        try {
            components = classify(fileSystem.getPath(path));
        } catch (InvalidPathException e) {
            return false;
        }

        for (PathComponentType c : components) {
            if (!c.isSafe()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Splits the specified {@code path} into components using the rules of the default {@link FileSystem}
     * and returns their types in order.
     *
     * @throws InvalidPathException if the default {@link FileSystem} cannot parse {@code path}
     */
    @VisibleForTesting
    static List<PathComponentType> classify(String path) {
        requireNonNull(path, "path");
        return classify(FileSystems.getDefault().getPath(path));
    }

    /**
     * Returns the types of the components of the specified {@link Path} in order.
     * A root such as {@code "C:\"} yields both {@link PathComponentType#PREFIX} and
     * {@link PathComponentType#ROOT}.
     */
    public static List<PathComponentType> classify(Path path) {
        requireNonNull(path, "path");
        final ImmutableList.Builder<PathComponentType> builder = ImmutableList.builder();

        final Path root = path.getRoot();
        if (root != null) {
            final String separator = path.getFileSystem().getSeparator();
            final String rootStr = root.toString();
            if (!rootStr.equals(separator)) {
                // Anything other than a lone separator carries a prefix, e.g. "C:", "C:\" or "\\host\share\".
                builder.add(PathComponentType.PREFIX);
            }
            if (rootStr.endsWith(separator)) {
                builder.add(PathComponentType.ROOT);
            }
        }

        for (Path name : path) {
            builder.add(classifyName(name.toString()));
        }
        return builder.build();
    }

    private static PathComponentType classifyName(String name) {
        switch (name) {
            case ".":
                return PathComponentType.CURRENT_DIR;
            case "..":
                return PathComponentType.PARENT_DIR;
            default:
                return PathComponentType.NORMAL;
        }
    }

    private SafePathValidator() {}
}
