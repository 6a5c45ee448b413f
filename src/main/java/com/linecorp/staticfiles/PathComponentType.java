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

/**
 * The structural class of a component of a file system path.
 *
 * @see SafePathValidator#classify(java.nio.file.Path)
 */
public enum PathComponentType {
    /**
     * The current directory marker, {@code "."}.
     */
    CURRENT_DIR,
    /**
     * The parent directory marker, {@code ".."}.
     */
    PARENT_DIR,
    /**
     * A named file or directory.
     */
    NORMAL,
    /**
     * The root directory separator, e.g. the leading {@code "/"} of {@code "/etc/passwd"}.
     */
    ROOT,
    /**
     * A platform-specific prefix such as a drive letter ({@code "C:"}) or a UNC share
     * ({@code "\\server\share"}).
     */
    PREFIX;

    /**
     * Returns {@code true} if a path component of this type can be resolved against a root directory
     * without escaping from it.
     */
    public boolean isSafe() {
        return this == CURRENT_DIR || this == NORMAL;
    }
}
