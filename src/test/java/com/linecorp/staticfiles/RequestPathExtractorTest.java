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

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.EnumSource.Mode;

import com.linecorp.armeria.common.HttpMethod;

class RequestPathExtractorTest {

    @Test
    void rootPathIsMappedToIndexFile() {
        assertThat(RequestPathExtractor.extract(HttpMethod.GET, "/")).isEqualTo("index.html");
        assertThat(RequestPathExtractor.extract(HttpMethod.HEAD, "/")).isEqualTo("index.html");
    }

    @Test
    void leadingSlashIsStripped() {
        assertThat(RequestPathExtractor.extract(HttpMethod.GET, "/a/b.txt")).isEqualTo("a/b.txt");
        assertThat(RequestPathExtractor.extract(HttpMethod.GET, "/a/")).isEqualTo("a/");
        // Only one character is removed.
        assertThat(RequestPathExtractor.extract(HttpMethod.GET, "//a")).isEqualTo("/a");
    }

    @Test
    void percentEncodingIsKept() {
        assertThat(RequestPathExtractor.extract(HttpMethod.GET, "/%2e%2e/secret.txt"))
                .isEqualTo("%2e%2e/secret.txt");
    }

    @Test
    void unavailablePath() {
        assertThat(RequestPathExtractor.extract(HttpMethod.GET, null)).isNull();
    }

    @ParameterizedTest
    @EnumSource(value = HttpMethod.class, names = { "GET", "HEAD" }, mode = Mode.EXCLUDE)
    void ineligibleMethods(HttpMethod method) {
        assertThat(RequestPathExtractor.isEligible(method)).isFalse();
        assertThat(RequestPathExtractor.extract(method, "/")).isNull();
        assertThat(RequestPathExtractor.extract(method, "/a/b.txt")).isNull();
    }
}
