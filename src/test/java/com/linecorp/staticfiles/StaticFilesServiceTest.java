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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import com.linecorp.armeria.common.AggregatedHttpResponse;
import com.linecorp.armeria.common.HttpMethod;
import com.linecorp.armeria.common.HttpRequest;
import com.linecorp.armeria.common.HttpResponse;
import com.linecorp.armeria.common.HttpStatus;
import com.linecorp.armeria.common.MediaType;
import com.linecorp.armeria.server.HttpService;
import com.linecorp.armeria.server.ServiceRequestContext;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class StaticFilesServiceTest {

    @TempDir
    Path rootDir;

    @Mock
    HttpService delegate;

    private StaticFilesService service;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(rootDir.resolve("a"));
        Files.write(rootDir.resolve("a/b.txt"), "Hello, b!".getBytes(StandardCharsets.UTF_8));
        when(delegate.serve(any(), any())).thenReturn(HttpResponse.of(HttpStatus.NOT_FOUND));
        service = StaticFilesService.newDecorator(rootDir).apply(delegate);
    }

    @Test
    void serveFile() throws Exception {
        final AggregatedHttpResponse res = serve(HttpMethod.GET, "/a/b.txt");
        assertThat(res.status()).isSameAs(HttpStatus.OK);
        assertThat(res.contentUtf8()).isEqualTo("Hello, b!");
        verify(delegate, never()).serve(any(), any());
    }

    @Test
    void serveIndexFile() throws Exception {
        Files.write(rootDir.resolve("index.html"), "<html/>".getBytes(StandardCharsets.UTF_8));
        final AggregatedHttpResponse res = serve(HttpMethod.GET, "/");
        assertThat(res.status()).isSameAs(HttpStatus.OK);
        assertThat(res.contentUtf8()).isEqualTo("<html/>");
    }

    @Test
    void passMissingFileToDelegate() throws Exception {
        assertThat(serve(HttpMethod.GET, "/a/missing.txt").status()).isSameAs(HttpStatus.NOT_FOUND);
        verify(delegate).serve(any(), any());
    }

    @Test
    void passDirectoryToDelegate() throws Exception {
        assertThat(serve(HttpMethod.GET, "/a").status()).isSameAs(HttpStatus.NOT_FOUND);
        verify(delegate).serve(any(), any());
    }

    @Test
    void passIneligibleMethodToDelegate() throws Exception {
        final HttpRequest req = HttpRequest.of(HttpMethod.POST, "/a/b.txt");
        final ServiceRequestContext ctx = ServiceRequestContext.of(req);
        final HttpResponse res = service.serve(ctx, req);
        // Passed synchronously, without looking up the file.
        verify(delegate).serve(same(ctx), same(req));
        assertThat(res.aggregate().join().status()).isSameAs(HttpStatus.NOT_FOUND);
    }

    @Test
    void rejectInvalidEncoding() throws Exception {
        final AggregatedHttpResponse res = serve(HttpMethod.GET, "/a/%C3%28.txt");
        assertThat(res.status()).isSameAs(HttpStatus.BAD_REQUEST);
        assertThat(res.contentType()).isEqualTo(MediaType.PLAIN_TEXT_UTF_8);
        assertThat(res.contentUtf8()).startsWith("invalid UTF-8 sequence in path:");
        verify(delegate, never()).serve(any(), any());
    }

    @Test
    void resolver() {
        assertThat(service.resolver().rootDir()).isEqualTo(rootDir);
        assertThat(service.toString()).contains(rootDir.toString());
    }

    private AggregatedHttpResponse serve(HttpMethod method, String path) throws Exception {
        final HttpRequest req = HttpRequest.of(method, path);
        final ServiceRequestContext ctx = ServiceRequestContext.of(req);
        return service.serve(ctx, req).aggregate().join();
    }
}
