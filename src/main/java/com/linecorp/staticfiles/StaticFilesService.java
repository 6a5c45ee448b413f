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
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import com.linecorp.armeria.common.HttpMethod;
import com.linecorp.armeria.common.HttpRequest;
import com.linecorp.armeria.common.HttpResponse;
import com.linecorp.armeria.common.MediaType;
import com.linecorp.armeria.server.HttpService;
import com.linecorp.armeria.server.ServiceRequestContext;
import com.linecorp.armeria.server.SimpleDecoratingHttpService;
import com.linecorp.armeria.server.file.HttpFile;

/**
 * Decorates an {@link HttpService} to serve the regular files beneath a root directory.
 *
 * <p>For each {@code GET} or {@code HEAD} request, the {@link ServiceRequestContext#mappedPath()} is
 * resolved by a {@link StaticFileResolver} and:
 * <ul>
 *   <li>the file is sent if the path points to a regular file,</li>
 *   <li>{@code 400 Bad Request} is sent if the path is not percent-encoded properly or
 *       contains a {@code ..} segment, or</li>
 *   <li>the request is passed to the decorated {@link HttpService} otherwise.</li>
 * </ul>
 * Any other request is passed to the decorated {@link HttpService} as is. A request for {@code "/"}
 * is served from {@code index.html} in the root directory.
 */
public final class StaticFilesService extends SimpleDecoratingHttpService {

    /**
     * Returns a new {@link HttpService} decorator that serves the files beneath
     * the specified root directory.
     */
    public static Function<? super HttpService, StaticFilesService> newDecorator(String rootDir) {
        return newDecorator(StaticFileResolver.of(rootDir));
    }

    /**
     * Returns a new {@link HttpService} decorator that serves the files beneath
     * the specified root directory.
     */
    public static Function<? super HttpService, StaticFilesService> newDecorator(Path rootDir) {
        return newDecorator(StaticFileResolver.of(rootDir));
    }

    /**
     * Returns a new {@link HttpService} decorator that serves the files resolved by
     * the specified {@link StaticFileResolver}.
     */
    public static Function<? super HttpService, StaticFilesService> newDecorator(
            StaticFileResolver resolver) {
        requireNonNull(resolver, "resolver");
        return delegate -> new StaticFilesService(delegate, resolver);
    }

    private final StaticFileResolver resolver;

    private StaticFilesService(HttpService delegate, StaticFileResolver resolver) {
        super(delegate);
        this.resolver = resolver;
    }

    /**
     * Returns the {@link StaticFileResolver} that resolves the files to serve.
     */
    public StaticFileResolver resolver() {
        return resolver;
    }

    @Override
    public HttpResponse serve(ServiceRequestContext ctx, HttpRequest req) throws Exception {
        final HttpMethod method = ctx.method();
        if (!RequestPathExtractor.isEligible(method)) {
            return unwrap().serve(ctx, req);
        }

        // Reading the file attributes may block, so it must not run in an event loop.
        final String path = ctx.mappedPath();
        final CompletableFuture<HttpResponse> future =
                CompletableFuture.supplyAsync(() -> resolver.resolve(method, path),
                                              ctx.blockingTaskExecutor())
                                 .thenApplyAsync(resolution -> respond(ctx, req, resolution),
                                                 ctx.eventLoop());
        return HttpResponse.of(future);
    }

    private HttpResponse respond(ServiceRequestContext ctx, HttpRequest req,
                                 StaticFileResolution resolution) {
        try {
            switch (resolution.type()) {
                case SERVE:
                    return HttpFile.of(resolution.file()).asService().serve(ctx, req);
                case REJECT:
                    return HttpResponse.of(resolution.status(), MediaType.PLAIN_TEXT_UTF_8,
                                           resolution.reason());
                case PASS_THROUGH:
                    return unwrap().serve(ctx, req);
                default:
                    throw new Error("unexpected resolution type: " + resolution.type());
            }
        } catch (Exception e) {
            return HttpResponse.ofFailure(e);
        }
    }

    @Override
    public String toString() {
        return StaticFilesService.class.getSimpleName() + '(' + unwrap() + ", " + resolver + ')';
    }
}
