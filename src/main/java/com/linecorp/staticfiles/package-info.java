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

/**
 * Serves the regular files beneath a root directory from an Armeria server.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * ServerBuilder sb = Server.builder();
 * sb.serviceUnder("/", myFallbackService.decorate(
 *         StaticFilesService.newDecorator("/path/to/serve/")));
 * }</pre>
 *
 * <p>A request is served from the root directory only when it is a {@code GET} or {@code HEAD} request
 * whose path points to a regular file. A request whose path contains a {@code ..} segment is rejected
 * with {@code 400 Bad Request}. Every other request goes to the decorated service.
 */
@NonNullByDefault
package com.linecorp.staticfiles;

import com.linecorp.armeria.common.annotation.NonNullByDefault;
