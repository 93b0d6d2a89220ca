/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.ferry.controller.http;

import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags each request with an id that follows it through the logs.
 *
 * <p>Agents may send their own {@code X-Request-ID} so that a poll or event post can be matched
 * with the agent's log. Ids that are too long or carry characters outside
 * {@code [A-Za-z0-9._-]} are replaced, since the value is written verbatim into log lines.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class CorrelationIdHandler implements Handler<RoutingContext> {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    public static final String MDC_REQUEST_ID = "requestId";

    private static final String CTX_KEY = "ferry.requestId";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    public void handle(RoutingContext ctx) {
        String supplied = ctx.request().getHeader(REQUEST_ID_HEADER);
        String requestId = supplied != null && ACCEPTED_ID.matcher(supplied).matches()
            ? supplied
            : newRequestId();

        ctx.put(CTX_KEY, requestId);
        ctx.response().putHeader(REQUEST_ID_HEADER, requestId);
        MDC.put(MDC_REQUEST_ID, requestId);
        ctx.addEndHandler(done -> MDC.remove(MDC_REQUEST_ID));
        ctx.next();
    }

    /**
     * @return the id assigned to this request, or null if the handler has not run
     */
    public static String getRequestId(RoutingContext ctx) {
        return ctx.get(CTX_KEY);
    }

    static String newRequestId() {
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
