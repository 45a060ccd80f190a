package villagecompute.mobile.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;
import villagecompute.mobile.auth.Identity;

/**
 * Standard MDC field names and helpers for structured logging of mobile API requests.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code user_id} - User UUID for authorized and unauthorized identities</li>
 * <li>{@code anon_id} - Anonymous device identifier</li>
 * <li>{@code identity_kind} - AUTHORIZED_USER, ANONYMOUS_USER or UNAUTHORIZED_USER</li>
 * <li>{@code entrypoint_key} - Entrypoint being resolved</li>
 * <li>{@code request_origin} - HTTP request path</li>
 * </ul>
 *
 * <p>
 * <b>Usage in REST resources:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setIdentity(identity);
 * LoggingConfig.setRequestOrigin("/api/mobile/whoami");
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Clear MDC at the end of
 * every request.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_USER_ID = "user_id";

    public static final String MDC_ANON_ID = "anon_id";

    public static final String MDC_IDENTITY_KIND = "identity_kind";

    public static final String MDC_ENTRYPOINT_KEY = "entrypoint_key";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. Empty strings are written when no
     * span is active.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    /**
     * Records the caller identity. Anonymous identities go to {@code anon_id}, all others to {@code user_id}.
     *
     * @param identity
     *            resolved caller identity
     */
    public static void setIdentity(Identity identity) {
        if (identity == null) {
            return;
        }
        MDC.put(MDC_IDENTITY_KIND, identity.kind().name());
        switch (identity.kind()) {
            case ANONYMOUS_USER -> {
                MDC.put(MDC_ANON_ID, identity.id());
                MDC.remove(MDC_USER_ID);
            }
            case AUTHORIZED_USER, UNAUTHORIZED_USER -> {
                MDC.put(MDC_USER_ID, identity.id());
                MDC.remove(MDC_ANON_ID);
            }
        }
    }

    public static void setEntrypointKey(String entrypointKey) {
        if (entrypointKey != null) {
            MDC.put(MDC_ENTRYPOINT_KEY, entrypointKey);
        }
    }

    /**
     * Sets the request origin.
     *
     * @param requestOrigin
     *            path like "/api/mobile/whoami"
     */
    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Clears all observability-related MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_ANON_ID);
        MDC.remove(MDC_IDENTITY_KIND);
        MDC.remove(MDC_ENTRYPOINT_KEY);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
