package dev.rocketblog.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * Tags every request with an id so that the error log lines of one listing request
 * can be correlated. An upstream {@code X-Request-ID} is reused when well formed.
 * The id is echoed in the response header, kept as the exchange attribute
 * {@link #REQUEST_ID_ATTRIBUTE} and written to the Reactor context.
 * <p>
 * The filter also opens an empty query-intent slot, shared between the exchange
 * attribute {@link #QUERY_INTENT_ATTRIBUTE} and the context key
 * {@link #QUERY_INTENT_CONTEXT_KEY}. {@link ResilienceConfig#bounded} fills it with the
 * operation being run, so the error handler can log what the failed query was for.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class RequestIdFilter implements WebFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_CONTEXT_KEY = "requestId";
    public static final String REQUEST_ID_ATTRIBUTE = RequestIdFilter.class.getName() + ".requestId";
    public static final String QUERY_INTENT_CONTEXT_KEY = "queryIntent";
    public static final String QUERY_INTENT_ATTRIBUTE = RequestIdFilter.class.getName() + ".queryIntent";

    private static final int MAX_ID_LENGTH = 64;
    private static final int GENERATED_ID_LENGTH = 16;
    private static final Pattern VALID_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_]+$");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String requestId = resolveRequestId(exchange.getRequest().getHeaders().getFirst(REQUEST_ID_HEADER));

        AtomicReference<String> queryIntent = new AtomicReference<>();

        exchange.getAttributes().put(REQUEST_ID_ATTRIBUTE, requestId);
        exchange.getAttributes().put(QUERY_INTENT_ATTRIBUTE, queryIntent);
        exchange.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);

        return chain.filter(exchange)
                .contextWrite(Context.of(REQUEST_ID_CONTEXT_KEY, requestId, QUERY_INTENT_CONTEXT_KEY, queryIntent));
    }

    /**
     * Id to log for the exchange, or {@code "-"} when the filter did not run.
     */
    public static String currentRequestId(ServerWebExchange exchange) {
        String requestId = exchange.getAttribute(REQUEST_ID_ATTRIBUTE);
        return requestId != null ? requestId : "-";
    }

    /**
     * Last store operation started for the exchange, or {@code "-"} when none was recorded.
     */
    public static String currentQueryIntent(ServerWebExchange exchange) {
        AtomicReference<String> queryIntent = exchange.getAttribute(QUERY_INTENT_ATTRIBUTE);
        String intent = queryIntent != null ? queryIntent.get() : null;
        return intent != null ? intent : "-";
    }

    private static String resolveRequestId(String upstream) {
        String sanitized = sanitizeId(upstream);
        if (sanitized != null) {
            return sanitized;
        }
        if (upstream != null && !upstream.isBlank()) {
            log.warn("Replacing malformed {} header", REQUEST_ID_HEADER);
        }
        return UUID.randomUUID().toString().replace("-", "").substring(0, GENERATED_ID_LENGTH);
    }

    /**
     * Null when the value is blank, longer than 64 characters, or has characters outside {@code [A-Za-z0-9_-]}.
     */
    static String sanitizeId(String value) {
        if (value == null || value.isBlank() || value.length() > MAX_ID_LENGTH) {
            return null;
        }
        return VALID_ID_PATTERN.matcher(value).matches() ? value : null;
    }
}
