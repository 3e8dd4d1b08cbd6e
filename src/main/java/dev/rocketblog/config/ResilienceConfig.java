package dev.rocketblog.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Deadline for one read operation, covering connection acquisition and every
 * statement the operation issues.
 *
 * <pre>
 * return postRepository.findByUsernameAndSlug(username, slug)
 *         .transform(op -> resilience.bounded(op, "getPostByUsernameAndSlug"));
 * </pre>
 *
 * Failures are not retried.
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration databaseTimeout;

    public ResilienceConfig(@Value("${resilience.database.timeout-seconds:10}") int databaseTimeoutSeconds) {
        this.databaseTimeout = Duration.ofSeconds(databaseTimeoutSeconds);
        log.info("Database operation timeout: {}", databaseTimeout);
    }

    /**
     * Apply {@link #databaseTimeout} to {@code operation}. On expiry the upstream is
     * cancelled, which returns any borrowed connection to the pool, and a
     * {@link TimeoutException} is signalled.
     * <p>
     * {@code operationName} is also recorded in the request's query-intent slot when
     * {@link RequestIdFilter} opened one, e.g. {@code "listPosts orderBy=title direction=ASC limit=20 offset=0"}.
     */
    public <T> Mono<T> bounded(Mono<T> operation, String operationName) {
        return Mono.deferContextual(ctx -> {
                    ctx.<AtomicReference<String>>getOrEmpty(RequestIdFilter.QUERY_INTENT_CONTEXT_KEY)
                            .ifPresent(queryIntent -> queryIntent.set(operationName));
                    return operation.timeout(databaseTimeout);
                })
                .doOnError(TimeoutException.class,
                        ex -> log.warn("{} exceeded database timeout of {}", operationName, databaseTimeout));
    }
}
