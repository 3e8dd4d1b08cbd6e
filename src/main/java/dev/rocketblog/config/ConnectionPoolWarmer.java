package dev.rocketblog.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Opens a few pooled connections right after startup so the first requests do not
 * pay for connection establishment. Failures are logged and never stop the application.
 */
@Component
@Slf4j
public class ConnectionPoolWarmer {

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    private final DatabaseClient databaseClient;
    private final boolean enabled;
    private final int connections;
    private final int poolMaxSize;

    public ConnectionPoolWarmer(DatabaseClient databaseClient,
                                @Value("${app.pool.warm-up.enabled:true}") boolean enabled,
                                @Value("${app.pool.warm-up.connections:2}") int connections,
                                @Value("${spring.r2dbc.pool.max-size:10}") int poolMaxSize) {
        this.databaseClient = databaseClient;
        this.enabled = enabled;
        this.connections = connections;
        this.poolMaxSize = poolMaxSize;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void warmOnStartup() {
        if (!enabled) {
            log.info("Connection pool warm-up disabled");
            return;
        }
        warm().subscribe(
                null,
                error -> log.error("Connection pool warm-up subscription error: {}", error.getMessage()));
    }

    /**
     * Run the probes concurrently.
     *
     * @return number of probes that succeeded
     */
    public Mono<Long> warm() {
        int count = Math.max(0, Math.min(connections, poolMaxSize));
        log.info("Warming up pool with {} connections...", count);

        return Flux.range(0, count)
                .flatMap(i -> probe(), count == 0 ? 1 : count)
                .filter(Boolean::booleanValue)
                .count()
                .doOnNext(ready -> log.info("Pool warmed: {}/{} connections ready", ready, count));
    }

    private Mono<Boolean> probe() {
        return databaseClient.sql("SELECT 1")
                .fetch()
                .one()
                .timeout(PROBE_TIMEOUT)
                .thenReturn(true)
                .onErrorResume(e -> {
                    log.warn("Failed to warm connection: {}", e.getMessage());
                    return Mono.just(false);
                });
    }
}
