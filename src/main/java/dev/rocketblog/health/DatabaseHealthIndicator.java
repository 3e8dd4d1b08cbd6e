package dev.rocketblog.health;

import io.r2dbc.pool.ConnectionPool;
import io.r2dbc.spi.ConnectionFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Actuator {@code db} indicator. Borrows one pooled connection for {@code SELECT 1}
 * and reports pool occupancy next to the result, so an exhausted pool shows up
 * here before listings start answering 503.
 */
@Component("db")
@RequiredArgsConstructor
@Slf4j
public class DatabaseHealthIndicator implements ReactiveHealthIndicator {

    static final String VALIDATION_QUERY = "SELECT 1";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final DatabaseClient databaseClient;
    private final ConnectionFactory connectionFactory;

    @Override
    public Mono<Health> health() {
        return databaseClient.sql(VALIDATION_QUERY)
                .fetch()
                .one()
                .timeout(TIMEOUT)
                .then(Mono.fromSupplier(() -> withPoolDetails(Health.up()
                        .withDetail("database", "PostgreSQL")
                        .withDetail("validationQuery", VALIDATION_QUERY))
                        .build()))
                .onErrorResume(ex -> {
                    log.error("Database health check failed: {}", ex.getClass().getSimpleName());
                    return Mono.just(withPoolDetails(Health.down()
                            .withDetail("database", "PostgreSQL")
                            .withDetail("error", ex.getClass().getSimpleName()))
                            .build());
                });
    }

    private Health.Builder withPoolDetails(Health.Builder builder) {
        if (connectionFactory instanceof ConnectionPool pool) {
            pool.getMetrics().ifPresent(metrics -> builder
                    .withDetail("pool.acquired", metrics.acquiredSize())
                    .withDetail("pool.idle", metrics.idleSize())
                    .withDetail("pool.max", metrics.getMaxAllocatedSize()));
        }
        return builder;
    }
}
