package dev.rocketblog.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import org.springframework.r2dbc.core.FetchSpec;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConnectionPoolWarmerTest {

    @Mock
    private DatabaseClient databaseClient;

    @Mock
    private GenericExecuteSpec executeSpec;

    @Mock
    private FetchSpec<Map<String, Object>> fetchSpec;

    @BeforeEach
    void setUp() {
        lenient().when(databaseClient.sql("SELECT 1")).thenReturn(executeSpec);
        lenient().when(executeSpec.fetch()).thenReturn(fetchSpec);
    }

    @Test
    @DisplayName("Should run one probe per requested connection")
    void shouldWarmRequestedConnections() {
        when(fetchSpec.one()).thenReturn(Mono.just(Map.of("?column?", 1)));
        ConnectionPoolWarmer warmer = new ConnectionPoolWarmer(databaseClient, true, 3, 20);

        StepVerifier.create(warmer.warm())
                .expectNext(3L)
                .verifyComplete();

        verify(databaseClient, times(3)).sql("SELECT 1");
    }

    @Test
    @DisplayName("Should never open more probes than the pool holds")
    void shouldCapAtPoolSize() {
        when(fetchSpec.one()).thenReturn(Mono.just(Map.of("?column?", 1)));
        ConnectionPoolWarmer warmer = new ConnectionPoolWarmer(databaseClient, true, 50, 4);

        StepVerifier.create(warmer.warm())
                .expectNext(4L)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should count failed probes as not ready instead of failing")
    void shouldTolerateProbeFailures() {
        when(fetchSpec.one())
                .thenReturn(Mono.just(Map.of("?column?", 1)))
                .thenReturn(Mono.error(new DataAccessResourceFailureException("connection refused")));
        ConnectionPoolWarmer warmer = new ConnectionPoolWarmer(databaseClient, true, 2, 20);

        StepVerifier.create(warmer.warm())
                .expectNext(1L)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should do nothing when disabled")
    void shouldSkipWhenDisabled() {
        ConnectionPoolWarmer warmer = new ConnectionPoolWarmer(databaseClient, false, 2, 20);

        warmer.warmOnStartup();

        verifyNoInteractions(databaseClient);
    }
}
