package dev.rocketblog.config;

import io.r2dbc.spi.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

@Configuration(proxyBeanMethods = false)
@EnableR2dbcRepositories(basePackages = "dev.rocketblog.repository")
@Slf4j
public class R2dbcConfig {

    /**
     * Creates the blog tables on startup and, when {@code app.schema.data-file} is set,
     * loads sample users, posts and tags after them. Only the {@code dev} profile enables this;
     * other environments manage the schema outside the application.
     */
    @Bean
    @ConditionalOnProperty(name = "app.schema.init", havingValue = "true")
    public ConnectionFactoryInitializer schemaInitializer(
            ConnectionFactory connectionFactory,
            @Value("${app.schema.file:schema.sql}") String schemaFile,
            @Value("${app.schema.data-file:}") String dataFile) {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(schemaFile));
        if (!dataFile.isBlank()) {
            populator.addScript(new ClassPathResource(dataFile));
        }
        log.info("Initialising schema from {}{}", schemaFile, dataFile.isBlank() ? "" : " with data from " + dataFile);

        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);
        initializer.setDatabasePopulator(populator);
        return initializer;
    }
}
