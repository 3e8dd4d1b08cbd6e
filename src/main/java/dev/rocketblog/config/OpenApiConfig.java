package dev.rocketblog.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration(proxyBeanMethods = false)
public class OpenApiConfig {

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @Value("${server.port:8000}")
    private String serverPort;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Rocket Blog API")
                        .description("""
                                Read API for published blog posts.

                                ## Features
                                - Post listing with offset/limit pagination, search and whitelisted ordering
                                - Posts by tag, random posts, single post by author and slug
                                - Tag listing

                                Every response is wrapped in `{ "success": ..., "data": ..., "meta": ... }`.
                                """)
                        .version(appVersion))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Development Server")));
    }
}
