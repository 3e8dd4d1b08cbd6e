package dev.rocketblog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RocketBlogApplication {

    public static void main(String[] args) {
        SpringApplication.run(RocketBlogApplication.class, args);
    }
}
