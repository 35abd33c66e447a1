package com.warden;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

import java.util.List;

/**
 * Entry point. {@code warden serve} starts the REST API; every other subcommand runs once
 * without a web server and exits with its picocli exit code.
 */
@SpringBootApplication
public class WardenApplication {

    public static void main(String[] args) {
        boolean serve = List.of(args).contains("serve");

        var context = new SpringApplicationBuilder(WardenApplication.class)
                .properties(
                        "spring.main.web-application-type=" + (serve ? "servlet" : "none"),
                        "spring.main.banner-mode=off")
                .run(args);

        if (!serve) {
            System.exit(SpringApplication.exit(context, context.getBean(ExitCodeGenerator.class)));
        }
    }
}
