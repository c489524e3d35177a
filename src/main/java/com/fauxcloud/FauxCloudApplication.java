package com.fauxcloud;

import com.fauxcloud.core.persistence.StoreLockedException;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;
import org.springframework.core.NestedExceptionUtils;

import java.util.Arrays;

@SpringBootApplication
public class FauxCloudApplication {

    public static void main(String[] args) {
        boolean serveMode = Arrays.asList(args).contains("serve");

        SpringApplicationBuilder builder = new SpringApplicationBuilder(FauxCloudApplication.class);

        if (serveMode) {
            builder.properties(
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off"
            );
        } else {
            // CLI-only: no web server, and expiry is left to the long-running server
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off",
                    "fauxcloud.lifecycle.sweep.enabled=false"
            );
        }

        ApplicationContext ctx;
        try {
            ctx = builder.run(args);
        } catch (RuntimeException e) {
            // another manager owns the state directory
            if (NestedExceptionUtils.getMostSpecificCause(e) instanceof StoreLockedException locked) {
                System.err.println(locked.getMessage());
                System.exit(1);
            }
            throw e;
        }

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
    }
}
