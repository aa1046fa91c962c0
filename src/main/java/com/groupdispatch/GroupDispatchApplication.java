package com.groupdispatch;

import com.groupdispatch.dispatch.cli.CliRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
public class GroupDispatchApplication {

    public static void main(String[] args) throws IOException {
        // The SQLite driver does not create parent directories of the database file
        Files.createDirectories(Path.of(System.getProperty("groupdispatch.data-dir", "data")));

        boolean serveMode = CliRunner.isServe(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(GroupDispatchApplication.class);
        if (serveMode) {
            builder.properties(
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off",
                    "groupdispatch.engine.autostart=true"
            );
        } else {
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off"
            );
        }

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            System.exit(SpringApplication.exit(ctx, exitCodeGen));
        }
    }
}
