package com.project.graph.digitizer;

import com.project.graph.digitizer.cli.CommandLineOptions;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point. With an image path on the command line the application digitizes that
 * image and exits; without one it starts the web front end.
 * No business logic belongs here.
 */
@SpringBootApplication
public class Application {
    public static void main(String[] args) {
        if (CommandLineOptions.hasPositionalArgument(args)) {
            ConfigurableApplicationContext ctx = new SpringApplicationBuilder(Application.class)
                    .web(WebApplicationType.NONE)
                    .headless(!CommandLineOptions.needsDisplay(args, System.getenv(), System.getProperty("os.name")))
                    .profiles("cli")
                    .bannerMode(Banner.Mode.OFF)
                    .logStartupInfo(false)
                    .run(args);
            System.exit(SpringApplication.exit(ctx));
        }
        SpringApplication.run(Application.class, args);
    }
}
