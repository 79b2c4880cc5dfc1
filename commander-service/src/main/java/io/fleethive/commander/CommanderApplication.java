package io.fleethive.commander;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan(basePackages = "io.fleethive.commander.config")
public class CommanderApplication {
    public static void main(String[] args) {
        SpringApplication.run(CommanderApplication.class, args);
    }
}
