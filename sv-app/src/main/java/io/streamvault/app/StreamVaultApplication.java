package io.streamvault.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.streamvault")
@ConfigurationPropertiesScan
@EnableScheduling
public class StreamVaultApplication {
    public static void main(String[] args) {
        SpringApplication.run(StreamVaultApplication.class, args);
    }
}
