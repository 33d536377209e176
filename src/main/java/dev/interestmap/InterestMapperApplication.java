package dev.interestmap;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class InterestMapperApplication implements CommandLineRunner {

    private final MappingRunner mappingRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(InterestMapperApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            mappingRunner.execute();
            exitManager.exit(0);
        } catch (Exception e) {
            log.error("Interest mapping failed: {}", e.getMessage(), e);
            exitManager.exit(1);
        }
    }
}
