package dev.interestmap.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.interestmap.model.QuestionCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/**
 * Configuration for loading the default QuestionCatalog from questions.json.
 */
@Slf4j
@Configuration
public class CatalogConfig {

    @Bean
    public QuestionCatalog questionCatalog(ObjectMapper objectMapper, ResourceLoader resourceLoader,
                                           @Value("${catalog.path:classpath:questions.json}") String catalogPath) {
        Resource resource = resourceLoader.getResource(catalogPath);
        if (!resource.exists()) {
            log.warn("Question catalog {} not found. Using empty catalog.", catalogPath);
            return QuestionCatalog.empty();
        }

        try (InputStream input = resource.getInputStream()) {
            QuestionCatalog catalog = objectMapper.readValue(input, QuestionCatalog.class);
            log.info("Loaded question catalog with {} questions and {} areas",
                    catalog.size(), catalog.getAreaOrder().size());
            return catalog;
        } catch (IOException e) {
            log.error("Failed to load question catalog {}. Ensure it matches the required structure.", catalogPath, e);
            throw new IllegalStateException("Could not load question catalog", e);
        }
    }
}
