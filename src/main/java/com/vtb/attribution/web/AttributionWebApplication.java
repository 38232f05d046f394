package com.vtb.attribution.web;

import com.vtb.attribution.config.AttributionConfig;
import com.vtb.attribution.model.AttributionService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;

/**
 * REST API атрибуции инцидентов
 *
 * Запуск:
 * java -jar intrusion-set-attribution.jar --web
 *
 * Каталог модели можно переопределить свойством attribution.model-location,
 * внешний файл конфигурации задаётся свойством attribution.config-path
 */
@SpringBootApplication
public class AttributionWebApplication {

    public static void main(String[] args) {
        SpringApplication.run(AttributionWebApplication.class, args);
    }

    @Bean
    public AttributionService attributionService(
            @Value("${attribution.config-path:}") String configPath,
            @Value("${attribution.model-location:}") String modelLocation) {
        AttributionConfig config = configPath.isBlank()
            ? AttributionConfig.load()
            : AttributionConfig.load(Path.of(configPath));
        if (modelLocation != null && !modelLocation.isBlank()) {
            config.getModel().setLocation(modelLocation);
        }
        return new AttributionService(config.getModel());
    }
}
