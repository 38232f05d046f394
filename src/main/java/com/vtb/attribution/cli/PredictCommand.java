package com.vtb.attribution.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vtb.attribution.config.AttributionConfig;
import com.vtb.attribution.model.AttributionService;
import com.vtb.attribution.models.AttributionResult;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Предсказание группировки для одного инцидента
 */
@Slf4j
@Command(
    name = "predict",
    mixinStandardHelpOptions = true,
    description = "Определить наиболее вероятные группировки для инцидента"
)
public class PredictCommand implements Callable<Integer> {

    @ParentCommand
    private MainCommand parent;

    @ArgGroup(multiplicity = "1")
    private Input input;

    @Option(
        names = {"-m", "--model-dir"},
        description = "Каталог с артефактами модели (по умолчанию из конфигурации)"
    )
    private String modelDir;

    static class Input {
        @Option(names = {"-t", "--text"}, description = "Инцидент строкой семантических идентификаторов")
        String text;

        @Option(names = {"-f", "--file"}, description = "JSON файл инцидента (STIX бандл)")
        Path file;
    }

    @Override
    public Integer call() {
        try {
            AttributionConfig config = parent != null ? parent.loadConfig() : AttributionConfig.load();
            if (modelDir != null) {
                config.getModel().setLocation(modelDir);
            }
            AttributionService service = new AttributionService(config.getModel());

            ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
            AttributionResult result;
            if (input.file != null) {
                JsonNode incident = mapper.readTree(input.file.toFile());
                result = service.predict(incident);
            } else {
                result = service.predict(input.text);
            }

            System.out.println(mapper.writeValueAsString(result));
            return result.isRanked() ? 0 : 2;
        } catch (Exception e) {
            log.error("Ошибка при предсказании: {}", e.getMessage(), e);
            return 1;
        }
    }
}
