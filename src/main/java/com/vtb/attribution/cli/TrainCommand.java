package com.vtb.attribution.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.attribution.config.AttributionConfig;
import com.vtb.attribution.model.FileArtifactStore;
import com.vtb.attribution.model.ModelArtifacts;
import com.vtb.attribution.models.DatabaseVersion;
import com.vtb.attribution.models.ModelMetadata;
import com.vtb.attribution.models.TrainingResult;
import com.vtb.attribution.parser.StixBundleReader;
import com.vtb.attribution.training.AttributionTrainer;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Обучение модели по каталогу STIX бандлов группировок
 */
@Slf4j
@Command(
    name = "train",
    mixinStandardHelpOptions = true,
    description = "Обучить модель атрибуции на синтетических инцидентах"
)
public class TrainCommand implements Callable<Integer> {

    @ParentCommand
    private MainCommand parent;

    @Parameters(
        index = "0",
        description = "JSON файл или каталог со STIX бандлами группировок"
    )
    private Path bundlesPath;

    @Option(
        names = {"-o", "--output"},
        description = "Каталог для артефактов модели (по умолчанию из конфигурации)"
    )
    private String outputDir;

    @Option(
        names = {"--db-version"},
        description = "Версия базы данных в формате \"(major, minor, micro)\""
    )
    private String databaseVersion;

    @Option(
        names = {"--per-label"},
        description = "Число синтетических инцидентов на группировку"
    )
    private Integer perLabel;

    @Override
    public Integer call() {
        try {
            AttributionConfig config = parent != null ? parent.loadConfig() : AttributionConfig.load();
            if (perLabel != null) {
                if (perLabel < 2) {
                    throw new IllegalArgumentException("--per-label должен быть не меньше 2");
                }
                config.getTraining().setPerLabel(perLabel);
            }
            DatabaseVersion supplied = databaseVersion != null
                ? DatabaseVersion.parse(databaseVersion)
                : config.getTraining().baseline();

            log.info("Загрузка бандлов: {}", bundlesPath);
            List<List<JsonNode>> bundles = new StixBundleReader().read(bundlesPath);

            AttributionTrainer trainer = new AttributionTrainer(config, supplied);
            TrainingResult result = trainer.retrain(bundles);
            if (!result.isSuccessful()) {
                log.error("Обучение не удалось, артефакты не сохранены");
                return 1;
            }

            Path output = Paths.get(outputDir != null ? outputDir : config.getModel().getLocation());
            ModelArtifacts artifacts = new ModelArtifacts(new FileArtifactStore(output),
                config.getModel().getMetadataFile(), config.getModel().getModelFile());
            ModelMetadata metadata = artifacts.save(result);

            System.out.printf("Модель обучена: %d групп, F1 = %.4f, версия %s%n",
                metadata.getLabels(), result.getF1Score(), metadata.getDbVersion());
            System.out.println("Артефакты: " + output.toAbsolutePath());
            return 0;
        } catch (Exception e) {
            log.error("Ошибка при обучении: {}", e.getMessage(), e);
            return 1;
        }
    }
}
