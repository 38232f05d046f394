package com.vtb.attribution.cli;

import com.vtb.attribution.config.AttributionConfig;
import com.vtb.attribution.web.AttributionWebApplication;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Главная CLI команда инструментов атрибуции
 */
@Slf4j
@Command(
    name = "attribution-tools",
    mixinStandardHelpOptions = true,
    version = "VTB Intrusion Set Attribution 1.0.0",
    subcommands = {TrainCommand.class, PredictCommand.class},
    description = """

        VTB Intrusion Set Attribution

        Атрибуция инцидентов к группировкам по STIX данным

        Возможности:
          • Построение профилей группировок из STIX бандлов
          • Генерация синтетических инцидентов и обучение модели
          • Ранжированное предсказание группировки (top-3)
          • REST API для атрибуции

        """
)
public class MainCommand implements Callable<Integer> {

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Option(
        names = {"--config"},
        description = "YAML файл конфигурации (по умолчанию attribution-config.yaml из classpath)"
    )
    Path configPath;

    @Option(
        names = {"--web"},
        description = "Запустить REST API (http://localhost:8080)"
    )
    private boolean webMode = false;

    @Option(
        names = {"--port"},
        description = "Порт для REST API (по умолчанию: 8080)"
    )
    private int webPort = 8080;

    private boolean webStarted;

    public static void main(String[] args) {
        MainCommand command = new MainCommand();
        int exitCode = new CommandLine(command).execute(args);
        // веб-сервер живёт в собственных потоках, JVM не завершаем
        if (!command.webStarted) {
            System.exit(exitCode);
        }
    }

    @Override
    public Integer call() {
        if (webMode) {
            log.info("Запуск REST API на порту {}...", webPort);
            String[] webArgs = configPath != null
                ? new String[]{"--server.port=" + webPort, "--attribution.config-path=" + configPath.toAbsolutePath()}
                : new String[]{"--server.port=" + webPort};
            AttributionWebApplication.main(webArgs);
            webStarted = true;
            return 0;
        }
        spec.commandLine().usage(System.out);
        return 0;
    }

    /**
     * Конфигурация из --config либо из classpath.
     */
    AttributionConfig loadConfig() {
        if (configPath != null) {
            log.info("Конфигурация: {}", configPath);
            return AttributionConfig.load(configPath);
        }
        return AttributionConfig.load();
    }
}
