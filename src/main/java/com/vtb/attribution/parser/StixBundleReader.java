package com.vtb.attribution.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Чтение STIX бандлов из JSON.
 *
 * Поддерживаются одиночный бандл ({@code {"objects": [...]}}) и массив бандлов.
 * Каждый бандл возвращается как плоский список своих объектов.
 */
@Slf4j
public class StixBundleReader {

    private static final long MAX_FILE_SIZE_MB = 200;

    private final ObjectMapper mapper;

    public StixBundleReader() {
        this(new ObjectMapper());
    }

    public StixBundleReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Разобрать JSON строку.
     *
     * @throws IllegalArgumentException если JSON некорректен
     */
    public List<List<JsonNode>> readString(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("JSON бандла не может быть пустым");
        }
        try {
            return toBundles(mapper.readTree(json));
        } catch (IOException e) {
            throw new IllegalArgumentException("Некорректный JSON бандла: " + e.getMessage(), e);
        }
    }

    /**
     * Прочитать файл или все *.json файлы каталога. Нечитаемые файлы пропускаются.
     */
    public List<List<JsonNode>> read(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("Путь к бандлам не может быть null");
        }
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Путь не найден: " + path);
        }

        List<List<JsonNode>> bundles = new ArrayList<>();
        if (Files.isDirectory(path)) {
            try (Stream<Path> files = Files.list(path)) {
                files.filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json"))
                    .sorted()
                    .forEach(file -> bundles.addAll(readFile(file)));
            } catch (IOException e) {
                throw new IllegalArgumentException("Не удалось прочитать каталог: " + path, e);
            }
        } else {
            bundles.addAll(readFile(path));
        }
        log.info("Загружено бандлов: {} из {}", bundles.size(), path);
        return bundles;
    }

    private List<List<JsonNode>> readFile(Path file) {
        try {
            long fileSize = Files.size(file);
            if (fileSize > MAX_FILE_SIZE_MB * 1024 * 1024) {
                log.warn("Файл {} пропущен: {} MB больше лимита {} MB",
                    file, fileSize / (1024 * 1024), MAX_FILE_SIZE_MB);
                return List.of();
            }
            return toBundles(mapper.readTree(file.toFile()));
        } catch (IOException e) {
            log.warn("Не удалось прочитать бандл {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    private List<List<JsonNode>> toBundles(JsonNode root) {
        List<List<JsonNode>> bundles = new ArrayList<>();
        if (root == null) {
            return bundles;
        }
        if (root.isArray()) {
            for (JsonNode bundle : root) {
                if (bundle != null && bundle.has("objects")) {
                    bundles.add(IntrusionSetExtractor.objects(bundle));
                }
            }
        } else if (root.has("objects")) {
            bundles.add(IntrusionSetExtractor.objects(root));
        }
        return bundles;
    }
}
