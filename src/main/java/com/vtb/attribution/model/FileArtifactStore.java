package com.vtb.attribution.model;

import lombok.extern.slf4j.Slf4j;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Артефакты в каталоге локальной файловой системы.
 */
@Slf4j
public class FileArtifactStore implements ArtifactStore {

    private final Path basePath;

    public FileArtifactStore(Path basePath) {
        if (basePath == null) {
            throw new IllegalArgumentException("Базовый путь артефактов не может быть null");
        }
        this.basePath = basePath;
    }

    @Override
    public byte[] read(String name) throws IOException {
        Path file = resolve(name);
        if (!Files.isRegularFile(file)) {
            throw new FileNotFoundException("Артефакт не найден: " + file);
        }
        return Files.readAllBytes(file);
    }

    @Override
    public void write(String name, byte[] content) throws IOException {
        Path file = resolve(name);
        Files.createDirectories(file.getParent());
        // запись через временный файл, чтобы читатель не увидел половину артефакта
        Path temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Файловая система не поддерживает атомарное перемещение, артефакт {} заменяется обычным", file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public boolean exists(String name) {
        return Files.isRegularFile(resolve(name));
    }

    @Override
    public String describe(String name) {
        return resolve(name).toString();
    }

    public Path getBasePath() {
        return basePath;
    }

    private Path resolve(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Имя артефакта не может быть пустым");
        }
        Path base = basePath.toAbsolutePath().normalize();
        Path resolved = base.resolve(name).normalize();
        if (!resolved.startsWith(base)) {
            throw new IllegalArgumentException("Имя артефакта выходит за пределы каталога: " + name);
        }
        return resolved;
    }
}
