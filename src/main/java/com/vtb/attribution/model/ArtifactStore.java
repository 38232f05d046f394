package com.vtb.attribution.model;

import java.io.IOException;

/**
 * Хранилище артефактов модели: двоичные ресурсы по имени относительно базового пути.
 */
public interface ArtifactStore {

    /**
     * @throws java.io.FileNotFoundException если ресурса нет
     */
    byte[] read(String name) throws IOException;

    void write(String name, byte[] content) throws IOException;

    boolean exists(String name);

    /**
     * Описание расположения для логов.
     */
    String describe(String name);
}
