package com.vtb.attribution.models;

import java.io.Serializable;
import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Версия базы/модели в виде тройки (major, minor, micro).
 *
 * Текстовое представление совпадает с форматом метаданных: {@code "(1, 2, 3)"}.
 */
public record DatabaseVersion(int major, int minor, int micro)
    implements Comparable<DatabaseVersion>, Serializable {

    /** Базовая версия кода. */
    public static final DatabaseVersion BASELINE = new DatabaseVersion(0, 0, 1);

    private static final Pattern FORMAT = Pattern.compile("^\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)$");

    private static final Comparator<DatabaseVersion> ORDER = Comparator
        .comparingInt(DatabaseVersion::major)
        .thenComparingInt(DatabaseVersion::minor)
        .thenComparingInt(DatabaseVersion::micro);

    public DatabaseVersion {
        if (major < 0 || minor < 0 || micro < 0) {
            throw new IllegalArgumentException("Компоненты версии не могут быть отрицательными");
        }
    }

    /**
     * Разобрать строку вида {@code "(1, 2, 3)"}.
     *
     * @throws IllegalArgumentException если формат не распознан
     */
    public static DatabaseVersion parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Версия не может быть null");
        }
        Matcher matcher = FORMAT.matcher(text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Неверный формат версии: " + text);
        }
        try {
            return new DatabaseVersion(
                Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Неверный формат версии: " + text, e);
        }
    }

    /**
     * Увеличить micro компонент строковой версии: {@code "(1, 2, 2)" -> "(1, 2, 3)"}.
     */
    public static String incrementDatabaseVersion(String version) {
        return parse(version).incrementMicro().toString();
    }

    public DatabaseVersion incrementMicro() {
        return new DatabaseVersion(major, minor, micro + 1);
    }

    public boolean isNewerThan(DatabaseVersion other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(DatabaseVersion other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + major + ", " + minor + ", " + micro + ")";
    }
}
