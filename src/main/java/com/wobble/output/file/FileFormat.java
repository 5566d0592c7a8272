package com.wobble.output.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wobble.output.report.JsonReport;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Format of file output, with the serializer and layout pair that produces it.
 */
public enum FileFormat {
    TXT("txt"),
    JSON("json");

    private final String extension;

    FileFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public EventSerializer serializer(int level, ObjectMapper objectMapper) {
        return switch (this) {
            case TXT -> new TextEventSerializer(level);
            case JSON -> new JsonEventSerializer(new JsonReport(objectMapper, level));
        };
    }

    public RecordLayout layout(int level, ObjectMapper objectMapper) {
        return switch (this) {
            case TXT -> new TextLayout();
            case JSON -> new JsonLayout(new JsonReport(objectMapper, level), objectMapper);
        };
    }

    public static FileFormat fromId(String id) {
        for (FileFormat format : values()) {
            if (format.extension.equalsIgnoreCase(id)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown file format: " + id + " (expected txt or json)");
    }

    /** Format implied by the file's extension, if it names one. */
    public static Optional<FileFormat> fromFileName(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        if (dot < 0) return Optional.empty();
        String extension = name.substring(dot + 1);
        for (FileFormat format : values()) {
            if (format.extension.equals(extension)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
