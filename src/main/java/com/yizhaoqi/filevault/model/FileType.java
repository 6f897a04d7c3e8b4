package com.yizhaoqi.filevault.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum FileType {
    FOLDER("folder"),
    FILE("file"),
    IMAGE("image");

    private final String value;

    FileType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean hasContent() {
        return this != FOLDER;
    }

    public static Optional<FileType> fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }
}
