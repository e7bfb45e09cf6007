package com.vigil.backend.model;

import java.util.Arrays;
import java.util.List;

public final class SubLabels {

    private SubLabels() {}

    public static List<String> split(String input) {
        if (input == null || input.isBlank()) {
            return List.of();
        }
        return Arrays.stream(input.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
