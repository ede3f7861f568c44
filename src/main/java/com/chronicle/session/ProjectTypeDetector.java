package com.chronicle.session;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Guesses the project type from marker files in the project root.
 */
public class ProjectTypeDetector {

    private static final Map<String, String> MARKERS = new LinkedHashMap<>();

    static {
        MARKERS.put("pom.xml", "java-maven");
        MARKERS.put("build.gradle", "java-gradle");
        MARKERS.put("build.gradle.kts", "kotlin-gradle");
        MARKERS.put("package.json", "node");
        MARKERS.put("pyproject.toml", "python");
        MARKERS.put("requirements.txt", "python");
        MARKERS.put("setup.py", "python");
        MARKERS.put("Cargo.toml", "rust");
        MARKERS.put("go.mod", "go");
        MARKERS.put("Gemfile", "ruby");
        MARKERS.put("composer.json", "php");
        MARKERS.put("mix.exs", "elixir");
    }

    public Optional<String> detect(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            return Optional.empty();
        }
        for (Map.Entry<String, String> marker : MARKERS.entrySet()) {
            if (Files.exists(directory.resolve(marker.getKey()))) {
                return Optional.of(marker.getValue());
            }
        }
        return Optional.empty();
    }
}
