package com.govmatrix.extract.export;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public record ExportResult(
    Map<String, Path> files,
    List<String> errors
) {
    public ExportResult {
        files = files == null ? Map.of() : Map.copyOf(files);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public Path file(String kind) {
        return files.get(kind);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
