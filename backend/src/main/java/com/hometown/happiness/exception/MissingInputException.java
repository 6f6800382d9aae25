package com.hometown.happiness.exception;

import java.nio.file.Path;

/** A required raw, reference or canonical file is absent. Fatal for the stage that needs it. */
public class MissingInputException extends RuntimeException {
    private final Path path;

    public MissingInputException(Path path) {
        super("Missing input: " + path);
        this.path = path;
    }

    public MissingInputException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public Path getPath() { return path; }
}
