package com.lbg.markets.surveillance.hsm.error;

import java.nio.file.Path;

/**
 * Size and block count could not be read for a path.
 * Retry-safe; says nothing about whether the file is on tape.
 */
public class ProbeException extends Exception {

    private final Path path;

    public ProbeException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public ProbeException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
