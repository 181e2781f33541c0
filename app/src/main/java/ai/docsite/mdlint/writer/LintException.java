package ai.docsite.mdlint.writer;

import java.nio.file.Path;

/**
 * Raised when a document cannot be read or written.
 */
public class LintException extends RuntimeException {

    private final Path path;

    public LintException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
