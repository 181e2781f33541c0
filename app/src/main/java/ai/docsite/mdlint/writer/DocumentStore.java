package ai.docsite.mdlint.writer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads Markdown documents and writes fixed content back in place, always as UTF-8.
 */
public class DocumentStore {

    public String read(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path must be provided");
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new LintException("Failed to read document", path, ex);
        }
    }

    public void write(Path path, String content) {
        if (path == null || content == null) {
            throw new IllegalArgumentException("path and content must be provided");
        }
        try {
            Files.writeString(path, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException ex) {
            throw new LintException("Failed to write document", path, ex);
        }
    }
}
