package ai.docsite.mdlint.writer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void readsAndWritesUtf8() throws Exception {
        DocumentStore store = new DocumentStore();
        Path file = tempDir.resolve("doc.md");
        Files.writeString(file, "old content that is longer\n", StandardCharsets.UTF_8);

        store.write(file, "行1\r\n行2\n");

        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo("行1\r\n行2\n");
        assertThat(store.read(file)).isEqualTo("行1\r\n行2\n");
    }

    @Test
    void wrapsIoFailuresWithPath() {
        Path missing = tempDir.resolve("missing.md");

        Throwable thrown = catchThrowable(() -> new DocumentStore().read(missing));

        assertThat(thrown)
                .isInstanceOf(LintException.class)
                .hasMessageContaining("Failed to read document")
                .hasMessageContaining(missing.toString());
        assertThat(((LintException) thrown).path()).isEqualTo(missing);
        assertThat(thrown.getCause()).isNotNull();
    }

    @Test
    void rejectsMissingArguments() {
        assertThatThrownBy(() -> new DocumentStore().read(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DocumentStore().write(tempDir.resolve("a.md"), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
