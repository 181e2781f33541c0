package ai.docsite.mdlint.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class LogFormatTest {

    @Test
    void parsesCaseInsensitively() {
        assertThat(LogFormat.from(" json ")).isEqualTo(LogFormat.JSON);
        assertThat(LogFormat.from("Text")).isEqualTo(LogFormat.TEXT);
    }

    @Test
    void rejectsBlankAndUnknownValues() {
        assertThatThrownBy(() -> LogFormat.from("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LogFormat.from("yaml")).hasMessageContaining("yaml");
    }
}
