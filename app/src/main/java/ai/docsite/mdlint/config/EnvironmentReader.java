package ai.docsite.mdlint.config;

import java.util.Optional;

/**
 * Source of environment values, replaced by a lambda in tests.
 */
@FunctionalInterface
public interface EnvironmentReader {
    Optional<String> get(String key);
}
