package ai.docsite.mdlint.config;

import ai.docsite.mdlint.cli.CliArguments;
import ai.docsite.mdlint.reflow.ReflowOptions;
import ai.docsite.mdlint.reflow.width.LengthMode;
import ai.docsite.mdlint.rule.LineLengthConfig;
import ai.docsite.mdlint.rule.ReflowMode;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} from CLI arguments, then environment variables, then defaults.
 */
public class ConfigLoader {

    static final String ENV_LINE_LENGTH = "MDLINT_LINE_LENGTH";
    static final String ENV_REFLOW_MODE = "MDLINT_REFLOW_MODE";
    static final String ENV_LENGTH_MODE = "MDLINT_LENGTH_MODE";
    static final String ENV_ABBREVIATIONS = "MDLINT_ABBREVIATIONS";
    static final String ENV_STRICT = "MDLINT_STRICT";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        LineLengthConfig defaults = LineLengthConfig.defaults();
        LineLengthConfig lineLength = new LineLengthConfig(
                resolveLineLength(arguments),
                defaults.codeBlocks(),
                defaults.tables(),
                defaults.headings(),
                defaults.paragraphs(),
                resolveStrict(arguments),
                arguments.fix(),
                resolveReflowMode(arguments),
                resolveLengthMode(arguments),
                resolveAbbreviations(arguments));
        return new Config(arguments.files(), lineLength, arguments.fix(), arguments.verbose(),
                resolveLogFormat(arguments));
    }

    private int resolveLineLength(CliArguments arguments) {
        Integer cliValue = arguments.lineLength();
        if (cliValue != null) {
            if (cliValue < 0) {
                throw new IllegalArgumentException("--line-length must be zero or greater");
            }
            return cliValue;
        }
        return environmentReader.get(ENV_LINE_LENGTH)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parseNonNegativeInteger(raw, ENV_LINE_LENGTH))
                .orElse(ReflowOptions.DEFAULT_LINE_LENGTH);
    }

    private ReflowMode resolveReflowMode(CliArguments arguments) {
        ReflowMode cliMode = arguments.reflowMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_REFLOW_MODE)
                .filter(ConfigLoader::isNotBlank)
                .map(ReflowMode::from)
                .orElse(ReflowMode.DEFAULT);
    }

    private LengthMode resolveLengthMode(CliArguments arguments) {
        LengthMode cliMode = arguments.lengthMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_LENGTH_MODE)
                .filter(ConfigLoader::isNotBlank)
                .map(LengthMode::from)
                .orElse(LengthMode.CHARS);
    }

    private Set<String> resolveAbbreviations(CliArguments arguments) {
        List<String> cliValues = arguments.abbreviations();
        if (!cliValues.isEmpty()) {
            return normalizeAbbreviations(cliValues);
        }
        return environmentReader.get(ENV_ABBREVIATIONS)
                .filter(ConfigLoader::isNotBlank)
                .map(raw -> normalizeAbbreviations(Arrays.asList(raw.split(","))))
                .orElse(Set.of());
    }

    private boolean resolveStrict(CliArguments arguments) {
        if (arguments.strict()) {
            return true;
        }
        return environmentReader.get(ENV_STRICT)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private static int parseNonNegativeInteger(String raw, String name) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException(name + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer", ex);
        }
    }

    private static Set<String> normalizeAbbreviations(List<String> raw) {
        return raw.stream()
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
