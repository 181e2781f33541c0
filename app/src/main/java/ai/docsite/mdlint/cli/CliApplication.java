package ai.docsite.mdlint.cli;

import ai.docsite.mdlint.config.Config;
import ai.docsite.mdlint.config.ConfigLoader;
import ai.docsite.mdlint.config.SystemEnvironmentReader;
import ai.docsite.mdlint.logging.LoggingConfigurator;
import ai.docsite.mdlint.reflow.DefaultReflower;
import ai.docsite.mdlint.reflow.block.DefaultBlockClassifier;
import ai.docsite.mdlint.rule.LineLengthRule;
import ai.docsite.mdlint.rule.LineLengthWarning;
import ai.docsite.mdlint.writer.DocumentStore;
import ai.docsite.mdlint.writer.LintException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point: checks each file against the line-length rule and optionally rewrites it.
 * Exit code 0 when every file is clean or fixed, 1 when warnings remain, 2 on usage or I/O errors.
 */
public final class CliApplication {

    static final int EXIT_CLEAN = 0;
    static final int EXIT_WARNINGS = 1;
    static final int EXIT_ERROR = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final DocumentStore documentStore;
    private final PrintWriter out;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new DocumentStore(),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true));
    }

    CliApplication(ConfigLoader configLoader, DocumentStore documentStore, PrintWriter out) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore");
        this.out = Objects.requireNonNull(out, "out");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return EXIT_ERROR;
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return EXIT_ERROR;
        }
        if (config.files().isEmpty()) {
            commandLine.getErr().println("At least one Markdown file must be given");
            commandLine.usage(commandLine.getErr());
            return EXIT_ERROR;
        }

        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.info("Checking {} file(s): lineLength={} reflowMode={} fix={}", config.files().size(),
                config.lineLength().lineLength(), config.lineLength().reflowMode(), config.fix());

        LineLengthRule rule = new LineLengthRule(config.lineLength(), new DefaultBlockClassifier(), new DefaultReflower());
        int warnings = 0;
        boolean failed = false;
        for (Path file : config.files()) {
            MDC.put("file", file.toString());
            try {
                warnings += process(rule, file, config.fix());
            } catch (LintException ex) {
                LOGGER.error("Skipping {}: {}", file, ex.getMessage(), ex);
                failed = true;
            } finally {
                MDC.remove("file");
            }
        }
        out.flush();
        if (failed) {
            return EXIT_ERROR;
        }
        if (warnings > 0) {
            LOGGER.warn("{} line(s) exceed {} characters", warnings, config.lineLength().lineLength());
            return EXIT_WARNINGS;
        }
        return EXIT_CLEAN;
    }

    private int process(LineLengthRule rule, Path file, boolean fix) {
        String content = documentStore.read(file);
        if (fix) {
            String fixed = rule.fix(content);
            if (!fixed.equals(content)) {
                documentStore.write(file, fixed);
                LOGGER.info("Reflowed {}", file);
                content = fixed;
            }
        }
        List<LineLengthWarning> warnings = rule.check(content);
        for (LineLengthWarning warning : warnings) {
            out.println(file + ":" + warning.line() + ": " + rule.id() + " " + warning.message());
        }
        return warnings.size();
    }
}
