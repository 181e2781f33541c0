package ai.docsite.mdlint.cli;

import ai.docsite.mdlint.config.LogFormat;
import ai.docsite.mdlint.reflow.width.LengthMode;
import ai.docsite.mdlint.rule.ReflowMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "mdlint", mixinStandardHelpOptions = true,
        description = "Checks Markdown line length and rewraps prose without breaking Markdown syntax")
public class CliArguments {

    @CommandLine.Parameters(paramLabel = "FILE", description = "Markdown files to check")
    private List<Path> files = new ArrayList<>();

    @CommandLine.Option(names = "--line-length", description = "Maximum line length, 0 for unlimited", paramLabel = "COLUMNS")
    private Integer lineLength;

    @CommandLine.Option(names = "--reflow-mode", converter = ReflowModeConverter.class,
            description = "Reflow mode: default, normalize, sentence-per-line or semantic-line-breaks")
    private ReflowMode reflowMode;

    @CommandLine.Option(names = "--length-mode", converter = LengthModeConverter.class,
            description = "How line length is counted: chars, visual or bytes")
    private LengthMode lengthMode;

    @CommandLine.Option(names = "--abbreviations", split = ",", paramLabel = "WORD",
            description = "Extra abbreviations that do not end a sentence, comma separated")
    private List<String> abbreviations = new ArrayList<>();

    @CommandLine.Option(names = "--strict", description = "Report lines whose overflow is a single unbreakable word")
    private boolean strict;

    @CommandLine.Option(names = "--fix", description = "Rewrite files with reflowed paragraphs")
    private boolean fix;

    @CommandLine.Option(names = "--verbose", description = "Log reflow details at debug level")
    private boolean verbose;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public List<Path> files() {
        return files;
    }

    public Integer lineLength() {
        return lineLength;
    }

    public ReflowMode reflowMode() {
        return reflowMode;
    }

    public LengthMode lengthMode() {
        return lengthMode;
    }

    public List<String> abbreviations() {
        return abbreviations;
    }

    public boolean strict() {
        return strict;
    }

    public boolean fix() {
        return fix;
    }

    public boolean verbose() {
        return verbose;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
