package ai.docsite.mdlint.cli;

import ai.docsite.mdlint.rule.ReflowMode;
import picocli.CommandLine;

public class ReflowModeConverter implements CommandLine.ITypeConverter<ReflowMode> {

    @Override
    public ReflowMode convert(String value) {
        return ReflowMode.from(value);
    }
}
