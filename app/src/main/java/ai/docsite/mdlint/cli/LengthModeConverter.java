package ai.docsite.mdlint.cli;

import ai.docsite.mdlint.reflow.width.LengthMode;
import picocli.CommandLine;

public class LengthModeConverter implements CommandLine.ITypeConverter<LengthMode> {

    @Override
    public LengthMode convert(String value) {
        return LengthMode.from(value);
    }
}
