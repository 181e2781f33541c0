package ai.docsite.mdlint.rule;

/**
 * A line over the configured limit.
 *
 * @param line   1-based line number
 * @param length measured length of the line
 */
public record LineLengthWarning(int line, int length, int limit) {

    public static final String RULE_ID = "MD013";

    public LineLengthWarning {
        if (line < 1) {
            throw new IllegalArgumentException("line must be 1 or greater");
        }
        if (length <= limit) {
            throw new IllegalArgumentException("length must exceed limit");
        }
    }

    public String message() {
        return "Line length (" + length + "/" + limit + ")";
    }
}
