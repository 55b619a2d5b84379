package tools.csv2json.exec;

/**
 * 开启 exitOnError 时，第一条失败的行会以此异常终止运行，cause 为原始错误。
 */
public class RunAbortedException extends Exception {
    private final long lineNumber;
    private final String line;

    public RunAbortedException(long lineNumber, String line, Throwable cause) {
        super("Line " + lineNumber + " " + line + " " + describe(cause), cause);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }
}
