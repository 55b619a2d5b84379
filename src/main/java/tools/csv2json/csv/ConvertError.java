package tools.csv2json.csv;

/**
 * 行转换过程中的结构化错误：引号不匹配、字段中间出现引号、表头追加失败。
 */
public class ConvertError extends Exception {
    private final Kind kind;
    private final int position;

    public ConvertError(Kind kind) {
        this(kind, -1);
    }

    public ConvertError(Kind kind, int position) {
        super(buildMessage(kind, position));
        this.kind = kind;
        this.position = position;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return 0-based character offset in the line where the error was detected, or -1 if unknown.
     */
    public int getPosition() {
        return position;
    }

    private static String buildMessage(Kind kind, int position) {
        if (position < 0) {
            return kind.getLabel();
        }
        return kind.getLabel() + " (position " + position + ")";
    }

    public enum Kind {
        /** 未加引号的字段中出现了 '"'。 */
        QUOTE_IN_THE_MIDDLE("QuoteInTheMiddle"),
        /** 右引号缺失，或右引号后既不是 ',' 也不是行尾。 */
        QUOTE_UNBALANCED("QuoteUnbalanced"),
        /** 表头只接受字符串。 */
        APPEND_FAILED("AppendFailed");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }
}
