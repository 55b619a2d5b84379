package tools.csv2json.csv;

/**
 * 行缓冲区中的一个字段切片，不复制字符。
 * 外层引号已去掉，内部的 "" 转义仍保留，需要时由 {@link FieldValue} 规范化。
 */
public final class Field {
    private final CharSequence line;
    private final int start;
    private final int end;

    Field(CharSequence line, int start, int end) {
        this.line = line;
        this.start = start;
        this.end = end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public CharSequence raw() {
        return line.subSequence(start, end);
    }

    public FieldValue value() {
        return FieldValue.parse(raw());
    }

    public FieldValue string() {
        return FieldValue.string(raw());
    }

    @Override
    public String toString() {
        return raw().toString();
    }
}
