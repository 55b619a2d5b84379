package tools.csv2json.csv;

/**
 * 由原始字段推断出的值。只有字符串类型持有规范化后的文本，数字与空值不持有额外缓冲。
 */
public final class FieldValue {
    private static final char QUOTE = '"';
    private static final FieldValue NULL = new FieldValue(Value.ofNull());

    private final Value value;

    private FieldValue(Value value) {
        this.value = value;
    }

    public Value getValue() {
        return value;
    }

    /**
     * 按字符串处理，跳过数字推断。用于构建表头，保证 "123" 之类的列名保持文本。
     */
    public static FieldValue string(CharSequence raw) {
        return new FieldValue(Value.ofString(canonicalize(raw)));
    }

    /**
     * 推断字段类型，优先级：空 -> Null；非疑似数字 -> String；整数 -> Integer；浮点 -> Float；其余回落为 String。
     */
    public static FieldValue parse(CharSequence raw) {
        if (raw.length() == 0) {
            return NULL;
        }
        String text = canonicalize(raw);
        if (!NumberStrings.isMaybeNumber(text)) {
            return new FieldValue(Value.ofString(text));
        }
        Long integer = parseInteger(text);
        if (integer != null) {
            return new FieldValue(Value.ofInteger(integer));
        }
        Double floating = parseFloat(text);
        if (floating != null) {
            return new FieldValue(Value.ofFloat(floating));
        }
        // fallback to string
        return new FieldValue(Value.ofString(text));
    }

    private static Long parseInteger(String text) {
        try {
            return Long.parseLong(text, 10);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static Double parseFloat(String text) {
        try {
            double parsed = Double.parseDouble(text);
            // JSON has no literal for infinity
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    /**
     * 将 "" 还原为单个 '"'，其他字符原样保留。
     *
     * @throws IllegalStateException 出现未成对的引号，说明切分结果不合法
     */
    public static String canonicalize(CharSequence raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        boolean pending = false;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c != QUOTE) {
                if (pending) {
                    throw new IllegalStateException("unpaired quote at " + (i - 1) + " in field: " + raw);
                }
                sb.append(c);
                continue;
            }
            if (pending) {
                sb.append(c);
                pending = false;
                continue;
            }
            pending = true;
        }
        if (pending) {
            throw new IllegalStateException("unpaired quote at end of field: " + raw);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
