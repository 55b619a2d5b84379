package tools.csv2json.csv;

/**
 * 数字判定相关的字符串工具。
 */
public final class NumberStrings {
    private NumberStrings() {
    }

    /**
     * 仅由 ASCII 数字和 '.' 组成的文本才尝试按数字解析。
     * 这是一个宽松的判定：".." 或 "1.2.3" 也会返回 true，随后在数字解析失败时回落为字符串。
     */
    public static boolean isMaybeNumber(CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            if (!isDigitOrPoint(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isDigitOrPoint(char c) {
        return (c >= '0' && c <= '9') || c == '.';
    }
}
