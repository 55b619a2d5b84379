package tools.csv2json.exec;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;

/**
 * 按 '\n' 逐行读取，返回的行不含换行符（行尾的 '\r' 一并去掉）。
 * 输入末尾的换行不会产生额外的空行。
 */
public class LineScanner implements Closeable {
    private final BufferedReader reader;
    private final int maxLineLength;
    private final StringBuilder line = new StringBuilder();
    private long lineNumber;

    public LineScanner(Reader reader, int maxLineLength) {
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("maxLineLength must be positive: " + maxLineLength);
        }
        this.reader = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        this.maxLineLength = maxLineLength;
    }

    /**
     * Read next line. Returns null when no more lines.
     *
     * @throws LineTooLongException the line has more than {@code maxLineLength} characters
     */
    public String next() throws IOException {
        line.setLength(0);
        int ch;
        boolean hasData = false;
        while ((ch = reader.read()) != -1) {
            hasData = true;
            char c = (char) ch;
            if (c == '\n') {
                return finishLine();
            }
            if (line.length() >= maxLineLength) {
                throw new LineTooLongException(lineNumber + 1, maxLineLength);
            }
            line.append(c);
        }
        if (!hasData) {
            return null;
        }
        return finishLine();
    }

    private String finishLine() {
        int len = line.length();
        if (len > 0 && line.charAt(len - 1) == '\r') {
            line.setLength(len - 1);
        }
        lineNumber++;
        return line.toString();
    }

    /**
     * @return 1-based number of the last line returned by {@link #next()}, 0 before the first line
     */
    public long getLineNumber() {
        return lineNumber;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
