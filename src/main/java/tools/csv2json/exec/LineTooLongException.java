package tools.csv2json.exec;

import java.io.IOException;

public class LineTooLongException extends IOException {
    private final long lineNumber;
    private final int maxLineLength;

    public LineTooLongException(long lineNumber, int maxLineLength) {
        super("Line " + lineNumber + " exceeds " + maxLineLength + " characters");
        this.lineNumber = lineNumber;
        this.maxLineLength = maxLineLength;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }
}
