package tools.csv2json.csv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pull-style CSV field splitter for a single line.
 * <p>
 * {@link #next()} returns the next field, {@code null} when the line is exhausted,
 * or throws {@link ConvertError} on malformed quoting. After an error the iterator
 * is finished: later calls return {@code null} and the error is not raised again.
 */
public class FieldIterator {
    private static final Logger log = LoggerFactory.getLogger(FieldIterator.class);
    private static final char QUOTE = '"';
    private static final char DELIMITER = ',';
    private static final int DONE = -1;

    private final CharSequence line;
    private int index;
    private boolean failed;

    public FieldIterator(CharSequence line) {
        this.line = line;
        this.index = 0;
    }

    public Field next() throws ConvertError {
        if (index == DONE) {
            return null;
        }
        try {
            return doNext();
        } catch (ConvertError e) {
            index = DONE;
            failed = true;
            throw e;
        }
    }

    /**
     * @return true if iteration stopped because of a malformed field
     */
    public boolean hasFailed() {
        return failed;
    }

    private Field doNext() throws ConvertError {
        int start = index;
        if (log.isDebugEnabled()) {
            log.debug("[FieldIterator] start [{}][{}]", line, start);
        }
        if (line.length() == 0) {
            return nextEmpty(start);
        }
        if (start < line.length()) {
            return line.charAt(start) == QUOTE ? nextQuoted(start) : nextRaw(start);
        }
        // trailing ',' leaves one more empty field
        if (start > 0 && line.charAt(start - 1) == DELIMITER) {
            return nextEmpty(start);
        }
        index = DONE;
        return null;
    }

    /** Yield an empty field and finish. */
    private Field nextEmpty(int start) {
        index = DONE;
        return slice(start, start);
    }

    private Field nextRaw(int start) throws ConvertError {
        int i = start;
        while (i < line.length()) {
            char c = line.charAt(i++);
            if (c == QUOTE) {
                // quote without an opening quote
                throw new ConvertError(ConvertError.Kind.QUOTE_IN_THE_MIDDLE, i - 1);
            }
            if (c == DELIMITER) {
                index = i;
                return slice(start, i - 1);
            }
        }
        index = line.length();
        return slice(start, line.length());
    }

    private Field nextQuoted(int start) throws ConvertError {
        int i = start + 1;
        while (i < line.length()) {
            char c = line.charAt(i++);
            if (c != QUOTE) {
                continue;
            }
            if (i >= line.length()) {
                // closed at end of line
                index = line.length();
                return slice(start + 1, line.length() - 1);
            }
            char d = line.charAt(i++);
            if (d == QUOTE) {
                continue;
            }
            if (d == DELIMITER) {
                index = i;
                return slice(start + 1, i - 2);
            }
            throw new ConvertError(ConvertError.Kind.QUOTE_UNBALANCED, i - 1);
        }
        throw new ConvertError(ConvertError.Kind.QUOTE_UNBALANCED, line.length());
    }

    private Field slice(int start, int end) {
        Field field = new Field(line, start, end);
        if (log.isDebugEnabled()) {
            log.debug("[FieldIterator] slice [{}][{}..{}] => {}", line, start, end, field);
        }
        return field;
    }
}
