package tools.csv2json.convert;

import tools.csv2json.csv.ConvertError;
import tools.csv2json.csv.Field;
import tools.csv2json.csv.FieldIterator;
import tools.csv2json.csv.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 有序的列名集合，用于把一行输出为 JSON 对象。列名允许重复。
 * 构建完成后调用 {@link #freeze()}，此后只读，可被多个线程共享。
 */
public class Header {
    private final List<String> names = new ArrayList<>();
    private volatile boolean frozen;

    /**
     * 按字符串切分表头行并冻结。
     */
    public static Header fromLine(CharSequence line) throws ConvertError {
        Header header = new Header();
        FieldIterator it = new FieldIterator(line);
        Field field;
        while ((field = it.next()) != null) {
            header.append(field.string().getValue());
        }
        header.freeze();
        return header;
    }

    public void append(Value value) throws ConvertError {
        if (frozen) {
            throw new IllegalStateException("header is read-only after freeze()");
        }
        if (value == null || !value.isString()) {
            throw new ConvertError(ConvertError.Kind.APPEND_FAILED);
        }
        names.add(value.asString());
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public int size() {
        return names.size();
    }

    public String name(int index) {
        return names.get(index);
    }

    public List<String> names() {
        return Collections.unmodifiableList(names);
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
