package tools.csv2json.exec;

import tools.csv2json.convert.Header;
import tools.csv2json.convert.RowBuilder;
import tools.csv2json.csv.ConvertError;
import tools.csv2json.csv.Field;
import tools.csv2json.csv.FieldIterator;

import java.io.IOException;

/**
 * 将一行 CSV 转为一行 JSON：有表头输出对象，无表头输出数组。
 * 内部复用同一个 {@link RowBuilder}，不可并发调用。
 */
public class CsvLineConverter implements LineFunction {
    private final RowBuilder builder;
    private final int maxOutputLength;

    /**
     * @param header          已冻结的表头，为 null 时输出数组
     * @param maxOutputLength 单行输出上限，0 表示不限制
     */
    public CsvLineConverter(Header header, int maxOutputLength) {
        this.builder = new RowBuilder(header);
        this.maxOutputLength = maxOutputLength;
    }

    @Override
    public String apply(String line) throws ConvertError, IOException {
        try {
            FieldIterator it = new FieldIterator(line);
            Field field;
            while ((field = it.next()) != null) {
                builder.append(field.value());
            }
            String json = builder.dump();
            if (maxOutputLength > 0 && json.length() > maxOutputLength) {
                throw new IOException("output exceeds " + maxOutputLength + " characters");
            }
            return json;
        } finally {
            builder.reset();
        }
    }
}
