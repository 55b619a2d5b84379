package tools.csv2json.convert;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import tools.csv2json.csv.FieldValue;
import tools.csv2json.csv.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * 累积一行的字段值并输出为一行 JSON。
 * <ul>
 *     <li>没有表头时输出数组，按字段顺序。</li>
 *     <li>有表头时输出对象，第 i 个值对应第 i 个列名；值不足的列填 null，超出列数的值丢弃。</li>
 * </ul>
 * 同一个实例可在 {@link #reset()} 后复用于下一行，表头不受影响。
 */
public class RowBuilder {
    private static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    private final Header header;
    private final List<FieldValue> values = new ArrayList<>();

    /**
     * @param header 列名，为 null 时输出 JSON 数组
     */
    public RowBuilder(Header header) {
        this.header = header;
    }

    public Header getHeader() {
        return header;
    }

    public void append(FieldValue value) {
        values.add(value);
    }

    public int size() {
        return values.size();
    }

    public void reset() {
        values.clear();
    }

    public String dump() {
        return GSON.toJson(toJsonElement());
    }

    public void dump(Appendable out) {
        GSON.toJson(toJsonElement(), out);
    }

    JsonElement toJsonElement() {
        if (header != null) {
            JsonObject object = new JsonObject();
            for (int i = 0; i < header.size(); i++) {
                JsonElement element = i < values.size()
                        ? toJson(values.get(i).getValue())
                        : JsonNull.INSTANCE;
                object.add(header.name(i), element);
            }
            return object;
        }
        JsonArray array = new JsonArray(values.size());
        for (FieldValue value : values) {
            array.add(toJson(value.getValue()));
        }
        return array;
    }

    static JsonElement toJson(Value value) {
        return switch (value.getType()) {
            case NULL -> JsonNull.INSTANCE;
            case STRING -> new JsonPrimitive(value.asString());
            case INTEGER -> new JsonPrimitive(value.asLong());
            case FLOAT -> new JsonPrimitive(value.asDouble());
        };
    }
}
