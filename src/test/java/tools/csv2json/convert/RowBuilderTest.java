package tools.csv2json.convert;

import org.junit.jupiter.api.Test;
import tools.csv2json.csv.ConvertError;
import tools.csv2json.csv.FieldValue;
import tools.csv2json.csv.Value;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RowBuilderTest {

    private static Header header(String... names) throws ConvertError {
        Header header = new Header();
        for (String name : names) {
            header.append(Value.ofString(name));
        }
        header.freeze();
        return header;
    }

    private static RowBuilder builderWith(Header header, List<String> raws) {
        RowBuilder builder = new RowBuilder(header);
        for (String raw : raws) {
            builder.append(FieldValue.parse(raw));
        }
        return builder;
    }

    @Test
    void dumpsObjectAndDropsValuesBeyondHeader() throws ConvertError {
        RowBuilder builder = builderWith(header("string", "int"), List.of("str", "128", "12.8", ""));
        assertEquals("{\"string\":\"str\",\"int\":128}", builder.dump());
    }

    @Test
    void dumpsObject() throws ConvertError {
        RowBuilder builder = builderWith(header("string", "int", "float", "null"), List.of("str", "128", "12.8", ""));
        assertEquals("{\"string\":\"str\",\"int\":128,\"float\":12.8,\"null\":null}", builder.dump());
    }

    @Test
    void fillsMissingValuesWithNull() throws ConvertError {
        RowBuilder builder = builderWith(header("string", "int", "float", "null"), List.of("str", "128"));
        assertEquals("{\"string\":\"str\",\"int\":128,\"float\":null,\"null\":null}", builder.dump());
    }

    @Test
    void dumpsArrayWithoutHeader() {
        RowBuilder builder = builderWith(null, List.of("str", "128", "12.8", ""));
        assertEquals("[\"str\",128,12.8,null]", builder.dump());
    }

    @Test
    void emptyHeaderGivesEmptyObject() throws ConvertError {
        RowBuilder builder = builderWith(header(), List.of("a"));
        assertEquals("{}", builder.dump());
    }

    @Test
    void duplicateHeaderNameKeepsLastValueAtFirstPosition() throws ConvertError {
        RowBuilder builder = builderWith(header("a", "b", "a"), List.of("1", "2", "3"));
        assertEquals("{\"a\":3,\"b\":2}", builder.dump());
    }

    @Test
    void stringsAreEscapedButNotHtmlEscaped() {
        RowBuilder builder = builderWith(null, List.of("say \"\"hi\"\"", "<a&b>", "tab\there"));
        assertEquals("[\"say \\\"hi\\\"\",\"<a&b>\",\"tab\\there\"]", builder.dump());
    }

    @Test
    void resetEmptiesRowButKeepsHeader() throws ConvertError {
        Header header = header("x", "y");
        RowBuilder builder = builderWith(header, List.of("1", "2"));
        assertEquals("{\"x\":1,\"y\":2}", builder.dump());

        builder.reset();
        assertEquals(0, builder.size());
        assertEquals("{\"x\":null,\"y\":null}", builder.dump());

        builder.append(FieldValue.parse("z"));
        assertEquals("{\"x\":\"z\",\"y\":null}", builder.dump());
        assertEquals(header, builder.getHeader());
    }

    @Test
    void dumpsToAppendable() {
        RowBuilder builder = builderWith(null, List.of("1", "a"));
        StringBuilder out = new StringBuilder();
        builder.dump(out);
        assertEquals("[1,\"a\"]", out.toString());
    }

    @Test
    void encodesLargeFloatsTheWayGsonDoes() {
        RowBuilder builder = builderWith(null, List.of("1000000000000000000000", "0.0001", "3.0"));
        assertEquals("[1.0E21,1.0E-4,3.0]", builder.dump());
    }
}
