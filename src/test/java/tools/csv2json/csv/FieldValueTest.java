package tools.csv2json.csv;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldValueTest {

    @Test
    void parsesInteger() {
        assertEquals(Value.ofInteger(123), FieldValue.parse("123").getValue());
    }

    @Test
    void parsesFloat() {
        assertEquals(Value.ofFloat(123.4), FieldValue.parse("123.4").getValue());
    }

    @Test
    void parsesString() {
        assertEquals(Value.ofString("12a"), FieldValue.parse("12a").getValue());
    }

    @Test
    void parsesEmptyAsNull() {
        assertTrue(FieldValue.parse("").getValue().isNull());
    }

    @Test
    void digitAndDotOnlyButNotNumberFallsBackToString() {
        assertEquals(Value.ofString("."), FieldValue.parse(".").getValue());
        assertEquals(Value.ofString(".."), FieldValue.parse("..").getValue());
        assertEquals(Value.ofString("1.2.3"), FieldValue.parse("1.2.3").getValue());
    }

    @Test
    void signsAndExponentsAreNotNumericCandidates() {
        assertEquals(Value.ofString("-5"), FieldValue.parse("-5").getValue());
        assertEquals(Value.ofString("+5"), FieldValue.parse("+5").getValue());
        assertEquals(Value.ofString("1e5"), FieldValue.parse("1e5").getValue());
        assertEquals(Value.ofString("NaN"), FieldValue.parse("NaN").getValue());
        assertEquals(Value.ofString(" 1"), FieldValue.parse(" 1").getValue());
    }

    @Test
    void leadingAndTrailingPointsAreFloats() {
        assertEquals(Value.ofFloat(0.5), FieldValue.parse(".5").getValue());
        assertEquals(Value.ofFloat(1.0), FieldValue.parse("1.").getValue());
    }

    @Test
    void integerOverflowBecomesFloat() {
        assertEquals(Value.ofInteger(Long.MAX_VALUE), FieldValue.parse("9223372036854775807").getValue());
        assertEquals(Value.ofFloat(9223372036854775808d), FieldValue.parse("9223372036854775808").getValue());
    }

    @Test
    void nonFiniteFloatFallsBackToString() {
        String huge = "9".repeat(400);
        assertEquals(Value.ofString(huge), FieldValue.parse(huge).getValue());
    }

    @Test
    void leadingZerosStillInteger() {
        assertEquals(Value.ofInteger(7), FieldValue.parse("007").getValue());
    }

    @Test
    void stringEntryPointSkipsInference() {
        assertEquals(Value.ofString("123"), FieldValue.string("123").getValue());
        assertEquals(Value.ofString(""), FieldValue.string("").getValue());
    }

    @Test
    void parseCanonicalizesStrings() {
        assertEquals(Value.ofString("a,\"b,c"), FieldValue.parse("a,\"\"b,c").getValue());
    }

    @Test
    void canonicalizeLeavesPlainTextUnchanged() {
        assertEquals("a,b,c", FieldValue.canonicalize("a,b,c"));
    }

    @Test
    void canonicalizeCollapsesDoubledQuotes() {
        assertEquals("a,b\",c", FieldValue.canonicalize("a,b\"\",c"));
        assertEquals("\"", FieldValue.canonicalize("\"\""));
        assertEquals("\"\"", FieldValue.canonicalize("\"\"\"\""));
    }

    @Test
    void canonicalizeRejectsLoneQuote() {
        assertThrows(IllegalStateException.class, () -> FieldValue.canonicalize("a\"b"));
        assertThrows(IllegalStateException.class, () -> FieldValue.canonicalize("ab\""));
    }

    @Test
    void fieldFromIteratorParses() throws ConvertError {
        FieldIterator it = new FieldIterator("str,128,12.8,,\"x\"\"y\"");
        assertEquals(Value.ofString("str"), it.next().value().getValue());
        assertEquals(Value.ofInteger(128), it.next().value().getValue());
        assertEquals(Value.ofFloat(12.8), it.next().value().getValue());
        assertTrue(it.next().value().getValue().isNull());
        assertEquals(Value.ofString("x\"y"), it.next().value().getValue());
    }

    @Test
    void maybeNumberHeuristic() {
        assertTrue(NumberStrings.isMaybeNumber("12345"));
        assertTrue(NumberStrings.isMaybeNumber(".."));
        assertFalse(NumberStrings.isMaybeNumber("12345a"));
        assertFalse(NumberStrings.isMaybeNumber("-1"));
    }
}
