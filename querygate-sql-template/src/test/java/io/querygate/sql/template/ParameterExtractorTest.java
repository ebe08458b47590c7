package io.querygate.sql.template;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParameterExtractorTest {

    @Test
    public void testFirstOccurrenceOrderWithoutDuplicates() {
        var sql = "SELECT * FROM t WHERE b = {{beta}} AND a = {{alpha}} OR b = {{beta}}";
        assertEquals(List.of("beta", "alpha"), ParameterExtractor.extract(sql));
    }

    @Test
    public void testWhitespaceInsideBraces() {
        assertEquals(List.of("region"), ParameterExtractor.extract("WHERE r = {{ region }} OR r = {{region}}"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT {{a-b}}",
            "SELECT {{1abc}}",
            "SELECT {{a b}}",
            "SELECT {{}}",
            "SELECT {single}",
            "SELECT 1"
    })
    public void testNonIdentifierTokensAreNotPlaceholders(String sql) {
        assertTrue(ParameterExtractor.extract(sql).isEmpty());
    }

    @Test
    public void testEmptyAndNullText() {
        assertTrue(ParameterExtractor.extract("").isEmpty());
        assertTrue(ParameterExtractor.extract(null).isEmpty());
    }

    @Test
    public void testUnderscoreAndDigits() {
        assertEquals(List.of("_p1", "range_start", "range_end"),
                ParameterExtractor.extract("{{_p1}} {{range_start}} {{range_end}}"));
    }
}
