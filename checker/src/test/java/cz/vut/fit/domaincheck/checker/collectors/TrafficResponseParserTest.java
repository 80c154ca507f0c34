package cz.vut.fit.domaincheck.checker.collectors;

import cz.vut.fit.domaincheck.models.providers.TrafficData;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class TrafficResponseParserTest {
    private static final String HEADER = "Domain;Rank;Organic Keywords;Organic Traffic;Organic Cost;"
            + "Adwords Keywords;Adwords Traffic;Adwords Cost";

    @Test
    void parse_dataRow() {
        var body = HEADER + "\r\nexample.com;1234;5600;78000;91234.5;12;340;567.25\r\n";

        var data = TrafficResponseParser.parse(body);

        assertEquals(new TrafficData(1234, 5600, 78000, 91234.5, 12, 340, 567.25), data);
    }

    @Test
    void parse_unixLineEndings() {
        var data = TrafficResponseParser.parse(HEADER + "\nexample.com;1;2;3;4.0;5;6;7.0");

        assertEquals(new TrafficData(1, 2, 3, 4.0, 5, 6, 7.0), data);
    }

    @ParameterizedTest(name = "{index} => {1}")
    @MethodSource("malformedBodies")
    void parse_malformedYieldsDefault(String body, String description) {
        assertEquals(TrafficData.empty(), TrafficResponseParser.parse(body), description);
    }

    private static Stream<Arguments> malformedBodies() {
        return Stream.of(
                Arguments.of(null, "no body"),
                Arguments.of("", "empty body"),
                Arguments.of("ERROR 50 :: NOTHING FOUND", "a single line"),
                Arguments.of(HEADER + "\r\n", "an empty data row"),
                Arguments.of(HEADER + "\r\nexample.com;1234;5600", "too few fields"),
                Arguments.of(HEADER + "\r\nexample.com;n/a;5600;78000;91234.5;12;340;567.25", "a non-numeric rank"),
                Arguments.of(HEADER + "\r\nexample.com;1234;5600;78000;cheap;12;340;567.25", "a non-numeric cost")
        );
    }
}
