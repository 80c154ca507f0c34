package cz.vut.fit.domaincheck.checker.collectors;

import com.google.common.base.Splitter;
import cz.vut.fit.domaincheck.Common;
import cz.vut.fit.domaincheck.models.providers.TrafficData;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Parses the semicolon-separated table returned by the SEMrush {@code domain_rank} report.
 * <p>
 * The first line holds the column headers, the second one the values in the order
 * {@code Dn;Rk;Or;Ot;Oc;Ad;At;Ac}. Anything else yields {@link TrafficData#empty()}.
 */
public final class TrafficResponseParser {
    public static final String COMPONENT_NAME = "parser-semrush";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(TrafficResponseParser.class);

    private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n");
    private static final Splitter FIELD_SPLITTER = Splitter.on(';').trimResults();
    private static final int FIELD_COUNT = 8;

    private TrafficResponseParser() {
    }

    /**
     * Parses a response body.
     *
     * @param body The response body.
     * @return The traffic data, or the default record if the body holds no data row or the row is malformed.
     */
    public static TrafficData parse(@Nullable String body) {
        if (body == null)
            return TrafficData.empty();

        final var lines = LINE_SPLITTER.splitToList(body);
        if (lines.size() < 2 || lines.get(1).isBlank()) {
            Logger.trace("No data row in the response");
            return TrafficData.empty();
        }

        final var fields = FIELD_SPLITTER.splitToList(lines.get(1));
        if (fields.size() < FIELD_COUNT) {
            Logger.debug("Malformed data row, {} fields: {}", fields.size(), lines.get(1));
            return TrafficData.empty();
        }

        try {
            return toTrafficData(fields);
        } catch (NumberFormatException e) {
            Logger.debug("Malformed data row, non-numeric field: {}", lines.get(1));
            return TrafficData.empty();
        }
    }

    private static TrafficData toTrafficData(List<String> fields) {
        return new TrafficData(
                Long.parseLong(fields.get(1)),
                Long.parseLong(fields.get(2)),
                Long.parseLong(fields.get(3)),
                Double.parseDouble(fields.get(4)),
                Long.parseLong(fields.get(5)),
                Long.parseLong(fields.get(6)),
                Double.parseDouble(fields.get(7)));
    }
}
