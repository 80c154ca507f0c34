package cz.vut.fit.domaincheck.checker.collectors;

import com.fasterxml.jackson.databind.JsonNode;
import cz.vut.fit.domaincheck.Common;
import cz.vut.fit.domaincheck.models.Flag;
import cz.vut.fit.domaincheck.models.providers.RegistrationData;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Locale;

import static cz.vut.fit.domaincheck.models.providers.RegistrationData.NO_DATA;

/**
 * Derives the lifecycle values of {@link RegistrationData} from a WhoisXML API response
 * (DNS_AND_WHOIS mode, JSON output).
 */
public class RegistrationNormalizer {
    public static final String COMPONENT_NAME = "normalizer-whois";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(RegistrationNormalizer.class);

    static final String INVALID_DOMAIN_MESSAGE = "Unable to retrieve whois record for";
    static final String MISSING_WHOIS_DATA = "MISSING_WHOIS_DATA";
    static final String PENDING_DELETE = "pendingDelete";
    static final String REDEMPTION_PERIOD = "redemptionPeriod";

    private final Clock _clock;

    public RegistrationNormalizer(@NotNull Clock clock) {
        _clock = clock;
    }

    /**
     * Normalizes a response body.
     *
     * @param response The parsed response body.
     * @return The registration data; the body is kept as {@link RegistrationData#raw()}.
     */
    public RegistrationData normalize(@NotNull JsonNode response) {
        final var errorMessage = textOrNull(response.path("ErrorMessage").path("msg"));
        final var isValidDomain = Flag.of(errorMessage == null || !errorMessage.contains(INVALID_DOMAIN_MESSAGE));

        final var whoisRecord = response.path("WhoisRecord");
        final var missingData = Flag.of(MISSING_WHOIS_DATA.equals(textOrNull(whoisRecord.path("dataError"))));

        var status = statusOrNull(whoisRecord.path("registryData").path("status"));
        final Flag isPendingDelete, isRedemptionPeriod;
        if (status != null) {
            isPendingDelete = Flag.of(status.contains(PENDING_DELETE));
            isRedemptionPeriod = Flag.of(status.contains(REDEMPTION_PERIOD));
        } else {
            status = NO_DATA;
            isPendingDelete = Flag.NO_DATA;
            isRedemptionPeriod = Flag.NO_DATA;
        }

        final var createdDate = textOrNoData(whoisRecord.path("createdDate"));
        final var expiresDate = textOrNoData(whoisRecord.path("expiresDate"));
        final var expiredWaitingTime = NO_DATA.equals(expiresDate) ? NO_DATA : waitingTime(expiresDate);

        return new RegistrationData(response, isValidDomain, missingData, status, isPendingDelete,
                isRedemptionPeriod, createdDate, expiresDate, expiredWaitingTime,
                domainAge(whoisRecord.path("estimatedDomainAge")));
    }

    private String waitingTime(String expiresDate) {
        return RelativeTime.parseDate(expiresDate)
                .map(expires -> RelativeTime.fromNow(expires, _clock.instant()))
                .orElseGet(() -> {
                    Logger.debug("Unsupported expiration date format: {}", expiresDate);
                    return NO_DATA;
                });
    }

    private static String domainAge(JsonNode ageInDays) {
        final var days = ageInDays.asDouble(0);
        if (days <= 0)
            return NO_DATA;

        return String.format(Locale.ROOT, "%.2f", days / 365);
    }

    /**
     * The registry status is usually a space-separated string; lists are joined to the same form.
     */
    private static @Nullable String statusOrNull(JsonNode node) {
        if (node.isArray()) {
            final var parts = new ArrayList<String>();
            node.forEach(part -> {
                if (part.isValueNode() && !part.asText().isBlank())
                    parts.add(part.asText());
            });
            return parts.isEmpty() ? null : String.join(" ", parts);
        }

        return textOrNull(node);
    }

    private static String textOrNoData(JsonNode node) {
        final var text = textOrNull(node);
        return text == null ? NO_DATA : text;
    }

    private static @Nullable String textOrNull(JsonNode node) {
        if (node == null || !node.isValueNode() || node.isNull())
            return null;

        final var text = node.asText();
        return text.isBlank() ? null : text;
    }
}
