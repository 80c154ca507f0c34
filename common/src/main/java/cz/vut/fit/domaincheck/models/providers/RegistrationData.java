package cz.vut.fit.domaincheck.models.providers;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import cz.vut.fit.domaincheck.models.Flag;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A record that represents the registration (whois) data retrieved from the WhoisXML API, together with
 * the values derived from them. The derived values are always present; unknown values are
 * {@link Flag#NO_DATA} or the {@value #NO_DATA} string.
 *
 * @param raw                The response body as returned by the API, null when the data were not fetched.
 * @param isValidDomain      False if the provider reported the domain name as invalid.
 * @param missingData        True if the provider has no whois data for the domain.
 * @param status             The registry status (e.g. "AVAILABLE" or a list of EPP status codes).
 * @param isPendingDelete    True if the registry status contains "pendingDelete".
 * @param isRedemptionPeriod True if the registry status contains "redemptionPeriod".
 * @param createdDate        The creation date as returned by the API.
 * @param expiresDate        The expiration date as returned by the API.
 * @param expiredWaitingTime The expiration date relative to the time of the check, e.g. "in 3 months".
 * @param estimatedDomainAge The domain age in years with two decimal places.
 */
public record RegistrationData(
        @Nullable JsonNode raw,
        @JsonProperty("isValidDomain") @NotNull Flag isValidDomain,
        @NotNull Flag missingData,
        @NotNull String status,
        @JsonProperty("isPendingDelete") @NotNull Flag isPendingDelete,
        @JsonProperty("isRedemptionPeriod") @NotNull Flag isRedemptionPeriod,
        @NotNull String createdDate,
        @NotNull String expiresDate,
        @NotNull String expiredWaitingTime,
        @NotNull String estimatedDomainAge
) {
    public static final String NO_DATA = Flag.NO_DATA_TEXT;

    /**
     * Creates the record used when the registration data were not fetched.
     *
     * @return A record with all the derived values set to "no-data".
     */
    public static RegistrationData empty() {
        return new RegistrationData(null, Flag.NO_DATA, Flag.NO_DATA, NO_DATA, Flag.NO_DATA, Flag.NO_DATA,
                NO_DATA, NO_DATA, NO_DATA, NO_DATA);
    }

    /**
     * @return True if a registry status was obtained.
     */
    @JsonIgnore
    public boolean hasStatus() {
        return !NO_DATA.equals(status);
    }
}
