package cz.vut.fit.domaincheck.models.providers;

/**
 * A record that represents the SEO traffic metrics retrieved from SEMrush about a domain name.
 *
 * @param rank            The SEMrush rank, -1 if unknown.
 * @param organicKeywords The number of keywords the domain ranks for in the organic results.
 * @param organicTraffic  The estimated organic traffic.
 * @param organicCost     The estimated cost of the organic traffic.
 * @param adwordsKeywords The number of keywords the domain buys in the paid results.
 * @param adwordsTraffic  The estimated paid traffic.
 * @param adwordsCost     The estimated cost of the paid traffic.
 */
public record TrafficData(
        long rank,
        long organicKeywords,
        long organicTraffic,
        double organicCost,
        long adwordsKeywords,
        long adwordsTraffic,
        double adwordsCost
) {
    /**
     * Creates the record used when the traffic data were not fetched or could not be parsed.
     *
     * @return A record with rank -1 and all the other metrics set to zero.
     */
    public static TrafficData empty() {
        return new TrafficData(-1, 0, 0, 0, 0, 0, 0);
    }
}
