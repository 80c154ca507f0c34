package cz.vut.fit.domaincheck;

/**
 * The configuration keys, descriptions and default values for the domain checker.
 */
@SuppressWarnings("ALL")
public class CheckerConfig {
    /* --- Address resolver --- */
    public static final String DNS_RESOLVERS_CONFIG = "checker.dns.resolvers";
    public static final String DNS_RESOLVERS_DOC = "Comma-separated IPs of the DNS resolvers to use. " +
            "If empty, the system resolvers are used.";
    public static final String DNS_RESOLVERS_DEFAULT = "";

    public static final String DNS_TIMEOUT_MS_CONFIG = "checker.dns.timeout";
    public static final String DNS_TIMEOUT_MS_DOC = "The timeout of a single DNS lookup (milliseconds).";
    public static final String DNS_TIMEOUT_MS_DEFAULT = "5000";

    /* --- Liveness prober --- */
    public static final String PING_TIMEOUT_MS_CONFIG = "checker.ping.timeout";
    public static final String PING_TIMEOUT_MS_DOC = "The reachability probe timeout (milliseconds).";
    public static final String PING_TIMEOUT_MS_DEFAULT = "3000";

    /* --- Authority (Majestic) fetcher --- */
    public static final String AUTHORITY_URL_CONFIG = "checker.authority.url";
    public static final String AUTHORITY_URL_DOC = "The Majestic JSON API endpoint.";
    public static final String AUTHORITY_URL_DEFAULT = "http://api.majestic.com/api/json";

    public static final String AUTHORITY_KEY_CONFIG = "checker.authority.key";
    public static final String AUTHORITY_KEY_DOC = "The Majestic API key. If empty, the authority data are not fetched.";
    public static final String AUTHORITY_KEY_DEFAULT = "";

    public static final String AUTHORITY_HTTP_TIMEOUT_CONFIG = "checker.authority.timeout";
    public static final String AUTHORITY_HTTP_TIMEOUT_DOC = "The request timeout to use in the authority fetcher (seconds).";
    public static final String AUTHORITY_HTTP_TIMEOUT_DEFAULT = "10";

    /* --- Registration (WhoisXML API) fetcher --- */
    public static final String REGISTRATION_URL_CONFIG = "checker.registration.url";
    public static final String REGISTRATION_URL_DOC = "The WhoisXML API whois service endpoint.";
    public static final String REGISTRATION_URL_DEFAULT = "https://www.whoisxmlapi.com/whoisserver/WhoisService";

    public static final String REGISTRATION_USER_CONFIG = "checker.registration.user";
    public static final String REGISTRATION_USER_DOC = "The WhoisXML API user name.";
    public static final String REGISTRATION_USER_DEFAULT = "";

    public static final String REGISTRATION_PASSWORD_CONFIG = "checker.registration.password";
    public static final String REGISTRATION_PASSWORD_DOC = "The WhoisXML API password.";
    public static final String REGISTRATION_PASSWORD_DEFAULT = "";

    public static final String REGISTRATION_HTTP_TIMEOUT_CONFIG = "checker.registration.timeout";
    public static final String REGISTRATION_HTTP_TIMEOUT_DOC = "The request timeout to use in the registration fetcher (seconds).";
    public static final String REGISTRATION_HTTP_TIMEOUT_DEFAULT = "10";

    /* --- Traffic (SEMrush) fetcher --- */
    public static final String TRAFFIC_URL_CONFIG = "checker.traffic.url";
    public static final String TRAFFIC_URL_DOC = "The SEMrush API endpoint.";
    public static final String TRAFFIC_URL_DEFAULT = "http://api.semrush.com/";

    public static final String TRAFFIC_KEY_CONFIG = "checker.traffic.key";
    public static final String TRAFFIC_KEY_DOC = "The SEMrush API key. If empty, the traffic data are not fetched.";
    public static final String TRAFFIC_KEY_DEFAULT = "";

    public static final String TRAFFIC_DATABASE_CONFIG = "checker.traffic.database";
    public static final String TRAFFIC_DATABASE_DOC = "The SEMrush regional database to query.";
    public static final String TRAFFIC_DATABASE_DEFAULT = "us";

    public static final String TRAFFIC_HTTP_TIMEOUT_CONFIG = "checker.traffic.timeout";
    public static final String TRAFFIC_HTTP_TIMEOUT_DOC = "The request timeout to use in the traffic fetcher (seconds).";
    public static final String TRAFFIC_HTTP_TIMEOUT_DEFAULT = "10";

    /* --- Index counter --- */
    public static final String INDEX_HOST_CONFIG = "checker.index.host";
    public static final String INDEX_HOST_DOC = "The search engine host used to count the indexed pages.";
    public static final String INDEX_HOST_DEFAULT = "www.google.com";

    public static final String INDEX_PROXIES_CONFIG = "checker.index.proxies";
    public static final String INDEX_PROXIES_DOC = "Comma-separated host:port HTTP proxies for the search queries. " +
            "A random one is used for each query.";
    public static final String INDEX_PROXIES_DEFAULT = "";

    public static final String INDEX_TIMEOUT_MS_CONFIG = "checker.index.timeout";
    public static final String INDEX_TIMEOUT_MS_DOC = "The search query timeout (milliseconds).";
    public static final String INDEX_TIMEOUT_MS_DEFAULT = "10000";

    public static final String INDEX_USER_AGENT_CONFIG = "checker.index.user.agent";
    public static final String INDEX_USER_AGENT_DOC = "The User-Agent header sent with the search queries.";
    public static final String INDEX_USER_AGENT_DEFAULT =
            "Mozilla/5.0 (X11; Linux x86_64; rv:128.0) Gecko/20100101 Firefox/128.0";

    /* --- Gating and the whole check --- */
    public static final String SKIP_IF_RESOLVABLE_CONFIG = "checker.skip.if.resolvable";
    public static final String SKIP_IF_RESOLVABLE_DOC = "If true, the authority, registration and traffic data " +
            "are not fetched for domains that resolve in the DNS.";
    public static final String SKIP_IF_RESOLVABLE_DEFAULT = "false";

    public static final String MIN_TRUST_FLOW_CONFIG = "checker.min.trust.flow";
    public static final String MIN_TRUST_FLOW_DOC = "The minimum Trust Flow required to fetch the registration " +
            "and traffic data. If empty, no threshold is applied.";
    public static final String MIN_TRUST_FLOW_DEFAULT = "";

    public static final String CHECK_TIMEOUT_MS_CONFIG = "checker.check.timeout";
    public static final String CHECK_TIMEOUT_MS_DOC = "The deadline for a whole domain check (milliseconds). " +
            "Zero means no deadline.";
    public static final String CHECK_TIMEOUT_MS_DEFAULT = "60000";
}
