package cz.vut.fit.domaincheck.checker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.Splitter;
import cz.vut.fit.domaincheck.CheckerConfig;
import cz.vut.fit.domaincheck.Common;
import cz.vut.fit.domaincheck.models.requests.CheckRequest;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.Properties;
import java.util.concurrent.ExecutionException;

/**
 * The main class for checking a single domain from the command line.
 * <p>
 * The configuration is read from a properties file and {@code -o key=value} overrides; the merged result
 * is printed to the standard output as JSON.
 */
public class DomainCheckRunner {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(DomainCheckRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_PROPERTIES = 2;
    public static final int EXIT_CHECK_FAILED = 3;
    public static final int EXIT_INIT_FAILED = 4;

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /**
     * Runs the check described by the command line arguments.
     *
     * @param args The command line arguments.
     * @param out  The stream to print the result to.
     * @return The process exit code.
     */
    static int run(String[] args, PrintStream out) {
        final var options = makeOptions();

        if (Arrays.stream(args).anyMatch(arg -> arg.equals("-h") || arg.equals("--help"))) {
            printHelp(options);
            return EXIT_OK;
        }

        final CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            printHelp(options);
            return EXIT_USAGE;
        }

        final var properties = new Properties();
        if (!loadProperties(cmd, properties))
            return EXIT_PROPERTIES;

        final CheckRequest request;
        try {
            request = buildRequest(cmd, properties);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return EXIT_USAGE;
        }

        final ObjectMapper jsonMapper = Common.makeMapper().build();
        final DomainChecker checker;
        try {
            checker = DomainChecker.create(properties, jsonMapper);
        } catch (Exception e) {
            Logger.error("Failed to initialize the checker", e);
            return EXIT_INIT_FAILED;
        }

        try (checker) {
            final var result = checker.check(request).get();
            final var writer = cmd.hasOption("pretty")
                    ? jsonMapper.writer(SerializationFeature.INDENT_OUTPUT)
                    : jsonMapper.writer();
            out.println(writer.writeValueAsString(result));
            return EXIT_OK;
        } catch (ExecutionException e) {
            final var cause = CompletableFutures.unwrap(e);
            if (cause instanceof DomainCheckException checkException) {
                Logger.error("{} (code {})", checkException.getMessage(), checkException.code());
            } else {
                Logger.error("Unhandled exception", cause);
            }
            return EXIT_CHECK_FAILED;
        } catch (JsonProcessingException e) {
            Logger.error("Cannot serialize the result", e);
            return EXIT_CHECK_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Logger.error("Interrupted while waiting for the result");
            return EXIT_CHECK_FAILED;
        }
    }

    /**
     * Builds the check request from the command line and the configuration. The command line
     * takes precedence over the configuration.
     *
     * @param cmd        The parsed command line.
     * @param properties The configuration.
     * @return The request.
     * @throws IllegalArgumentException If the domain is blank or the minimum Trust Flow is not a number.
     */
    static CheckRequest buildRequest(@NotNull CommandLine cmd, @NotNull Properties properties) {
        final var skipIfResolvable = cmd.hasOption("skip-if-resolvable")
                || Boolean.parseBoolean(properties.getProperty(CheckerConfig.SKIP_IF_RESOLVABLE_CONFIG,
                CheckerConfig.SKIP_IF_RESOLVABLE_DEFAULT).trim());
        final var minTrustFlow = cmd.hasOption("min-trust-flow")
                ? cmd.getOptionValue("min-trust-flow")
                : properties.getProperty(CheckerConfig.MIN_TRUST_FLOW_CONFIG, CheckerConfig.MIN_TRUST_FLOW_DEFAULT);

        return CheckRequest.builder(cmd.getOptionValue("domain"))
                .authorityKey(properties.getProperty(CheckerConfig.AUTHORITY_KEY_CONFIG,
                        CheckerConfig.AUTHORITY_KEY_DEFAULT))
                .registrationCredential(
                        properties.getProperty(CheckerConfig.REGISTRATION_USER_CONFIG,
                                CheckerConfig.REGISTRATION_USER_DEFAULT),
                        properties.getProperty(CheckerConfig.REGISTRATION_PASSWORD_CONFIG,
                                CheckerConfig.REGISTRATION_PASSWORD_DEFAULT))
                .trafficKey(properties.getProperty(CheckerConfig.TRAFFIC_KEY_CONFIG,
                        CheckerConfig.TRAFFIC_KEY_DEFAULT))
                .trafficDatabase(properties.getProperty(CheckerConfig.TRAFFIC_DATABASE_CONFIG,
                        CheckerConfig.TRAFFIC_DATABASE_DEFAULT))
                .skipDeepChecksIfResolvable(skipIfResolvable)
                .minAuthorityScore(parseMinTrustFlow(minTrustFlow))
                .indexSearchHost(properties.getProperty(CheckerConfig.INDEX_HOST_CONFIG,
                        CheckerConfig.INDEX_HOST_DEFAULT))
                .proxyList(LIST_SPLITTER.splitToList(properties.getProperty(CheckerConfig.INDEX_PROXIES_CONFIG,
                        CheckerConfig.INDEX_PROXIES_DEFAULT)))
                .build();
    }

    private static @Nullable Integer parseMinTrustFlow(@Nullable String value) {
        if (Common.isNullOrBlank(value))
            return null;

        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("The minimum Trust Flow must be an integer: " + value, e);
        }
    }

    /**
     * Loads the properties from the file and the --option values passed in the command line.
     *
     * @return False if the properties file cannot be read.
     */
    private static boolean loadProperties(CommandLine cmd, Properties props) {
        if (cmd.hasOption("properties")) {
            var path = cmd.getOptionValue("properties");
            try (var inStream = new FileInputStream(path)) {
                props.load(inStream);
            } catch (IOException e) {
                Logger.error("Failed to load properties: {}", e.getMessage());
                return false;
            }
        }

        var cmdLineProperties = cmd.getOptionValues("option");
        if (cmdLineProperties != null) {
            for (var option : cmdLineProperties) {
                if (option.contains("=")) {
                    var parts = option.split("=", 2);
                    props.put(parts[0].trim(), parts[1]);
                } else {
                    Logger.warn("Ignoring invalid command-line option: {}", option);
                }
            }
        }

        return true;
    }

    @NotNull
    static Options makeOptions() {
        final var options = new Options();
        options.addOption("h", "help", false, "Print this help message");

        options.addOption(Option.builder("d")
                .longOpt("domain")
                .desc("The domain name to check (required)")
                .argName("domain")
                .hasArg()
                .required()
                .build());
        options.addOption(Option.builder("p")
                .longOpt("properties")
                .desc("Path to a configuration file")
                .argName("path")
                .hasArg()
                .build());
        options.addOption(Option.builder("o")
                .longOpt("option")
                .desc("A properties key/value to add to the configuration")
                .argName("key=value")
                .hasArg()
                .build());
        options.addOption(null, "skip-if-resolvable", false,
                "Do not fetch the authority, registration and traffic data of domains that resolve");
        options.addOption(Option.builder()
                .longOpt("min-trust-flow")
                .desc("The minimum Trust Flow required to fetch the registration and traffic data")
                .argName("n")
                .hasArg()
                .build());
        options.addOption(null, "pretty", false, "Indent the JSON output");

        return options;
    }

    private static void printHelp(Options options) {
        final var formatter = new HelpFormatter();
        formatter.printHelp(new PrintWriter(System.err, true), 119,
                "domain-check -d <domain> [options]", "", options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, "");
    }
}
