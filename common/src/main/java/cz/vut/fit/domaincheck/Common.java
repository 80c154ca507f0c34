package cz.vut.fit.domaincheck;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.MapperBuilder;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.net.InternetDomainName;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.util.Locale;

/**
 * Common utility functions and constants.
 */
public final class Common {
    private Common() {
    }

    /**
     * Creates a new Jackson JSON {@link ObjectMapper} builder with the following settings:
     * <ul>
     *     <li>Include the JavaTimeModule to support Java 8 date/time datatypes.</li>
     *     <li>Include source locations in exceptions.</li>
     *     <li>Write dates as ISO-8601 strings.</li>
     *     <li>Do not fail on unknown properties.</li>
     * </ul>
     *
     * @return a new {@link MapperBuilder} instance
     */
    public static MapperBuilder<? extends ObjectMapper, ?> makeMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .configure(JsonParser.Feature.INCLUDE_SOURCE_IN_LOCATION, true)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Creates a logger for a specific pipeline component. The logger name will be created by concatenating
     * the class name, a dot, and the value of the static field {@code COMPONENT_NAME} in the class.
     *
     * @param clazz the class to get the logger for
     * @return a SLF4J {@link Logger} instance
     */
    public static Logger getComponentLogger(Class<?> clazz) {
        try {
            final String componentName = clazz.getField("COMPONENT_NAME")
                    .get(null).toString();
            return org.slf4j.LoggerFactory.getLogger(clazz.getName() + "." + componentName);
        } catch (IllegalAccessException | NoSuchFieldException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Extracts the top-level domain of a domain name. The ICANN section of the public suffix list is used
     * so that names under multi-label suffixes (e.g. {@code example.co.uk}) yield the whole suffix
     * ({@code co.uk}), while private entries such as {@code blogspot.com} are not treated as suffixes.
     * Names that do not end with a known public suffix yield their last label.
     *
     * @param domainName the domain name
     * @return the registry suffix, the last label, or an empty string for an empty input
     */
    public static @NotNull String getTld(@NotNull String domainName) {
        var name = domainName.trim().toLowerCase(Locale.ROOT);
        if (name.endsWith("."))
            name = name.substring(0, name.length() - 1);

        if (name.isEmpty())
            return "";

        if (InternetDomainName.isValid(name)) {
            var parsed = InternetDomainName.from(name);
            if (parsed.hasRegistrySuffix()) {
                //noinspection DataFlowIssue
                return parsed.registrySuffix().toString();
            }
        }

        var lastDot = name.lastIndexOf('.');
        return lastDot < 0 ? name : name.substring(lastDot + 1);
    }

    /**
     * Returns true if the string is null or contains only whitespace.
     *
     * @param value the string to check
     * @return whether the string is blank
     */
    public static boolean isNullOrBlank(String value) {
        return value == null || value.isBlank();
    }
}
