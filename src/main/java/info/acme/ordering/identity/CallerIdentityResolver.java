package info.acme.ordering.identity;

import java.util.HashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns the {@code user-info} request header into a {@link CallerIdentity}.
 * <p>
 * The header is a list of {@code key=value} pairs separated by {@code ;}, for
 * example {@code name=Alice Johnson; email=alice@example.com}. Only the
 * {@code name} and {@code email} keys are used.
 * </p>
 * <p>
 * When the header is missing and the fallback is enabled, the configured
 * fallback identity is returned. The fallback exists for local development
 * and tests and is disabled in the default configuration.
 * </p>
 */
@Component
@Slf4j
public class CallerIdentityResolver {
    public static final String USER_INFO_HEADER = "user-info";

    private final boolean fallbackEnabled;
    private final CallerIdentity fallbackIdentity;

    /**
     * Constructs an instance of {@code CallerIdentityResolver}.
     *
     * @param fallbackEnabled Whether a missing header resolves to the fallback.
     * @param fallbackName    Name of the fallback identity.
     * @param fallbackEmail   Email of the fallback identity.
     */
    public CallerIdentityResolver(@Value("${app.identity.fallback.enabled:false}") boolean fallbackEnabled,
            @Value("${app.identity.fallback.name:}") String fallbackName,
            @Value("${app.identity.fallback.email:}") String fallbackEmail) {
        this.fallbackEnabled = fallbackEnabled;
        this.fallbackIdentity = new CallerIdentity(fallbackName, fallbackEmail);

        if (fallbackEnabled) {
            log.warn("Fallback caller identity is enabled ({}). Do not use this setting in production.",
                    fallbackEmail);
        }
    }

    /**
     * Resolves the caller identity from the raw header value.
     * A header that cannot be parsed is logged and treated as if the request
     * carried no identity.
     *
     * @param userInfoHeader The raw {@code user-info} header, may be null.
     * @return The resolved identity, {@link CallerIdentity#anonymous()} if none
     *         could be determined.
     */
    public CallerIdentity resolve(String userInfoHeader) {
        if (userInfoHeader == null || userInfoHeader.isBlank()) {
            if (fallbackEnabled) {
                log.debug("No {} header present, using fallback identity", USER_INFO_HEADER);
                return fallbackIdentity;
            }
            return CallerIdentity.anonymous();
        }

        try {
            return parse(userInfoHeader);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unparseable {} header: {}", USER_INFO_HEADER, e.getMessage());
            return CallerIdentity.anonymous();
        }
    }

    private CallerIdentity parse(String userInfoHeader) {
        Map<String, String> values = new HashMap<>();

        for (String part : userInfoHeader.split(";")) {
            String trimmed = part.trim();
            int separator = trimmed.indexOf('=');
            if (separator > 0) {
                values.put(trimmed.substring(0, separator).trim(), trimmed.substring(separator + 1).trim());
            }
        }

        if (values.isEmpty()) {
            throw new IllegalArgumentException("no key=value pairs found");
        }

        return new CallerIdentity(values.get("name"), values.get("email"));
    }
}
