package com.analyticscache.api;

import com.analyticscache.domain.security.UserContext;
import com.analyticscache.exception.SecurityViolationException;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the caller's {@link UserContext} from headers set by the authenticating gateway.
 *
 * Headers:
 * - X-User-Id: required
 * - X-User-Permissions: comma-separated permission names
 * - X-User-Practices: comma-separated practice UIDs of the caller's organizations
 * - X-User-Provider: provider UID of a provider-level user
 */
@Component
public class GatewayUserContextResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String PERMISSIONS_HEADER = "X-User-Permissions";
    public static final String PRACTICES_HEADER = "X-User-Practices";
    public static final String PROVIDER_HEADER = "X-User-Provider";

    public UserContext resolve(String userId, String permissions, String practices, String provider) {
        if (userId == null || userId.isBlank()) {
            throw new SecurityViolationException("Missing authenticated user");
        }

        return UserContext.builder()
                .userId(userId.trim())
                .permissions(splitTokens(permissions))
                .practiceUids(splitTokens(practices).stream()
                        .map(value -> parseUid(value, PRACTICES_HEADER))
                        .collect(Collectors.toCollection(LinkedHashSet::new)))
                .providerUid(provider == null || provider.isBlank() ? null : parseUid(provider.trim(), PROVIDER_HEADER))
                .build();
    }

    private static Set<String> splitTokens(String header) {
        if (header == null || header.isBlank()) {
            return new LinkedHashSet<>();
        }
        return Arrays.stream(header.split(","))
                .map(String::trim)
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static Integer parseUid(String value, String header) {
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid UID in " + header + ": " + value);
        }
    }
}
