package tech.manajer.platform.authentication;

import java.util.List;
import java.util.Map;

/**
 * Identity carried by a verified token.
 *
 * @param userId the user's id (24-char hex)
 * @param email  the user's email, may be null
 * @param roles  role names per business id
 */
public record AuthenticatedUser(
    String userId,
    String email,
    Map<String, List<String>> roles
) {

    public static final String SUPER_ADMIN = "super_admin";

    public AuthenticatedUser {
        roles = roles == null ? Map.of() : Map.copyOf(roles);
    }

    /**
     * Whether the user holds the role in any business.
     */
    public boolean hasRole(String role) {
        return roles.values().stream().anyMatch(names -> names.contains(role));
    }

    public boolean isSuperAdmin() {
        return hasRole(SUPER_ADMIN);
    }
}
