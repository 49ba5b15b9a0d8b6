package tech.manajer.platform.authentication;

import io.smallrye.jwt.auth.principal.JWTParser;
import io.smallrye.jwt.auth.principal.ParseException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.JsonString;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;
import tech.manajer.platform.config.AuthConfig;
import tech.manajer.platform.shared.ObjectIds;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Verifies HS256 access tokens and extracts the caller's identity.
 *
 * Tokens carry the claims {@code user_id}, {@code email} and {@code roles}
 * (business id to role names). A token is accepted only when its signature,
 * expiry and issuer check out and {@code user_id} is a well-formed id.
 */
@ApplicationScoped
public class TokenVerifier {

    private static final Logger LOG = Logger.getLogger(TokenVerifier.class);

    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLES = "roles";

    private static final String BEARER_PREFIX = "Bearer ";

    private final JWTParser parser;
    private final AuthConfig config;
    private final SecretKey key;

    @Inject
    public TokenVerifier(JWTParser parser, AuthConfig config) {
        this.parser = parser;
        this.config = config;
        this.key = new SecretKeySpec(config.secret().getBytes(StandardCharsets.UTF_8), "HmacSHA256");
    }

    /**
     * Verify a raw token.
     *
     * @return the identity, or empty if the token is absent or invalid
     */
    public Optional<AuthenticatedUser> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }

        JsonWebToken jwt;
        try {
            jwt = parser.verify(token, key);
        } catch (ParseException e) {
            LOG.debugf("Rejected token: %s", e.getMessage());
            return Optional.empty();
        }

        if (!config.issuer().equals(jwt.getIssuer())) {
            LOG.debugf("Rejected token from issuer [%s]", jwt.getIssuer());
            return Optional.empty();
        }

        String userId = asText(jwt.getClaim(CLAIM_USER_ID));
        if (!ObjectIds.isValid(userId)) {
            LOG.debugf("Rejected token with malformed user_id [%s]", userId);
            return Optional.empty();
        }

        return Optional.of(new AuthenticatedUser(
            userId,
            asText(jwt.getClaim(CLAIM_EMAIL)),
            asRoles(jwt.getClaim(CLAIM_ROLES))));
    }

    /**
     * Verify the token of an {@code Authorization: Bearer ...} header.
     */
    public Optional<AuthenticatedUser> verifyBearer(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        return verify(authorizationHeader.substring(BEARER_PREFIX.length()).trim());
    }

    // Custom claims surface either as plain Java values or as JSON-P values
    private static String asText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof JsonString json) {
            return json.getString();
        }
        return value.toString();
    }

    private static Map<String, List<String>> asRoles(Object value) {
        Map<String, List<String>> roles = new LinkedHashMap<>();
        if (!(value instanceof Map<?, ?> byBusiness)) {
            return roles;
        }
        for (Map.Entry<?, ?> entry : byBusiness.entrySet()) {
            List<String> names = new ArrayList<>();
            if (entry.getValue() instanceof Iterable<?> values) {
                for (Object name : values) {
                    names.add(asText(name));
                }
            }
            roles.put(asText(entry.getKey()), names);
        }
        return roles;
    }
}
