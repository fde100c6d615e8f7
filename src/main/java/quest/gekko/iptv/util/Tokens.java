package quest.gekko.iptv.util;

import quest.gekko.iptv.exception.ConfigInvalidException;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Tenant token helpers. Tokens end up inside store keys, so their alphabet excludes the key
 * separator and glob characters.
 */
public final class Tokens {

    private static final Pattern VALID = Pattern.compile("^[A-Za-z0-9._-]{8,256}$");
    private static final SecureRandom RANDOM = new SecureRandom();

    private Tokens() {
    }

    public static String generate() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    public static String requireValid(String tenant) {
        if (tenant == null || !VALID.matcher(tenant.strip()).matches()) {
            throw new ConfigInvalidException("Invalid tenant token: " + abbreviate(tenant));
        }
        return tenant.strip();
    }

    /** First 8 characters, for log lines. */
    public static String abbreviate(String tenant) {
        if (tenant == null) return "null";
        return tenant.length() <= 8 ? tenant : tenant.substring(0, 8) + "...";
    }
}
