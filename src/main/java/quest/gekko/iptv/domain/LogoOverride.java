package quest.gekko.iptv.domain;

import java.util.regex.Pattern;

/**
 * Replacement logo for a channel id, or for every channel id a regex pattern matches
 * (matched from the start of the id).
 */
public record LogoOverride(String pattern, String logoUrl, boolean regex) {

    public boolean matches(String channelId) {
        if (channelId == null) return false;
        if (!regex) return pattern.equals(channelId);
        return Pattern.compile(pattern).matcher(channelId).lookingAt();
    }
}
