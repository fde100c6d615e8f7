package quest.gekko.iptv.util;

import java.util.Locale;

public class Slug {
    /** "Live Sports" becomes "live-sports"; blank input becomes "uncategorized". */
    public static String of(String s) {
        String slug = s == null ? "" : s.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
        return slug.isEmpty() ? "uncategorized" : slug;
    }
}
