package quest.gekko.iptv.domain;

import java.util.Locale;

public enum ImageKind {
    POSTER, BACKGROUND, LOGO, ICON;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
