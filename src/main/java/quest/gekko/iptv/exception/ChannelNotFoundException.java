package quest.gekko.iptv.exception;

import quest.gekko.iptv.util.Tokens;

public class ChannelNotFoundException extends IptvException {

    public ChannelNotFoundException(String tenant, String channelId) {
        super("Channel '" + channelId + "' not found for tenant " + Tokens.abbreviate(tenant));
    }
}
