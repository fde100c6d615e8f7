package quest.gekko.iptv.exception;

import quest.gekko.iptv.util.Tokens;

public class TenantNotConfiguredException extends IptvException {

    public TenantNotConfiguredException(String tenant) {
        super("Tenant not configured: " + Tokens.abbreviate(tenant));
    }
}
