package com.edgedispatch.core.overlay;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds {@code edgedispatch.overlay.*}.
 *
 * <pre>
 * edgedispatch:
 *   overlay:
 *     enabled: true
 *     auth-key: ${TS_AUTHKEY:}
 *     hostname: ts-sidecar
 *     cli: tailscale
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "edgedispatch.overlay")
public class OverlayProperties {

    private boolean enabled = true;
    private String authKey = "";
    private String hostname = "ts-sidecar";
    private String cli = "tailscale";
    /** tailscaled socket path; blank means the CLI default. */
    private String socket = "";
    private int initTimeoutSeconds = 30;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getAuthKey() { return authKey; }
    public void setAuthKey(String authKey) { this.authKey = authKey; }
    public String getHostname() { return hostname; }
    public void setHostname(String hostname) { this.hostname = hostname; }
    public String getCli() { return cli; }
    public void setCli(String cli) { this.cli = cli; }
    public String getSocket() { return socket; }
    public void setSocket(String socket) { this.socket = socket; }
    public int getInitTimeoutSeconds() { return initTimeoutSeconds; }
    public void setInitTimeoutSeconds(int initTimeoutSeconds) { this.initTimeoutSeconds = initTimeoutSeconds; }

    public boolean hasAuthKey() {
        return authKey != null && !authKey.isBlank();
    }
}
