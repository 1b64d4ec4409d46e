package com.edgedispatch.core.execution;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Binds {@code edgedispatch.execution.*}: remote-shell tuning and execution budgets.
 */
@Component
@ConfigurationProperties(prefix = "edgedispatch.execution")
public class ExecutionProperties {

    private Ssh ssh = new Ssh();
    private int probeTimeoutSeconds = 20;
    private long overallTimeoutMillis = 60_000;
    private int shutdownGraceSeconds = 10;
    private int maxOutputChars = 10_000;
    private String policyDenialPattern = PolicyDenialClassifier.DEFAULT_PATTERN;

    // -- Ssh accessors (delegate to nested) --
    public String getSshUser() { return ssh.user; }
    public int getSshPort() { return ssh.port; }
    public String getSshBinary() { return ssh.binary; }
    public int getConnectTimeoutSeconds() { return ssh.connectTimeoutSeconds; }
    public int getServerAliveIntervalSeconds() { return ssh.serverAliveIntervalSeconds; }

    public Duration getProbeTimeout() { return Duration.ofSeconds(probeTimeoutSeconds); }
    public Duration getOverallTimeout() { return Duration.ofMillis(overallTimeoutMillis); }

    public Ssh getSsh() { return ssh; }
    public void setSsh(Ssh ssh) { this.ssh = ssh; }
    public int getProbeTimeoutSeconds() { return probeTimeoutSeconds; }
    public void setProbeTimeoutSeconds(int probeTimeoutSeconds) { this.probeTimeoutSeconds = probeTimeoutSeconds; }
    public long getOverallTimeoutMillis() { return overallTimeoutMillis; }
    public void setOverallTimeoutMillis(long overallTimeoutMillis) { this.overallTimeoutMillis = overallTimeoutMillis; }
    public int getShutdownGraceSeconds() { return shutdownGraceSeconds; }
    public void setShutdownGraceSeconds(int shutdownGraceSeconds) { this.shutdownGraceSeconds = shutdownGraceSeconds; }
    public int getMaxOutputChars() { return maxOutputChars; }
    public void setMaxOutputChars(int maxOutputChars) { this.maxOutputChars = maxOutputChars; }
    public String getPolicyDenialPattern() { return policyDenialPattern; }
    public void setPolicyDenialPattern(String policyDenialPattern) { this.policyDenialPattern = policyDenialPattern; }

    public static class Ssh {
        private String user = "root";
        private int port = 22;
        private String binary = "ssh";
        private int connectTimeoutSeconds = 25;
        private int serverAliveIntervalSeconds = 10;

        public String getUser() { return user; }
        public void setUser(String user) { this.user = user; }
        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public String getBinary() { return binary; }
        public void setBinary(String binary) { this.binary = binary; }
        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
        public int getServerAliveIntervalSeconds() { return serverAliveIntervalSeconds; }
        public void setServerAliveIntervalSeconds(int serverAliveIntervalSeconds) { this.serverAliveIntervalSeconds = serverAliveIntervalSeconds; }
    }
}
