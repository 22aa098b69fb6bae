package io.github.drompincen.fixflow.runtime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Application settings bound from {@code application.yml} under the {@code fixflow} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "fixflow")
public class FixFlowProperties {

    private Auth auth = new Auth();
    private Identity identity = new Identity();
    private Cors cors = new Cors();
    private WorkOrders workOrders = new WorkOrders();

    public Auth getAuth() { return auth; }
    public void setAuth(Auth auth) { this.auth = auth; }

    public Identity getIdentity() { return identity; }
    public void setIdentity(Identity identity) { this.identity = identity; }

    public Cors getCors() { return cors; }
    public void setCors(Cors cors) { this.cors = cors; }

    public WorkOrders getWorkOrders() { return workOrders; }
    public void setWorkOrders(WorkOrders workOrders) { this.workOrders = workOrders; }

    public static class Auth {
        /** HMAC secret for bearer tokens; at least 32 bytes. */
        private String jwtSecret;
        private long tokenTtlMinutes = 10080;
        private Duration sessionTtl = Duration.ofDays(7);
        private String cookieName = "session_token";

        public String getJwtSecret() { return jwtSecret; }
        public void setJwtSecret(String jwtSecret) { this.jwtSecret = jwtSecret; }

        public long getTokenTtlMinutes() { return tokenTtlMinutes; }
        public void setTokenTtlMinutes(long tokenTtlMinutes) { this.tokenTtlMinutes = tokenTtlMinutes; }

        public Duration getSessionTtl() { return sessionTtl; }
        public void setSessionTtl(Duration sessionTtl) { this.sessionTtl = sessionTtl; }

        public String getCookieName() { return cookieName; }
        public void setCookieName(String cookieName) { this.cookieName = cookieName; }
    }

    public static class Identity {
        private String exchangeUrl;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);

        public String getExchangeUrl() { return exchangeUrl; }
        public void setExchangeUrl(String exchangeUrl) { this.exchangeUrl = exchangeUrl; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
    }

    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

        public List<String> getAllowedOrigins() { return allowedOrigins; }
        public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }
    }

    public static class WorkOrders {
        /** When false any status may follow any other. */
        private boolean enforceTransitions = false;

        public boolean isEnforceTransitions() { return enforceTransitions; }
        public void setEnforceTransitions(boolean enforceTransitions) { this.enforceTransitions = enforceTransitions; }
    }
}
