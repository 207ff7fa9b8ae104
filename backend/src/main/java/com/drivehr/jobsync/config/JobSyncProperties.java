package com.drivehr.jobsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "job-sync")
public class JobSyncProperties {
    public static final String DEFAULT_WEBHOOK_PATH = "/webhook/drivehr-sync";
    private static final String DEFAULT_SOURCE = "drivehr";
    private static final String DEFAULT_SYNC_SOURCE_TAG = "drivehr-netlify-sync";

    private boolean enabled;
    private String webhookSecret = "";
    private String webhookPath = DEFAULT_WEBHOOK_PATH;
    private int maxJobsPerRequest = 100;
    private int maxTimestampDriftSeconds = 300;
    private String source = DEFAULT_SOURCE;
    private String syncSourceTag = DEFAULT_SYNC_SOURCE_TAG;
    private String syncVersion = "0.1.0";
    private boolean debugLogging;
    private RateLimit rateLimit = new RateLimit();
    private Trigger trigger = new Trigger();
    private Api api = new Api();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getWebhookSecret() {
        return webhookSecret == null ? "" : webhookSecret;
    }

    public void setWebhookSecret(String webhookSecret) {
        this.webhookSecret = webhookSecret;
    }

    public boolean isSecretConfigured() {
        return !getWebhookSecret().isEmpty();
    }

    public String getWebhookPath() {
        return webhookPath;
    }

    public void setWebhookPath(String webhookPath) {
        this.webhookPath = (webhookPath == null || webhookPath.isBlank()) ? DEFAULT_WEBHOOK_PATH : webhookPath.trim();
    }

    public int getMaxJobsPerRequest() {
        return Math.max(1, maxJobsPerRequest);
    }

    public void setMaxJobsPerRequest(int maxJobsPerRequest) {
        this.maxJobsPerRequest = Math.max(1, maxJobsPerRequest);
    }

    public int getMaxTimestampDriftSeconds() {
        return Math.max(0, maxTimestampDriftSeconds);
    }

    public void setMaxTimestampDriftSeconds(int maxTimestampDriftSeconds) {
        this.maxTimestampDriftSeconds = Math.max(0, maxTimestampDriftSeconds);
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = (source == null || source.isBlank()) ? DEFAULT_SOURCE : source.trim();
    }

    public String getSyncSourceTag() {
        return syncSourceTag;
    }

    public void setSyncSourceTag(String syncSourceTag) {
        this.syncSourceTag = (syncSourceTag == null || syncSourceTag.isBlank())
            ? DEFAULT_SYNC_SOURCE_TAG
            : syncSourceTag.trim();
    }

    public String getSyncVersion() {
        return syncVersion;
    }

    public void setSyncVersion(String syncVersion) {
        this.syncVersion = syncVersion;
    }

    public boolean isDebugLogging() {
        return debugLogging;
    }

    public void setDebugLogging(boolean debugLogging) {
        this.debugLogging = debugLogging;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public void setTrigger(Trigger trigger) {
        this.trigger = trigger;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public static class RateLimit {
        private int maxRequests = 10;
        private int windowSeconds = 60;
        private String store = "memory";

        public int getMaxRequests() {
            return Math.max(1, maxRequests);
        }

        public void setMaxRequests(int maxRequests) {
            this.maxRequests = Math.max(1, maxRequests);
        }

        public int getWindowSeconds() {
            return Math.max(1, windowSeconds);
        }

        public void setWindowSeconds(int windowSeconds) {
            this.windowSeconds = Math.max(1, windowSeconds);
        }

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }
    }

    public static class Trigger {
        private String url;
        private int timeoutSeconds = 30;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public boolean isConfigured() {
            return url != null && !url.isBlank();
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }
    }

    public static class Api {
        private int defaultLimit = 50;
        private int maxLimit = 200;

        public int getDefaultLimit() {
            return Math.max(1, Math.min(defaultLimit, getMaxLimit()));
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = Math.max(1, defaultLimit);
        }

        public int getMaxLimit() {
            return Math.max(1, maxLimit);
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = Math.max(1, maxLimit);
        }
    }
}
