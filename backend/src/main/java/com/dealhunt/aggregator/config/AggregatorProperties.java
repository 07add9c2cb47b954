package com.dealhunt.aggregator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "aggregator")
public class AggregatorProperties {
    private static final String DEFAULT_USER_AGENT = "deal-aggregator/0.1 (+contact)";

    private String userAgent;
    private Search search = new Search();
    private Aliexpress aliexpress = new Aliexpress();
    private Ebay ebay = new Ebay();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Aliexpress getAliexpress() {
        return aliexpress;
    }

    public void setAliexpress(Aliexpress aliexpress) {
        this.aliexpress = aliexpress;
    }

    public Ebay getEbay() {
        return ebay;
    }

    public void setEbay(Ebay ebay) {
        this.ebay = ebay;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Search {
        private int cacheTtlSeconds = 300;
        private int maxConsecutiveFailures = 3;
        private int dispatchDeadlineSeconds = 20;
        private int veryHighPageThreshold = 20;
        private int earlyPageThreshold = 3;
        private int maxQueryLength = 200;
        private int providerConcurrency = 8;

        public int getCacheTtlSeconds() {
            return Math.max(1, cacheTtlSeconds);
        }

        public void setCacheTtlSeconds(int cacheTtlSeconds) {
            this.cacheTtlSeconds = Math.max(1, cacheTtlSeconds);
        }

        public int getMaxConsecutiveFailures() {
            return Math.max(1, maxConsecutiveFailures);
        }

        public void setMaxConsecutiveFailures(int maxConsecutiveFailures) {
            this.maxConsecutiveFailures = Math.max(1, maxConsecutiveFailures);
        }

        public int getDispatchDeadlineSeconds() {
            return Math.max(1, dispatchDeadlineSeconds);
        }

        public void setDispatchDeadlineSeconds(int dispatchDeadlineSeconds) {
            this.dispatchDeadlineSeconds = Math.max(1, dispatchDeadlineSeconds);
        }

        public int getVeryHighPageThreshold() {
            return Math.max(1, veryHighPageThreshold);
        }

        public void setVeryHighPageThreshold(int veryHighPageThreshold) {
            this.veryHighPageThreshold = Math.max(1, veryHighPageThreshold);
        }

        public int getEarlyPageThreshold() {
            return Math.max(1, earlyPageThreshold);
        }

        public void setEarlyPageThreshold(int earlyPageThreshold) {
            this.earlyPageThreshold = Math.max(1, earlyPageThreshold);
        }

        public int getMaxQueryLength() {
            return Math.max(1, maxQueryLength);
        }

        public void setMaxQueryLength(int maxQueryLength) {
            this.maxQueryLength = Math.max(1, maxQueryLength);
        }

        public int getProviderConcurrency() {
            return Math.max(1, providerConcurrency);
        }

        public void setProviderConcurrency(int providerConcurrency) {
            this.providerConcurrency = Math.max(1, providerConcurrency);
        }
    }

    public static class Aliexpress {
        private boolean enabled = true;
        private String baseUrl = "https://api-sg.aliexpress.com/sync";
        private String appKey;
        private String appSecret;
        private String trackingId;
        private String apiVersion = "2.0";
        private String signMethod = "md5";
        private int pageSize = 12;
        private String targetCurrency = "USD";
        private String targetLanguage = "EN";
        private int connectTimeoutSeconds = 15;
        private int readTimeoutSeconds = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isConfigured() {
            return enabled && hasText(appKey) && hasText(appSecret) && hasText(trackingId);
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getAppKey() {
            return appKey;
        }

        public void setAppKey(String appKey) {
            this.appKey = appKey;
        }

        public String getAppSecret() {
            return appSecret;
        }

        public void setAppSecret(String appSecret) {
            this.appSecret = appSecret;
        }

        public String getTrackingId() {
            return trackingId;
        }

        public void setTrackingId(String trackingId) {
            this.trackingId = trackingId;
        }

        public String getApiVersion() {
            return apiVersion;
        }

        public void setApiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
        }

        public String getSignMethod() {
            return signMethod == null || signMethod.isBlank() ? "md5" : signMethod.trim();
        }

        public void setSignMethod(String signMethod) {
            this.signMethod = signMethod;
        }

        public int getPageSize() {
            return Math.max(1, pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = Math.max(1, pageSize);
        }

        public String getTargetCurrency() {
            return targetCurrency;
        }

        public void setTargetCurrency(String targetCurrency) {
            this.targetCurrency = targetCurrency;
        }

        public String getTargetLanguage() {
            return targetLanguage;
        }

        public void setTargetLanguage(String targetLanguage) {
            this.targetLanguage = targetLanguage;
        }

        public int getConnectTimeoutSeconds() {
            return Math.max(1, connectTimeoutSeconds);
        }

        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
            this.connectTimeoutSeconds = Math.max(1, connectTimeoutSeconds);
        }

        public int getReadTimeoutSeconds() {
            return Math.max(1, readTimeoutSeconds);
        }

        public void setReadTimeoutSeconds(int readTimeoutSeconds) {
            this.readTimeoutSeconds = Math.max(1, readTimeoutSeconds);
        }
    }

    public static class Ebay {
        private boolean enabled = true;
        private String baseUrl = "https://api.ebay.com";
        private String token;
        private String campaignId;
        private String marketplaceId = "EBAY_US";
        private String currency = "USD";
        private int pageSize = 50;
        private int connectTimeoutSeconds = 5;
        private int readTimeoutSeconds = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isConfigured() {
            return enabled && hasText(token);
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public String getCampaignId() {
            return campaignId;
        }

        public void setCampaignId(String campaignId) {
            this.campaignId = campaignId;
        }

        public String getMarketplaceId() {
            return marketplaceId;
        }

        public void setMarketplaceId(String marketplaceId) {
            this.marketplaceId = marketplaceId;
        }

        public String getCurrency() {
            return currency;
        }

        public void setCurrency(String currency) {
            this.currency = currency;
        }

        public int getPageSize() {
            return Math.max(1, pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = Math.max(1, pageSize);
        }

        public int getConnectTimeoutSeconds() {
            return Math.max(1, connectTimeoutSeconds);
        }

        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
            this.connectTimeoutSeconds = Math.max(1, connectTimeoutSeconds);
        }

        public int getReadTimeoutSeconds() {
            return Math.max(1, readTimeoutSeconds);
        }

        public void setReadTimeoutSeconds(int readTimeoutSeconds) {
            this.readTimeoutSeconds = Math.max(1, readTimeoutSeconds);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
