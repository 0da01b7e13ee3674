package com.contractlink.harvester.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@ConfigurationProperties(prefix = "harvester")
public class HarvesterProperties {
    private static final String DEFAULT_USER_AGENT = "contract-harvester/0.1 (+procurement research)";

    private String userAgent;
    private int perHostDelayMs = 250;
    private int globalConcurrency = 7;
    private int requestTimeoutSeconds = 20;
    private int scraperTimeoutSeconds = 300;
    private boolean parallel = true;
    private Retry retry = new Retry();
    private Filters filters = new Filters();
    private Schedule schedule = new Schedule();
    private Admin admin = new Admin();
    private Cli cli = new Cli();
    private Map<String, Source> sources = new LinkedHashMap<>();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(0, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(0, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getScraperTimeoutSeconds() {
        return Math.max(1, scraperTimeoutSeconds);
    }

    public void setScraperTimeoutSeconds(int scraperTimeoutSeconds) {
        this.scraperTimeoutSeconds = Math.max(1, scraperTimeoutSeconds);
    }

    public boolean isParallel() {
        return parallel;
    }

    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Filters getFilters() {
        return filters;
    }

    public void setFilters(Filters filters) {
        this.filters = filters;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public Admin getAdmin() {
        return admin;
    }

    public void setAdmin(Admin admin) {
        this.admin = admin;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Map<String, Source> getSources() {
        return sources;
    }

    public void setSources(Map<String, Source> sources) {
        this.sources = sources == null ? new LinkedHashMap<>() : sources;
    }

    public Source source(String key) {
        if (key == null) {
            return new Source();
        }
        Source configured = sources.get(key.toLowerCase(Locale.ROOT));
        return configured == null ? new Source() : configured;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Retry {
        private int maxAttempts = 3;
        private int baseDelayMs = 1000;
        private int maxDelayMs = 4000;
        private int rateLimitDelayMs = 5000;
        private int rateLimitMaxDelayMs = 30000;
        private boolean jitter = true;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(int baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public int getMaxDelayMs() {
            return Math.max(0, maxDelayMs);
        }

        public void setMaxDelayMs(int maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }

        public int getRateLimitDelayMs() {
            return Math.max(0, rateLimitDelayMs);
        }

        public void setRateLimitDelayMs(int rateLimitDelayMs) {
            this.rateLimitDelayMs = Math.max(0, rateLimitDelayMs);
        }

        public int getRateLimitMaxDelayMs() {
            return Math.max(0, rateLimitMaxDelayMs);
        }

        public void setRateLimitMaxDelayMs(int rateLimitMaxDelayMs) {
            this.rateLimitMaxDelayMs = Math.max(0, rateLimitMaxDelayMs);
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }
    }

    public static class Filters {
        private List<String> states = new ArrayList<>();
        private List<String> keywords = new ArrayList<>(List.of("janitorial", "custodial", "cleaning", "facilities"));
        private int limit = 500;

        public List<String> getStates() {
            return states;
        }

        public void setStates(List<String> states) {
            this.states = states == null ? new ArrayList<>() : states;
        }

        public List<String> getKeywords() {
            return keywords;
        }

        public void setKeywords(List<String> keywords) {
            this.keywords = keywords == null ? new ArrayList<>() : keywords;
        }

        public int getLimit() {
            return Math.max(1, limit);
        }

        public void setLimit(int limit) {
            this.limit = Math.max(1, limit);
        }
    }

    public static class Schedule {
        private boolean enabled = false;
        private int startHour = 3;
        private int intervalHours = 24;
        private String zone = "America/New_York";
        private int lockTtlMinutes = 120;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getStartHour() {
            return Math.min(23, Math.max(0, startHour));
        }

        public void setStartHour(int startHour) {
            this.startHour = Math.min(23, Math.max(0, startHour));
        }

        public int getIntervalHours() {
            return Math.max(1, intervalHours);
        }

        public void setIntervalHours(int intervalHours) {
            this.intervalHours = Math.max(1, intervalHours);
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone == null || zone.isBlank() ? "UTC" : zone.trim();
        }

        public int getLockTtlMinutes() {
            return Math.max(1, lockTtlMinutes);
        }

        public void setLockTtlMinutes(int lockTtlMinutes) {
            this.lockTtlMinutes = Math.max(1, lockTtlMinutes);
        }
    }

    public static class Admin {
        private String token;

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;
        private int sampleSize = 20;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }

        public int getSampleSize() {
            return Math.max(0, sampleSize);
        }

        public void setSampleSize(int sampleSize) {
            this.sampleSize = Math.max(0, sampleSize);
        }
    }

    public static class Source {
        private boolean enabled = true;
        private String baseUrl;
        private String apiUrl;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String baseUrlOr(String fallback) {
            return stripTrailingSlash(baseUrl, fallback);
        }

        public String apiUrlOr(String fallback) {
            return stripTrailingSlash(apiUrl, fallback);
        }

        private static String stripTrailingSlash(String value, String fallback) {
            if (value == null || value.isBlank()) {
                return fallback;
            }
            String trimmed = value.trim();
            return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }
    }
}
