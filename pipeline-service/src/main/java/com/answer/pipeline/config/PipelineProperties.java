package com.answer.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private final Cache cache = new Cache();
    private final Timeouts timeouts = new Timeouts();
    private final Breaker breaker = new Breaker();
    private final Budget budget = new Budget();
    private final Search search = new Search();
    private final Fetch fetch = new Fetch();
    private final Executors executors = new Executors();

    public Cache getCache() {
        return cache;
    }

    public Timeouts getTimeouts() {
        return timeouts;
    }

    public Breaker getBreaker() {
        return breaker;
    }

    public Budget getBudget() {
        return budget;
    }

    public Search getSearch() {
        return search;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public Executors getExecutors() {
        return executors;
    }

    public static class Cache {
        private int memoryMaxEntries = 1000;
        private long enhancementTtlSeconds = 3600;
        private long searchTtlSeconds = 1800;
        private long responseTtlSeconds = 14400;
        private long contentTtlSeconds = 7200;
        private boolean sharedEnabled = true;
        private String sharedUrl = "http://caching-service:8096";
        private long sharedTimeoutMs = 150;

        public int getMemoryMaxEntries() {
            return memoryMaxEntries;
        }

        public void setMemoryMaxEntries(int memoryMaxEntries) {
            this.memoryMaxEntries = memoryMaxEntries;
        }

        public long getEnhancementTtlSeconds() {
            return enhancementTtlSeconds;
        }

        public void setEnhancementTtlSeconds(long enhancementTtlSeconds) {
            this.enhancementTtlSeconds = enhancementTtlSeconds;
        }

        public long getSearchTtlSeconds() {
            return searchTtlSeconds;
        }

        public void setSearchTtlSeconds(long searchTtlSeconds) {
            this.searchTtlSeconds = searchTtlSeconds;
        }

        public long getResponseTtlSeconds() {
            return responseTtlSeconds;
        }

        public void setResponseTtlSeconds(long responseTtlSeconds) {
            this.responseTtlSeconds = responseTtlSeconds;
        }

        public long getContentTtlSeconds() {
            return contentTtlSeconds;
        }

        public void setContentTtlSeconds(long contentTtlSeconds) {
            this.contentTtlSeconds = contentTtlSeconds;
        }

        public boolean isSharedEnabled() {
            return sharedEnabled;
        }

        public void setSharedEnabled(boolean sharedEnabled) {
            this.sharedEnabled = sharedEnabled;
        }

        public String getSharedUrl() {
            return sharedUrl;
        }

        public void setSharedUrl(String sharedUrl) {
            this.sharedUrl = sharedUrl;
        }

        public long getSharedTimeoutMs() {
            return sharedTimeoutMs;
        }

        public void setSharedTimeoutMs(long sharedTimeoutMs) {
            this.sharedTimeoutMs = sharedTimeoutMs;
        }
    }

    public static class Timeouts {
        private long requestMs = 30_000;
        private long enhanceMs = 2_000;
        private long searchMs = 10_000;
        private long fetchMs = 15_000;
        private long synthesizeMs = 30_000;

        public long getRequestMs() {
            return requestMs;
        }

        public void setRequestMs(long requestMs) {
            this.requestMs = requestMs;
        }

        public long getEnhanceMs() {
            return enhanceMs;
        }

        public void setEnhanceMs(long enhanceMs) {
            this.enhanceMs = enhanceMs;
        }

        public long getSearchMs() {
            return searchMs;
        }

        public void setSearchMs(long searchMs) {
            this.searchMs = searchMs;
        }

        public long getFetchMs() {
            return fetchMs;
        }

        public void setFetchMs(long fetchMs) {
            this.fetchMs = fetchMs;
        }

        public long getSynthesizeMs() {
            return synthesizeMs;
        }

        public void setSynthesizeMs(long synthesizeMs) {
            this.synthesizeMs = synthesizeMs;
        }
    }

    public static class Breaker {
        private int failureThreshold = 5;
        private long failureWindowMs = 60_000;
        private long openDurationMs = 30_000;
        private double backoffMultiplier = 2.0;
        private long maxOpenDurationMs = 300_000;

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public long getFailureWindowMs() {
            return failureWindowMs;
        }

        public void setFailureWindowMs(long failureWindowMs) {
            this.failureWindowMs = failureWindowMs;
        }

        public long getOpenDurationMs() {
            return openDurationMs;
        }

        public void setOpenDurationMs(long openDurationMs) {
            this.openDurationMs = openDurationMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public long getMaxOpenDurationMs() {
            return maxOpenDurationMs;
        }

        public void setMaxOpenDurationMs(long maxOpenDurationMs) {
            this.maxOpenDurationMs = maxOpenDurationMs;
        }
    }

    public static class Budget {
        private double dailyGlobalUsd = 100.0;
        private double monthlyGlobalUsd = 0.0;
        private double alertThreshold = 0.8;
        private Map<String, Double> providerDailyUsd = new HashMap<>();
        private Map<String, Double> providerMonthlyUsd = new HashMap<>();

        public double getDailyGlobalUsd() {
            return dailyGlobalUsd;
        }

        public void setDailyGlobalUsd(double dailyGlobalUsd) {
            this.dailyGlobalUsd = dailyGlobalUsd;
        }

        public double getMonthlyGlobalUsd() {
            return monthlyGlobalUsd;
        }

        public void setMonthlyGlobalUsd(double monthlyGlobalUsd) {
            this.monthlyGlobalUsd = monthlyGlobalUsd;
        }

        public double getAlertThreshold() {
            return alertThreshold;
        }

        public void setAlertThreshold(double alertThreshold) {
            this.alertThreshold = alertThreshold;
        }

        public Map<String, Double> getProviderDailyUsd() {
            return providerDailyUsd;
        }

        public void setProviderDailyUsd(Map<String, Double> providerDailyUsd) {
            this.providerDailyUsd = providerDailyUsd;
        }

        public Map<String, Double> getProviderMonthlyUsd() {
            return providerMonthlyUsd;
        }

        public void setProviderMonthlyUsd(Map<String, Double> providerMonthlyUsd) {
            this.providerMonthlyUsd = providerMonthlyUsd;
        }
    }

    public static class Search {
        private int providerResultLimit = 10;
        private int maxEnhancedQueries = 3;

        public int getProviderResultLimit() {
            return providerResultLimit;
        }

        public void setProviderResultLimit(int providerResultLimit) {
            this.providerResultLimit = providerResultLimit;
        }

        public int getMaxEnhancedQueries() {
            return maxEnhancedQueries;
        }

        public void setMaxEnhancedQueries(int maxEnhancedQueries) {
            this.maxEnhancedQueries = maxEnhancedQueries;
        }
    }

    public static class Fetch {
        private int concurrency = 4;
        private int maxContentLength = 5000;

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getMaxContentLength() {
            return maxContentLength;
        }

        public void setMaxContentLength(int maxContentLength) {
            this.maxContentLength = maxContentLength;
        }
    }

    public static class Executors {
        private int pipelineThreads = 16;
        private int dependencyThreads = 32;
        private int cacheWriteThreads = 2;

        public int getPipelineThreads() {
            return pipelineThreads;
        }

        public void setPipelineThreads(int pipelineThreads) {
            this.pipelineThreads = pipelineThreads;
        }

        public int getDependencyThreads() {
            return dependencyThreads;
        }

        public void setDependencyThreads(int dependencyThreads) {
            this.dependencyThreads = dependencyThreads;
        }

        public int getCacheWriteThreads() {
            return cacheWriteThreads;
        }

        public void setCacheWriteThreads(int cacheWriteThreads) {
            this.cacheWriteThreads = cacheWriteThreads;
        }
    }
}
