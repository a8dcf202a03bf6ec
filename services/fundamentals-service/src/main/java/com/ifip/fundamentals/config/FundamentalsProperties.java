package com.ifip.fundamentals.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "fundamentals")
public class FundamentalsProperties {

    private String userAgent = "IFIPResearchBot/1.0 (research@ifip.example)";
    private String secDataBaseUrl = "https://data.sec.gov";
    private String secWwwBaseUrl = "https://www.sec.gov";
    private int secDataMaxInMemoryMb = 32;
    private int connectTimeoutMs = 3_000;
    private long requestTimeoutMs = 9_000;
    private int maxAttempts = 3;
    private long initialBackoffMs = 500;
    private long maxBackoffMs = 5_000;
    private int maxConcurrentRequests = 5;
    private long cacheTtlHours = 24;
    private long cacheMaxEntries = 1_000;
    private long tickerDirectoryTtlHours = 24;
    private double ytdRatioThreshold = 8.0;
    private double scaleMismatchMultiple = 100.0;
    private double growthFlagCeilingPct = 300.0;
    private int batchConcurrency = 5;
    private boolean schedulerEnabled = false;
    private long schedulerFixedDelayMs = 86_400_000;
    private List<String> defaultTickers = new ArrayList<>();

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getSecDataBaseUrl() {
        return secDataBaseUrl;
    }

    public void setSecDataBaseUrl(String secDataBaseUrl) {
        this.secDataBaseUrl = secDataBaseUrl;
    }

    public String getSecWwwBaseUrl() {
        return secWwwBaseUrl;
    }

    public void setSecWwwBaseUrl(String secWwwBaseUrl) {
        this.secWwwBaseUrl = secWwwBaseUrl;
    }

    public int getSecDataMaxInMemoryMb() {
        return secDataMaxInMemoryMb;
    }

    public void setSecDataMaxInMemoryMb(int secDataMaxInMemoryMb) {
        this.secDataMaxInMemoryMb = secDataMaxInMemoryMb;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getInitialBackoffMs() {
        return initialBackoffMs;
    }

    public void setInitialBackoffMs(long initialBackoffMs) {
        this.initialBackoffMs = initialBackoffMs;
    }

    public long getMaxBackoffMs() {
        return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
        this.maxBackoffMs = maxBackoffMs;
    }

    public int getMaxConcurrentRequests() {
        return maxConcurrentRequests;
    }

    public void setMaxConcurrentRequests(int maxConcurrentRequests) {
        this.maxConcurrentRequests = maxConcurrentRequests;
    }

    public long getCacheTtlHours() {
        return cacheTtlHours;
    }

    public void setCacheTtlHours(long cacheTtlHours) {
        this.cacheTtlHours = cacheTtlHours;
    }

    public long getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    public void setCacheMaxEntries(long cacheMaxEntries) {
        this.cacheMaxEntries = cacheMaxEntries;
    }

    public long getTickerDirectoryTtlHours() {
        return tickerDirectoryTtlHours;
    }

    public void setTickerDirectoryTtlHours(long tickerDirectoryTtlHours) {
        this.tickerDirectoryTtlHours = tickerDirectoryTtlHours;
    }

    public double getYtdRatioThreshold() {
        return ytdRatioThreshold;
    }

    public void setYtdRatioThreshold(double ytdRatioThreshold) {
        this.ytdRatioThreshold = ytdRatioThreshold;
    }

    public double getScaleMismatchMultiple() {
        return scaleMismatchMultiple;
    }

    public void setScaleMismatchMultiple(double scaleMismatchMultiple) {
        this.scaleMismatchMultiple = scaleMismatchMultiple;
    }

    public double getGrowthFlagCeilingPct() {
        return growthFlagCeilingPct;
    }

    public void setGrowthFlagCeilingPct(double growthFlagCeilingPct) {
        this.growthFlagCeilingPct = growthFlagCeilingPct;
    }

    public int getBatchConcurrency() {
        return batchConcurrency;
    }

    public void setBatchConcurrency(int batchConcurrency) {
        this.batchConcurrency = batchConcurrency;
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public void setSchedulerEnabled(boolean schedulerEnabled) {
        this.schedulerEnabled = schedulerEnabled;
    }

    public long getSchedulerFixedDelayMs() {
        return schedulerFixedDelayMs;
    }

    public void setSchedulerFixedDelayMs(long schedulerFixedDelayMs) {
        this.schedulerFixedDelayMs = schedulerFixedDelayMs;
    }

    public List<String> getDefaultTickers() {
        return defaultTickers;
    }

    public void setDefaultTickers(List<String> defaultTickers) {
        this.defaultTickers = defaultTickers;
    }
}
