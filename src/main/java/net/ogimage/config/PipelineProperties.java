package net.ogimage.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for the render-and-cache pipeline.
 */
@Component
@ConfigurationProperties(prefix = "og.pipeline")
public class PipelineProperties {

    /**
     * TTL applied when a request omits one.
     */
    private int defaultTtlHours = 24;

    /**
     * Upper bound on a requested TTL (one year).
     */
    private int maxTtlHours = 8760;

    private int defaultWidth = 1200;

    private int defaultHeight = 630;

    private int maxWidth = 4096;

    private int maxHeight = 4096;

    /**
     * Number of render workers.
     */
    private int workers = 4;

    /**
     * Hard upper bound on a single render, measured by the owning worker.
     */
    private Duration renderTimeout = Duration.ofSeconds(45);

    /**
     * Page load timeout handed to the browser. Kept below the render timeout.
     */
    private Duration pageLoadTimeout = Duration.ofSeconds(30);

    /**
     * How long an idle worker waits before polling the ledger again.
     */
    private Duration idlePollInterval = Duration.ofSeconds(2);

    private int dedupMaxAttempts = 3;

    private Duration dedupBackoff = Duration.ofMillis(25);

    /**
     * Extra time past the render timeout before a processing task is considered abandoned.
     */
    private Duration abandonedTaskGrace = Duration.ofSeconds(60);

    /**
     * Interval between sweeps for abandoned processing tasks.
     */
    private Duration abandonedTaskSweepInterval = Duration.ofSeconds(30);

    /**
     * How long {@code GET /} waits for a render before answering 504.
     */
    private Duration redirectWaitTimeout = Duration.ofSeconds(60);

    private Duration redirectPollInterval = Duration.ofSeconds(2);

    /**
     * Whitelisted domains. Empty means every domain is allowed.
     */
    private List<String> allowedDomains = new ArrayList<>();

    private String contactEmail = "support@ogimage.net";

    /**
     * Task ledger backend: {@code jdbc} or {@code memory}.
     */
    private String ledger = "jdbc";

    /**
     * Artifact backend: {@code s3} or {@code local}.
     */
    private String artifactStore = "s3";

    private String artifactKeyPrefix = "og_images/";

    /**
     * Maximum number of artifact lookups cached in memory.
     */
    private long lookupCacheSize = 10_000;

    private String localStorageDir = "/tmp/og-images";

    /**
     * Public base URL that serves {@link #localStorageDir}. Blank uses {@code file:} URLs.
     */
    private String localPublicBaseUrl = "";

    @PostConstruct
    void validate() {
        Assert.isTrue(defaultTtlHours > 0, "og.pipeline.default-ttl-hours must be positive");
        Assert.isTrue(maxTtlHours >= defaultTtlHours, "og.pipeline.max-ttl-hours must be at least default-ttl-hours");
        Assert.isTrue(defaultWidth > 0 && defaultWidth <= maxWidth, "og.pipeline.default-width must be within (0, max-width]");
        Assert.isTrue(defaultHeight > 0 && defaultHeight <= maxHeight, "og.pipeline.default-height must be within (0, max-height]");
        Assert.isTrue(workers > 0, "og.pipeline.workers must be positive");
        Assert.isTrue(renderTimeout != null && !renderTimeout.isNegative() && !renderTimeout.isZero(),
            "og.pipeline.render-timeout must be positive");
        Assert.isTrue(pageLoadTimeout != null && pageLoadTimeout.compareTo(renderTimeout) <= 0,
            "og.pipeline.page-load-timeout must not exceed render-timeout");
        Assert.isTrue(idlePollInterval != null && !idlePollInterval.isNegative() && !idlePollInterval.isZero(),
            "og.pipeline.idle-poll-interval must be positive");
        Assert.isTrue(dedupMaxAttempts > 0, "og.pipeline.dedup-max-attempts must be positive");
        Assert.isTrue(dedupBackoff != null && !dedupBackoff.isNegative(), "og.pipeline.dedup-backoff must be non-negative");
        Assert.isTrue(abandonedTaskGrace != null && !abandonedTaskGrace.isNegative(),
            "og.pipeline.abandoned-task-grace must be non-negative");
        Assert.isTrue(redirectWaitTimeout != null && !redirectWaitTimeout.isNegative(),
            "og.pipeline.redirect-wait-timeout must be non-negative");
        Assert.isTrue(redirectPollInterval != null && !redirectPollInterval.isNegative() && !redirectPollInterval.isZero(),
            "og.pipeline.redirect-poll-interval must be positive");
        Assert.isTrue("jdbc".equals(ledger) || "memory".equals(ledger), "og.pipeline.ledger must be jdbc or memory");
        Assert.isTrue("s3".equals(artifactStore) || "local".equals(artifactStore),
            "og.pipeline.artifact-store must be s3 or local");
        Assert.isTrue(lookupCacheSize > 0, "og.pipeline.lookup-cache-size must be positive");
    }

    /**
     * Lower-cased, trimmed whitelist entries with blanks removed.
     */
    public List<String> normalizedAllowedDomains() {
        List<String> normalized = new ArrayList<>();
        for (String domain : allowedDomains) {
            if (domain != null && !domain.isBlank()) {
                normalized.add(domain.trim().toLowerCase(Locale.ROOT));
            }
        }
        return normalized;
    }

    public Duration defaultTtl() {
        return Duration.ofHours(defaultTtlHours);
    }

    public int getDefaultTtlHours() {
        return defaultTtlHours;
    }

    public void setDefaultTtlHours(int defaultTtlHours) {
        this.defaultTtlHours = defaultTtlHours;
    }

    public int getMaxTtlHours() {
        return maxTtlHours;
    }

    public void setMaxTtlHours(int maxTtlHours) {
        this.maxTtlHours = maxTtlHours;
    }

    public int getDefaultWidth() {
        return defaultWidth;
    }

    public void setDefaultWidth(int defaultWidth) {
        this.defaultWidth = defaultWidth;
    }

    public int getDefaultHeight() {
        return defaultHeight;
    }

    public void setDefaultHeight(int defaultHeight) {
        this.defaultHeight = defaultHeight;
    }

    public int getMaxWidth() {
        return maxWidth;
    }

    public void setMaxWidth(int maxWidth) {
        this.maxWidth = maxWidth;
    }

    public int getMaxHeight() {
        return maxHeight;
    }

    public void setMaxHeight(int maxHeight) {
        this.maxHeight = maxHeight;
    }

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public Duration getRenderTimeout() {
        return renderTimeout;
    }

    public void setRenderTimeout(Duration renderTimeout) {
        this.renderTimeout = renderTimeout;
    }

    public Duration getPageLoadTimeout() {
        return pageLoadTimeout;
    }

    public void setPageLoadTimeout(Duration pageLoadTimeout) {
        this.pageLoadTimeout = pageLoadTimeout;
    }

    public Duration getIdlePollInterval() {
        return idlePollInterval;
    }

    public void setIdlePollInterval(Duration idlePollInterval) {
        this.idlePollInterval = idlePollInterval;
    }

    public int getDedupMaxAttempts() {
        return dedupMaxAttempts;
    }

    public void setDedupMaxAttempts(int dedupMaxAttempts) {
        this.dedupMaxAttempts = dedupMaxAttempts;
    }

    public Duration getDedupBackoff() {
        return dedupBackoff;
    }

    public void setDedupBackoff(Duration dedupBackoff) {
        this.dedupBackoff = dedupBackoff;
    }

    public Duration getAbandonedTaskGrace() {
        return abandonedTaskGrace;
    }

    public void setAbandonedTaskGrace(Duration abandonedTaskGrace) {
        this.abandonedTaskGrace = abandonedTaskGrace;
    }

    public Duration getAbandonedTaskSweepInterval() {
        return abandonedTaskSweepInterval;
    }

    public void setAbandonedTaskSweepInterval(Duration abandonedTaskSweepInterval) {
        this.abandonedTaskSweepInterval = abandonedTaskSweepInterval;
    }

    public Duration getRedirectWaitTimeout() {
        return redirectWaitTimeout;
    }

    public void setRedirectWaitTimeout(Duration redirectWaitTimeout) {
        this.redirectWaitTimeout = redirectWaitTimeout;
    }

    public Duration getRedirectPollInterval() {
        return redirectPollInterval;
    }

    public void setRedirectPollInterval(Duration redirectPollInterval) {
        this.redirectPollInterval = redirectPollInterval;
    }

    public List<String> getAllowedDomains() {
        return allowedDomains;
    }

    public void setAllowedDomains(List<String> allowedDomains) {
        this.allowedDomains = allowedDomains == null ? new ArrayList<>() : allowedDomains;
    }

    public String getContactEmail() {
        return contactEmail;
    }

    public void setContactEmail(String contactEmail) {
        this.contactEmail = contactEmail;
    }

    public String getLedger() {
        return ledger;
    }

    public void setLedger(String ledger) {
        this.ledger = ledger;
    }

    public String getArtifactStore() {
        return artifactStore;
    }

    public void setArtifactStore(String artifactStore) {
        this.artifactStore = artifactStore;
    }

    public String getArtifactKeyPrefix() {
        return artifactKeyPrefix;
    }

    public void setArtifactKeyPrefix(String artifactKeyPrefix) {
        this.artifactKeyPrefix = artifactKeyPrefix;
    }

    public long getLookupCacheSize() {
        return lookupCacheSize;
    }

    public void setLookupCacheSize(long lookupCacheSize) {
        this.lookupCacheSize = lookupCacheSize;
    }

    public String getLocalStorageDir() {
        return localStorageDir;
    }

    public void setLocalStorageDir(String localStorageDir) {
        this.localStorageDir = localStorageDir;
    }

    public String getLocalPublicBaseUrl() {
        return localPublicBaseUrl;
    }

    public void setLocalPublicBaseUrl(String localPublicBaseUrl) {
        this.localPublicBaseUrl = localPublicBaseUrl;
    }
}
