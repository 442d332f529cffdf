package com.williamcallahan.nutrichat.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Formatter formatter = new Formatter();

    public Formatter getFormatter() {
        return formatter;
    }

    public void setFormatter(Formatter formatter) {
        this.formatter = formatter;
    }

    /**
     * Rejects settings the formatter service cannot run with.
     *
     * @throws IllegalArgumentException when a limit is not positive
     */
    @PostConstruct
    public void validateConfiguration() {
        if (formatter == null) {
            throw new IllegalArgumentException("app.formatter must be configured");
        }
        if (formatter.getMaxInputLength() <= 0) {
            throw new IllegalArgumentException(
                "app.formatter.max-input-length must be positive: " + formatter.getMaxInputLength());
        }
        if (formatter.getCacheSize() <= 0) {
            throw new IllegalArgumentException(
                "app.formatter.cache-size must be positive: " + formatter.getCacheSize());
        }
        Duration cacheTtl = formatter.getCacheTtl();
        if (cacheTtl == null || cacheTtl.isNegative() || cacheTtl.isZero()) {
            throw new IllegalArgumentException("app.formatter.cache-ttl must be positive: " + cacheTtl);
        }
    }

    public static class Formatter {
        private int maxInputLength = 32_768;
        private long cacheSize = 500;
        private Duration cacheTtl = Duration.ofMinutes(30);

        public int getMaxInputLength() { return maxInputLength; }
        public void setMaxInputLength(int maxInputLength) { this.maxInputLength = maxInputLength; }

        public long getCacheSize() { return cacheSize; }
        public void setCacheSize(long cacheSize) { this.cacheSize = cacheSize; }

        public Duration getCacheTtl() { return cacheTtl; }
        public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }
    }
}
