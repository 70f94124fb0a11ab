package com.williamcallahan.notesrender.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Render render = new Render();
    private Cache cache = new Cache();

    public Render getRender() {
        return render;
    }

    public void setRender(Render render) {
        this.render = render;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    /**
     * Fails fast on limits that would make rendering unusable.
     */
    @PostConstruct
    public void validateConfiguration() {
        if (render.getMaxInputLength() <= 0) {
            throw new IllegalArgumentException("app.render.max-input-length must be positive");
        }
        if (render.getMaxMathDepth() <= 0) {
            throw new IllegalArgumentException("app.render.max-math-depth must be positive");
        }
        if (cache.getMaximumSize() < 0) {
            throw new IllegalArgumentException("app.cache.maximum-size must not be negative");
        }
        if (cache.getExpireAfterWrite() == null || cache.getExpireAfterWrite().isNegative()
            || cache.getExpireAfterWrite().isZero()) {
            throw new IllegalArgumentException("app.cache.expire-after-write must be a positive duration");
        }
    }

    public static class Render {
        private int maxInputLength = 100_000;
        private int maxMathDepth = 16;

        public int getMaxInputLength() { return maxInputLength; }
        public void setMaxInputLength(int maxInputLength) { this.maxInputLength = maxInputLength; }

        public int getMaxMathDepth() { return maxMathDepth; }
        public void setMaxMathDepth(int maxMathDepth) { this.maxMathDepth = maxMathDepth; }
    }

    public static class Cache {
        private long maximumSize = 500;
        private Duration expireAfterWrite = Duration.ofMinutes(30);

        public long getMaximumSize() { return maximumSize; }
        public void setMaximumSize(long maximumSize) { this.maximumSize = maximumSize; }

        public Duration getExpireAfterWrite() { return expireAfterWrite; }
        public void setExpireAfterWrite(Duration expireAfterWrite) { this.expireAfterWrite = expireAfterWrite; }
    }
}
