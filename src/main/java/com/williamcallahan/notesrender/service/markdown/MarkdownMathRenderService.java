package com.williamcallahan.notesrender.service.markdown;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.notesrender.config.AppProperties;
import com.williamcallahan.notesrender.domain.render.Block;
import com.williamcallahan.notesrender.domain.render.InlineRun;
import com.williamcallahan.notesrender.domain.render.StyledRun;
import com.williamcallahan.notesrender.service.math.MathProcessor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for rendering AI-generated markdown with embedded LaTeX math.
 *
 * <p>Content is stored unprocessed and rendered at display time; this service turns it into a
 * UI-agnostic render tree (or HTML for web hosts). Rendering is a pure function of the input,
 * so block renders are memoized. No method throws: failures degrade to literal text.</p>
 */
@Service
public class MarkdownMathRenderService {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownMathRenderService.class);

    private static final Counter FALLBACK_COUNTER =
        Metrics.counter("notesrender.render.fallbacks", "stage", "service");

    private final BlockParser blockParser;
    private final RenderTreeBuilder treeBuilder;
    private final MathProcessor mathProcessor;
    private final HtmlRenderTreeWriter htmlWriter;
    private final int maxInputLength;
    private final Cache<String, List<Block>> blockCache;

    public MarkdownMathRenderService(BlockParser blockParser,
                                     RenderTreeBuilder treeBuilder,
                                     MathProcessor mathProcessor,
                                     HtmlRenderTreeWriter htmlWriter,
                                     AppProperties appProperties) {
        this.blockParser = blockParser;
        this.treeBuilder = treeBuilder;
        this.mathProcessor = mathProcessor;
        this.htmlWriter = htmlWriter;
        this.maxInputLength = appProperties.getRender().getMaxInputLength();
        this.blockCache = Caffeine.newBuilder()
            .maximumSize(appProperties.getCache().getMaximumSize())
            .expireAfterWrite(appProperties.getCache().getExpireAfterWrite())
            .recordStats()
            .build();

        logger.info("MarkdownMathRenderService initialized (max input {} chars, math depth {})",
            maxInputLength, mathProcessor.getMaxDepth());
    }

    /**
     * Renders a full document into blocks.
     *
     * @param content markdown with embedded math; may be null
     * @return render tree, empty for null or empty content
     */
    public List<Block> renderBlock(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        String bounded = truncate(content);
        try {
            List<Block> cached = blockCache.getIfPresent(bounded);
            if (cached != null) {
                logger.debug("Cache hit for block render");
                return cached;
            }
            List<Block> blocks = blockParser.parseBlocks(bounded);
            blockCache.put(bounded, blocks);
            logger.debug("Rendered {} chars into {} blocks", bounded.length(), blocks.size());
            return blocks;
        } catch (RuntimeException | StackOverflowError e) {
            logger.error("Error rendering markdown blocks", e);
            FALLBACK_COUNTER.increment();
            return BlockParser.literalBlocks(bounded);
        }
    }

    /**
     * Renders a single line or chat-bubble fragment without block classification.
     *
     * @param content inline markdown with embedded math; may be null
     * @return inline runs, empty for null or empty content
     */
    public List<InlineRun> renderInline(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        String bounded = truncate(content);
        try {
            return treeBuilder.buildInline(bounded);
        } catch (RuntimeException | StackOverflowError e) {
            logger.error("Error rendering inline markdown", e);
            FALLBACK_COUNTER.increment();
            return List.of(StyledRun.plain(bounded));
        }
    }

    /**
     * Renders content to an HTML fragment.
     *
     * @param content markdown with embedded math; may be null
     * @param inline true to skip block classification
     * @return HTML fragment, empty for null or empty content
     */
    public String renderHtml(String content, boolean inline) {
        return inline
            ? htmlWriter.writeInline(renderInline(content))
            : htmlWriter.writeBlocks(renderBlock(content));
    }

    /**
     * Converts a bare LaTeX fragment to Unicode text.
     */
    public String processMath(String latex) {
        if (latex == null || latex.isEmpty()) {
            return "";
        }
        return mathProcessor.processMath(truncate(latex));
    }

    /**
     * Gets cache statistics for monitoring.
     */
    public CacheStats getCacheStats() {
        var stats = blockCache.stats();
        return new CacheStats(
            stats.hitCount(),
            stats.missCount(),
            stats.evictionCount(),
            blockCache.estimatedSize()
        );
    }

    /**
     * Clears the block render cache.
     */
    public void clearCache() {
        blockCache.invalidateAll();
        logger.info("Block render cache cleared");
    }

    private String truncate(String content) {
        if (content.length() <= maxInputLength) {
            return content;
        }
        logger.warn("Render input exceeds maximum length: {} > {}", content.length(), maxInputLength);
        int end = maxInputLength;
        // never split a surrogate pair
        if (Character.isHighSurrogate(content.charAt(end - 1))) {
            end--;
        }
        return content.substring(0, end);
    }

    /**
     * Cache statistics record.
     */
    public record CacheStats(
        long hitCount,
        long missCount,
        long evictionCount,
        long size
    ) {
        public double hitRate() {
            long total = hitCount + missCount;
            return total == 0 ? 0.0 : (double) hitCount / total;
        }
    }
}
