package com.williamcallahan.notesrender.web;

import com.williamcallahan.notesrender.domain.api.BlockRenderOutcome;
import com.williamcallahan.notesrender.domain.api.BlockRenderResponse;
import com.williamcallahan.notesrender.domain.api.CacheClearOutcome;
import com.williamcallahan.notesrender.domain.api.CacheClearResponse;
import com.williamcallahan.notesrender.domain.api.CacheStatsResponse;
import com.williamcallahan.notesrender.domain.api.CacheStatsSnapshot;
import com.williamcallahan.notesrender.domain.api.HtmlRenderOutcome;
import com.williamcallahan.notesrender.domain.api.HtmlRenderResponse;
import com.williamcallahan.notesrender.domain.api.InlineRenderOutcome;
import com.williamcallahan.notesrender.domain.api.InlineRenderResponse;
import com.williamcallahan.notesrender.domain.api.MathRenderOutcome;
import com.williamcallahan.notesrender.domain.api.MathRenderResponse;
import com.williamcallahan.notesrender.domain.api.MathRequest;
import com.williamcallahan.notesrender.domain.api.RenderErrorResponse;
import com.williamcallahan.notesrender.domain.api.RenderRequest;
import com.williamcallahan.notesrender.domain.render.Block;
import com.williamcallahan.notesrender.service.markdown.MarkdownMathRenderService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

/**
 * REST controller exposing the markdown and math render tree to host applications.
 * Content is rendered on every request from the stored, unprocessed text.
 */
@RestController
@RequestMapping("/api/render")
@CrossOrigin(origins = "*")
public class RenderController {

    private static final Logger logger = LoggerFactory.getLogger(RenderController.class);

    private final MarkdownMathRenderService renderService;

    public RenderController(MarkdownMathRenderService renderService) {
        this.renderService = renderService;
    }

    /**
     * Renders a full document to a render tree.
     *
     * @param request A JSON object containing the content to render. Expected format:
     *                <pre>{@code
     *                  {
     *                    "content": "# Title\n\nThe area is $\\pi r^2$."
     *                  }
     *                }</pre>
     * @return the blocks with their inline runs, each tagged with a {@code kind}
     */
    @PostMapping(value = "/blocks",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BlockRenderResponse> renderBlocks(@RequestBody RenderRequest request) {
        try {
            long startTime = System.currentTimeMillis();
            logger.debug("Rendering blocks for content of length: {}", request.content().length());
            List<Block> blocks = renderService.renderBlock(request.content());
            return ResponseEntity.ok(new BlockRenderOutcome(blocks, System.currentTimeMillis() - startTime));
        } catch (Exception e) {
            logger.error("Error rendering blocks", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new RenderErrorResponse("Failed to render blocks", e.getMessage()));
        }
    }

    /**
     * Renders a single line, such as a chat bubble, without block classification.
     *
     * @param request A JSON object with a {@code content} field
     * @return the inline runs
     */
    @PostMapping(value = "/inline",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<InlineRenderResponse> renderInline(@RequestBody RenderRequest request) {
        try {
            return ResponseEntity.ok(new InlineRenderOutcome(renderService.renderInline(request.content())));
        } catch (Exception e) {
            logger.error("Error rendering inline content", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new RenderErrorResponse("Failed to render inline content", e.getMessage()));
        }
    }

    /**
     * Renders content to an HTML fragment for web hosts.
     *
     * @param request A JSON object with {@code content} and an optional {@code inline} flag
     * @return the HTML fragment
     */
    @PostMapping(value = "/html",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<HtmlRenderResponse> renderHtml(@RequestBody RenderRequest request) {
        try {
            String html = renderService.renderHtml(request.content(), request.inline());
            return ResponseEntity.ok(new HtmlRenderOutcome(html, request.inline()));
        } catch (Exception e) {
            logger.error("Error rendering HTML", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new RenderErrorResponse("Failed to render HTML", e.getMessage()));
        }
    }

    /**
     * Converts a bare LaTeX fragment to Unicode text.
     *
     * @param request A JSON object with a {@code latex} field
     * @return the fragment and its rendering
     */
    @PostMapping(value = "/math",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MathRenderResponse> renderMath(@RequestBody MathRequest request) {
        try {
            return ResponseEntity.ok(new MathRenderOutcome(request.latex(), renderService.processMath(request.latex())));
        } catch (Exception e) {
            logger.error("Error rendering math", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new RenderErrorResponse("Failed to render math", e.getMessage()));
        }
    }

    /**
     * Retrieves statistics about the block render cache.
     */
    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStatsResponse> getCacheStats() {
        try {
            var stats = renderService.getCacheStats();
            return ResponseEntity.ok(new CacheStatsSnapshot(
                stats.hitCount(),
                stats.missCount(),
                stats.evictionCount(),
                stats.size(),
                String.format(Locale.ROOT, "%.2f%%", stats.hitRate() * 100)
            ));
        } catch (Exception e) {
            logger.error("Error getting cache stats", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new RenderErrorResponse("Failed to get cache stats", e.getMessage()));
        }
    }

    /**
     * Clears the block render cache.
     */
    @PostMapping("/cache/clear")
    public ResponseEntity<CacheClearResponse> clearCache() {
        try {
            renderService.clearCache();
            logger.info("Render cache cleared via API");
            return ResponseEntity.ok(new CacheClearOutcome("success", "Cache cleared successfully"));
        } catch (Exception e) {
            logger.error("Error clearing cache", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new RenderErrorResponse("Failed to clear cache", e.getMessage()));
        }
    }
}
