package com.williamcallahan.notesrender.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.notesrender.domain.api.BlockRenderOutcome;
import com.williamcallahan.notesrender.domain.render.Block;
import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.AfterReturning;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Logging aspect for the render pipeline.
 * Each render call is logged as a step with its duration under the {@code PIPELINE} logger.
 */
@Aspect
@Component
public class RenderPipelineLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");
    private static final AtomicLong REQUEST_SEQUENCE = new AtomicLong();
    private final ObjectMapper objectMapper = new ObjectMapper();

    // Thread-local storage for request tracking
    private static final ThreadLocal<String> REQUEST_ID = ThreadLocal.withInitial(() ->
        "REQ-" + System.currentTimeMillis() + "-" + REQUEST_SEQUENCE.incrementAndGet()
    );

    /**
     * Log block, inline and HTML rendering
     */
    @Around("execution(public * com.williamcallahan.notesrender.service.markdown.MarkdownMathRenderService.render*(..))")
    public Object logRender(ProceedingJoinPoint joinPoint) throws Throwable {
        String requestId = REQUEST_ID.get();
        String step = joinPoint.getSignature().getName();
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.info("[{}] RENDER {} - Starting", requestId, step);
        Object[] args = joinPoint.getArgs();
        if (args.length > 0 && args[0] instanceof String content) {
            PIPELINE_LOG.debug("[{}] Input length: {}", requestId, content.length());
        }

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            if (result instanceof List<?> list) {
                PIPELINE_LOG.info("[{}] RENDER {} - Produced {} nodes in {}ms",
                    requestId, step, list.size(), duration);
            } else {
                PIPELINE_LOG.info("[{}] RENDER {} - Completed in {}ms", requestId, step, duration);
            }
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] RENDER {} - Failed: {}", requestId, step, e.getMessage());
            throw e;
        } finally {
            REQUEST_ID.remove();
        }
    }

    /**
     * Log the block kinds a document rendered into
     */
    @AfterReturning(
        pointcut = "execution(* com.williamcallahan.notesrender.web.RenderController.renderBlocks(..))",
        returning = "result"
    )
    public void logBlockSummary(JoinPoint joinPoint, Object result) {
        if (!PIPELINE_LOG.isDebugEnabled()) {
            return;
        }
        if (result instanceof ResponseEntity<?> entity
                && entity.getBody() instanceof BlockRenderOutcome outcome) {
            PIPELINE_LOG.debug("Block kinds: {}", summarize(outcome.blocks()));
        }
    }

    private String summarize(List<Block> blocks) {
        Map<String, Integer> counts = new TreeMap<>();
        for (Block block : blocks) {
            counts.merge(block.getClass().getSimpleName(), 1, Integer::sum);
        }
        try {
            return objectMapper.writeValueAsString(counts);
        } catch (JsonProcessingException e) {
            return counts.toString();
        }
    }
}
