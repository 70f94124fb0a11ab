package com.williamcallahan.notesrender.config;

import com.williamcallahan.notesrender.service.markdown.BlockParser;
import com.williamcallahan.notesrender.service.markdown.EmphasisParser;
import com.williamcallahan.notesrender.service.markdown.HtmlRenderTreeWriter;
import com.williamcallahan.notesrender.service.markdown.InlineTokenizer;
import com.williamcallahan.notesrender.service.markdown.RenderTreeBuilder;
import com.williamcallahan.notesrender.service.math.MathProcessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free rendering engine into the application context.
 */
@Configuration
public class RenderEngineConfig {

    @Bean
    public MathProcessor mathProcessor(AppProperties appProperties) {
        return new MathProcessor(appProperties.getRender().getMaxMathDepth());
    }

    @Bean
    public InlineTokenizer inlineTokenizer(MathProcessor mathProcessor) {
        return new InlineTokenizer(mathProcessor);
    }

    @Bean
    public EmphasisParser emphasisParser() {
        return new EmphasisParser();
    }

    @Bean
    public RenderTreeBuilder renderTreeBuilder(InlineTokenizer inlineTokenizer, EmphasisParser emphasisParser) {
        return new RenderTreeBuilder(inlineTokenizer, emphasisParser);
    }

    @Bean
    public BlockParser blockParser(RenderTreeBuilder renderTreeBuilder) {
        return new BlockParser(renderTreeBuilder);
    }

    @Bean
    public HtmlRenderTreeWriter htmlRenderTreeWriter() {
        return new HtmlRenderTreeWriter();
    }
}
