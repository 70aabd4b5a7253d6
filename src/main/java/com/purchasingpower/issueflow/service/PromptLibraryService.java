package com.purchasingpower.issueflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.issueflow.model.prompt.PromptTemplate;
import com.purchasingpower.issueflow.model.prompt.RenderedPrompt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt Library Service
 *
 * Loads prompts from {@code classpath:prompts/*.yaml} and renders the user part with Mustache.
 * Templates use triple braces ({@code {{{issue}}}}) so code and diffs are not HTML-escaped.
 *
 * Usage:
 * RenderedPrompt prompt = promptLibrary.render("plan", Map.of(
 *     "requirements", requirements,
 *     "context", repositoryContext
 * ));
 */
@Slf4j
@Service
public class PromptLibraryService {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:prompts/*.yaml");

            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    register(yamlMapper.readValue(in, PromptTemplate.class));
                }
            }

            log.info("📚 Loaded {} prompt templates", templates.size());

        } catch (IOException e) {
            log.error("❌ Failed to load prompt templates", e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }
    }

    /**
     * Adds or replaces a template. Used at startup and by tests that need a custom prompt.
     */
    public void register(PromptTemplate template) {
        if (template.getName() == null || template.getUserPrompt() == null) {
            throw new IllegalArgumentException("Prompt template needs a name and a userPrompt");
        }
        templates.put(template.getName(), template);
        compiled.put(template.getName(),
                mustacheFactory.compile(new StringReader(template.getUserPrompt()), template.getName()));
        log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
    }

    /**
     * Render a prompt with variables
     */
    public RenderedPrompt render(String templateName, Map<String, Object> variables) {
        PromptTemplate template = templates.get(templateName);
        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }

        StringWriter writer = new StringWriter();
        compiled.get(templateName).execute(writer, variables);

        String system = template.getSystemPrompt() == null ? null : template.getSystemPrompt().strip();
        return new RenderedPrompt(system, writer.toString());
    }

    /**
     * Get template metadata (for logging, debugging)
     */
    public PromptTemplate getTemplate(String name) {
        return templates.get(name);
    }
}
