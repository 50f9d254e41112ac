package me.golemcore.report.domain.service;

import me.golemcore.report.domain.model.PromptStage;
import me.golemcore.report.domain.model.PromptTemplate;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PromptTemplateServiceTest {

    private final PromptTemplateService service = new PromptTemplateService();

    @Test
    void shouldListCandidatesFromMostToLeastSpecific() {
        List<String> candidates = service.candidates("DeepSeek", "Novel", PromptStage.ARTICLE);

        assertEquals(List.of(
                "prompts/deepseek/article-novel.txt",
                "prompts/default/article-novel.txt",
                "prompts/deepseek/article.txt",
                "prompts/default/article.txt"), candidates);
    }

    @Test
    void shouldCollapseCandidatesForDefaults() {
        assertEquals(List.of("prompts/default/diff_map.txt"),
                service.candidates(null, "default", PromptStage.DIFF_MAP));
    }

    @Test
    void shouldPreferProviderSpecificTemplate() {
        PromptTemplate template = service.resolve("ollama", null, PromptStage.DIFF_MAP);

        assertEquals("prompts/ollama/diff_map.txt", template.source());
    }

    @Test
    void shouldFallBackToDefaultTemplate() {
        PromptTemplate template = service.resolve("deepseek", "unknown-style", PromptStage.SUMMARY_REDUCE);

        assertEquals("prompts/default/summary_reduce.txt", template.source());
        assertFalse(template.user().isBlank());
    }

    @Test
    void shouldResolveStyleVariant() {
        assertEquals("prompts/default/article-anime.txt",
                service.resolve("gemini", "anime", PromptStage.ARTICLE).source());
    }

    @Test
    void shouldSplitSystemAndUserOnSeparator() {
        PromptTemplate template = PromptTemplateService.parse("system part\n---\nuser {{X}}\n", "inline");

        assertEquals("system part", template.system());
        assertEquals("user {{X}}", template.user());
    }

    @Test
    void shouldTreatWholeFileAsUserPromptWithoutSeparator() {
        PromptTemplate template = PromptTemplateService.parse("just a user prompt", "inline");

        assertEquals("", template.system());
        assertEquals("just a user prompt", template.user());
    }

    @Test
    void shouldFailWhenNoTemplateExists() {
        PromptTemplateService empty = new PromptTemplateService("nowhere/");

        assertThrows(IllegalStateException.class, () -> empty.resolve("mock", null, PromptStage.ARTICLE));
    }

    @Test
    void shouldRenderVariablesAndKeepUnknownPlaceholders() {
        PromptTemplateEngine engine = new PromptTemplateEngine();

        String rendered = engine.render("Hi {{ NAME }}, cost {{PRICE}} in {{MISSING}}",
                Map.of("NAME", "Ann", "PRICE", "$5"));

        assertEquals("Hi Ann, cost $5 in {{MISSING}}", rendered);
    }

    @Test
    void shouldDropUnknownPlaceholdersFromPrompts() {
        PromptTemplateEngine engine = new PromptTemplateEngine();
        PromptTemplate template = new PromptTemplate("You write for {{PROJECT}}.",
                "Memory: {{PRIOR_MEMORY}}\nDiff: {{DIFF}}", "inline");

        PromptTemplateEngine.RenderedPrompt rendered = engine.renderPrompt(template,
                Map.of("PROJECT", "widgets", "DIFF", "+a"));

        assertEquals("You write for widgets.", rendered.system());
        assertEquals("Memory: \nDiff: +a", rendered.user());
    }

    @Test
    void shouldNotExpandPlaceholdersInsideValues() {
        PromptTemplateEngine engine = new PromptTemplateEngine();
        PromptTemplate template = new PromptTemplate("", "Message: {{MESSAGE}}", "inline");

        PromptTemplateEngine.RenderedPrompt rendered = engine.renderPrompt(template,
                Map.of("MESSAGE", "Fix {{DIFF}} rendering", "DIFF", "secret"));

        assertEquals("Message: Fix {{DIFF}} rendering", rendered.user());
        assertEquals("", rendered.system());
    }
}
