package me.golemcore.report.plugin.builtin;

import me.golemcore.report.domain.model.HookPoint;
import me.golemcore.report.domain.model.RunContext;
import me.golemcore.report.infrastructure.config.ReportProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinHooksTest {

    private ReportProperties properties;
    private RunContext context;

    @BeforeEach
    void setUp() {
        properties = new ReportProperties();
        context = RunContext.builder().projectName("demo").build();
    }

    @ParameterizedTest
    @ValueSource(strings = { "```markdown\n# Title\nbody\n```", "```md\n# Title\nbody\n```",
            "```\n# Title\nbody\n```", "  ```markdown\n# Title\nbody\n```  " })
    void shouldStripWrappingFence(String answer) {
        CleanMarkdownOutputHook hook = new CleanMarkdownOutputHook(properties);

        assertEquals("# Title\nbody", hook.apply(HookPoint.POST_REDUCE, context, answer));
    }

    @Test
    void shouldLeaveUnfencedSummaryAlone() {
        CleanMarkdownOutputHook hook = new CleanMarkdownOutputHook(properties);
        String summary = "# Title\n\n```java\nint x;\n```";

        assertSame(summary, hook.apply(HookPoint.POST_REDUCE, context, summary));
    }

    @Test
    void shouldFollowCleanMarkdownSwitch() {
        properties.getHooks().setCleanMarkdownEnabled(false);

        assertFalse(new CleanMarkdownOutputHook(properties).isEnabled());
    }

    @Test
    void shouldRedactConfiguredTerms() {
        properties.getHooks().setSensitiveTerms(new ArrayList<>(List.of("hunter2", "internal.corp")));
        properties.getHooks().setReplacement("[redacted]");
        SensitiveTermRedactionHook hook = new SensitiveTermRedactionHook(properties);

        String result = hook.apply(HookPoint.POST_MAP, context, "Set password hunter2 on internal.corp host");

        assertEquals("Set password [redacted] on [redacted] host", result);
        assertTrue(hook.getHookPoints().contains(HookPoint.POST_REDUCE));
    }

    @Test
    void shouldDisableRedactionWithoutTerms() {
        properties.getHooks().setSensitiveTerms(new ArrayList<>());

        assertFalse(new SensitiveTermRedactionHook(properties).isEnabled());
    }

    @Test
    void shouldInsertFooterBeforeBodyEnd() {
        properties.getHooks().setFooterHtml("<footer>bye</footer>");
        ReportFooterHook hook = new ReportFooterHook(properties);

        String html = hook.apply(HookPoint.POST_RENDER, context, "<html><body><p>x</p></body></html>");

        assertEquals("<html><body><p>x</p><footer>bye</footer>\n</body></html>", html);
    }

    @Test
    void shouldLeaveDocumentWithoutBodyUntouched() {
        ReportFooterHook hook = new ReportFooterHook(properties);

        assertEquals("<p>fragment</p>", hook.apply(HookPoint.POST_RENDER, context, "<p>fragment</p>"));
    }

    @Test
    void shouldDisableFooterWhenBlank() {
        properties.getHooks().setFooterHtml(" ");

        assertFalse(new ReportFooterHook(properties).isEnabled());
    }
}
