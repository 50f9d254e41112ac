package me.golemcore.report.plugin.context;

import me.golemcore.report.domain.model.HookPoint;
import me.golemcore.report.domain.model.RunContext;
import me.golemcore.report.domain.model.RunDiagnostic;
import me.golemcore.report.domain.model.RunStage;
import me.golemcore.report.plugin.api.ReportHook;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

class HookManagerTest {

    private final RunContext context = RunContext.builder().projectName("demo").build();

    @Test
    void shouldApplyHooksInOrder() {
        HookManager manager = new HookManager(List.of(
                hook("second", 20, HookPoint.POST_REDUCE, s -> s + "-b"),
                hook("first", 10, HookPoint.POST_REDUCE, s -> s + "-a")));
        List<RunDiagnostic> diagnostics = new ArrayList<>();

        String result = manager.apply(HookPoint.POST_REDUCE, context, "x", diagnostics::add);

        assertEquals("x-a-b", result);
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void shouldOnlyRunHooksRegisteredAtPoint() {
        HookManager manager = new HookManager(List.of(
                hook("render-only", 10, HookPoint.POST_RENDER, s -> "changed")));

        assertEquals("x", manager.apply(HookPoint.POST_MAP, context, "x", d -> fail("no diagnostics expected")));
        assertEquals(1, manager.getHooks(HookPoint.POST_RENDER).size());
    }

    @Test
    void shouldSkipFailingHookAndReportDiagnostic() {
        HookManager manager = new HookManager(List.of(
                hook("broken", 10, HookPoint.PRE_RENDER, s -> {
                    throw new IllegalStateException("boom");
                }),
                hook("suffix", 20, HookPoint.PRE_RENDER, s -> s + "!")));
        List<RunDiagnostic> diagnostics = new ArrayList<>();

        String result = manager.apply(HookPoint.PRE_RENDER, context, "summary", diagnostics::add);

        assertEquals("summary!", result);
        assertEquals(1, diagnostics.size());
        RunDiagnostic diagnostic = diagnostics.get(0);
        assertEquals(RunDiagnostic.Code.HOOK_FAILED, diagnostic.getCode());
        assertEquals(RunStage.HOOKING, diagnostic.getStage());
        assertEquals("broken", diagnostic.getSubject());
        assertEquals("boom", diagnostic.getMessage());
    }

    @Test
    void shouldKeepPayloadWhenHookReturnsNull() {
        HookManager manager = new HookManager(List.of(hook("null", 10, HookPoint.POST_MAP, s -> null)));

        assertEquals("keep", manager.apply(HookPoint.POST_MAP, context, "keep", d -> fail("unexpected")));
    }

    @Test
    void shouldNotRegisterDisabledHook() {
        ReportHook disabled = new TestHook("off", 10, EnumSet.of(HookPoint.POST_MAP), s -> "changed", false);
        HookManager manager = new HookManager(List.of(disabled));

        assertTrue(manager.getHooks(HookPoint.POST_MAP).isEmpty());
    }

    @Test
    void shouldRejectDuplicateNames() {
        HookManager manager = new HookManager();
        manager.register(hook("same", 10, HookPoint.POST_MAP, s -> s));

        ReportHook duplicate = hook("same", 20, HookPoint.POST_RENDER, s -> s);
        assertThrows(IllegalStateException.class, () -> manager.register(duplicate));
    }

    private static ReportHook hook(String name, int order, HookPoint point, UnaryOperator<String> fn) {
        return new TestHook(name, order, EnumSet.of(point), fn, true);
    }

    private record TestHook(String name, int order, Set<HookPoint> points, UnaryOperator<String> fn,
            boolean enabled) implements ReportHook {

        @Override
        public String getName() {
            return name;
        }

        @Override
        public Set<HookPoint> getHookPoints() {
            return points;
        }

        @Override
        public int getOrder() {
            return order;
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }

        @Override
        public String apply(HookPoint point, RunContext context, String payload) {
            return fn.apply(payload);
        }
    }
}
