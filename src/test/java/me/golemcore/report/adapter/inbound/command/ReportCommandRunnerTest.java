package me.golemcore.report.adapter.inbound.command;

import me.golemcore.report.domain.exception.UnknownProviderException;
import me.golemcore.report.domain.model.AttachFormat;
import me.golemcore.report.domain.model.RunContext;
import me.golemcore.report.domain.model.RunRequest;
import me.golemcore.report.domain.model.RunResult;
import me.golemcore.report.domain.model.RunStage;
import me.golemcore.report.domain.service.ReportOrchestrator;
import me.golemcore.report.domain.service.RunContextFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ReportCommandRunnerTest {

    private RunContextFactory contextFactory;
    private ReportOrchestrator orchestrator;
    private ReportCommandRunner runner;

    @BeforeEach
    void setUp() {
        contextFactory = mock(RunContextFactory.class);
        orchestrator = mock(ReportOrchestrator.class);
        runner = new ReportCommandRunner(contextFactory, orchestrator);
    }

    @Test
    void shouldParseAllOptions() {
        RunRequest request = runner.toRequest(args("--project=shop", "--since=2 weeks ago", "--llm=deepseek",
                "--style=novel", "--attach-format=pdf", "--email=a@acme.io, b@acme.io,", "--distill"));

        assertEquals("shop", request.getProject());
        assertEquals(Duration.ofDays(14), request.getWindow().getSince());
        assertEquals("deepseek", request.getProvider());
        assertEquals("novel", request.getStyle());
        assertEquals(AttachFormat.PDF, request.getAttachFormat());
        assertEquals(List.of("a@acme.io", "b@acme.io"), request.getRecipients());
        assertTrue(request.isForceDistill());
    }

    @Test
    void shouldParseCommitCountWindow() {
        RunRequest request = runner.toRequest(args("--repo-path=/work/widgets", "--number=20"));

        assertEquals("/work/widgets", request.getRepoLocation());
        assertEquals(20, request.getWindow().getCount());
        assertNull(request.getWindow().getSince());
        assertFalse(request.isForceDistill());
        assertTrue(request.getRecipients().isEmpty());
    }

    @Test
    void shouldRejectConflictingWindows() {
        DefaultApplicationArguments args = args("--project=shop", "--since=1 day ago", "--number=3");

        assertThrows(IllegalArgumentException.class, () -> runner.toRequest(args));
    }

    @Test
    void shouldRejectInvalidValues() {
        DefaultApplicationArguments number = args("--project=shop", "--number=many");
        DefaultApplicationArguments format = args("--project=shop", "--attach-format=docx");
        DefaultApplicationArguments since = args("--project=shop", "--since=yesterday");

        assertThrows(IllegalArgumentException.class, () -> runner.toRequest(number));
        assertThrows(IllegalArgumentException.class, () -> runner.toRequest(format));
        assertThrows(IllegalArgumentException.class, () -> runner.toRequest(since));
    }

    @Test
    void shouldOnlyPrintUsageWithoutTarget() {
        runner.run(args("--style=novel"));

        verifyNoInteractions(contextFactory, orchestrator);
        assertEquals(ReportCommandRunner.EXIT_OK, runner.getExitCode());
    }

    @Test
    void shouldExitWithConfigurationErrorForUnknownProvider() {
        when(contextFactory.create(any())).thenThrow(new UnknownProviderException("foo", Set.of("mock")));

        runner.run(args("--project=shop", "--llm=foo"));

        assertEquals(ReportCommandRunner.EXIT_BAD_CONFIGURATION, runner.getExitCode());
        verifyNoInteractions(orchestrator);
    }

    @Test
    void shouldExitWithConfigurationErrorForBadArguments() {
        runner.run(args("--project=shop", "--number=0"));

        assertEquals(ReportCommandRunner.EXIT_BAD_CONFIGURATION, runner.getExitCode());
        verifyNoInteractions(contextFactory, orchestrator);
    }

    @Test
    void shouldRunPipelineAndReportSuccess() {
        RunContext context = RunContext.builder().runId("r1").projectName("shop").build();
        when(contextFactory.create(any())).thenReturn(context);
        when(orchestrator.run(context)).thenReturn(RunResult.builder()
                .runId("r1").project("shop").status(RunResult.Status.COMPLETED).build());

        runner.run(args("--project=shop"));

        ArgumentCaptor<RunRequest> request = ArgumentCaptor.forClass(RunRequest.class);
        verify(contextFactory).create(request.capture());
        assertEquals("shop", request.getValue().getProject());
        assertNull(request.getValue().getWindow());
        assertEquals(ReportCommandRunner.EXIT_OK, runner.getExitCode());
    }

    @Test
    void shouldExitWithFailureWhenRunFails() {
        RunContext context = RunContext.builder().runId("r2").projectName("shop").build();
        when(contextFactory.create(any())).thenReturn(context);
        when(orchestrator.run(context)).thenReturn(RunResult.builder()
                .runId("r2").project("shop").status(RunResult.Status.FAILED)
                .failedStage(RunStage.REDUCING).failureMessage("provider down").build());

        runner.run(args("--project=shop"));

        assertEquals(ReportCommandRunner.EXIT_RUN_FAILED, runner.getExitCode());
    }

    private static DefaultApplicationArguments args(String... args) {
        return new DefaultApplicationArguments(args);
    }
}
