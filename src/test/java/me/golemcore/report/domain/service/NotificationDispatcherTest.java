package me.golemcore.report.domain.service;

import me.golemcore.report.domain.exception.DeliveryException;
import me.golemcore.report.domain.model.DeliveryResult;
import me.golemcore.report.domain.model.ReportArtifact;
import me.golemcore.report.domain.model.RunDiagnostic;
import me.golemcore.report.domain.model.RunStage;
import me.golemcore.report.port.outbound.NotifierPort;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class NotificationDispatcherTest {

    private static final List<String> RECIPIENTS = List.of("a@acme.io", "b@acme.io");

    private final NotificationDispatcher dispatcher = new NotificationDispatcher();
    private final ReportArtifact artifact = ReportArtifact.builder().subject("report").summary("text").build();

    @Test
    void shouldIsolateFailingChannel() {
        NotifierPort broken = notifier("email");
        when(broken.deliver(any(), any())).thenThrow(new DeliveryException("SMTP host is not configured"));
        NotifierPort working = notifier("feishu");
        when(working.deliver(any(), any())).thenReturn(DeliveryResult.builder()
                .channel("feishu")
                .recipients(Map.of("a@acme.io", true))
                .recipient("b@acme.io", true)
                .build());
        List<RunDiagnostic> diagnostics = new ArrayList<>();

        List<DeliveryResult> results = dispatcher.dispatch(List.of(broken, working), artifact, RECIPIENTS,
                diagnostics::add);

        assertEquals(2, results.size());
        DeliveryResult failed = results.get(0);
        assertFalse(failed.isSuccessful());
        assertEquals("SMTP host is not configured", failed.getError());
        assertEquals(RECIPIENTS, failed.getFailedRecipients());
        assertTrue(results.get(1).isSuccessful());

        assertEquals(1, diagnostics.size());
        RunDiagnostic diagnostic = diagnostics.get(0);
        assertEquals(RunStage.NOTIFYING, diagnostic.getStage());
        assertEquals(RunDiagnostic.Code.DELIVERY_FAILED, diagnostic.getCode());
        assertEquals("email", diagnostic.getSubject());
    }

    @Test
    void shouldReportPartialRecipientFailure() {
        NotifierPort email = notifier("email");
        when(email.deliver(any(), any())).thenReturn(DeliveryResult.builder()
                .channel("email")
                .recipient("a@acme.io", true)
                .recipient("b@acme.io", false)
                .build());
        List<RunDiagnostic> diagnostics = new ArrayList<>();

        List<DeliveryResult> results = dispatcher.dispatch(List.of(email), artifact, RECIPIENTS, diagnostics::add);

        assertTrue(results.get(0).isSuccessful());
        assertEquals(1, diagnostics.size());
        assertEquals("Not delivered to b@acme.io", diagnostics.get(0).getMessage());
    }

    @Test
    void shouldDoNothingWithoutChannels() {
        List<DeliveryResult> results = dispatcher.dispatch(List.of(), artifact, RECIPIENTS,
                d -> fail("no diagnostics expected"));

        assertTrue(results.isEmpty());
    }

    private static NotifierPort notifier(String channel) {
        NotifierPort notifier = mock(NotifierPort.class);
        when(notifier.getChannel()).thenReturn(channel);
        return notifier;
    }
}
