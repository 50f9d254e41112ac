/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.report.adapter.inbound.command;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.exception.LlmProviderException;
import me.golemcore.report.domain.exception.UnknownProviderException;
import me.golemcore.report.domain.model.AttachFormat;
import me.golemcore.report.domain.model.CommitWindow;
import me.golemcore.report.domain.model.DeliveryResult;
import me.golemcore.report.domain.model.RunContext;
import me.golemcore.report.domain.model.RunDiagnostic;
import me.golemcore.report.domain.model.RunRequest;
import me.golemcore.report.domain.model.RunResult;
import me.golemcore.report.domain.service.ReportOrchestrator;
import me.golemcore.report.domain.service.RunContextFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Command-line entry point. Runs one report when {@code --project} or
 * {@code --repo-path} is given, otherwise only logs usage.
 *
 * <pre>
 * --project=NAME | --repo-path=PATH_OR_URL
 * [--since="2 days ago" | --number=N] [--llm=ID] [--style=STYLE]
 * [--attach-format=html|pdf] [--email=a@x.com,b@y.com] [--distill]
 * </pre>
 */
@Component
@Slf4j
public class ReportCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_BAD_CONFIGURATION = 2;

    private static final String USAGE = "Usage: --project=NAME | --repo-path=PATH_OR_URL "
            + "[--since=\"1 day ago\" | --number=N] [--llm=ID] [--style=STYLE] "
            + "[--attach-format=html|pdf] [--email=a@x.com,b@y.com] [--distill]";

    private final RunContextFactory runContextFactory;
    private final ReportOrchestrator orchestrator;
    private int exitCode = EXIT_OK;

    public ReportCommandRunner(RunContextFactory runContextFactory, ReportOrchestrator orchestrator) {
        this.runContextFactory = runContextFactory;
        this.orchestrator = orchestrator;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption("project") && !args.containsOption("repo-path")) {
            log.info("[Cli] {}", USAGE);
            return;
        }
        RunContext context;
        try {
            context = runContextFactory.create(toRequest(args));
        } catch (UnknownProviderException | LlmProviderException | IllegalArgumentException
                | IllegalStateException e) {
            log.error("[Cli] {}", e.getMessage());
            exitCode = EXIT_BAD_CONFIGURATION;
            return;
        }
        RunResult result = orchestrator.run(context);
        report(result);
        exitCode = result.isFailed() ? EXIT_RUN_FAILED : EXIT_OK;
    }

    RunRequest toRequest(ApplicationArguments args) {
        RunRequest.RunRequestBuilder request = RunRequest.builder()
                .project(option(args, "project"))
                .repoLocation(option(args, "repo-path"))
                .provider(option(args, "llm"))
                .style(option(args, "style"))
                .forceDistill(args.containsOption("distill"));

        String number = option(args, "number");
        String since = option(args, "since");
        if (number != null && since != null) {
            throw new IllegalArgumentException("--since and --number are mutually exclusive");
        }
        if (number != null) {
            try {
                request.window(CommitWindow.lastCommits(Integer.parseInt(number.trim())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--number must be an integer: " + number, e);
            }
        } else if (since != null) {
            request.window(CommitWindow.parseSince(since));
        }

        String attach = option(args, "attach-format");
        if (attach != null) {
            try {
                request.attachFormat(AttachFormat.fromString(attach));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("--attach-format must be html or pdf: " + attach, e);
            }
        }

        String emails = option(args, "email");
        if (emails != null) {
            Arrays.stream(emails.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(request::recipient);
        }
        return request.build();
    }

    private void report(RunResult result) {
        if (result.isFailed()) {
            log.error("[Cli] Run {} FAILED at {}: {}", result.getRunId(), result.getFailedStage(),
                    result.getFailureMessage());
            return;
        }
        log.info("[Cli] Run {} {}", result.getRunId(), result.getStatus());
        if (result.getDailySummary() != null) {
            log.info("[Cli] Summary for {}:\n{}", result.getProject(), result.getDailySummary().getText());
        }
        if (result.getArtifact() != null) {
            log.info("[Cli] Report: {}", result.getArtifact().getHtmlPath());
        }
        for (RunDiagnostic diagnostic : result.getDiagnostics()) {
            log.warn("[Cli] {}", diagnostic);
        }
        for (DeliveryResult delivery : result.getDeliveries()) {
            log.info("[Cli] {}: {}", delivery.getChannel(),
                    delivery.isSuccessful() ? "delivered " + delivery.getRecipients() : delivery.getError());
        }
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? null : value;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
