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

package me.golemcore.report.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.exception.LlmProviderException;
import me.golemcore.report.domain.model.AttachFormat;
import me.golemcore.report.domain.model.CancellationToken;
import me.golemcore.report.domain.model.CommitWindow;
import me.golemcore.report.domain.model.PipelineSettings;
import me.golemcore.report.domain.model.ProjectSettings;
import me.golemcore.report.domain.model.RunContext;
import me.golemcore.report.domain.model.RunRequest;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.port.outbound.CommitSourcePort;
import me.golemcore.report.port.outbound.LlmPort;
import me.golemcore.report.port.outbound.LlmRegistryPort;
import me.golemcore.report.port.outbound.NotifierPort;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Resolves a {@link RunRequest} into an immutable {@link RunContext}.
 *
 * <p>
 * Every setting is taken from the request first, then from the project's
 * {@code config.json}, then from global configuration. Unknown or unusable
 * providers and unreachable repository locations fail here, before any work
 * starts.
 */
@Service
@Slf4j
public class RunContextFactory {

    private static final String AUTO_SOURCE = "auto";

    private final ReportProperties properties;
    private final LlmRegistryPort llmRegistry;
    private final List<CommitSourcePort> commitSources;
    private final List<NotifierPort> notifiers;
    private final MemoryStoreFactory memoryStoreFactory;
    private final ProjectSettingsService projectSettingsService;
    private final Clock clock;

    public RunContextFactory(ReportProperties properties, LlmRegistryPort llmRegistry,
            List<CommitSourcePort> commitSources, List<NotifierPort> notifiers,
            MemoryStoreFactory memoryStoreFactory, ProjectSettingsService projectSettingsService, Clock clock) {
        this.properties = properties;
        this.llmRegistry = llmRegistry;
        this.commitSources = commitSources;
        this.notifiers = notifiers;
        this.memoryStoreFactory = memoryStoreFactory;
        this.projectSettingsService = projectSettingsService;
        this.clock = clock;
    }

    public RunContext create(RunRequest request) {
        String repository = resolveRepository(request);
        String project = hasText(request.getProject()) ? request.getProject() : projectNameOf(repository);
        ProjectSettings settings = projectSettingsService.load(project);
        if (!hasText(repository)) {
            repository = settings.getRepoPath();
        }
        if (!hasText(repository)) {
            throw new IllegalArgumentException("No repository location known for project '" + project + "'");
        }

        String providerId = firstNonBlank(request.getProvider(), settings.getLlm(), properties.getLlm().getProvider());
        LlmPort llm = llmRegistry.require(providerId);
        if (!llm.isAvailable()) {
            throw new LlmProviderException(providerId, LlmErrorClassifier.PROVIDER_NOT_CONFIGURED,
                    "Provider '" + providerId + "' is missing its api key or model");
        }

        String style = firstNonBlank(request.getStyle(), settings.getStyle(), properties.getLlm().getStyle());
        AttachFormat attachFormat = request.getAttachFormat() != null
                ? request.getAttachFormat()
                : AttachFormat.fromString(firstNonBlank(settings.getAttachFormat(),
                        properties.getOutput().getAttachFormat()));
        List<String> recipients = !request.getRecipients().isEmpty() ? request.getRecipients()
                : settings.getRecipients() != null && !settings.getRecipients().isEmpty() ? settings.getRecipients()
                        : properties.getRecipients();
        CommitWindow window = request.getWindow() != null
                ? request.getWindow()
                : CommitWindow.parseSince(properties.getSource().getDefaultSince());

        RunContext context = RunContext.builder()
                .runId(UUID.randomUUID().toString())
                .projectName(project)
                .repository(repository)
                .window(window)
                .providerId(providerId)
                .style(style.toLowerCase(Locale.ROOT))
                .attachFormat(attachFormat)
                .recipients(recipients)
                .forceDistill(request.isForceDistill())
                .settings(pipelineSettings())
                .startedAt(clock.instant())
                .llm(llm)
                .commitSource(selectSource(repository))
                .memoryStore(memoryStoreFactory.open(project))
                .notifiers(notifiers.stream().filter(NotifierPort::isEnabled).toList())
                .cancellationToken(new CancellationToken())
                .build();
        log.info("[Run] {} project={} repo={} provider={} style={} window={} channels={}", context.getRunId(),
                project, repository, providerId, context.getStyle(), window.describe(),
                context.getNotifiers().stream().map(NotifierPort::getChannel).toList());
        return context;
    }

    private String resolveRepository(RunRequest request) {
        if (hasText(request.getRepoLocation())) {
            return request.getRepoLocation();
        }
        if (hasText(request.getProject())) {
            return projectSettingsService.resolveAlias(request.getProject()).orElse(null);
        }
        throw new IllegalArgumentException("Either a project or a repository location is required");
    }

    CommitSourcePort selectSource(String repository) {
        String type = properties.getSource().getType();
        for (CommitSourcePort source : commitSources) {
            boolean typeMatches = AUTO_SOURCE.equalsIgnoreCase(type) || source.getSourceType().equalsIgnoreCase(type);
            if (typeMatches && source.supports(repository)) {
                return source;
            }
        }
        throw new IllegalArgumentException("No " + type + " commit source supports repository: " + repository);
    }

    PipelineSettings pipelineSettings() {
        ReportProperties.PipelineProperties pipeline = properties.getPipeline();
        return PipelineSettings.builder()
                .mapConcurrency(pipeline.getMapConcurrency())
                .mapTimeout(Duration.ofMillis(pipeline.getMapTimeoutMs()))
                .mapGracePeriod(Duration.ofMillis(pipeline.getMapGracePeriodMs()))
                .reduceMaxAttempts(pipeline.getReduceMaxAttempts())
                .reduceInitialBackoff(Duration.ofMillis(pipeline.getReduceInitialBackoffMs()))
                .reduceBackoffMultiplier(pipeline.getReduceBackoffMultiplier())
                .maxDiffChars(pipeline.getMaxDiffChars())
                .distillEveryRuns(properties.getMemory().getDistillEveryRuns())
                .build();
    }

    /**
     * Project name derived from a repository location: the last path segment
     * without a {@code .git} suffix.
     */
    static String projectNameOf(String repository) {
        if (!hasText(repository)) {
            throw new IllegalArgumentException("Either a project or a repository location is required");
        }
        String trimmed = repository.trim().replace('\\', '/');
        if (!trimmed.contains("://") && !trimmed.startsWith("git@")) {
            Path local = Paths.get(trimmed).toAbsolutePath().normalize().getFileName();
            trimmed = local != null ? local.toString() : trimmed;
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int cut = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf(':'));
        String name = cut >= 0 ? trimmed.substring(cut + 1) : trimmed;
        if (name.endsWith(".git")) {
            name = name.substring(0, name.length() - 4);
        }
        if (name.isBlank() || ".".equals(name) || "..".equals(name)) {
            throw new IllegalArgumentException("Cannot derive a project name from: " + repository);
        }
        return name;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (hasText(value)) {
                return value;
            }
        }
        return null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
