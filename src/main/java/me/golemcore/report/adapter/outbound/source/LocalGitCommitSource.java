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

package me.golemcore.report.adapter.outbound.source;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.exception.SourceUnavailableException;
import me.golemcore.report.domain.model.Commit;
import me.golemcore.report.domain.model.CommitWindow;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.infrastructure.process.ProcessRunner;
import me.golemcore.report.port.outbound.CommitSourcePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Reads history from a local work tree by running the git CLI.
 */
@Component
@Slf4j
public class LocalGitCommitSource implements CommitSourcePort {

    private static final String SOURCE_TYPE = "local";
    private static final List<String> README_NAMES = List.of("README.md", "readme.md", "README.markdown",
            "README.rst", "README.txt", "README");

    private final ProcessRunner processRunner;
    private final ReportProperties properties;
    private final Clock clock;

    public LocalGitCommitSource(ProcessRunner processRunner, ReportProperties properties, Clock clock) {
        this.processRunner = processRunner;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String getSourceType() {
        return SOURCE_TYPE;
    }

    @Override
    public boolean supports(String repository) {
        return repository != null && !repository.isBlank() && !GitHubCommitSource.isRemote(repository);
    }

    @Override
    public List<Commit> fetch(String repository, CommitWindow window) {
        Path workTree = requireWorkTree(repository);
        List<String> command = new ArrayList<>(List.of(properties.getSource().getGitCommand(),
                "log", "--no-color", "--no-merges", "--numstat", GitLogParser.PRETTY_FORMAT));
        if (window.isCountBased()) {
            command.add("-n");
            command.add(String.valueOf(window.getCount()));
        } else {
            Instant since = clock.instant().minus(window.getSince()).truncatedTo(ChronoUnit.SECONDS);
            command.add("--since=" + since);
        }
        String output = git(workTree, command);
        List<Commit> commits = GitLogParser.parse(output);
        log.info("[Source] {} commits from {} ({})", commits.size(), workTree, window.describe());
        return commits;
    }

    @Override
    public String fetchDiff(String repository, Commit commit) {
        Path workTree = requireWorkTree(repository);
        return git(workTree, List.of(properties.getSource().getGitCommand(),
                "show", "--no-color", "--no-ext-diff", "--pretty=format:", commit.getId()));
    }

    @Override
    public Optional<String> fetchReadme(String repository) {
        Path workTree = requireWorkTree(repository);
        for (String name : README_NAMES) {
            Path candidate = workTree.resolve(name);
            if (Files.isRegularFile(candidate)) {
                try {
                    return Optional.of(Files.readString(candidate, StandardCharsets.UTF_8));
                } catch (IOException e) {
                    throw new SourceUnavailableException("Failed to read " + candidate, e);
                }
            }
        }
        return Optional.empty();
    }

    private Path requireWorkTree(String repository) {
        Path workTree = Paths.get(repository).toAbsolutePath().normalize();
        if (!Files.isDirectory(workTree)) {
            throw new SourceUnavailableException("Repository directory not found: " + workTree);
        }
        return workTree;
    }

    private String git(Path workTree, List<String> command) {
        Duration timeout = Duration.ofMillis(properties.getSource().getGitCommandTimeoutMs());
        try {
            ProcessRunner.ProcessOutput output = processRunner.run(command, workTree, null, timeout);
            if (!output.isSuccess()) {
                throw new SourceUnavailableException("git " + command.get(1) + " failed in " + workTree
                        + " (exit " + output.exitCode() + "): " + output.stderr().strip());
            }
            return output.stdout();
        } catch (IOException e) {
            throw new SourceUnavailableException("Failed to run git in " + workTree + ": " + e.getMessage(), e);
        } catch (TimeoutException e) {
            throw new SourceUnavailableException(e.getMessage(), e);
        }
    }
}
