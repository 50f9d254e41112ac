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

package me.golemcore.report.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the report pipeline, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code report.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - provider registry entries and default
 * provider/style</li>
 * <li>{@link SourceProperties} - local git and GitHub commit sources</li>
 * <li>{@link StorageProperties} - data root for per-project history</li>
 * <li>{@link MemoryProperties} - memory log files and distillation
 * cadence</li>
 * <li>{@link PipelineProperties} - Map concurrency, deadlines and Reduce
 * retries</li>
 * <li>{@link FilterProperties} - noise file rules</li>
 * <li>{@link OutputProperties}, {@link MailProperties},
 * {@link FeishuProperties}, {@link HooksProperties},
 * {@link HttpProperties}</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "report")
@Data
public class ReportProperties {

    private LlmProperties llm = new LlmProperties();
    private SourceProperties source = new SourceProperties();
    private StorageProperties storage = new StorageProperties();
    private MemoryProperties memory = new MemoryProperties();
    private PipelineProperties pipeline = new PipelineProperties();
    private FilterProperties filter = new FilterProperties();
    private OutputProperties output = new OutputProperties();
    private List<String> recipients = new ArrayList<>();
    private MailProperties mail = new MailProperties();
    private FeishuProperties feishu = new FeishuProperties();
    private HooksProperties hooks = new HooksProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "mock";
        private String style = "default";
        private long timeoutMs = 120000;
        private Map<String, ProviderProperties> providers = new LinkedHashMap<>();
    }

    @Data
    public static class ProviderProperties {
        /** One of {@code openai}, {@code anthropic}, {@code gemini}. */
        private String type = "openai";
        private String apiKey;
        private String baseUrl;
        private String model;
        private Double temperature;
    }

    // ==================== SOURCES ====================

    @Data
    public static class SourceProperties {
        /** {@code local}, {@code github}, or {@code auto} (URLs go to GitHub). */
        private String type = "auto";
        private String gitCommand = "git";
        private long gitCommandTimeoutMs = 60000;
        private String defaultSince = "1 day ago";
        private GitHubProperties github = new GitHubProperties();
    }

    @Data
    public static class GitHubProperties {
        private String apiUrl = "https://api.github.com";
        private String token;
        private int maxCommits = 100;
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/reports";
        private String projectsFile = "projects.json";
        private String projectConfigFile = "config.json";
    }

    @Data
    public static class MemoryProperties {
        private String logFile = "project_log.jsonl";
        private String memoryFile = "project_memory.md";
        private int distillEveryRuns = 1;
    }

    // ==================== PIPELINE ====================

    @Data
    public static class PipelineProperties {
        private int mapConcurrency = 4;
        private long mapTimeoutMs = 300000;
        private long mapGracePeriodMs = 20000;
        private int reduceMaxAttempts = 3;
        private long reduceInitialBackoffMs = 2000;
        private double reduceBackoffMultiplier = 2.0;
        private int maxDiffChars = 100000;
    }

    @Data
    public static class FilterProperties {
        private List<String> suffixDenylist = new ArrayList<>(List.of(
                ".lock", ".min.js", ".pyc", ".so", ".o", ".class", ".jar"));
        private List<String> prefixDenylist = new ArrayList<>(List.of(
                "dist/", "build/", "target/", "out/", "node_modules/", "__pycache__/",
                ".pytest_cache/", ".mypy_cache/", ".ruff_cache/", ".vscode/", ".idea/"));
        private List<String> patterns = new ArrayList<>(List.of(
                "package-lock.json", "pnpm-lock.yaml", "poetry.lock", "pdm.lock", "uv.lock",
                ".env", "*.png", "*.jpg", "*.jpeg", "*.gif", "*.svg", "*.ico", "*.pdf",
                "*.woff", "*.woff2", "*.eot", "*.ttf", "*.otf", "*.zip", "*.tar.gz"));
    }

    // ==================== OUTPUT ====================

    @Data
    public static class OutputProperties {
        private String filenamePrefix = "GitReport";
        /** {@code html} or {@code pdf}. */
        private String attachFormat = "html";
        private String princeCommand = "prince";
        private long exportTimeoutMs = 120000;
    }

    // ==================== CHANNELS ====================

    @Data
    public static class MailProperties {
        private boolean enabled = false;
        private String host;
        /** 0 picks the standard port of the security mode. */
        private int port = 0;
        private String username;
        private String password;
        private String from;
        private String security = "ssl";
        private int connectTimeout = 10000;
        private int readTimeout = 30000;
    }

    @Data
    public static class FeishuProperties {
        private boolean enabled = false;
        private String appId;
        private String appSecret;
        private String webhookUrl;
        private String apiBaseUrl = "https://open.feishu.cn/open-apis";
    }

    @Data
    public static class HooksProperties {
        private boolean cleanMarkdownEnabled = true;
        private List<String> sensitiveTerms = new ArrayList<>(List.of("password"));
        private String replacement = "***";
        private String footerHtml = "<p class=\"report-footer\">Generated by GolemCore Report</p>";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
        private String userAgent = "golemcore-report";
    }
}
