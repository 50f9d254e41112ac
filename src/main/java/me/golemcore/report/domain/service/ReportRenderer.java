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

import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.data.MutableDataSet;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.exception.RenderFailedException;
import me.golemcore.report.domain.model.ChangeStats;
import me.golemcore.report.domain.model.Commit;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the human-facing outputs of a run: the plain-text commit report and
 * the HTML report that wraps the AI summary, statistics and commit list.
 */
@Component
@Slf4j
public class ReportRenderer {

    private static final String TEMPLATE = "templates/report.html";
    private static final String ARTICLE_TEMPLATE = "templates/article.html";
    private static final String STYLESHEET = "templates/report.css";
    private static final String RULE = "=".repeat(80);
    private static final String THIN_RULE = "-".repeat(80);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final PromptTemplateEngine templateEngine;
    private final Parser markdownParser;
    private final HtmlRenderer htmlRenderer;

    public ReportRenderer(PromptTemplateEngine templateEngine) {
        this.templateEngine = templateEngine;
        MutableDataSet options = new MutableDataSet();
        options.set(Parser.EXTENSIONS, List.of(TablesExtension.create()));
        options.set(HtmlRenderer.SOFT_BREAK, "<br />\n");
        // raw HTML in model output is shown as text
        options.set(HtmlRenderer.ESCAPE_HTML, true);
        this.markdownParser = Parser.builder(options).build();
        this.htmlRenderer = HtmlRenderer.builder(options).build();
    }

    /**
     * Plain-text report: commits grouped by author, then merged per-file
     * statistics.
     */
    public String renderText(List<Commit> commits, ChangeStats stats, ZonedDateTime generatedAt) {
        StringBuilder text = new StringBuilder();
        text.append(RULE).append('\n');
        text.append("Git work summary\n");
        text.append(RULE).append('\n');
        text.append("Generated: ").append(TIME_FORMAT.format(generatedAt)).append('\n');
        text.append("Commits: ").append(commits.size()).append('\n');
        text.append("Changes: +").append(stats.getAdditions()).append(" -").append(stats.getDeletions())
                .append(" (files changed: ").append(stats.getFilesChanged()).append(")\n\n");

        if (commits.isEmpty()) {
            text.append("No commits found\n");
        }
        groupByAuthor(commits).forEach((author, authored) -> {
            text.append("Author: ").append(author).append(" (").append(authored.size()).append(" commits)\n");
            text.append("-".repeat(40)).append('\n');
            for (Commit commit : authored) {
                text.append("* ").append(commit.getShortId());
                if (commit.hasBranch()) {
                    text.append(" (").append(commit.getBranch()).append(')');
                }
                text.append(" - ").append(commit.getMessage());
                if (commit.getRelativeTime() != null && !commit.getRelativeTime().isBlank()) {
                    text.append(" (").append(commit.getRelativeTime()).append(')');
                }
                text.append('\n');
            }
            text.append('\n');
        });

        if (!stats.getFileStats().isEmpty()) {
            text.append(RULE).append('\n');
            text.append("File changes (merged per file)\n");
            text.append(RULE).append('\n');
            text.append(String.format(" %-7s | %-7s | %s%n", "Added", "Deleted", "File"));
            text.append(THIN_RULE).append('\n');
            for (ChangeStats.FileStat stat : stats.getFileStats()) {
                text.append(String.format(" +%-6d | -%-6d | %s%n", stat.getAdditions(), stat.getDeletions(),
                        stat.getPath()));
            }
            text.append(THIN_RULE).append('\n');
        }
        text.append(RULE);
        return text.toString();
    }

    /**
     * HTML report. {@code summary} and {@code article} are Markdown; the article
     * section is omitted when it is null.
     *
     * @throws RenderFailedException
     *             when the bundled template cannot be loaded
     */
    public String renderHtml(String projectName, List<Commit> commits, ChangeStats stats, String summary,
            String article, ZonedDateTime generatedAt) {
        Map<String, String> vars = new HashMap<>();
        vars.put("TITLE", escape("Git work report - " + projectName + " - " + DATE_FORMAT.format(generatedAt)));
        vars.put("PROJECT", escape(projectName));
        vars.put("GENERATED_AT", TIME_FORMAT.format(generatedAt));
        vars.put("CSS", loadResource(STYLESHEET));
        vars.put("SUMMARY_HTML", summary == null || summary.isBlank() ? "<p>No summary available.</p>"
                : markdownToHtml(summary));
        vars.put("ARTICLE_SECTION", article == null || article.isBlank() ? ""
                : "<section class=\"article\">\n<h2>Article</h2>\n" + markdownToHtml(article) + "</section>");
        vars.put("COMMIT_COUNT", String.valueOf(commits.size()));
        vars.put("AUTHORS", escape(String.join(", ", groupByAuthor(commits).keySet())));
        vars.put("ADDITIONS", String.valueOf(stats.getAdditions()));
        vars.put("DELETIONS", String.valueOf(stats.getDeletions()));
        vars.put("FILES_CHANGED", String.valueOf(stats.getFilesChanged()));
        vars.put("FILE_ROWS", fileRows(stats));
        vars.put("COMMIT_SECTIONS", commitSections(commits));
        return templateEngine.render(loadResource(TEMPLATE), vars);
    }

    /**
     * Standalone HTML document for a styled article, used as the PDF export
     * input.
     */
    public String renderArticleHtml(String title, String article) {
        Map<String, String> vars = new HashMap<>();
        vars.put("TITLE", escape(title));
        vars.put("CSS", loadResource(STYLESHEET));
        vars.put("ARTICLE_HTML", markdownToHtml(article));
        return templateEngine.render(loadResource(ARTICLE_TEMPLATE), vars);
    }

    public String markdownToHtml(String markdown) {
        return htmlRenderer.render(markdownParser.parse(markdown));
    }

    private String fileRows(ChangeStats stats) {
        if (stats.getFileStats().isEmpty()) {
            return "<tr><td colspan=\"3\">No significant file changes</td></tr>";
        }
        StringBuilder rows = new StringBuilder();
        for (ChangeStats.FileStat stat : stats.getFileStats()) {
            rows.append("<tr><td class=\"add\">+").append(stat.getAdditions())
                    .append("</td><td class=\"del\">-").append(stat.getDeletions())
                    .append("</td><td class=\"path\">").append(escape(stat.getPath())).append("</td></tr>\n");
        }
        return rows.toString();
    }

    private String commitSections(List<Commit> commits) {
        if (commits.isEmpty()) {
            return "<p>No commits in this window.</p>";
        }
        StringBuilder html = new StringBuilder();
        groupByAuthor(commits).forEach((author, authored) -> {
            html.append("<div class=\"author\">\n<h3>").append(escape(author)).append(" <span class=\"count\">(")
                    .append(authored.size()).append(" commits)</span></h3>\n<ul>\n");
            for (Commit commit : authored) {
                html.append("<li><code>").append(escape(commit.getShortId())).append("</code> ");
                if (commit.hasBranch()) {
                    html.append("<span class=\"branch\">").append(escape(commit.getBranch())).append("</span> ");
                }
                html.append(escape(commit.getMessage()));
                if (commit.getRelativeTime() != null && !commit.getRelativeTime().isBlank()) {
                    html.append(" <span class=\"time\">").append(escape(commit.getRelativeTime())).append("</span>");
                }
                html.append("</li>\n");
            }
            html.append("</ul>\n</div>\n");
        });
        return html.toString();
    }

    private static Map<String, List<Commit>> groupByAuthor(List<Commit> commits) {
        Map<String, List<Commit>> grouped = new LinkedHashMap<>();
        for (Commit commit : commits) {
            String author = commit.getAuthor() != null ? commit.getAuthor() : "unknown";
            grouped.computeIfAbsent(author, k -> new ArrayList<>()).add(commit);
        }
        return grouped;
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    private String loadResource(String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RenderFailedException("Failed to load " + path, e);
        }
    }
}
