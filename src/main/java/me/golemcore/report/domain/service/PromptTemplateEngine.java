package me.golemcore.report.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.model.PromptTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code {{VAR}}} placeholders in prompt and report templates.
 *
 * <p>
 * Substitution is single-pass: a value that itself contains {@code {{X}}}
 * (a commit message, an LLM answer) is inserted verbatim and never expanded.
 * Report documents keep unknown placeholders; prompts drop them so the
 * provider never sees template syntax.
 */
@Component
@Slf4j
public class PromptTemplateEngine {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{\\{\\s*(\\w+)\\s*}}");

    /**
     * System and user messages ready to send.
     */
    public record RenderedPrompt(String system, String user) {
    }

    /**
     * Render a document template, leaving unknown placeholders in place.
     */
    public String render(String content, Map<String, String> variables) {
        return substitute(content, variables, null);
    }

    /**
     * Render both parts of a prompt. Placeholders without a value are removed
     * and reported once per template.
     */
    public RenderedPrompt renderPrompt(PromptTemplate template, Map<String, String> variables) {
        Set<String> missing = new TreeSet<>();
        String system = substitute(template.system(), variables, missing);
        String user = substitute(template.user(), variables, missing);
        if (!missing.isEmpty()) {
            log.warn("[Prompt] {} has no value for {}", template.source(), missing);
        }
        return new RenderedPrompt(system, user);
    }

    private static String substitute(String content, Map<String, String> variables, Set<String> missing) {
        if (content == null || content.isEmpty()) {
            return content;
        }
        Map<String, String> values = variables != null ? variables : Map.of();
        Matcher matcher = VARIABLE_PATTERN.matcher(content);
        StringBuilder result = new StringBuilder(content.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = values.get(name);
            if (value == null) {
                if (missing == null) {
                    value = matcher.group(0);
                } else {
                    missing.add(name);
                    value = "";
                }
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
