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

package me.golemcore.report.plugin.builtin;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.model.HookPoint;
import me.golemcore.report.domain.model.RunContext;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.plugin.api.ReportHook;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Removes a code fence wrapped around the whole model answer
 * ({@code ```markdown ... ```}).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CleanMarkdownOutputHook implements ReportHook {

    private static final Pattern FENCE_START = Pattern.compile("^```(?:markdown|md)?[ \\t]*\\n",
            Pattern.CASE_INSENSITIVE);
    private static final String FENCE_END = "```";

    private final ReportProperties properties;

    @Override
    public String getName() {
        return "clean-markdown-output";
    }

    @Override
    public Set<HookPoint> getHookPoints() {
        return EnumSet.of(HookPoint.POST_REDUCE);
    }

    @Override
    public int getOrder() {
        return 10;
    }

    @Override
    public boolean isEnabled() {
        return properties.getHooks().isCleanMarkdownEnabled();
    }

    @Override
    public String apply(HookPoint point, RunContext context, String payload) {
        if (payload == null || payload.isBlank()) {
            return payload;
        }
        String cleaned = payload.strip();
        var start = FENCE_START.matcher(cleaned);
        if (!start.find()) {
            return payload;
        }
        cleaned = cleaned.substring(start.end());
        if (cleaned.endsWith(FENCE_END)) {
            cleaned = cleaned.substring(0, cleaned.length() - FENCE_END.length());
        }
        log.debug("[Hooks] Removed markdown fence from summary");
        return cleaned.strip();
    }
}
