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
import java.util.List;
import java.util.Set;

/**
 * Replaces configured sensitive terms with a mask in Map outputs and in the
 * daily summary, before anything is persisted or rendered.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SensitiveTermRedactionHook implements ReportHook {

    private final ReportProperties properties;

    @Override
    public String getName() {
        return "sensitive-term-redaction";
    }

    @Override
    public Set<HookPoint> getHookPoints() {
        return EnumSet.of(HookPoint.POST_MAP, HookPoint.POST_REDUCE);
    }

    @Override
    public int getOrder() {
        return 20;
    }

    @Override
    public boolean isEnabled() {
        return !properties.getHooks().getSensitiveTerms().isEmpty();
    }

    @Override
    public String apply(HookPoint point, RunContext context, String payload) {
        if (payload == null || payload.isEmpty()) {
            return payload;
        }
        List<String> terms = properties.getHooks().getSensitiveTerms();
        String replacement = properties.getHooks().getReplacement();
        String result = payload;
        int redacted = 0;
        for (String term : terms) {
            if (term != null && !term.isEmpty() && result.contains(term)) {
                result = result.replace(term, replacement);
                redacted++;
            }
        }
        if (redacted > 0) {
            log.info("[Hooks] Redacted {} sensitive term(s) at {}", redacted, point);
        }
        return result;
    }
}
