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
import me.golemcore.report.domain.model.HookPoint;
import me.golemcore.report.domain.model.RunContext;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.plugin.api.ReportHook;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Injects the configured footer before {@code </body>} of the rendered report.
 */
@Component
@RequiredArgsConstructor
public class ReportFooterHook implements ReportHook {

    private static final String BODY_END = "</body>";

    private final ReportProperties properties;

    @Override
    public String getName() {
        return "report-footer";
    }

    @Override
    public Set<HookPoint> getHookPoints() {
        return EnumSet.of(HookPoint.POST_RENDER);
    }

    @Override
    public boolean isEnabled() {
        String footer = properties.getHooks().getFooterHtml();
        return footer != null && !footer.isBlank();
    }

    @Override
    public String apply(HookPoint point, RunContext context, String payload) {
        int index = payload.lastIndexOf(BODY_END);
        if (index < 0) {
            return payload;
        }
        return payload.substring(0, index) + properties.getHooks().getFooterHtml() + "\n" + payload.substring(index);
    }
}
