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

package me.golemcore.report.plugin.api;

import me.golemcore.report.domain.model.HookPoint;
import me.golemcore.report.domain.model.RunContext;

import java.util.Set;

/**
 * Extension that rewrites a text payload at one or more hook points.
 *
 * <p>
 * Hooks are cosmetic: a hook that throws is logged and skipped, and the
 * payload continues unmodified.
 */
public interface ReportHook {

    /**
     * Unique hook name used in logs and diagnostics.
     */
    String getName();

    /**
     * Hook points this hook participates in.
     */
    Set<HookPoint> getHookPoints();

    /**
     * Registration order; lower runs first.
     */
    default int getOrder() {
        return 100;
    }

    default boolean isEnabled() {
        return true;
    }

    /**
     * Return the payload to pass on, possibly unchanged.
     */
    String apply(HookPoint point, RunContext context, String payload);
}
