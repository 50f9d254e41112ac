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

package me.golemcore.report.plugin.context;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.model.HookPoint;
import me.golemcore.report.domain.model.RunContext;
import me.golemcore.report.domain.model.RunDiagnostic;
import me.golemcore.report.domain.model.RunStage;
import me.golemcore.report.plugin.api.ReportHook;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Ordered registry of report hooks.
 *
 * <p>
 * Hooks run strictly in registration order. Spring-discovered hooks are
 * registered sorted by {@link ReportHook#getOrder()}; hooks registered later
 * run after them. A failing hook is logged, reported as a
 * {@link RunDiagnostic.Code#HOOK_FAILED} diagnostic and skipped; the payload
 * it received passes on unchanged.
 */
@Service
@Slf4j
public class HookManager {

    private final Map<HookPoint, List<ReportHook>> hooksByPoint = new EnumMap<>(HookPoint.class);
    private final Set<String> names = new HashSet<>();

    public HookManager() {
        for (HookPoint point : HookPoint.values()) {
            hooksByPoint.put(point, new ArrayList<>());
        }
    }

    @Autowired
    public HookManager(List<ReportHook> hooks) {
        this();
        hooks.stream()
                .sorted(Comparator.comparingInt(ReportHook::getOrder))
                .forEach(this::register);
    }

    public final synchronized void register(ReportHook hook) {
        if (!names.add(hook.getName())) {
            throw new IllegalStateException("Duplicate hook name: " + hook.getName());
        }
        if (!hook.isEnabled()) {
            log.info("[Hooks] Hook disabled: {}", hook.getName());
            return;
        }
        for (HookPoint point : hook.getHookPoints()) {
            hooksByPoint.get(point).add(hook);
        }
        log.debug("[Hooks] Registered hook: {} at {}", hook.getName(), hook.getHookPoints());
    }

    public synchronized List<ReportHook> getHooks(HookPoint point) {
        return Collections.unmodifiableList(new ArrayList<>(hooksByPoint.get(point)));
    }

    /**
     * Pass {@code payload} through every hook registered at {@code point}.
     *
     * @param diagnostics
     *            receives one diagnostic per failed hook
     */
    public String apply(HookPoint point, RunContext context, String payload, Consumer<RunDiagnostic> diagnostics) {
        String current = payload;
        for (ReportHook hook : getHooks(point)) {
            try {
                String result = hook.apply(point, context, current);
                if (result == null) {
                    log.warn("[Hooks] {} returned null at {}, keeping payload", hook.getName(), point);
                    continue;
                }
                current = result;
            } catch (RuntimeException e) {
                log.warn("[Hooks] {} failed at {}: {}", hook.getName(), point, e.getMessage(), e);
                diagnostics.accept(RunDiagnostic.builder()
                        .stage(stageOf(point))
                        .code(RunDiagnostic.Code.HOOK_FAILED)
                        .subject(hook.getName())
                        .message(e.getMessage())
                        .build());
            }
        }
        return current;
    }

    private static RunStage stageOf(HookPoint point) {
        return switch (point) {
        case POST_MAP -> RunStage.MAPPING;
        case POST_REDUCE -> RunStage.REDUCING;
        case PRE_RENDER -> RunStage.HOOKING;
        case POST_RENDER -> RunStage.RENDERING;
        };
    }
}
