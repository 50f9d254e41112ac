package me.golemcore.report.domain.model;

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

/**
 * Extension points where report hooks may rewrite the current payload.
 */
public enum HookPoint {

    /** Each successful diff summary, before Reduce. */
    POST_MAP,

    /** The daily summary text, before it is persisted. */
    POST_REDUCE,

    /** The daily summary text, before rendering. */
    PRE_RENDER,

    /** The rendered HTML document. */
    POST_RENDER
}
