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


package me.golemcore.assistant.port.outbound;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Produces a short summary of an older part of the conversation.
 */
public interface SummarizerPort {

    /**
     * Summarizes a plain-text transcript. Completes with empty when no summary
     * could be produced; never completes exceptionally for model failures.
     */
    CompletableFuture<Optional<String>> summarize(String transcript);
}
