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


package me.golemcore.assistant.domain.component;

import me.golemcore.assistant.domain.model.MemoryFact;

import java.util.List;
import java.util.Optional;

/**
 * Long-term facts about the user, injected into the system prompt.
 */
public interface MemoryComponent extends Component {

    @Override
    default String getComponentType() {
        return "memory";
    }

    /**
     * Returns all facts ranked by confidence and formatted for the prompt, or
     * empty when nothing is stored.
     */
    Optional<String> getForPrompt();

    /**
     * Returns facts ranked by relevance to the given conversation topics. Falls
     * back to {@link #getForPrompt()} when no topics are given.
     *
     * @param topics
     *            lower-case keywords extracted from the conversation
     */
    Optional<String> getRelevantForConversation(List<String> topics);

    /**
     * Stores a new fact.
     */
    MemoryFact remember(String content, List<String> topics);
}
