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


package me.golemcore.assistant.domain.service;

import me.golemcore.assistant.domain.model.Message;

import java.util.List;

/**
 * Cheap character-based token estimate. Not a tokenizer: ASCII-dominated text
 * costs about one token per four characters, anything else (CJK and other
 * dense scripts) one token per character.
 */
public final class TokenEstimator {

    private static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {
    }

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int length = text.length();
        int ascii = 0;
        for (int i = 0; i < length; i++) {
            if (text.charAt(i) < 128) {
                ascii++;
            }
        }
        if (ascii * 2 > length) {
            return Math.max(1, length / CHARS_PER_TOKEN);
        }
        return length;
    }

    public static int estimate(Message message) {
        return message != null ? estimate(message.getContent()) : 0;
    }

    public static int estimate(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return 0;
        }
        int total = 0;
        for (Message message : messages) {
            total += estimate(message);
        }
        return total;
    }

    /**
     * Characters that fit into the given number of tokens under the ASCII
     * assumption. Used for truncation.
     */
    public static int charsForTokens(int tokens) {
        return Math.max(0, tokens) * CHARS_PER_TOKEN;
    }
}
