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

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tool-triggering request categories, each recognized by a small set of
 * English regular expressions and served by one tool.
 */
public enum IntentFamily {

    MATH("calculator",
            "\\d+(?:\\.\\d+)?\\s*(?:%|percent)\\s+of\\s+\\d",
            "\\d\\s*[+\\-*/×÷^]\\s*\\d",
            "\\d\\s+x\\s+\\d",
            "\\b(?:calculate|compute|square root|sqrt|divided by|multiplied by|times|plus|minus)\\b",
            "\\b(?:percent(?:age)?|tip on|how much is \\d)"),

    CALENDAR("calendar",
            "\\b(?:calendar|meetings?|appointments?|agenda|events?)\\b",
            "\\bschedul(?:e|ed|ing)\\b",
            "\\bwhat'?s on (?:my|the|for)\\b",
            "\\bam i (?:free|busy)\\b"),

    WEATHER("weather",
            "\\b(?:weather|forecast|temperature|umbrella|humidity)\\b",
            "\\b(?:raining|snowing|sunny|rainy|windy)\\b",
            "\\b(?:will|is) it (?:rain|snow|be (?:hot|cold|warm|sunny))\\b",
            "\\b(?:hot|cold|warm) (?:today|tomorrow|outside)\\b"),

    REMINDERS("reminders",
            "\\bremind(?:er|ers)?\\b",
            "\\b(?:to-?do|task list|don'?t (?:let me )?forget)\\b");

    private final String toolName;
    private final List<Pattern> patterns;

    IntentFamily(String toolName, String... regexes) {
        this.toolName = toolName;
        this.patterns = Arrays.stream(regexes)
                .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
    }

    public String getToolName() {
        return toolName;
    }

    public boolean matches(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    public static Set<IntentFamily> detect(String text) {
        Set<IntentFamily> families = EnumSet.noneOf(IntentFamily.class);
        for (IntentFamily family : values()) {
            if (family.matches(text)) {
                families.add(family);
            }
        }
        return families;
    }

    public static Optional<IntentFamily> forTool(String toolName) {
        for (IntentFamily family : values()) {
            if (family.toolName.equals(toolName)) {
                return Optional.of(family);
            }
        }
        return Optional.empty();
    }
}
