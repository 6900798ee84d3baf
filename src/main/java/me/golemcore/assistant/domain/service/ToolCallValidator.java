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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Regex-based guard rails around tool use: picks the tool set for a turn,
 * rejects tool calls that do not fit the request, and corrects final answers
 * that contradict what actually ran. All patterns are English-only.
 */
@Component
@Slf4j
public class ToolCallValidator {

    public static final String CREATIVE_REDIRECT = "I can't write stories, poems or other creative pieces here. "
            + "I'm best at practical tasks like checking the weather, managing your calendar and reminders, "
            + "and doing calculations. What can I help you with?";

    public static final String REPHRASE_MATH = "I couldn't work that out reliably. Could you rephrase the "
            + "calculation, for example \"85 * 0.20\"?";

    public static final String ACTION_NOT_COMPLETED = "I wasn't able to complete that action, nothing was "
            + "changed. Please try again.";

    public static final String REFUSAL_FALLBACK = "I'm best at helping with tasks like checking your calendar, "
            + "setting reminders, getting weather updates, and doing calculations. What can I help you with?";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Pattern> CONVERSATIONAL = List.of(
            Pattern.compile("^\\s*(?:hi|hello|hey|hiya|howdy|yo|greetings|good (?:morning|afternoon|evening))\\b",
                    FLAGS),
            Pattern.compile("\\b(?:what can you do|what do you do|who are you|what are you|how can you help|"
                    + "what are your (?:capabilities|features)|how are you)\\b", FLAGS),
            Pattern.compile("^\\s*(?:thanks|thank you|thx|ty|cheers|bye|goodbye|see you|good night|"
                    + "ok|okay|cool|great|nice|awesome)\\b", FLAGS));

    private static final List<Pattern> CREATIVE = List.of(
            Pattern.compile("\\b(?:tell|write|make up|compose|create|give)\\s+(?:me\\s+)?(?:a|an|another|some)?\\s*"
                    + "(?:short\\s+|little\\s+|funny\\s+|bedtime\\s+)?"
                    + "(?:story|stories|poem|poems|song|lyrics|haiku|limerick|fairy ?tale|fable|novel|script|rap)\\b",
                    FLAGS),
            Pattern.compile("\\bimagine (?:a|an|that|if|you)\\b", FLAGS),
            Pattern.compile("\\bonce upon a time\\b", FLAGS),
            Pattern.compile("\\bpretend (?:you(?:'re| are)|to be)\\b", FLAGS),
            Pattern.compile("\\brole-?play\\b", FLAGS));

    private static final Pattern IRRELEVANT_TO_MATH = Pattern.compile(
            "\\b(?:schedul\\w*|calendar|meeting|appointment|event|remind\\w*|weather|forecast|temperature|"
                    + "rain|sunny|contact|phone number|email address|location|address)\\b",
            FLAGS);

    private static final Pattern DIGIT = Pattern.compile("\\d");

    // Requests for tools outside the four intent families (web fetch, memory).
    private static final Pattern OTHER_TOOL_HINT = Pattern.compile(
            "https?://|\\bwww\\.|\\b\\w+\\.(?:com|org|net|io|dev)\\b|\\b(?:fetch|remember|url|website|web ?page)\\b",
            FLAGS);

    private static final String ACTION_VERBS = "(?:created|scheduled|deleted|removed|sent|added|booked|"
            + "set(?: up)?|saved|cancell?ed|updated|moved|emailed|texted|called)";

    // First-person claims ("I've scheduled") and results reported on the user's
    // own things ("your meeting has been moved"). Third-person passives are facts.
    private static final Pattern ACTION_CLAIM = Pattern.compile(
            "\\b(?:i(?:'ve| have)?|i'll|we(?:'ve| have)?)\\s+(?:(?!not\\b|never\\b)\\w+\\s+)?" + ACTION_VERBS + "\\b"
                    + "|\\byour\\s+(?:\\w+\\s+){0,3}?(?:has been|have been|was|were|is now)\\s+"
                    + "(?:(?!not\\b|never\\b)\\w+\\s+)?" + ACTION_VERBS + "\\b"
                    + "|^\\s*(?:done[.!]?\\s+)?successfully\\s+" + ACTION_VERBS + "\\b",
            FLAGS);

    private static final List<String> REFUSAL_PHRASES = List.of(
            "i cannot fulfill",
            "i can't fulfill",
            "i'm not able to help",
            "i am not able to help",
            "i'm unable to",
            "i am unable to",
            "i cannot assist",
            "i can't assist",
            "sorry, but i cannot",
            "sorry, but i can't");

    private static final int SHORT_UTTERANCE_WORDS = 3;

    /**
     * Describes why {@code chosenTool} does not fit {@code userText}, or empty
     * when the call may run.
     */
    public Optional<String> detectMismatch(String userText, String chosenTool) {
        if (userText == null || chosenTool == null) {
            return Optional.empty();
        }
        Set<IntentFamily> families = IntentFamily.detect(userText);
        boolean math = families.contains(IntentFamily.MATH);
        boolean toolFamilyMatched = IntentFamily.forTool(chosenTool).map(families::contains).orElse(false);

        if (math && !IntentFamily.MATH.getToolName().equals(chosenTool) && !toolFamilyMatched) {
            log.info("[Validator] Mismatch: math request routed to '{}'", chosenTool);
            return Optional.of("The user asked a math question, but the '" + chosenTool
                    + "' tool was selected. Use the calculator tool for calculations.");
        }
        if (IntentFamily.CALENDAR.getToolName().equals(chosenTool) && families.equals(Set.of(IntentFamily.MATH))) {
            log.info("[Validator] Mismatch: calendar tool chosen for a math-only request");
            return Optional.of("The calendar tool was selected for a request that only involves math. "
                    + "Use the calculator tool instead.");
        }
        return Optional.empty();
    }

    /**
     * Checks a final answer against what ran this turn.
     *
     * @param executedTools
     *            names of tools executed during the turn
     * @return the corrected answer, or empty when the response is accepted
     */
    public Optional<String> checkCoherence(String userText, String responseText, Collection<String> executedTools) {
        String response = responseText != null ? responseText : "";

        if (IntentFamily.MATH.matches(userText)) {
            boolean irrelevant = IRRELEVANT_TO_MATH.matcher(response).find();
            boolean numeric = DIGIT.matcher(response).find();
            boolean calculatorRan = executedTools.contains(IntentFamily.MATH.getToolName());
            if (irrelevant || !numeric) {
                log.info("[Validator] Incoherent math answer (irrelevant: {}, numeric: {}), using fallback",
                        irrelevant, numeric);
                return Optional.of(attemptMathFallback(userText).orElse(REPHRASE_MATH));
            }
            if (!calculatorRan) {
                Optional<String> local = attemptMathFallback(userText);
                if (local.isPresent()) {
                    log.info("[Validator] Calculator was not used, preferring local arithmetic");
                    return local;
                }
                log.info("[Validator] Calculator was not used and no local arithmetic applies");
                return Optional.of(REPHRASE_MATH);
            }
        }

        if (executedTools.isEmpty() && ACTION_CLAIM.matcher(response).find()) {
            log.info("[Validator] Response claims an action but no tool ran");
            return Optional.of(ACTION_NOT_COMPLETED);
        }
        return Optional.empty();
    }

    /**
     * Greetings, capability questions, thanks and farewells, and short
     * utterances that trigger no tool. No tools are advertised for these.
     */
    public boolean isConversational(String text) {
        if (text == null || text.isBlank()) {
            return true;
        }
        if (!IntentFamily.detect(text).isEmpty() || OTHER_TOOL_HINT.matcher(text).find()) {
            return false;
        }
        for (Pattern pattern : CONVERSATIONAL) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return text.trim().split("\\s+").length <= SHORT_UTTERANCE_WORDS;
    }

    /**
     * Open-ended generative requests. These are answered with
     * {@link #CREATIVE_REDIRECT} and never sent to the model.
     */
    public boolean isCreativeWriting(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        for (Pattern pattern : CREATIVE) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * The single tool to advertise when the text matches exactly one intent
     * family; empty when it matches none or several.
     */
    public Optional<String> restrictedToolName(String text) {
        Set<IntentFamily> families = IntentFamily.detect(text);
        if (families.size() != 1) {
            return Optional.empty();
        }
        return Optional.of(families.iterator().next().getToolName());
    }

    public Optional<String> attemptMathFallback(String text) {
        return ArithmeticFallback.evaluate(text);
    }

    /**
     * Replaces a model refusal with a friendly redirect.
     */
    public Optional<String> applyRefusalFallback(String responseText) {
        if (responseText == null) {
            return Optional.empty();
        }
        String lowercased = responseText.toLowerCase(Locale.ROOT);
        for (String phrase : REFUSAL_PHRASES) {
            if (lowercased.contains(phrase)) {
                log.info("[Validator] Detected refusal response, applying fallback");
                return Optional.of(REFUSAL_FALLBACK);
            }
        }
        return Optional.empty();
    }
}
