package me.golemcore.careergraph.domain.service;

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

import me.golemcore.careergraph.domain.model.ParsedCandidate;
import me.golemcore.careergraph.domain.model.ParsedJob;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based extraction of skills and a few labeled fields from free-text CVs
 * and job postings. Pure: never touches the graph.
 */
@Component
public class DocumentParser {

    private static final Pattern SKILLS_LABEL = Pattern.compile(
            "\\b(?:technical\\s+)?skills\\s*(?::|-\\s)\\s*(.+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern REQUIRED_SKILLS_LABEL = Pattern.compile(
            "\\brequired\\s+skills\\s*(?::|-\\s)\\s*(.+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern REQUIREMENTS_LABEL = Pattern.compile(
            "\\b(?:requirements|you\\s+must\\s+have|must\\s+have)\\s*(?::|-\\s)\\s*(.+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TITLE_LABEL = Pattern.compile(
            "\\btitle\\s*(?::|-\\s)\\s*(.+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPANY_LABEL = Pattern.compile(
            "\\bcompany\\s*(?::|-\\s)\\s*(.+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern SEPARATORS = Pattern.compile("[,|\\n;]+");
    private static final Pattern WORD = Pattern.compile("(?<![A-Za-z+#])[A-Za-z+#]{2,20}(?![A-Za-z+#])");
    private static final Pattern EXPERIENCE = Pattern.compile(
            "[^\\n]{0,80}?(?:\\bat\\b|@)[ \\t]+[A-Z][\\w&\\- \\t]{2,80}");

    static final int MAX_FREQUENT_WORDS = 40;
    static final int MIN_WORD_OCCURRENCES = 2;
    static final int MAX_EXPERIENCE_LINES = 10;

    public ParsedCandidate parseCandidateText(String text) {
        String source = text != null ? text : "";
        Matcher label = SKILLS_LABEL.matcher(source);
        List<String> skills = label.find()
                ? splitList(label.group(1))
                : frequentWords(source);
        return new ParsedCandidate(skills, experienceLines(source));
    }

    public ParsedJob parseJobText(String text) {
        String source = text != null ? text : "";
        List<String> required = List.of();
        Matcher requiredLabel = REQUIRED_SKILLS_LABEL.matcher(source);
        if (requiredLabel.find()) {
            required = splitList(requiredLabel.group(1));
        } else {
            Matcher requirements = REQUIREMENTS_LABEL.matcher(source);
            if (requirements.find()) {
                required = splitList(requirements.group(1));
            }
        }
        return new ParsedJob(labeled(TITLE_LABEL, source), labeled(COMPANY_LABEL, source), required);
    }

    /**
     * Splits on commas, pipes, semicolons and newlines; trims, drops empties and
     * duplicates, keeping first-occurrence order.
     */
    static List<String> splitList(String raw) {
        LinkedHashSet<String> tokens = new LinkedHashSet<>();
        for (String token : SEPARATORS.split(raw)) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                tokens.add(trimmed);
            }
        }
        return new ArrayList<>(tokens);
    }

    private static List<String> frequentWords(String text) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            counts.merge(matcher.group().toLowerCase(Locale.ROOT), 1, Integer::sum);
        }
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
        ranked.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));

        List<String> words = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : ranked) {
            if (words.size() == MAX_FREQUENT_WORDS || entry.getValue() < MIN_WORD_OCCURRENCES) {
                break;
            }
            words.add(entry.getKey());
        }
        return words;
    }

    private static List<String> experienceLines(String text) {
        List<String> lines = new ArrayList<>();
        Matcher matcher = EXPERIENCE.matcher(text);
        while (matcher.find() && lines.size() < MAX_EXPERIENCE_LINES) {
            String line = matcher.group().trim();
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }
        return lines;
    }

    private static String labeled(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1).trim() : "";
    }
}
