package com.autonomous.cos.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a task description to a learning bucket. Rules are tried in order and the
 * first match wins, so the markers and defect keywords come before the broad ones.
 */
@Component
public class TaskClassifier {

    public static final String FALLBACK = "general";

    private record Rule(Pattern pattern, Function<Matcher, String> bucket) {
        static Rule fixed(String regex, String bucket) {
            return new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), m -> bucket);
        }

        static Rule captured(String regex, String prefix) {
            return new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE),
                m -> prefix + m.group(1).toLowerCase(Locale.ROOT));
        }
    }

    private static final List<Rule> RULES = List.of(
        Rule.captured("\\[self-improvement]\\s*([\\w-]+)", "self-improve:"),
        Rule.captured("\\[improvement:[^\\]]*]\\s*([\\w-]+)", "task:"),
        Rule.fixed("\\[idle review]", "idle-review"),
        Rule.fixed("\\[auto(?:-fix)?]", "auto-fix"),
        Rule.fixed("\\b(?:fix\\w*|bugs?|broken|crash\\w*|errors?)\\b", "bug-fix"),
        Rule.fixed("\\b(?:refactor\\w*|clean ?up)\\b", "refactor"),
        Rule.fixed("\\b(?:tests?|testing|coverage)\\b", "testing"),
        Rule.fixed("\\b(?:security|vulnerab\\w*)\\b", "security"),
        Rule.fixed("\\b(?:docs?|documentation|readme)\\b", "documentation"),
        Rule.fixed("\\b(?:performance|optimi[sz]\\w*|slow\\w*)\\b", "performance"),
        Rule.fixed("\\b(?:mobile|responsive)\\b", "mobile-responsive"),
        Rule.fixed("\\b(?:ui|layout|css|styles?|styling)\\b", "ui"),
        Rule.fixed("\\b(?:add\\w*|implement\\w*|features?|create\\w*)\\b", "feature")
    );

    public String classify(String description) {
        if (description == null || description.isBlank()) {
            return FALLBACK;
        }
        for (Rule rule : RULES) {
            Matcher matcher = rule.pattern().matcher(description);
            if (matcher.find()) {
                return rule.bucket().apply(matcher);
            }
        }
        return FALLBACK;
    }
}
