package com.purchasingpower.issueflow.workflow;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the files whose contents go into the prompts. Deterministic for a given file list and issue text.
 *
 * <ol>
 *   <li>well-known project files, in a fixed order;</li>
 *   <li>paths quoted in the issue, in order of appearance;</li>
 *   <li>up to 8 paths ranked by how many issue keywords they contain;</li>
 *   <li>the first 3 files when nothing matched.</li>
 * </ol>
 * At most 10 files are returned.
 */
@Component
public class FileSelector {

    static final List<String> COMMON_FILES = List.of(
            "README.md", "pyproject.toml", "requirements.txt", "package.json", "pom.xml", "build.gradle");

    static final int MAX_KEYWORD_MATCHES = 8;
    static final int FALLBACK_COUNT = 3;
    static final int MAX_SELECTED = 10;

    private static final Pattern PATH_PATTERN = Pattern.compile(
            "(?:\\./|/)?[\\w./-]+\\.(?:py|md|txt|toml|yml|yaml|json|java|js|ts|xml|gradle)(?!\\w)");
    private static final Pattern WORD_PATTERN = Pattern.compile("[a-z0-9_/-]+");

    public List<String> select(List<String> files, String issueText) {
        Set<String> available = new LinkedHashSet<>(files);
        Set<String> selected = new LinkedHashSet<>();

        for (String common : COMMON_FILES) {
            if (available.contains(common)) {
                selected.add(common);
            }
        }

        for (String mentioned : mentionedPaths(issueText)) {
            if (available.contains(mentioned)) {
                selected.add(mentioned);
            }
        }

        Set<String> keywords = keywords(issueText);
        List<ScoredPath> scored = new ArrayList<>();
        for (String path : files) {
            if (selected.contains(path)) {
                continue;
            }
            String lower = path.toLowerCase(Locale.ROOT);
            int score = (int) keywords.stream().filter(lower::contains).count();
            if (score > 0) {
                scored.add(new ScoredPath(path, score));
            }
        }
        // List.sort is stable, so equal scores keep enumeration order
        scored.sort(Comparator.comparingInt(ScoredPath::score).reversed());
        scored.stream().limit(MAX_KEYWORD_MATCHES).forEach(s -> selected.add(s.path()));

        if (selected.isEmpty()) {
            files.stream().limit(FALLBACK_COUNT).forEach(selected::add);
        }
        return selected.stream().limit(MAX_SELECTED).toList();
    }

    static List<String> mentionedPaths(String text) {
        List<String> paths = new ArrayList<>();
        if (text == null) {
            return paths;
        }
        Matcher matcher = PATH_PATTERN.matcher(text);
        while (matcher.find()) {
            String path = matcher.group();
            while (path.startsWith("./") || path.startsWith("/")) {
                path = path.startsWith("./") ? path.substring(2) : path.substring(1);
            }
            if (!path.isEmpty() && !paths.contains(path)) {
                paths.add(path);
            }
        }
        return paths;
    }

    static Set<String> keywords(String text) {
        Set<String> words = new LinkedHashSet<>();
        if (text == null) {
            return words;
        }
        Matcher matcher = WORD_PATTERN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            if (matcher.group().length() > 2) {
                words.add(matcher.group());
            }
        }
        return words;
    }

    private record ScoredPath(String path, int score) {
    }
}
