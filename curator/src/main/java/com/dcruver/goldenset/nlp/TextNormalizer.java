package com.dcruver.goldenset.nlp;

import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonicalizes spec text into a comparable form and cuts it into word shingles.
 * Pure and deterministic; every similarity computation goes through here.
 */
@Component
public class TextNormalizer {

    public static final int SHINGLE_SIZE = 3;

    // Platform config filenames and the wildcard bind address are template noise
    private static final List<String> NOISE_LITERALS = List.of("replit.toml", "replit.nix", "0.0.0.0");

    private static final Pattern YAML_FRONT_MATTER = Pattern.compile("\\A---\\s*\\n.*?\\n---\\s*\\n", Pattern.DOTALL);
    private static final Pattern H2_HEADER = Pattern.compile("^##\\s+.*$", Pattern.MULTILINE);
    private static final Pattern FENCED_CODE = Pattern.compile("```[^`]*```", Pattern.DOTALL);
    private static final Pattern WORD = Pattern.compile("\\b[a-zA-Z0-9_]+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Apply all normalization steps in fixed order:
     * HTML unescape, front matter, H2 headers, noise literals, fenced code.
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = Parser.unescapeEntities(text, false);
        result = YAML_FRONT_MATTER.matcher(result).replaceFirst("");
        result = stripH2Headers(result);
        for (String literal : NOISE_LITERALS) {
            result = result.replace(literal, "");
        }
        result = FENCED_CODE.matcher(result).replaceAll("");
        return result;
    }

    public String stripH2Headers(String text) {
        return H2_HEADER.matcher(text).replaceAll("");
    }

    /**
     * Lowercase ASCII word tokens
     */
    public List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    /**
     * Stride-1 n-grams joined by a single space; max(0, len - n + 1) of them.
     */
    public List<String> shingle(List<String> tokens, int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("Shingle size must be positive: " + n);
        }
        int count = Math.max(0, tokens.size() - n + 1);
        List<String> shingles = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            shingles.add(String.join(" ", tokens.subList(i, i + n)));
        }
        return shingles;
    }

    /**
     * Word-trigram set of the normalized text
     */
    public Set<String> shingleSet(String text) {
        return new LinkedHashSet<>(shingle(tokenize(normalize(text)), SHINGLE_SIZE));
    }
}
