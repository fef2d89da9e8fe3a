package net.agentcharter.application.generation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Lenient parser for model-produced tag lists.
 *
 * <p>Accepts a JSON array, a JSON object with a {@code tags} array, quoted strings, or a plain list
 * split on newlines, commas, semicolons or pipes. Tags are title-cased, limited to
 * {@value #MAX_WORDS_PER_TAG} words, deduplicated ignoring case and capped at {@value #MAX_TAGS}.</p>
 */
@Component
public class TagListParser {

    public static final int MAX_TAGS = 3;
    public static final int MAX_WORDS_PER_TAG = 3;

    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"|'([^']+)'");
    private static final Pattern LIST_MARKER = Pattern.compile("^(?:[-*•#]+|\\d+[.)])\\s*");
    private static final String[] SEPARATORS = {"\n", ",", ";", "|"};

    private final ObjectMapper objectMapper;

    public TagListParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<String> parse(String content) {
        String cleaned = ArtifactTextNormalizer.stripCodeFence(content);
        if (cleaned.isEmpty()) {
            return List.of();
        }
        List<String> parsed = parseJson(cleaned);
        if (parsed.isEmpty()) {
            parsed = parseQuoted(cleaned);
        }
        if (parsed.isEmpty()) {
            parsed = splitOnSeparator(cleaned);
        }
        if (parsed.isEmpty()) {
            parsed = List.of(cleaned);
        }
        return normalize(parsed);
    }

    /**
     * Cleans raw tag strings into stored tags.
     */
    public static List<String> normalize(List<String> rawTags) {
        Map<String, String> unique = new LinkedHashMap<>();
        for (String raw : rawTags) {
            if (unique.size() >= MAX_TAGS) {
                break;
            }
            String tag = normalizeTag(raw);
            if (!tag.isEmpty()) {
                unique.putIfAbsent(tag.toLowerCase(Locale.ROOT), tag);
            }
        }
        return List.copyOf(unique.values());
    }

    private List<String> parseJson(String cleaned) {
        JsonNode root;
        try {
            root = objectMapper.readTree(cleaned);
        } catch (JacksonException ex) {
            return List.of();
        }
        if (root == null) {
            return List.of();
        }
        if (root.isArray()) {
            return textValues(root);
        }
        if (root.isObject()) {
            JsonNode tags = root.get("tags");
            if (tags != null && tags.isArray()) {
                return textValues(tags);
            }
            return textValues(root);
        }
        if (root.isString()) {
            return List.of(root.asString());
        }
        return List.of();
    }

    private static List<String> textValues(JsonNode container) {
        List<String> values = new ArrayList<>();
        for (JsonNode element : container) {
            if (element.isValueNode() && !element.isNull()) {
                values.add(element.asString());
            }
        }
        return values;
    }

    private static List<String> parseQuoted(String cleaned) {
        List<String> values = new ArrayList<>();
        Matcher matcher = QUOTED.matcher(cleaned);
        while (matcher.find()) {
            values.add(matcher.group(1) != null ? matcher.group(1) : matcher.group(2));
        }
        return values;
    }

    private static List<String> splitOnSeparator(String cleaned) {
        for (String separator : SEPARATORS) {
            if (!cleaned.contains(separator)) {
                continue;
            }
            List<String> parts = new ArrayList<>();
            for (String part : cleaned.split(Pattern.quote(separator))) {
                if (StringUtils.hasText(part)) {
                    parts.add(part.trim());
                }
            }
            if (!parts.isEmpty()) {
                return parts;
            }
        }
        return List.of();
    }

    private static String normalizeTag(String raw) {
        if (raw == null) {
            return "";
        }
        String text = LIST_MARKER.matcher(raw.trim()).replaceFirst("");
        text = text.replaceAll("^[\"'`\\[(]+|[\"'`\\])]+$", "").trim();
        text = text.replaceAll("[.!?:]+$", "").trim();
        if (text.isEmpty()) {
            return "";
        }
        String[] words = text.split("\\s+");
        StringBuilder tag = new StringBuilder();
        for (int i = 0; i < words.length && i < MAX_WORDS_PER_TAG; i++) {
            if (i > 0) {
                tag.append(' ');
            }
            tag.append(titleCase(words[i]));
        }
        return tag.toString();
    }

    private static String titleCase(String word) {
        if (word.length() <= 4 && word.equals(word.toUpperCase(Locale.ROOT)) && word.chars().anyMatch(Character::isLetter)) {
            return word;
        }
        String lower = word.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
