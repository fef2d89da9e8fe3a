package net.agentcharter.application.generation;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.util.StringUtils;

/**
 * Cleans model output into the shape each text artifact is stored in.
 */
public final class ArtifactTextNormalizer {

    public static final int SHORT_DESCRIPTION_MAX_CHARS = 160;
    public static final int MINI_DESCRIPTION_MAX_WORDS = 5;
    public static final int MINI_DESCRIPTION_MAX_CHARS = 40;
    public static final int VISUAL_DESCRIPTION_MAX_CHARS = 1200;

    private static final Pattern CODE_FENCE = Pattern.compile("^```[\\w-]*\\s*|\\s*```$");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final String ELLIPSIS = "…";

    private ArtifactTextNormalizer() {
    }

    /**
     * Removes a surrounding markdown code fence, if any.
     */
    public static String stripCodeFence(String text) {
        if (text == null) {
            return "";
        }
        return CODE_FENCE.matcher(text.trim()).replaceAll("").trim();
    }

    /**
     * Single line, without wrapping quotes, at most {@value #SHORT_DESCRIPTION_MAX_CHARS} characters.
     */
    public static String shortDescription(String raw) {
        String text = stripQuotes(collapseWhitespace(stripCodeFence(raw)));
        return truncateAtWord(text, SHORT_DESCRIPTION_MAX_CHARS);
    }

    /**
     * At most {@value #MINI_DESCRIPTION_MAX_WORDS} words and {@value #MINI_DESCRIPTION_MAX_CHARS}
     * characters, trailing punctuation removed.
     */
    public static String miniDescription(String raw) {
        String text = stripQuotes(collapseWhitespace(stripCodeFence(raw)));
        if (text.isEmpty()) {
            return "";
        }
        String limited = Arrays.stream(text.split(" "))
            .limit(MINI_DESCRIPTION_MAX_WORDS)
            .collect(Collectors.joining(" "));
        while (limited.length() > MINI_DESCRIPTION_MAX_CHARS && limited.contains(" ")) {
            limited = limited.substring(0, limited.lastIndexOf(' '));
        }
        if (limited.length() > MINI_DESCRIPTION_MAX_CHARS) {
            limited = limited.substring(0, MINI_DESCRIPTION_MAX_CHARS);
        }
        return stripTrailingPunctuation(limited);
    }

    /**
     * One paragraph of at most {@value #VISUAL_DESCRIPTION_MAX_CHARS} characters.
     */
    public static String visualDescription(String raw) {
        return truncateAtWord(collapseWhitespace(stripCodeFence(raw)), VISUAL_DESCRIPTION_MAX_CHARS);
    }

    static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE_RUN.matcher(text.trim()).replaceAll(" ");
    }

    static String truncateAtWord(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        String cut = text.substring(0, maxChars - ELLIPSIS.length());
        int lastSpace = cut.lastIndexOf(' ');
        if (lastSpace > maxChars / 2) {
            cut = cut.substring(0, lastSpace);
        }
        return stripTrailingPunctuation(cut) + ELLIPSIS;
    }

    private static String stripQuotes(String text) {
        String result = text;
        while (result.length() >= 2 && isQuote(result.charAt(0)) && isQuote(result.charAt(result.length() - 1))) {
            result = result.substring(1, result.length() - 1).trim();
        }
        return result;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'' || c == '“' || c == '”' || c == '`';
    }

    private static String stripTrailingPunctuation(String text) {
        String result = text.trim();
        while (StringUtils.hasLength(result) && ".,;:!-".indexOf(result.charAt(result.length() - 1)) >= 0) {
            result = result.substring(0, result.length() - 1).trim();
        }
        return result;
    }
}
