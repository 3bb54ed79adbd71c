package com.hcl2map.transform;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns heredoc tokens ({@code <<EOF ... EOF} and the indented {@code <<-EOF ... EOF})
 * into quoted string literals.
 */
public final class HeredocNormalizer {
    private static final Pattern HEREDOC =
            Pattern.compile("<<([a-zA-Z][a-zA-Z0-9._-]+)\n([\\s\\S]*)\\1");
    private static final Pattern HEREDOC_TRIM =
            Pattern.compile("<<-([a-zA-Z][a-zA-Z0-9._-]+)\n([\\s\\S]*)\\1");

    private static final String TRAILING_CHARS = "\n\t ";

    private HeredocNormalizer() {
    }

    public static String normalize(String token) {
        return quote(stripTrailing(body(HEREDOC, token)));
    }

    /**
     * The {@code <<-} form. The smallest count of leading spaces over all lines is removed
     * from every line; tabs do not count as indentation.
     */
    public static String normalizeTrimmed(String token) {
        String text = stripTrailing(body(HEREDOC_TRIM, token));
        String[] lines = text.split("\n", -1);

        int minSpaces = Integer.MAX_VALUE;
        for (String line : lines) {
            minSpaces = Math.min(minSpaces, leadingSpaces(line));
        }

        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(lines[i], minSpaces, lines[i].length());
        }
        return quote(sb.toString());
    }

    private static String body(Pattern pattern, String token) {
        Matcher matcher = pattern.matcher(token);
        if (!matcher.lookingAt()) {
            throw new HclTransformException("Invalid Heredoc token: " + token);
        }
        return matcher.group(2);
    }

    private static String stripTrailing(String text) {
        int end = text.length();
        while (end > 0 && TRAILING_CHARS.indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        return text.substring(0, end);
    }

    private static int leadingSpaces(String line) {
        int count = 0;
        while (count < line.length() && line.charAt(count) == ' ') {
            count++;
        }
        return count;
    }

    private static String quote(String text) {
        return "\"" + text + "\"";
    }
}
