package gk.java.engine;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Shell-style endpoint pattern: {@code *} (anything, including '/'), {@code ?} (one character),
 * {@code [seq]} and {@code [!seq]}. Case-sensitive. Compiled once, when the rule is registered.
 */
final class GlobPattern {

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    static GlobPattern compile(String glob) {
        if (glob == null || glob.isEmpty()) {
            throw new InvalidRuleException("endpoint pattern must not be empty");
        }
        try {
            return new GlobPattern(glob, Pattern.compile(translate(glob), Pattern.DOTALL));
        } catch (PatternSyntaxException e) {
            throw new InvalidRuleException("malformed endpoint pattern '" + glob + "'", e);
        }
    }

    boolean matches(String endpoint) {
        return regex.matcher(endpoint).matches();
    }

    String glob() {
        return glob;
    }

    private static String translate(String glob) {
        StringBuilder out = new StringBuilder(glob.length() + 8);
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i++);
            switch (c) {
                case '*' -> out.append(".*");
                case '?' -> out.append('.');
                case '[' -> {
                    int j = i;
                    if (j < n && glob.charAt(j) == '!') j++;
                    if (j < n && glob.charAt(j) == ']') j++;
                    while (j < n && glob.charAt(j) != ']') j++;
                    if (j >= n) {
                        // unterminated class is a literal '[' as in fnmatch
                        out.append("\\[");
                    } else {
                        String body = glob.substring(i, j);
                        i = j + 1;
                        out.append('[');
                        if (body.startsWith("!")) {
                            out.append('^');
                            body = body.substring(1);
                        } else if (body.startsWith("^")) {
                            out.append("\\");
                        }
                        out.append(body.replace("\\", "\\\\").replace("[", "\\[").replace("]", "\\]")
                            .replace("&&", "&\\&"));
                        out.append(']');
                    }
                }
                default -> out.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return out.toString();
    }
}
