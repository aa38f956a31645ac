package org.muma.mini.kv.pubsub;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * glob 风格匹配，用于 PSUBSCRIBE 与 KEYS。
 * {@code *} 任意长度，{@code ?} 单个字符，{@code [abc]} 字符集合，其余字符按字面匹配，必须整串匹配。
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) {
        Pattern regex;
        try {
            regex = Pattern.compile(toRegex(glob), Pattern.DOTALL);
        } catch (PatternSyntaxException e) {
            // 非法模式永远不匹配
            regex = null;
        }
        return new GlobPattern(glob, regex);
    }

    public static boolean matches(String glob, String text) {
        return compile(glob).matches(text);
    }

    public boolean matches(String text) {
        return regex != null && regex.matcher(text).matches();
    }

    public boolean isValid() {
        return regex != null;
    }

    public String glob() {
        return glob;
    }

    static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder(glob.length() + 8);
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> sb.append(".*");
                case '?' -> sb.append('.');
                case '[' -> {
                    int end = glob.indexOf(']', i + 1);
                    if (end < 0) {
                        throw new PatternSyntaxException("Unclosed character class", glob, i);
                    }
                    String body = glob.substring(i + 1, end);
                    sb.append('[');
                    if (body.startsWith("^") || body.startsWith("!")) {
                        sb.append('^');
                        body = body.substring(1);
                    }
                    sb.append(body.replace("\\", "\\\\").replace("[", "\\["));
                    sb.append(']');
                    i = end;
                }
                case '\\' -> {
                    if (i + 1 < glob.length()) {
                        i++;
                    }
                    sb.append(Pattern.quote(String.valueOf(glob.charAt(i))));
                }
                default -> sb.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return glob;
    }
}
