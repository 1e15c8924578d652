/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.compiler;

import com.helios.ignore.api.exceptions.PatternCompileException;
import com.helios.ignore.api.model.PathPattern;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Translates shell-style globs into anchored regular expressions with path-name semantics.
 *
 * <ul>
 *   <li>{@code **} matches any sequence of characters, including {@code /}</li>
 *   <li>{@code *} matches any sequence of characters except {@code /}</li>
 *   <li>{@code ?} matches exactly one character other than {@code /}</li>
 *   <li>{@code [...]} is a character class; {@code [!...]} or {@code [^...]} negates it and
 *       never matches {@code /}</li>
 *   <li>{@code \x} matches {@code x} literally</li>
 * </ul>
 *
 * Control characters are rejected. With case folding enabled the generated regex is
 * prefixed with {@code (?i)}, so the canonical source differs between the two modes.
 */
public final class GlobTranslator {

    private static final String REGEX_META = ".+()|{}^$";

    private final boolean caseInsensitive;

    public GlobTranslator() {
        this(false);
    }

    public GlobTranslator(boolean caseInsensitive) {
        this.caseInsensitive = caseInsensitive;
    }

    /**
     * @param glob the glob text, already stripped of rule prefixes such as {@code !} or {@code /}
     * @return a compiled pattern matching whole paths
     * @throws PatternCompileException if the glob is malformed
     */
    public PathPattern translate(String glob) {
        String regex = toRegex(glob);
        try {
            int flags = caseInsensitive ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0;
            return new RegexPathPattern(Pattern.compile(regex, flags));
        } catch (PatternSyntaxException e) {
            throw new PatternCompileException(glob, e.getDescription(), null, e);
        }
    }

    String toRegex(String glob) {
        StringBuilder sb = new StringBuilder(glob.length() * 2 + 8);
        if (caseInsensitive) {
            sb.append("(?i)");
        }
        sb.append('^');
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (isControl(c)) {
                throw new PatternCompileException(glob,
                        String.format("unescaped control character U+%04X at index %d", (int) c, i));
            }
            switch (c) {
                case '*':
                    if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                        sb.append(".*");
                        i += 2;
                    } else {
                        sb.append("[^/]*");
                        i++;
                    }
                    break;
                case '?':
                    sb.append("[^/]");
                    i++;
                    break;
                case '[':
                    i = appendCharacterClass(glob, i, sb);
                    break;
                case '\\':
                    if (i + 1 >= glob.length()) {
                        throw new PatternCompileException(glob, "trailing escape character");
                    }
                    appendLiteral(glob.charAt(i + 1), sb);
                    i += 2;
                    break;
                default:
                    appendLiteral(c, sb);
                    i++;
                    break;
            }
        }
        sb.append('$');
        return sb.toString();
    }

    /**
     * Appends the class starting at {@code start} (the '[') and returns the index after its ']'.
     */
    private static int appendCharacterClass(String glob, int start, StringBuilder sb) {
        int i = start + 1;
        sb.append('[');
        if (i < glob.length() && (glob.charAt(i) == '!' || glob.charAt(i) == '^')) {
            sb.append("^/");
            i++;
        }
        boolean first = true;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == ']' && !first) {
                sb.append(']');
                return i + 1;
            }
            if (isControl(c)) {
                throw new PatternCompileException(glob,
                        String.format("unescaped control character U+%04X at index %d", (int) c, i));
            }
            if (c == '\\') {
                if (i + 1 >= glob.length()) {
                    break;
                }
                char escaped = glob.charAt(i + 1);
                if (!Character.isLetterOrDigit(escaped)) {
                    sb.append('\\');
                }
                sb.append(escaped);
                i += 2;
            } else if (c == '[' || c == ']' || c == '&' || c == '^') {
                // these carry meaning inside a Java character class
                sb.append('\\').append(c);
                i++;
            } else {
                sb.append(c);
                i++;
            }
            first = false;
        }
        throw new PatternCompileException(glob, "unterminated character class at index " + start);
    }

    private static boolean isControl(char c) {
        return c < 0x20 || c == 0x7f;
    }

    private static void appendLiteral(char c, StringBuilder sb) {
        if (REGEX_META.indexOf(c) >= 0 || c == '[' || c == ']' || c == '*' || c == '?' || c == '\\') {
            sb.append('\\');
        }
        sb.append(c);
    }
}
