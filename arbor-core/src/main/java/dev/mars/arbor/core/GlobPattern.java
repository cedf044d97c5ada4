/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */
package dev.mars.arbor.core;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Shell-style pattern for a single path component: {@code *}, {@code ?},
 * {@code [abc]}, {@code [!abc]}, {@code {a,b}} and backslash escapes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class GlobPattern {
    private static final char BACKSLASH = '\\';

    private final String glob;
    private final Pattern compiled;
    private final boolean wildcard;

    public GlobPattern(String glob) {
        this.glob = glob;
        StringBuilder regex = new StringBuilder();
        boolean inSet = false;
        int groups = 0;
        boolean hasWildcard = false;
        int length = glob.length();

        for (int i = 0; i < length; i++) {
            char c = glob.charAt(i);
            switch (c) {
                case BACKSLASH:
                    if (++i >= length) {
                        throw new PatternSyntaxException("Missing escaped character", glob, i);
                    }
                    appendLiteral(regex, glob.charAt(i));
                    break;
                case '*':
                    regex.append(inSet ? "*" : ".*");
                    hasWildcard |= !inSet;
                    break;
                case '?':
                    regex.append(inSet ? "?" : ".");
                    hasWildcard |= !inSet;
                    break;
                case '[':
                    if (inSet) {
                        throw new PatternSyntaxException("Nested character class", glob, i);
                    }
                    inSet = true;
                    hasWildcard = true;
                    regex.append('[');
                    if (i + 1 < length && glob.charAt(i + 1) == '!') {
                        regex.append('^');
                        i++;
                    }
                    break;
                case ']':
                    regex.append(inSet ? "]" : "\\]");
                    inSet = false;
                    break;
                case '{':
                    if (inSet) {
                        regex.append("\\{");
                    } else {
                        regex.append("(?:");
                        groups++;
                        hasWildcard = true;
                    }
                    break;
                case ',':
                    regex.append(groups > 0 && !inSet ? "|" : ",");
                    break;
                case '}':
                    if (groups > 0 && !inSet) {
                        regex.append(')');
                        groups--;
                    } else {
                        regex.append("\\}");
                    }
                    break;
                case '-':
                case '^':
                    regex.append(inSet && c == '-' ? "-" : "\\" + c);
                    break;
                default:
                    appendLiteral(regex, c);
            }
        }

        if (inSet) {
            throw new PatternSyntaxException("Unclosed character class", glob, length);
        }
        if (groups > 0) {
            throw new PatternSyntaxException("Unclosed group", glob, length);
        }
        this.compiled = Pattern.compile(regex.toString());
        this.wildcard = hasWildcard;
    }

    private static void appendLiteral(StringBuilder regex, char c) {
        if (!Character.isLetterOrDigit(c)) {
            regex.append(BACKSLASH);
        }
        regex.append(c);
    }

    public boolean matches(CharSequence name) {
        return compiled.matcher(name).matches();
    }

    /**
     * False for a pattern that only matches its own literal text.
     */
    public boolean hasWildcard() {
        return wildcard;
    }

    @Override
    public String toString() {
        return glob;
    }
}
