// SPDX-License-Identifier: Apache-2.0
package org.tallymark.render;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;

/**
 * Writes JSON string literals.
 */
final class JsonStrings {

    private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    private JsonStrings() {}

    /**
     * Appends the value as a quoted JSON string. Control characters are written as short escapes where JSON
     * has one and as {@code \u005Cu00XX} otherwise; quote, backslash and slash are escaped with a backslash.
     *
     * @param output where to append
     * @param value  the string
     * @throws IOException if appending fails
     */
    static void appendQuoted(@NonNull Appendable output, @NonNull String value) throws IOException {
        output.append('"');
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            switch (c) {
                case '\b':
                    output.append("\\b");
                    break;
                case '\t':
                    output.append("\\t");
                    break;
                case '\n':
                    output.append("\\n");
                    break;
                case '\f':
                    output.append("\\f");
                    break;
                case '\r':
                    output.append("\\r");
                    break;
                case '"':
                case '\\':
                case '/':
                    output.append('\\').append(c);
                    break;
                default:
                    if (c < 0x20) {
                        output.append("\\u00").append(HEX_DIGITS[c >> 4]).append(HEX_DIGITS[c & 0xF]);
                    } else {
                        output.append(c);
                    }
            }
        }
        output.append('"');
    }
}
