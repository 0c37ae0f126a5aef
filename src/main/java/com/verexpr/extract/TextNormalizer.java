package com.verexpr.extract;

import com.verexpr.parse.ParseNode;

/**
 * Text of a node with surrounding whitespace removed. Inner whitespace and case are untouched.
 *
 * <p>Whitespace is the Unicode White_Space property, which unlike {@link String#strip()} includes
 * the no-break spaces U+00A0, U+2007 and U+202F, and NEL U+0085.
 */
public class TextNormalizer {

    public String normalize(ParseNode node) {
        return normalize(node.text());
    }

    public String normalize(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isWhiteSpace(text.charAt(start))) {
            start++;
        }
        while (end > start && isWhiteSpace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    // All White_Space code points are in the BMP
    static boolean isWhiteSpace(char c) {
        if (c <= 0x20) {
            return c == ' ' || (c >= 0x09 && c <= 0x0D);
        }
        if (c < 0x85) {
            return false;
        }
        switch (c) {
            case 0x85:
            case 0xA0:
            case 0x1680:
            case 0x2028:
            case 0x2029:
            case 0x202F:
            case 0x205F:
            case 0x3000:
                return true;
            default:
                return c >= 0x2000 && c <= 0x200A;
        }
    }
}
