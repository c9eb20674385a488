package com.datapatch.transform;

/**
 * Decodes quoted string tokens.
 */
public final class StringLiterals {

    private StringLiterals() {
        // Utility class
    }

    /**
     * Strips matching surrounding quotes (single or double) and decodes backslash escapes.
     * Unknown escapes keep the escaped character.
     */
    public static String unescape(String token) {
        String body = token;
        if (body.length() >= 2) {
            char first = body.charAt(0);
            if ((first == '"' || first == '\'') && body.charAt(body.length() - 1) == first) {
                body = body.substring(1, body.length() - 1);
            }
        }
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                continue;
            }
            char escaped = body.charAt(++i);
            switch (escaped) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case '0' -> sb.append('\0');
                case 'u' -> {
                    if (i + 4 < body.length() && isHex(body, i + 1, i + 5)) {
                        sb.append((char) Integer.parseInt(body.substring(i + 1, i + 5), 16));
                        i += 4;
                    } else {
                        sb.append('u');
                    }
                }
                default -> sb.append(escaped);
            }
        }
        return sb.toString();
    }

    private static boolean isHex(String text, int from, int to) {
        for (int i = from; i < to; i++) {
            if (Character.digit(text.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
