package org.netpreserve.pagecrawl.util;

public class LogUtils {
    public static String ellipses(String string) {
        return ellipses(string, 40);
    }

    /**
     * Shortens each quoted string in a JSON-ish log line to roughly {@code maxLength} characters.
     */
    public static String ellipses(String string, int maxLength) {
        boolean inQuotes = false;
        var output = new StringBuilder();
        var quote = new StringBuilder();
        for (int i = 0; i < string.length(); i++) {
            char c = string.charAt(i);
            if (c == '"') {
                if (inQuotes) {
                    output.append('"');
                    appendShortened(output, quote, maxLength);
                    output.append('"');
                    quote.setLength(0);
                }
                inQuotes = !inQuotes;
            } else if (inQuotes) {
                quote.append(c);
            } else {
                output.append(c);
            }
        }
        if (inQuotes) {
            output.append('"');
            appendShortened(output, quote, maxLength);
        }
        return output.toString();
    }

    private static void appendShortened(StringBuilder output, CharSequence text, int maxLength) {
        if (text.length() < maxLength) {
            output.append(text);
        } else {
            output.append(text, 0, maxLength / 2);
            output.append("...");
            output.append(text, text.length() - maxLength / 2, text.length());
        }
    }

    /**
     * Formats an error as {@code SimpleClassName: message} for error lists and progress reports.
     */
    public static String describe(Throwable e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) return e.getClass().getSimpleName();
        return e.getClass().getSimpleName() + ": " + message;
    }
}
