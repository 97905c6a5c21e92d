package io.looming.input;

/**
 * Decides what of an already-executed act's input is replayed to later acts.
 */
public final class HistorySummarizer {
    private final int autoSummaryChars;

    public HistorySummarizer(int autoSummaryChars) {
        this.autoSummaryChars = autoSummaryChars;
    }

    /**
     * @return the text to replay, or null when the input is dropped from history
     */
    public String historyText(ResolvedContent content) {
        return switch (content.retention()) {
            case DROP -> null;
            case SUMMARY -> content.summary();
            case FULL -> content.text().length() > autoSummaryChars ? content.summary() : content.text();
        };
    }

    public static String tableSummary(String table, int rows) {
        return "[Table: " + table + ", " + rows + " rows queried]";
    }

    public static String platformSummary(String platform, String command) {
        return "[Platform command: " + platform + "." + command + "]";
    }

    public static String textSummary(String text) {
        long kb = Math.max(1L, Math.round(text.length() / 1024d));
        return "[Text: ~" + kb + "KB]";
    }
}
