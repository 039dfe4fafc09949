package com.communitycare.reporting.util;

import java.util.Locale;

public class LabelNormalizer {

    /**
     * Strips display decoration from a category or priority label: leading emoji/symbols and any
     * " - description" suffix. "🛣️ Road - Potholes or road damage" becomes "Road".
     */
    public static String canonical(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        int dash = s.indexOf(" - ");
        if (dash >= 0) s = s.substring(0, dash);
        int i = 0;
        while (i < s.length()) {
            int cp = s.codePointAt(i);
            if (Character.isLetterOrDigit(cp)) break;
            i += Character.charCount(cp);
        }
        return s.substring(i).trim().replaceAll("\\s+", " ");
    }

    /** Maps "In Progress", "in-progress", " in_progress " to "IN_PROGRESS"; blank input maps to null. */
    public static String enumKey(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.isEmpty()) return null;
        return s.replaceAll("[\\s\\-_]+", "_").toUpperCase(Locale.ROOT);
    }
}
