package com.jamra.offline.util;

/** Display titles for chapters, shared by downloads and metadata rebuilds. */
public final class ChapterTitles {

    private ChapterTitles() {
    }

    /**
     * {@code Chapter 12 - The Return}, {@code The Return}, {@code Chapter 12} or
     * {@code Chapter <id>}, depending on what is known.
     */
    public static String format(String number, String title, String chapterId) {
        boolean hasNumber = number != null && !number.isBlank();
        boolean hasTitle = title != null && !title.isBlank();

        if (hasNumber && hasTitle) {
            return "Chapter " + number + " - " + title;
        }
        if (hasTitle) {
            return title;
        }
        if (hasNumber) {
            return "Chapter " + number;
        }
        return "Chapter " + chapterId;
    }
}
