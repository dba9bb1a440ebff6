package com.trackflow.service;

import java.util.Locale;

/**
 * Best-effort descriptive fields derived from an uploaded filename.
 * {@code "daft_punk - around-the.world.mp3"} gives artist {@code "Daft Punk"}
 * and title {@code "Around The World"}.
 */
public record FilenameMetadata(String title, String artist, String format) {

    public static FilenameMetadata of(String filename) {
        int dot = filename.lastIndexOf('.');
        String base = dot > 0 ? filename.substring(0, dot) : filename;
        String format = dot > 0 ? filename.substring(dot + 1).toLowerCase(Locale.ROOT) : "";

        String artist = null;
        String title = base;
        int sep = base.indexOf(" - ");
        if (sep > 0 && sep + 3 < base.length()) {
            artist = clean(base.substring(0, sep));
            title = base.substring(sep + 3);
        }
        String cleanedTitle = clean(title);
        if (cleanedTitle.isEmpty()) {
            cleanedTitle = clean(base);
        }
        return new FilenameMetadata(cleanedTitle, artist == null || artist.isEmpty() ? null : artist, format);
    }

    static String clean(String raw) {
        String spaced = raw.replace('_', ' ').replace('-', ' ').replace('.', ' ').trim();
        return titleCase(spaced.replaceAll("\\s+", " "));
    }

    static String titleCase(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                out.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                out.append(c);
                startOfWord = Character.isWhitespace(c);
            }
        }
        return out.toString();
    }
}
