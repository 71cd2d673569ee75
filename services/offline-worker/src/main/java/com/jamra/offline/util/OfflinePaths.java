package com.jamra.offline.util;

import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Directory layout of the offline store:
 * <pre>
 * {dataDir}/offline/{extensionId}/{mangaSlug}/metadata.json
 *                                            /cover.jpg
 *                                            /chapters/chapter-0001/metadata.json
 *                                            /chapters/chapter-0001/page-0001.jpg
 * </pre>
 */
public class OfflinePaths {

    public static final String METADATA_FILE = "metadata.json";
    public static final String CHAPTERS_DIR = "chapters";
    public static final String DEFAULT_COVER = "cover.jpg";

    private static final Pattern LEADING_NUMBER = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");

    private final Path dataDir;

    public OfflinePaths(Path dataDir) {
        Path absolute = dataDir.toAbsolutePath().normalize();
        // tolerate being pointed at the offline folder itself
        if (absolute.getFileName() != null && "offline".equals(absolute.getFileName().toString())
                && absolute.getParent() != null) {
            absolute = absolute.getParent();
        }
        this.dataDir = absolute;
    }

    public Path dataDir() {
        return dataDir;
    }

    public Path offlineDir() {
        return dataDir.resolve("offline");
    }

    public Path extensionDir(String extensionId) {
        return offlineDir().resolve(extensionId);
    }

    public Path mangaDir(String extensionId, String mangaSlug) {
        return extensionDir(extensionId).resolve(mangaSlug);
    }

    public Path mangaMetadataFile(String extensionId, String mangaSlug) {
        return mangaDir(extensionId, mangaSlug).resolve(METADATA_FILE);
    }

    public Path chaptersDir(String extensionId, String mangaSlug) {
        return mangaDir(extensionId, mangaSlug).resolve(CHAPTERS_DIR);
    }

    public Path chapterDir(String extensionId, String mangaSlug, String folderName) {
        return chaptersDir(extensionId, mangaSlug).resolve(folderName);
    }

    public Path chapterMetadataFile(String extensionId, String mangaSlug, String folderName) {
        return chapterDir(extensionId, mangaSlug, folderName).resolve(METADATA_FILE);
    }

    public Path pagePath(String extensionId, String mangaSlug, String folderName, String filename) {
        return chapterDir(extensionId, mangaSlug, folderName).resolve(filename);
    }

    /**
     * Lowercases and replaces everything outside {@code [a-z0-9-]} with a dash, collapsing runs
     * and trimming dashes at either end.
     */
    public static String sanitizeSlug(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9-]", "-")
                .replaceAll("-+", "-")
                .replaceAll("^-|-$", "");
    }

    /**
     * {@code chapter-0001} for whole chapter numbers and {@code chapter-0010-5} for decimal ones,
     * otherwise {@code chapter-} followed by the value with non-alphanumerics replaced by dashes.
     */
    public static String chapterFolderName(String numberOrId) {
        String value = numberOrId == null ? "" : numberOrId.trim();
        Matcher matcher = LEADING_NUMBER.matcher(value);
        if (!matcher.find()) {
            return "chapter-" + value.replaceAll("[^A-Za-z0-9]", "-");
        }
        String number = matcher.group();
        String folder = String.format(Locale.ROOT, "chapter-%04d", (long) Math.floor(Double.parseDouble(number)));
        int dot = number.indexOf('.');
        // trailing zeros carry no value: "10.50" and "10.5" are the same chapter
        String fraction = dot < 0 ? "" : number.substring(dot + 1).replaceAll("0+$", "");
        return fraction.isEmpty() ? folder : folder + "-" + fraction;
    }

    /** Folder keyed on the chapter id alone, used when the number-based folder is owned by another chapter. */
    public static String chapterFolderNameForId(String chapterId) {
        return "chapter-id-" + (chapterId == null ? "" : chapterId.trim().replaceAll("[^A-Za-z0-9]", "-"));
    }

    public static String pageFilename(int index, String extension) {
        return String.format(Locale.ROOT, "page-%04d.%s", index, extension);
    }

    /**
     * Image extension from the mime type, then from the URL path, defaulting to {@code jpg}.
     */
    public static String imageExtension(String url, String mimeType) {
        if (mimeType != null) {
            String mime = mimeType.toLowerCase(Locale.ROOT);
            if (mime.contains("png")) return "png";
            if (mime.contains("webp")) return "webp";
            if (mime.contains("gif")) return "gif";
            if (mime.contains("jpeg") || mime.contains("jpg")) return "jpg";
        }

        if (url != null) {
            String path = url.split("\\?")[0];
            int slash = path.lastIndexOf('/');
            String name = slash >= 0 ? path.substring(slash + 1) : path;
            int dot = name.lastIndexOf('.');
            if (dot >= 0 && dot < name.length() - 1) {
                return name.substring(dot + 1).toLowerCase(Locale.ROOT);
            }
        }
        return "jpg";
    }
}
