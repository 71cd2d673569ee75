package com.jamra.offline.catalog;

/**
 * Source of manga details and page lists. The worker never scrapes sources itself.
 */
public interface ContentProvider {

    /**
     * @throws CatalogException when the provider cannot be reached or answers with an error
     */
    MangaDetails fetchMangaDetails(String extensionId, String mangaId);

    /**
     * @throws CatalogException when the provider cannot be reached or answers with an error
     */
    ChapterPages fetchChapterPages(String extensionId, String mangaId, String chapterId);
}
