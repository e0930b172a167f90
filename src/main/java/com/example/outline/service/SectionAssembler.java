package com.example.outline.service;

import com.example.outline.exception.EntryProcessingException;
import com.example.outline.model.Section;
import com.example.outline.model.SectionOrigin;
import com.example.outline.model.TocEntry;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Builds {@link Section}s for one document. Not shared between runs.
 */
public class SectionAssembler {

    static final String TAG_STANDALONE = "standalone_page";

    private final String docTitle;
    private int sectionsCreated;

    public SectionAssembler(String docTitle) {
        this.docTitle = docTitle;
    }

    public Section buildFromTocEntry(TocEntry entry, String content) {
        if (entry == null) {
            throw new EntryProcessingException(null, "TOC entry is null");
        }
        if (entry.getTitle() == null || entry.getTitle().trim().isEmpty()) {
            throw new EntryProcessingException(entry, "TOC entry has no title");
        }
        if (entry.getPage() < 1) {
            throw new EntryProcessingException(entry, "TOC entry has invalid page " + entry.getPage());
        }

        String sectionId = entry.getSectionId() == null ? "" : entry.getSectionId().trim();
        String fullPath = (sectionId + " " + entry.getTitle()).trim();
        Section section = new Section(docTitle, sectionId, entry.getTitle(), fullPath, entry.getPage(),
                entry.getLevel(), entry.getParentId(), entry.getTags(), content, SectionOrigin.TOC);
        sectionsCreated++;
        return section;
    }

    public Section buildPageSection(int pageNumber, String content, String heading) {
        String title = heading == null || heading.trim().isEmpty() ? "Page " + pageNumber : heading.trim();
        String sectionId = "Page-" + pageNumber;
        String safeContent = content == null ? "" : content;
        Section section = new Section(docTitle, sectionId, title, sectionId + " " + title, pageNumber,
                1, null, contentTags(safeContent), safeContent, SectionOrigin.PAGE);
        sectionsCreated++;
        return section;
    }

    private static Set<String> contentTags(String content) {
        Set<String> tags = new LinkedHashSet<>();
        tags.add(TAG_STANDALONE);
        if (content.contains("|")) {
            tags.add("contains_tables");
        }
        if (content.length() > 5000) {
            tags.add("large_content");
        } else if (content.length() > 1000) {
            tags.add("medium_content");
        } else {
            tags.add("small_content");
        }
        return tags;
    }

    public String getDocTitle() {
        return docTitle;
    }

    public int getSectionsCreated() {
        return sectionsCreated;
    }
}
