package com.example.outline.model;

import com.example.outline.util.TocTextUtils;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One recognized line of the table of contents.
 * <p>
 * {@code level} and {@code parentId} are always derived from {@code sectionId}, so an entry read
 * back from a cached file cannot carry an inconsistent hierarchy.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TocEntry {
    private final String sectionId;
    private final String title;
    private final int page;
    private final int level;
    private final String parentId;
    private final String fullPath;
    private final Set<String> tags;

    @JsonCreator
    public TocEntry(@JsonProperty("section_id") String sectionId,
                    @JsonProperty("title") String title,
                    @JsonProperty("page") int page,
                    @JsonProperty("full_path") String fullPath,
                    @JsonProperty("tags") Collection<String> tags) {
        this.sectionId = sectionId;
        this.title = title;
        this.page = page;
        this.level = TocTextUtils.levelOf(sectionId);
        this.parentId = TocTextUtils.parentOf(sectionId);
        this.fullPath = fullPath;
        this.tags = tags == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    @JsonProperty("section_id")
    public String getSectionId() {
        return sectionId;
    }

    @JsonProperty("title")
    public String getTitle() {
        return title;
    }

    @JsonProperty("page")
    public int getPage() {
        return page;
    }

    @JsonProperty("level")
    public int getLevel() {
        return level;
    }

    @JsonProperty("parent_id")
    public String getParentId() {
        return parentId;
    }

    @JsonProperty("full_path")
    public String getFullPath() {
        return fullPath;
    }

    @JsonProperty("tags")
    public Set<String> getTags() {
        return tags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TocEntry)) return false;
        TocEntry that = (TocEntry) o;
        return page == that.page
                && Objects.equals(sectionId, that.sectionId)
                && Objects.equals(title, that.title)
                && Objects.equals(fullPath, that.fullPath)
                && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sectionId, title, page, fullPath, tags);
    }

    @Override
    public String toString() {
        return "TocEntry{" + (sectionId == null ? "-" : sectionId) + " '" + title + "' p" + page + "}";
    }
}
