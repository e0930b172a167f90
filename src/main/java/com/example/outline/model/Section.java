package com.example.outline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Section {
    private final String docTitle;
    private final String sectionId;
    private final String title;
    private final String fullPath;
    private final int page;
    private final int level;
    private final String parentId;
    private final Set<String> tags;
    private final String content;
    private final SectionOrigin origin;

    @JsonCreator
    public Section(@JsonProperty("doc_title") String docTitle,
                   @JsonProperty("section_id") String sectionId,
                   @JsonProperty("title") String title,
                   @JsonProperty("full_path") String fullPath,
                   @JsonProperty("page") int page,
                   @JsonProperty("level") int level,
                   @JsonProperty("parent_id") String parentId,
                   @JsonProperty("tags") Collection<String> tags,
                   @JsonProperty("content") String content,
                   @JsonProperty("origin") SectionOrigin origin) {
        this.docTitle = docTitle;
        this.sectionId = sectionId;
        this.title = title;
        this.fullPath = fullPath;
        this.page = page;
        this.level = level;
        this.parentId = parentId;
        this.tags = tags == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        this.content = content == null ? "" : content;
        this.origin = origin == null ? SectionOrigin.TOC : origin;
    }

    @JsonProperty("doc_title")
    public String getDocTitle() {
        return docTitle;
    }

    @JsonProperty("section_id")
    public String getSectionId() {
        return sectionId;
    }

    @JsonProperty("title")
    public String getTitle() {
        return title;
    }

    @JsonProperty("full_path")
    public String getFullPath() {
        return fullPath;
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

    @JsonProperty("tags")
    public Set<String> getTags() {
        return tags;
    }

    @JsonProperty("content")
    public String getContent() {
        return content;
    }

    @JsonProperty("origin")
    public SectionOrigin getOrigin() {
        return origin;
    }

    @JsonIgnore
    public boolean isTocDerived() {
        return origin == SectionOrigin.TOC;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Section)) return false;
        Section that = (Section) o;
        return page == that.page
                && level == that.level
                && origin == that.origin
                && Objects.equals(docTitle, that.docTitle)
                && Objects.equals(sectionId, that.sectionId)
                && Objects.equals(title, that.title)
                && Objects.equals(fullPath, that.fullPath)
                && Objects.equals(parentId, that.parentId)
                && tags.equals(that.tags)
                && content.equals(that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(docTitle, sectionId, title, fullPath, page, level, parentId, tags, content, origin);
    }

    @Override
    public String toString() {
        return "Section{" + origin + " " + sectionId + " '" + title + "' p" + page + "}";
    }
}
