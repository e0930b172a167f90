package com.example.outline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class DocumentMetadata {
    public static final String UNKNOWN = "Unknown";

    private String docTitle = UNKNOWN;
    private String revision = UNKNOWN;
    private String version = UNKNOWN;
    private String releaseDate = UNKNOWN;

    public DocumentMetadata() {}

    @JsonProperty("doc_title")
    public String getDocTitle() {
        return docTitle;
    }

    public void setDocTitle(String docTitle) {
        this.docTitle = docTitle;
    }

    @JsonProperty("revision")
    public String getRevision() {
        return revision;
    }

    public void setRevision(String revision) {
        this.revision = revision;
    }

    @JsonProperty("version")
    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    @JsonProperty("release_date")
    public String getReleaseDate() {
        return releaseDate;
    }

    public void setReleaseDate(String releaseDate) {
        this.releaseDate = releaseDate;
    }

    public boolean hasTitle() {
        return docTitle != null && !UNKNOWN.equals(docTitle) && !docTitle.trim().isEmpty();
    }

    @Override
    public String toString() {
        return "DocumentMetadata{title='" + docTitle + "', revision=" + revision
                + ", version=" + version + ", releaseDate=" + releaseDate + "}";
    }
}
