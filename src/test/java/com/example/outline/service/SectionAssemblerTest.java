package com.example.outline.service;

import com.example.outline.exception.EntryProcessingException;
import com.example.outline.model.Section;
import com.example.outline.model.SectionOrigin;
import com.example.outline.model.TocEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("SectionAssembler")
class SectionAssemblerTest {

    private final SectionAssembler assembler = new SectionAssembler("USB PD Specification");

    @Test
    @DisplayName("Should copy TOC entry fields into the section")
    void shouldBuildFromTocEntry() {
        TocEntry entry = new TocEntry("3.2.1", "Voltage Transitions", 12, "3.2.1 Voltage Transitions .... 12",
                Collections.singleton("specification"));

        Section section = assembler.buildFromTocEntry(entry, "body");

        assertThat(section.getDocTitle()).isEqualTo("USB PD Specification");
        assertThat(section.getSectionId()).isEqualTo("3.2.1");
        assertThat(section.getFullPath()).isEqualTo("3.2.1 Voltage Transitions");
        assertThat(section.getLevel()).isEqualTo(3);
        assertThat(section.getParentId()).isEqualTo("3.2");
        assertThat(section.getTags()).containsExactly("specification");
        assertThat(section.getContent()).isEqualTo("body");
        assertThat(section.getOrigin()).isEqualTo(SectionOrigin.TOC);
        assertThat(section.isTocDerived()).isTrue();
    }

    @Test
    @DisplayName("Should use an empty id for entries without one")
    void shouldUseEmptyId_whenEntryHasNone() {
        Section section = assembler.buildFromTocEntry(new TocEntry(null, "Glossary", 40, "Glossary 40", null), "");

        assertThat(section.getSectionId()).isEmpty();
        assertThat(section.getFullPath()).isEqualTo("Glossary");
        assertThat(section.getLevel()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject entries that cannot anchor a section")
    void shouldRejectInvalidEntries() {
        assertThatThrownBy(() -> assembler.buildFromTocEntry(null, ""))
                .isInstanceOf(EntryProcessingException.class);
        assertThatThrownBy(() -> assembler.buildFromTocEntry(new TocEntry("1", "  ", 2, "", null), ""))
                .isInstanceOf(EntryProcessingException.class)
                .hasMessageContaining("title");
        TocEntry badPage = new TocEntry("1", "Scope", 0, "", null);
        EntryProcessingException thrown = assertThrows(EntryProcessingException.class,
                () -> assembler.buildFromTocEntry(badPage, ""));
        assertThat(thrown.getEntry()).isSameAs(badPage);
        assertThat(assembler.getSectionsCreated()).isZero();
    }

    @Test
    @DisplayName("Should build standalone page sections with content tags")
    void shouldBuildPageSection() {
        Section section = assembler.buildPageSection(7, "| a | b |", "FOREWORD");

        assertThat(section.getSectionId()).isEqualTo("Page-7");
        assertThat(section.getTitle()).isEqualTo("FOREWORD");
        assertThat(section.getFullPath()).isEqualTo("Page-7 FOREWORD");
        assertThat(section.getLevel()).isEqualTo(1);
        assertThat(section.getParentId()).isNull();
        assertThat(section.getOrigin()).isEqualTo(SectionOrigin.PAGE);
        assertThat(section.getTags()).containsExactly("standalone_page", "contains_tables", "small_content");
    }

    @Test
    @DisplayName("Should size tag long pages and default the title")
    void shouldTagLargeContent() {
        Section medium = assembler.buildPageSection(1, "x".repeat(1001), null);
        Section large = assembler.buildPageSection(2, "x".repeat(5001), " ");

        assertThat(medium.getTags()).contains("medium_content");
        assertThat(large.getTags()).contains("large_content");
        assertThat(large.getTitle()).isEqualTo("Page 2");
        assertThat(assembler.getSectionsCreated()).isEqualTo(2);
    }
}
