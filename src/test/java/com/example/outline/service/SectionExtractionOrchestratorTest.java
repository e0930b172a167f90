package com.example.outline.service;

import com.example.outline.config.OutlineSettings;
import com.example.outline.exception.InputValidationException;
import com.example.outline.model.PageRecord;
import com.example.outline.model.Section;
import com.example.outline.model.SectionExtractionResult;
import com.example.outline.model.SectionOrigin;
import com.example.outline.model.TocEntry;
import com.example.outline.status.ProcessingStatus;
import com.example.outline.status.Validatable;
import com.example.outline.strategy.HeadingStrategy;
import com.example.outline.strategy.impl.KeywordTocEntryHeuristic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SectionExtractionOrchestrator")
class SectionExtractionOrchestratorTest {

    @Mock
    private Validatable<List<PageRecord>> validator;

    private OutlineSettings settings;
    private TocEntryExtractor extractor;
    private SectionExtractionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        settings = OutlineSettings.defaults();
        extractor = new TocEntryExtractor(settings, new TocDiscoveryService(settings),
                new KeywordTocEntryHeuristic(settings.getGenuineKeywords()));
        orchestrator = new SectionExtractionOrchestrator(settings, extractor, new CoverageMapper(),
                HeadingDetector.withDefaultStrategies());
    }

    private static List<PageRecord> sampleDocument() {
        return Arrays.asList(
                new PageRecord(1, "Table of Contents\n1 Introduction .... 3\n2 Overview .... 5"),
                new PageRecord(2, "FOREWORD\nSome foreword text"),
                new PageRecord(3, "1 Introduction\nIntro text"),
                new PageRecord(4, "more intro"),
                new PageRecord(5, "2 Overview\nOverview text"),
                new PageRecord(6, ""));
    }

    @Test
    @DisplayName("Should partition the document into TOC and standalone sections")
    void shouldPartitionDocument() {
        SectionExtractionResult result = orchestrator.extractSections(sampleDocument());

        assertThat(result.getStatus()).isEqualTo(ProcessingStatus.DONE);
        assertThat(result.getSections()).extracting(Section::getPage).containsExactly(1, 2, 3, 5);
        assertThat(result.getSections()).extracting(Section::getOrigin).containsExactly(
                SectionOrigin.PAGE, SectionOrigin.PAGE, SectionOrigin.TOC, SectionOrigin.TOC);
        assertThat(result.getSections()).extracting(Section::getTitle)
                .containsExactly("Table of Contents", "FOREWORD", "Introduction", "Overview");
        assertThat(result.getSections().get(2).getContent()).isEqualTo("1 Introduction\nIntro text\nmore intro");
        assertThat(result.getSections().get(3).getContent()).isEqualTo("2 Overview\nOverview text");
        assertThat(result.getSections()).allSatisfy(s ->
                assertThat(s.getDocTitle()).isEqualTo(OutlineSettings.DEFAULT_DOC_TITLE));
        assertThat(result.getCoveredPages()).containsExactly(3, 4, 5, 6);
        assertThat(result.getSectionsCreated()).isEqualTo(4);
        assertThat(result.getTocEntries()).hasSize(2);
        assertThat(result.getTocStats()).isNotNull();
    }

    @Test
    @DisplayName("Should claim each page with text exactly once")
    void shouldClaimEachPageOnce() {
        SectionExtractionResult result = orchestrator.extractSections(sampleDocument());

        Set<Integer> standalonePages = new HashSet<>();
        for (Section section : result.getSections()) {
            if (!section.isTocDerived()) {
                standalonePages.add(section.getPage());
            }
        }
        assertThat(standalonePages).doesNotContainAnyElementsOf(result.getCoveredPages());

        Set<Integer> claimed = new HashSet<>(result.getCoveredPages());
        claimed.addAll(standalonePages);
        assertThat(claimed).contains(1, 2, 3, 4, 5);
    }

    @Test
    @DisplayName("Should produce identical output for identical input")
    void shouldBeDeterministic() {
        List<Section> first = orchestrator.extractSections(sampleDocument(), null, "Doc").getSections();
        List<Section> second = orchestrator.extractSections(sampleDocument(), null, "Doc").getSections();

        assertThat(second).isEqualTo(first);
        assertThat(first).allSatisfy(s -> assertThat(s.getDocTitle()).isEqualTo("Doc"));
    }

    @Test
    @DisplayName("Should fail without producing sections when the input is invalid")
    void shouldFail_whenInputInvalid() {
        SectionExtractionResult result = orchestrator.extractSections(Arrays.asList(
                new PageRecord(0, "bad"), new PageRecord(1, "ok")));

        assertThat(result.getStatus()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getSections()).isEmpty();
        assertThat(result.getErrorMessage()).contains("invalid page number 0");
        assertThat(orchestrator.getStatus()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(orchestrator.getErrorCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fail for null input")
    void shouldFail_whenInputNull() {
        SectionExtractionResult result = orchestrator.extractSections(null);

        assertThat(result.getStatus()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(result.getFailure()).isInstanceOf(InputValidationException.class);
    }

    @Test
    @DisplayName("Should succeed with no sections for an empty document")
    void shouldReturnEmpty_whenNoPages() {
        SectionExtractionResult result = orchestrator.extractSections(Collections.emptyList());

        assertThat(result.getStatus()).isEqualTo(ProcessingStatus.DONE);
        assertThat(result.getSections()).isEmpty();
        assertThat(orchestrator.getProcessedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should skip a broken TOC entry and cover its pages as standalone sections")
    void shouldSkipFailedEntry() {
        List<PageRecord> pages = Arrays.asList(
                new PageRecord(1, "Cover"),
                new PageRecord(2, "lost section text"),
                new PageRecord(3, "more lost text"),
                new PageRecord(4, "2 Overview\nbody"),
                new PageRecord(5, "tail"));
        List<TocEntry> toc = Arrays.asList(
                new TocEntry("1", "  ", 2, "1", null),
                new TocEntry("2", "Overview", 4, "2 Overview", null));

        SectionExtractionResult result = orchestrator.extractSections(pages, toc);

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getFailedEntries()).extracting(TocEntry::getSectionId).containsExactly("1");
        assertThat(result.getCoveredPages()).containsExactly(4, 5);
        assertThat(result.getSections()).extracting(Section::getSectionId)
                .containsExactly("Page-1", "Page-2", "Page-3", "2");
        assertThat(result.getSections().get(3).getContent()).isEqualTo("2 Overview\nbody\ntail");
    }

    @Test
    @DisplayName("Should use a provided TOC and ignore entries past the last page")
    void shouldUseProvidedToc() {
        List<PageRecord> pages = new ArrayList<>(sampleDocument());
        List<TocEntry> toc = Arrays.asList(
                new TocEntry("A", "Annex Material", 2, "A Annex Material", null),
                new TocEntry("B", "Missing Pages", 9, "B Missing Pages", null));

        SectionExtractionResult result = orchestrator.extractSections(pages, toc);

        assertThat(result.getTocStats()).isNull();
        assertThat(result.getTocEntries()).hasSize(2);
        assertThat(result.getCoveredPages()).containsExactly(2, 3, 4, 5, 6);
        assertThat(result.getSections()).extracting(Section::getSectionId).containsExactly("Page-1", "A");
    }

    @Test
    @DisplayName("Should fall back from detected heading to first short line to a synthetic label")
    void shouldFindHeadingWithFallbacks() {
        assertThat(orchestrator.findHeading("some prose\nREQUIREMENTS\nmore", 3)).isEqualTo("REQUIREMENTS");
        assertThat(orchestrator.findHeading("plain lower case prose\nmore prose", 3))
                .isEqualTo("plain lower case prose");
        assertThat(orchestrator.findHeading("x".repeat(200), 8)).isEqualTo("Content from Page 8");
    }

    @Test
    @DisplayName("Should only look at the first few lines for a heading")
    void shouldLimitHeadingScanDepth() {
        String text = "a one\nb two\nc three\nd four\ne five\nAPPENDIX MATERIAL";

        assertThat(orchestrator.findHeading(text, 1)).isEqualTo("a one");
    }

    @Test
    @DisplayName("Should delegate validation to the injected validator")
    void shouldUseInjectedValidator() {
        when(validator.isEnabled()).thenReturn(true);
        doThrow(new InputValidationException("rejected")).when(validator).validate(any());
        SectionExtractionOrchestrator custom = new SectionExtractionOrchestrator(settings, extractor,
                new CoverageMapper(), HeadingDetector.withDefaultStrategies(), validator);

        SectionExtractionResult result = custom.extractSections(sampleDocument());

        assertThat(result.getStatus()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(result.getErrorMessage()).isEqualTo("rejected");
    }

    @Test
    @DisplayName("Should skip validation when the validator is disabled")
    void shouldSkipDisabledValidator() {
        when(validator.isEnabled()).thenReturn(false);
        SectionExtractionOrchestrator custom = new SectionExtractionOrchestrator(settings, extractor,
                new CoverageMapper(), HeadingDetector.withDefaultStrategies(), validator);

        SectionExtractionResult result = custom.extractSections(Arrays.asList(
                new PageRecord(0, "dropped"), new PageRecord(1, "INTRODUCTION")));

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getSections()).extracting(Section::getTitle).containsExactly("INTRODUCTION");
    }

    @Test
    @DisplayName("Should record a page whose heading detection fails and keep going")
    void shouldRecordFailedPage_whenStrategyThrows(@Mock HeadingStrategy strategy) {
        when(strategy.evaluate(anyString())).thenAnswer(invocation -> {
            if ("BAD".equals(invocation.getArgument(0))) {
                throw new IllegalStateException("unreadable line");
            }
            return 0.0;
        });
        SectionExtractionOrchestrator custom = new SectionExtractionOrchestrator(settings, extractor,
                new CoverageMapper(), new HeadingDetector(Collections.singletonList(strategy)));

        SectionExtractionResult result = custom.extractSections(Arrays.asList(
                new PageRecord(1, "fine"),
                new PageRecord(2, "BAD"),
                new PageRecord(3, "also fine")));

        assertThat(result.getStatus()).isEqualTo(ProcessingStatus.DONE);
        assertThat(result.getFailedPages()).containsExactly(2);
        assertThat(result.getSections()).extracting(Section::getPage).containsExactly(1, 3);
        assertThat(result.getSections()).extracting(Section::getTitle).containsExactly("fine", "also fine");
    }

    @Test
    @DisplayName("Should not let callers change a result after it is returned")
    void shouldCopyResultLists() {
        List<TocEntry> toc = new ArrayList<>(Arrays.asList(
                new TocEntry("1", "Introduction", 3, "1 Introduction", null),
                new TocEntry("2", "Overview", 5, "2 Overview", null)));

        SectionExtractionResult result = orchestrator.extractSections(sampleDocument(), toc);
        toc.clear();

        assertThat(result.getTocEntries()).extracting(TocEntry::getTitle).containsExactly("Introduction", "Overview");
        assertThatThrownBy(() -> result.getSections().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.getFailedPages().add(9)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.getFailedEntries().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
