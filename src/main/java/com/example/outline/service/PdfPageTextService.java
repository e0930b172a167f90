package com.example.outline.service;

import com.example.outline.exception.DocumentReadException;
import com.example.outline.model.PageRecord;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the plain text of each PDF page with PDFBox.
 */
@Service
public class PdfPageTextService {

    private static final Logger logger = LoggerFactory.getLogger(PdfPageTextService.class);

    public List<PageRecord> extractPages(byte[] pdfBytes) {
        return extractPages(new ByteArrayInputStream(pdfBytes), 1, Integer.MAX_VALUE);
    }

    public List<PageRecord> extractPages(InputStream in) {
        return extractPages(in, 1, Integer.MAX_VALUE);
    }

    /**
     * Pages {@code startPage..endPage} (1-based, inclusive, clamped to the document). A page whose
     * text cannot be read is logged and left out.
     */
    public List<PageRecord> extractPages(InputStream in, int startPage, int endPage) {
        List<PageRecord> pages = new ArrayList<>();
        try (PDDocument doc = PDDocument.load(in)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);

            int first = Math.max(1, startPage);
            int last = Math.min(doc.getNumberOfPages(), endPage);
            for (int i = first; i <= last; i++) {
                stripper.setStartPage(i);
                stripper.setEndPage(i);
                try {
                    pages.add(new PageRecord(i, stripper.getText(doc)));
                } catch (IOException | RuntimeException e) {
                    // 字体解析失败等情况只跳过当前页
                    logger.warn("Failed to extract text from page {}: {}", i, e.getMessage());
                }
            }
            logger.info("Extracted text from {} of {} pages", pages.size(), doc.getNumberOfPages());
        } catch (IOException e) {
            throw new DocumentReadException("Failed to read PDF: " + e.getMessage(), e);
        }
        return pages;
    }
}
