package com.example.outline.model;

public class PageLine {
    private final int page;
    private final String text;
    private final int index; // 在展开后的行序列中的位置

    public PageLine(int page, String text, int index) {
        this.page = page;
        this.text = text;
        this.index = index;
    }

    public int getPage() {
        return page;
    }

    public String getText() {
        return text;
    }

    public int getIndex() {
        return index;
    }

    public String trimmed() {
        return text.trim();
    }

    @Override
    public String toString() {
        return page + ":" + index + " " + text;
    }
}
