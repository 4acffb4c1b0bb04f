package com.poc.tradedata.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RawCell {
    /**
     * Display text of the cell, or null when the cell is blank.
     */
    private String text;

    /**
     * Formatting signature captured by the reader (font ARGB hex of solid-filled cells).
     * Null when the cell carries no fill.
     */
    private String styleTag;

    public static RawCell of(String text) {
        return new RawCell(text, null);
    }

    public boolean isBlank() {
        return text == null || text.trim().isEmpty();
    }

    public String trimmed() {
        return text == null ? "" : text.trim();
    }
}
