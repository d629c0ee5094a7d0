package com.planprobe.inspect;

/**
 * One previewed value.
 *
 * @param rowIndex zero-based index of the row across all batches
 * @param text the display text, possibly truncated
 */
public record PreviewRow(long rowIndex, String text) {
}
