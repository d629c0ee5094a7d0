package com.planprobe.source;

/**
 * Footer statistics of a columnar source.
 *
 * @param fileCount number of files the source expands to
 * @param rowGroupCount total row groups across files
 * @param rowCount total rows across files
 */
public record SourceStatistics(long fileCount, long rowGroupCount, long rowCount) {
}
