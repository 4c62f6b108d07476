package com.taskwise.core.model;

/**
 * Non-fatal problem met while extracting tasks; the offending entry was skipped.
 *
 * @param task   name of the entry as declared
 * @param source where it came from (document path or script path)
 * @param reason what was wrong
 */
public record ExtractionNote(String task, String source, String reason) {}
