package com.ryuqq.workflow.testkit.fixture;

import java.util.List;

/**
 * Read-only input of a document analysis.
 *
 * @param pages raw page contents in page order
 */
public record DocumentConfig(List<String> pages) {

    public DocumentConfig {
        if (pages == null) {
            throw new IllegalArgumentException("pages cannot be null");
        }
        pages = List.copyOf(pages);
    }
}
