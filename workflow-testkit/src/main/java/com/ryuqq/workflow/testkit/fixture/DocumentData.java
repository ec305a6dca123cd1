package com.ryuqq.workflow.testkit.fixture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a document analysis: one slot per page plus the aggregation flag.
 */
public final class DocumentData {

    private final List<PageData> pageResults;
    private boolean allPagesDone;

    public DocumentData(int pageCount) {
        if (pageCount < 0) {
            throw new IllegalArgumentException("pageCount cannot be negative (current: " + pageCount + ")");
        }
        this.pageResults = new ArrayList<>(Collections.nCopies(pageCount, null));
    }

    /**
     * @return page results in page order; unfinished pages are null
     */
    public List<PageData> getPageResults() {
        return pageResults;
    }

    public void setPageResult(int index, PageData pageData) {
        pageResults.set(index, pageData);
    }

    public long completedPageCount() {
        return pageResults.stream().filter(page -> page != null).count();
    }

    public boolean isAllPagesDone() {
        return allPagesDone;
    }

    public void setAllPagesDone(boolean allPagesDone) {
        this.allPagesDone = allPagesDone;
    }
}
