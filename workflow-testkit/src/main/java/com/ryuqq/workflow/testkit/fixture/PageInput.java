package com.ryuqq.workflow.testkit.fixture;

/**
 * Per-component input of a page analysis component in the document workflow.
 *
 * @param index page index
 */
public record PageInput(int index) {
}
