package com.ryuqq.workflow.testkit.fixture;

/**
 * Read-only input of a page analysis.
 *
 * @param pageContent raw page content
 */
public record PageConfig(String pageContent) {
}
