package com.ryuqq.workflow.testkit.fixture;

import com.ryuqq.workflow.core.component.Component;
import com.ryuqq.workflow.core.component.ComponentConfig;
import com.ryuqq.workflow.core.context.ExecutionContext;
import com.ryuqq.workflow.core.data.DataTracker;
import com.ryuqq.workflow.core.limiter.ConcurrencyLimiter;
import com.ryuqq.workflow.core.outcome.ExecutionResult;
import com.ryuqq.workflow.runner.ComponentHandle;
import com.ryuqq.workflow.runner.Workflow;
import com.ryuqq.workflow.runner.WorkflowConfig;
import com.ryuqq.workflow.testkit.ConcurrencyProbe;
import com.ryuqq.workflow.testkit.ExecutionTimeline;

import java.time.Duration;
import java.util.List;

/**
 * Document analysis fixture: a two-level workflow used by the scenario contract tests.
 *
 * <p><strong>Page workflow</strong> (durations in time units):</p>
 * <pre>
 * VisualInformation (1) ─┬─→ Parameter1 (1)
 * TextExtractor     (1) ─┼─→ Parameter2 (4)
 *                        └─→ Parameter3 (3)
 * </pre>
 *
 * <p>Critical path: 1 + 4 = {@value #PAGE_CRITICAL_PATH_UNITS} units.
 * ParameterN is the concatenation of the N-th visual and text entries.</p>
 *
 * <p><strong>Document workflow:</strong> one PageAnalysis component per page, each bound to a shared
 * {@link ConcurrencyLimiter} and running a nested page workflow, then FinalAggregation depending on all
 * pages and setting {@code allPagesDone}.</p>
 *
 * <p>Timeline labels are {@code "Page-<index>/<component>"} for page components and
 * {@code "Page-<index>"} for the document-level page component.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class DocumentAnalysisFixture {

    public static final int PAGE_CRITICAL_PATH_UNITS = 5;

    public static final List<String> VISUAL_INFORMATION = List.of("visual1", "visual2", "visual3");
    public static final List<String> EXTRACTED_TEXT = List.of("text1", "text2", "text3");

    private final Duration unit;
    private final ExecutionTimeline timeline;
    private final ConcurrencyProbe pageProbe;

    /**
     * @param unit duration of one time unit
     * @param timeline span recorder
     * @param pageProbe probe entered by each document-level page component
     */
    public DocumentAnalysisFixture(Duration unit, ExecutionTimeline timeline, ConcurrencyProbe pageProbe) {
        if (unit == null || unit.isNegative() || unit.isZero()) {
            throw new IllegalArgumentException("unit must be positive (current: " + unit + ")");
        }
        if (timeline == null || pageProbe == null) {
            throw new IllegalArgumentException("timeline and pageProbe cannot be null");
        }
        this.unit = unit;
        this.timeline = timeline;
        this.pageProbe = pageProbe;
    }

    /**
     * Builds the page workflow.
     *
     * @param label timeline label prefix (e.g. "Page-0")
     * @return an unexecuted page workflow
     */
    public Workflow<PageConfig, PageData> pageWorkflow(String label) {
        Workflow<PageConfig, PageData> workflow = new Workflow<>(new WorkflowConfig().withName(label));

        ComponentHandle visual = workflow.addComponent(Component.of("VisualInformation",
            (ctx, input, tracker) -> {
                work(ctx, label + "/VisualInformation", 1);
                tracker.update(data -> data.setVisualInformation(VISUAL_INFORMATION));
            }));

        ComponentHandle text = workflow.addComponent(Component.of("TextExtractor",
            (ctx, input, tracker) -> {
                work(ctx, label + "/TextExtractor", 1);
                tracker.update(data -> data.setExtractedText(EXTRACTED_TEXT));
            }));

        workflow.addComponent(Component.of("Parameter1", 0,
            (ctx, position, tracker) -> {
                work(ctx, label + "/Parameter1", 1);
                String value = concatenate(tracker, position);
                tracker.update(data -> data.setParameter1(value));
            }))
            .addDependencies(visual, text);

        workflow.addComponent(Component.of("Parameter2", 1,
            (ctx, position, tracker) -> {
                work(ctx, label + "/Parameter2", 4);
                String value = concatenate(tracker, position);
                tracker.update(data -> data.setParameter2(value));
            }))
            .addDependencies(visual, text);

        workflow.addComponent(Component.of("Parameter3", 2,
            (ctx, position, tracker) -> {
                work(ctx, label + "/Parameter3", 3);
                String value = concatenate(tracker, position);
                tracker.update(data -> data.setParameter3(value));
            }))
            .addDependencies(visual, text);

        return workflow;
    }

    /**
     * Runs a single page analysis.
     *
     * @param ctx cancellation signal
     * @param pageContent page content
     * @param label timeline label prefix
     * @return page result
     */
    public ExecutionResult<PageData> analysePage(ExecutionContext ctx, String pageContent, String label) {
        return pageWorkflow(label).execute(ctx, new PageConfig(pageContent), new PageData());
    }

    /**
     * Builds the document workflow.
     *
     * @param pageCount number of pages
     * @param pageLimiter limiter shared by all page components
     * @return an unexecuted document workflow
     */
    public Workflow<DocumentConfig, DocumentData> documentWorkflow(int pageCount, ConcurrencyLimiter pageLimiter) {
        Workflow<DocumentConfig, DocumentData> workflow =
            new Workflow<>(new WorkflowConfig().withName("document").withThreadNamePrefix("document-worker-"));

        ComponentHandle aggregation = workflow.addComponent(Component.of("FinalAggregation",
            (ctx, input, tracker) -> {
                boolean allPagesDone = tracker.read(data -> data.getPageResults().stream().allMatch(page -> page != null));
                tracker.update(data -> data.setAllPagesDone(allPagesDone));
            }));

        ComponentConfig pageConfig = ComponentConfig.withLimiter(pageLimiter);
        for (int i = 0; i < pageCount; i++) {
            ComponentHandle page = workflow.addComponent(Component.of("PageAnalysis", new PageInput(i),
                (ctx, input, tracker) -> {
                    String label = "Page-" + input.index();
                    ExecutionResult<PageData> result;
                    try (ConcurrencyProbe.Entry entry = pageProbe.enter();
                         ExecutionTimeline.Span span = timeline.span(label)) {
                        result = analysePage(ctx, tracker.getConfig().pages().get(input.index()), label);
                    }
                    if (!result.isDone()) {
                        throw new IllegalStateException("page analysis failed: " + label, result.getErrorOrNull());
                    }
                    tracker.update(data -> data.setPageResult(input.index(), result.getData()));
                }), pageConfig);
            aggregation.addDependencies(page);
        }
        return workflow;
    }

    /**
     * Runs a document analysis.
     *
     * @param ctx cancellation signal
     * @param pages page contents
     * @param pageLimiter limiter shared by all page components
     * @return document result
     */
    public ExecutionResult<DocumentData> analyseDocument(ExecutionContext ctx, List<String> pages,
                                                         ConcurrencyLimiter pageLimiter) {
        return documentWorkflow(pages.size(), pageLimiter)
            .execute(ctx, new DocumentConfig(pages), new DocumentData(pages.size()));
    }

    public Duration unit() {
        return unit;
    }

    private void work(ExecutionContext ctx, String label, int units) throws Exception {
        try (ExecutionTimeline.Span span = timeline.span(label)) {
            ctx.sleep(unit.multipliedBy(units));
        }
    }

    private static String concatenate(DataTracker<PageConfig, PageData> tracker, int position) {
        return tracker.read(data -> data.getVisualInformation().get(position) + data.getExtractedText().get(position));
    }
}
