package com.specsim.infrastructure.sim.pipeline;

import com.specsim.domain.sim.model.CoverageGap;
import com.specsim.domain.sim.model.DictionaryRow;
import com.specsim.domain.sim.model.Document;
import com.specsim.domain.sim.model.FieldRecord;
import com.specsim.domain.sim.model.GapReason;
import com.specsim.domain.sim.model.IngestionRequest;
import com.specsim.domain.sim.model.PageRegion;
import com.specsim.domain.sim.model.PageText;
import com.specsim.domain.sim.model.PipelineResult;
import com.specsim.domain.sim.model.Section;
import com.specsim.domain.sim.model.SectionKind;
import com.specsim.domain.sim.model.SemanticModel;
import com.specsim.domain.sim.service.SimBuildService;
import com.specsim.domain.sim.service.TableExtractor;
import com.specsim.infrastructure.sim.CancellationToken;
import com.specsim.infrastructure.sim.InvalidPipelineInputException;
import com.specsim.infrastructure.sim.PipelineCancelledException;
import com.specsim.infrastructure.sim.arbiter.ArbitrationOutcome;
import com.specsim.infrastructure.sim.arbiter.ExtractionArbiter;
import com.specsim.infrastructure.sim.arbiter.SelectedTable;
import com.specsim.infrastructure.sim.model.SectionContent;
import com.specsim.infrastructure.sim.model.SemanticModelBuilder;
import com.specsim.infrastructure.sim.normalize.FieldNormalizer;
import com.specsim.infrastructure.sim.normalize.NormalizedTable;
import com.specsim.infrastructure.sim.section.SectionClassifier;
import com.specsim.infrastructure.sim.validation.ValidationContext;
import com.specsim.infrastructure.sim.validation.ValidationEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Orchestrates one document run:
 * <p>
 * arbitrate (per page, extraction pool) ∥ classify → normalize (per table, worker pool) → join →
 * build (single writer) → validate (checkers concurrent) → result
 * </p>
 * Document-quality problems end up in the report; only caller contract violations and
 * cancellation abort the run, and an aborted run returns no model.
 */
@Slf4j
@Component
public class SimPipeline implements SimBuildService {

    static final String IMPLICIT_SECTION_LABEL = "DOCUMENT";

    private static final long NOT_STARTED = Long.MIN_VALUE;
    private static final long POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final ExtractionArbiter extractionArbiter;
    private final SectionClassifier sectionClassifier;
    private final FieldNormalizer fieldNormalizer;
    private final SemanticModelBuilder modelBuilder;
    private final ValidationEngine validationEngine;
    private final ExecutorService extractionPool;
    private final ExecutorService workerPool;

    @Value("${sim.pipeline.page-timeout-ms:5000}")
    private long pageTimeoutMs = 5000;

    @Value("${sim.pipeline.arbitration-timeout-ms:60000}")
    private long arbitrationTimeoutMs = 60000;

    public SimPipeline(ExtractionArbiter extractionArbiter,
                       SectionClassifier sectionClassifier,
                       FieldNormalizer fieldNormalizer,
                       SemanticModelBuilder modelBuilder,
                       ValidationEngine validationEngine,
                       @Qualifier("simExtractionPool") ExecutorService extractionPool,
                       @Qualifier("simWorkerPool") ExecutorService workerPool) {
        this.extractionArbiter = extractionArbiter;
        this.sectionClassifier = sectionClassifier;
        this.fieldNormalizer = fieldNormalizer;
        this.modelBuilder = modelBuilder;
        this.validationEngine = validationEngine;
        this.extractionPool = extractionPool;
        this.workerPool = workerPool;
    }

    @Override
    public PipelineResult build(IngestionRequest request) {
        return build(request, null, CancellationToken.none());
    }

    @Override
    public PipelineResult build(IngestionRequest request, SemanticModel priorModel) {
        return build(request, priorModel, CancellationToken.none());
    }

    /**
     * Execute the full pipeline with a cooperative cancellation signal.
     *
     * @throws InvalidPipelineInputException on null or malformed input
     * @throws PipelineCancelledException    when {@code token} is cancelled before the run completes
     */
    public PipelineResult build(IngestionRequest request, SemanticModel priorModel, CancellationToken token) {
        requireValid(request);
        CancellationToken cancellation = token == null ? CancellationToken.none() : token;

        SimPipelineContext ctx = new SimPipelineContext();
        ctx.setStartedAt(System.currentTimeMillis());
        ctx.setDocument(request.document());
        ctx.setPages(request.pages().stream().sorted(Comparator.comparingInt(PageText::page)).toList());
        ctx.setPriorModel(priorModel);
        cancellation.throwIfCancelled();

        // 1. Arbitration runs on the extraction pool while pages are classified on this thread
        List<PageTask> pageTasks = submitArbitration(ctx, request.primaryExtractor(),
                request.secondaryExtractor(), cancellation);
        try {
            ctx.setSections(new ArrayList<>(sectionClassifier.classify(ctx.getPages(), cancellation)));
            collectArbitration(ctx, pageTasks, cancellation);
        } catch (RuntimeException e) {
            pageTasks.forEach(task -> task.future().cancel(true));
            throw e;
        }

        // 2. Normalize every selected table against its section (barrier before build)
        normalize(ctx, cancellation);

        // 3. Build
        cancellation.throwIfCancelled();
        ctx.setBuildOutcome(modelBuilder.build(ctx.getDocument(), ctx.getSectionContents(),
                ctx.getDiscoveredEnums(), cancellation));

        // 4. Validate
        cancellation.throwIfCancelled();
        long validationStart = System.currentTimeMillis();
        ctx.setReport(validationEngine.validate(new ValidationContext(
                ctx.getBuildOutcome().model(),
                priorModel,
                ctx.getCoverageGaps(),
                ctx.getSkippedRows(),
                ctx.getBuildOutcome().emptySections(),
                ctx.getBuildOutcome().unattributed())));
        ctx.setValidationMs(System.currentTimeMillis() - validationStart);
        cancellation.throwIfCancelled();

        PipelineResult result = ctx.toPipelineResult();
        log.info("[Pipeline] {} {}: {} pages, {} tables, {} messages, {} fields, {} gaps, {} skipped rows "
                        + "(arbitration={}ms, normalization={}ms, validation={}ms, total={}ms)",
                ctx.getDocument().standard(), ctx.getDocument().edition(),
                result.stats().pageCount(), result.stats().selectedTableCount(), result.stats().messageCount(),
                result.stats().fieldCount(), result.stats().coverageGapCount(), result.stats().skippedRowCount(),
                ctx.getArbitrationMs(), ctx.getNormalizationMs(), ctx.getValidationMs(),
                result.stats().totalLatencyMs());
        return result;
    }

    // ===== Arbitration =====

    /**
     * One page's arbitration. {@code startedAt} is set when a pool thread picks the page up,
     * so time spent queued behind other pages does not count against its timeout.
     */
    private record PageTask(PageText page, Future<List<ArbitrationOutcome>> future, AtomicLong startedAt,
                            CountDownLatch finished) {}

    private List<PageTask> submitArbitration(SimPipelineContext ctx, TableExtractor primary,
                                             TableExtractor secondary, CancellationToken token) {
        List<PageTask> tasks = new ArrayList<>();
        int regions = 0;
        for (PageText page : ctx.getPages()) {
            List<PageRegion> pageRegions = page.effectiveRegions();
            regions += pageRegions.size();
            AtomicLong startedAt = new AtomicLong(NOT_STARTED);
            CountDownLatch finished = new CountDownLatch(1);
            Future<List<ArbitrationOutcome>> future = extractionPool.submit(() -> {
                startedAt.set(System.nanoTime());
                try {
                    List<ArbitrationOutcome> outcomes = new ArrayList<>();
                    for (PageRegion region : pageRegions) {
                        token.throwIfCancelled();
                        outcomes.add(extractionArbiter.select(region, primary, secondary));
                    }
                    return outcomes;
                } finally {
                    finished.countDown();
                }
            });
            tasks.add(new PageTask(page, future, startedAt, finished));
        }
        ctx.setRegionCount(regions);
        return tasks;
    }

    private void collectArbitration(SimPipelineContext ctx, List<PageTask> tasks, CancellationToken token) {
        long start = System.currentTimeMillis();
        long budgetMs = Math.max(pageTimeoutMs, Math.min(arbitrationTimeoutMs, pageTimeoutMs * tasks.size()));
        long runDeadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(budgetMs);
        for (PageTask task : tasks) {
            try {
                for (ArbitrationOutcome outcome : awaitPage(task, runDeadline, token)) {
                    if (outcome.isSelected()) {
                        ctx.getSelectedTables().add(outcome.selection());
                    } else {
                        ctx.getCoverageGaps().add(outcome.gap());
                    }
                }
            } catch (TimeoutException e) {
                // cancel(true) on a FutureTask interrupts the extractor thread
                task.future().cancel(true);
                log.warn("[Pipeline] page {} timed out after {}ms, recorded as coverage gap",
                        task.page().page(), pageTimeoutMs);
                for (PageRegion region : task.page().effectiveRegions()) {
                    ctx.getCoverageGaps().add(new CoverageGap(region.page(), region.index(), GapReason.TIMEOUT,
                            "extraction exceeded " + pageTimeoutMs + "ms"));
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException re) throw re;
                throw new IllegalStateException("Arbitration failed for page " + task.page().page(), cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PipelineCancelledException("Interrupted while waiting for page " + task.page().page(), e);
            }
        }
        ctx.setArbitrationMs(System.currentTimeMillis() - start);
    }

    /**
     * Waits for one page in short slices so cancellation is noticed while waiting. A page gets
     * {@code pageTimeoutMs} from the moment it starts; a page that never starts is bounded by the
     * run-wide deadline.
     */
    private List<ArbitrationOutcome> awaitPage(PageTask task, long runDeadline, CancellationToken token)
            throws InterruptedException, ExecutionException, TimeoutException {
        long pageTimeout = TimeUnit.MILLISECONDS.toNanos(pageTimeoutMs);
        while (true) {
            token.throwIfCancelled();
            if (task.future().isDone()) {
                return task.future().get();
            }
            long startedAt = task.startedAt().get();
            long deadline = startedAt == NOT_STARTED ? runDeadline : Math.min(runDeadline, startedAt + pageTimeout);
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new TimeoutException("page " + task.page().page());
            }
            if (task.finished().await(Math.min(remaining, POLL_NANOS), TimeUnit.NANOSECONDS)) {
                return task.future().get();
            }
        }
    }

    // ===== Normalization =====

    private record TableJob(Section section, SelectedTable table, CompletableFuture<NormalizedTable> future) {}

    private void normalize(SimPipelineContext ctx, CancellationToken token) {
        long start = System.currentTimeMillis();
        if (ctx.getSections().isEmpty() && !ctx.getSelectedTables().isEmpty()) {
            ctx.getSections().add(implicitSection(ctx));
        }

        List<TableJob> jobs = new ArrayList<>();
        for (SelectedTable table : ctx.getSelectedTables()) {
            token.throwIfCancelled();
            Optional<Section> section = SectionClassifier.sectionFor(ctx.getSections(), table.page());
            if (section.isEmpty()) {
                PageRegion region = table.candidate().region();
                log.warn("[Pipeline] {}: table outside any section, recorded as coverage gap", region.describe());
                ctx.getCoverageGaps().add(new CoverageGap(region.page(), region.index(), GapReason.NO_SECTION,
                        "table on a page outside any recognized section"));
                continue;
            }
            CompletableFuture<NormalizedTable> future = CompletableFuture.supplyAsync(() ->
                    fieldNormalizer.normalize(table.candidate(), table.score().total(), section.get(), token),
                    workerPool);
            jobs.add(new TableJob(section.get(), table, future));
        }

        // Barrier: every table finished before the single-writer build
        Map<Section, List<NormalizedTable>> bySection = new LinkedHashMap<>();
        ctx.getSections().forEach(s -> bySection.put(s, new ArrayList<>()));
        for (TableJob job : jobs) {
            NormalizedTable normalized;
            try {
                normalized = job.future().join();
            } catch (CompletionException e) {
                jobs.forEach(j -> j.future().cancel(true));
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException re) throw re;
                throw new IllegalStateException("Normalization failed for " + job.table().candidate().region().describe(), cause);
            }
            bySection.get(job.section()).add(normalized);
            ctx.getSkippedRows().addAll(normalized.skippedRows());
        }

        bySection.forEach((section, tables) -> {
            List<FieldRecord> fields = new ArrayList<>();
            List<DictionaryRow> rows = new ArrayList<>();
            for (NormalizedTable table : tables) {
                fields.addAll(table.fields());
                rows.addAll(table.dictionaryRows());
                ctx.getDiscoveredEnums().addAll(table.enums());
            }
            ctx.getSectionContents().add(new SectionContent(section, fields, rows));
        });
        ctx.setNormalizationMs(System.currentTimeMillis() - start);
    }

    /**
     * A document with tables but no recognizable heading is treated as one message.
     */
    private static Section implicitSection(SimPipelineContext ctx) {
        Document document = ctx.getDocument();
        String label = document.standard() == null || document.standard().isBlank()
                ? IMPLICIT_SECTION_LABEL : document.standard().strip();
        List<PageText> pages = ctx.getPages();
        Section section = new Section(SectionKind.MESSAGE, label, "",
                pages.get(0).page(), pages.get(pages.size() - 1).page());
        log.info("[Pipeline] no section headings recognized, treating pages {}-{} as message {}",
                section.startPage(), section.endPage(), label);
        return section;
    }

    // ===== Input contract =====

    private static void requireValid(IngestionRequest request) {
        if (request == null) {
            throw new InvalidPipelineInputException("Ingestion request must not be null");
        }
        if (request.document() == null) {
            throw new InvalidPipelineInputException("Document must not be null");
        }
        if (request.pages() == null) {
            throw new InvalidPipelineInputException("Page list must not be null");
        }
        if (request.primaryExtractor() == null || request.secondaryExtractor() == null) {
            throw new InvalidPipelineInputException("Both table extractors are required");
        }
        if (request.document().pageCount() < 0) {
            throw new InvalidPipelineInputException("Page count must not be negative");
        }
        for (PageText page : request.pages()) {
            if (page == null) {
                throw new InvalidPipelineInputException("Page list must not contain null pages");
            }
            if (page.page() < 1) {
                throw new InvalidPipelineInputException("Page numbers are 1-based: " + page.page());
            }
        }
    }
}
