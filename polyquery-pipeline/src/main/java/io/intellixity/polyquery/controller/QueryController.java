package io.intellixity.polyquery.controller;

import io.intellixity.polyquery.cache.ResultCache;
import io.intellixity.polyquery.exec.StoreExecutionException;
import io.intellixity.polyquery.merge.ResultMerger;
import io.intellixity.polyquery.pipeline.PipelineExecutor;
import io.intellixity.polyquery.pipeline.PipelineRun;
import io.intellixity.polyquery.plan.PlanAcquisitionException;
import io.intellixity.polyquery.plan.QueryPlan;
import io.intellixity.polyquery.row.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Answers requests: cache lookup, then up to {@code maxRetries + 1} attempts of
 * plan, execute, merge, cache, summarize.\n
 *
 * Each failed attempt appends its error to the feedback handed to the planner on the next
 * attempt. Attempts run back to back with no delay.
 */
public final class QueryController {
  private static final Logger log = LoggerFactory.getLogger(QueryController.class);

  public static final int DEFAULT_MAX_RETRIES = 3;

  private final QueryPlanner planner;
  private final PipelineExecutor executor;
  private final ResultCache cache;
  private final ResultMerger merger;
  private final ResultSummarizer summarizer;
  private final int maxRetries;

  public QueryController(QueryPlanner planner,
                         PipelineExecutor executor,
                         ResultCache cache,
                         ResultSummarizer summarizer) {
    this(planner, executor, cache, new ResultMerger(), summarizer, DEFAULT_MAX_RETRIES);
  }

  public QueryController(QueryPlanner planner,
                         PipelineExecutor executor,
                         ResultCache cache,
                         ResultMerger merger,
                         ResultSummarizer summarizer,
                         int maxRetries) {
    if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
    this.planner = Objects.requireNonNull(planner, "planner");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.merger = Objects.requireNonNull(merger, "merger");
    this.summarizer = Objects.requireNonNull(summarizer, "summarizer");
    this.maxRetries = maxRetries;
  }

  public int maxRetries() { return maxRetries; }

  /**
   * @throws QueryPipelineException when every attempt failed
   * @throws CancellationException if the calling thread is interrupted while a plan executes
   */
  public QueryAnswer answer(QueryRequest request) {
    Objects.requireNonNull(request, "request");
    String text = request.text();

    Optional<List<Row>> cached = cache.lookup(text);
    if (cached.isPresent()) {
      if (log.isDebugEnabled()) log.debug("polyquery.controller op=CACHE_HIT rows={}", cached.get().size());
      List<Row> rows = cached.get();
      return new QueryAnswer(rows, request.humanReadable() ? summarize(text, rows) : null, true, 0);
    }

    int totalAttempts = maxRetries + 1;
    StringBuilder feedback = new StringBuilder();
    AttemptFailure last = null;
    RuntimeException lastError = null;

    for (int attempt = 1; attempt <= totalAttempts; attempt++) {
      try {
        QueryPlan plan = planner.plan(text, feedback.length() == 0 ? null : feedback.toString());
        if (plan == null) throw new PlanAcquisitionException("Planner returned no plan");
        PipelineRun run = executor.execute(plan);
        List<Row> rows = request.mergeKeys().isEmpty()
            ? run.rows()
            : merger.merge(run.stageRows(), request.mergeKeys());

        cache.store(text, rows);
        if (log.isDebugEnabled()) {
          log.debug("polyquery.controller op=ANSWERED attempt={} stages={} rows={}", attempt, plan.size(), rows.size());
        }
        return new QueryAnswer(rows, request.humanReadable() ? summarize(text, rows) : null, false, attempt);
      } catch (CancellationException e) {
        throw e;
      } catch (PlanAcquisitionException e) {
        last = new AttemptFailure(attempt, FailureKind.PLAN_ACQUISITION, e.getMessage());
        lastError = e;
      } catch (StoreExecutionException e) {
        last = new AttemptFailure(attempt, FailureKind.STORE_EXECUTION, e.getMessage());
        lastError = e;
      } catch (RuntimeException e) {
        last = new AttemptFailure(attempt, FailureKind.INTERNAL, String.valueOf(e.getMessage()));
        lastError = e;
      }

      log.warn("polyquery.controller op=ATTEMPT_FAILED attempt={} of={} kind={} error={}",
          attempt, totalAttempts, last.kind(), last.message());
      appendFeedback(feedback, last);
    }

    throw new QueryPipelineException(totalAttempts, last, lastError);
  }

  /** Runs {@link #answer(QueryRequest)} on {@code executor}; failures complete the future exceptionally. */
  public CompletableFuture<QueryAnswer> answerAsync(QueryRequest request, Executor executor) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(executor, "executor");
    return CompletableFuture.supplyAsync(() -> answer(request), executor);
  }

  private String summarize(String text, List<Row> rows) {
    try {
      String s = summarizer.summarize(text, rows);
      return (s == null || s.isBlank()) ? ResultSummarizer.FALLBACK : s;
    } catch (RuntimeException e) {
      log.warn("polyquery.controller op=SUMMARIZE_FAILED error={}", e.toString());
      return ResultSummarizer.FALLBACK;
    }
  }

  static void appendFeedback(StringBuilder feedback, AttemptFailure failure) {
    if (feedback.length() > 0) feedback.append('\n');
    feedback.append("Attempt ").append(failure.attempt()).append(" failed with error: ").append(failure.message()).append('\n')
        .append("Please fix the query and try again. Common issues to check:\n")
        .append("- Ensure JSON formatting is correct\n")
        .append("- Verify database names are correct ('postgresql', 'neo4j', 'mongodb')\n")
        .append("- Check that all referenced columns exist\n")
        .append("- Verify syntax for the specific database being queried\n");
  }
}
