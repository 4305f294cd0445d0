package io.intellixity.polyquery.pipeline;

import io.intellixity.polyquery.exec.StoreExecutionException;
import io.intellixity.polyquery.plan.QueryPlan;
import io.intellixity.polyquery.plan.Stage;
import io.intellixity.polyquery.plan.StoreQuery;
import io.intellixity.polyquery.row.Row;
import io.intellixity.polyquery.spi.StoreAdapter;
import io.intellixity.polyquery.substitution.StageResultTable;
import io.intellixity.polyquery.substitution.SubstitutionException;
import io.intellixity.polyquery.substitution.Substitutions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Runs the stages of a plan strictly in order, feeding each stage's declared outputs into
 * the placeholders of later stages.\n
 *
 * A run owns its {@link StageResultTable}; nothing is shared between runs, so one executor
 * may serve concurrent requests.
 */
public final class PipelineExecutor {
  private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

  private final StoreAdapterRegistry adapters;
  private final StageListener listener;

  public PipelineExecutor(StoreAdapterRegistry adapters) {
    this(adapters, StageListener.NONE);
  }

  public PipelineExecutor(StoreAdapterRegistry adapters, StageListener listener) {
    this.adapters = Objects.requireNonNull(adapters, "adapters");
    this.listener = (listener == null) ? StageListener.NONE : listener;
  }

  /**
   * @throws StoreExecutionException if a stage has no adapter, its query cannot be substituted, or the store fails
   * @throws CancellationException if the calling thread is interrupted between stages
   */
  public PipelineRun execute(QueryPlan plan) {
    Objects.requireNonNull(plan, "plan");
    StageResultTable table = new StageResultTable();
    LinkedHashMap<String, List<Row>> stageRows = new LinkedHashMap<>();
    List<Row> last = List.of();

    for (Stage stage : plan) listener.onTransition(stage, StageState.PENDING);

    for (Stage stage : plan) {
      if (Thread.currentThread().isInterrupted()) {
        listener.onTransition(stage, StageState.FAILED);
        throw new CancellationException("Pipeline cancelled before stage " + stage.number());
      }
      try {
        last = runStage(stage, table);
      } catch (RuntimeException e) {
        listener.onTransition(stage, StageState.FAILED);
        throw e;
      }
      stageRows.put(PipelineRun.stageKey(stage.number()), last);
      listener.onTransition(stage, StageState.RECORDED);
    }

    listener.onTransition(plan.last(), StageState.DONE);
    return new PipelineRun(last, stageRows, table);
  }

  private List<Row> runStage(Stage stage, StageResultTable table) {
    StoreAdapter adapter = adapters.find(stage.storeKind())
        .orElseThrow(() -> new StoreExecutionException(stage.storeKind(),
            "no adapter registered for stage " + stage.number()));

    listener.onTransition(stage, StageState.SUBSTITUTING);
    StoreQuery query;
    try {
      query = Substitutions.substitute(stage.query(), table, stage.storeKind());
    } catch (SubstitutionException e) {
      throw new StoreExecutionException(stage.storeKind(), e.getMessage(), e);
    }

    listener.onTransition(stage, StageState.EXECUTING);
    long start = System.nanoTime();
    List<Row> rows = adapter.execute(query);
    table.record(stage.number(), stage.outputKeys(), rows);

    if (log.isDebugEnabled()) {
      log.debug("polyquery.pipeline op=STAGE stage={} store={} rows={} durationMs={} outputKeys={}",
          stage.number(), stage.storeKind().wireName(), rows.size(),
          (System.nanoTime() - start) / 1_000_000, stage.outputKeys());
    }
    return rows;
  }
}
