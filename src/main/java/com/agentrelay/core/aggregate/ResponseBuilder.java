package com.agentrelay.core.aggregate;

import com.agentrelay.core.model.AggregatedResult;
import com.agentrelay.core.model.AggregationPolicy;
import com.agentrelay.core.model.RunOutcome;
import com.agentrelay.core.model.Task;
import com.agentrelay.core.model.TaskResult;
import com.agentrelay.core.routing.Decomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Converts a finished dispatch table into the caller-facing {@link AggregatedResult}.
 * <p>
 * Outcome rules, in order:
 * <ol>
 *   <li>run deadline hit → {@code DEADLINE_EXCEEDED}, partial</li>
 *   <li>nothing succeeded → {@code ALL_TASKS_FAILED}</li>
 *   <li>everything succeeded → {@code COMPLETED}</li>
 *   <li>some failed → {@code COMPLETED_PARTIAL} when the policy tolerates it, else {@code TASK_FAILED}</li>
 * </ol>
 * Failed tasks are listed in an annotation block and never passed to the merger.
 */
@Service
public class ResponseBuilder {

    private static final Logger log = LoggerFactory.getLogger(ResponseBuilder.class);

    private final List<ResultMerger> mergers;
    private final ReplyParser parser;
    private final ResultMerger fallback = new ListingResultMerger();

    public ResponseBuilder(List<ResultMerger> mergers, ReplyParser parser) {
        this.mergers = List.copyOf(mergers);
        this.parser = parser;
    }

    public AggregatedResult build(String runId, Decomposition decomposition, List<Task> tasks,
                                  boolean deadlineExceeded) {
        List<TaskResult> results = tasks.stream().map(this::toResult).toList();
        List<TaskResult> succeeded = results.stream().filter(TaskResult::succeeded).toList();
        List<TaskResult> failed = results.stream().filter(t -> !t.succeeded()).toList();
        ResultMerger merger = mergerFor(decomposition.role());

        if (deadlineExceeded) {
            StringBuilder sb = new StringBuilder("Error: run deadline exceeded; ")
                    .append(succeeded.size()).append(" of ").append(results.size())
                    .append(" tasks completed. Partial result:");
            if (!succeeded.isEmpty()) {
                sb.append("\n\n").append(body(merger, succeeded));
            }
            sb.append(annotations(merger, failed));
            return new AggregatedResult(runId, RunOutcome.DEADLINE_EXCEEDED, sb.toString(), results, true);
        }

        if (succeeded.isEmpty()) {
            String response = results.size() == 1
                    ? singleFailure(results.get(0))
                    : "Error: all " + results.size() + " tasks failed." + annotations(merger, failed);
            return new AggregatedResult(runId, RunOutcome.ALL_TASKS_FAILED, response, results, false);
        }

        if (failed.isEmpty()) {
            String response = results.size() == 1 ? succeeded.get(0).result() : body(merger, succeeded);
            return new AggregatedResult(runId, RunOutcome.COMPLETED, response, results, false);
        }

        if (decomposition.policy() == AggregationPolicy.REQUIRE_ALL) {
            String response = "Error: " + failed.size() + " of " + results.size()
                    + " required tasks failed." + annotations(merger, failed);
            return new AggregatedResult(runId, RunOutcome.TASK_FAILED, response, results, false);
        }

        String response = body(merger, succeeded) + annotations(merger, failed);
        return new AggregatedResult(runId, RunOutcome.COMPLETED_PARTIAL, response, results, false);
    }

    TaskResult toResult(Task task) {
        String orderId = task.result() == null ? null : parser.parse(task.result()).orderId();
        return new TaskResult(task.taskId(), task.worker(), task.payload(), task.status(), task.attempt(),
                task.result(), task.error(), task.failureKind(), orderId);
    }

    private String body(ResultMerger merger, List<TaskResult> succeeded) {
        try {
            return merger.merge(succeeded);
        } catch (RuntimeException e) {
            log.warn("{} failed, listing results instead: {}", merger.getClass().getSimpleName(), e.getMessage());
            return fallback.merge(succeeded);
        }
    }

    private ResultMerger mergerFor(String role) {
        return mergers.stream().filter(m -> m.supports(role)).findFirst().orElse(fallback);
    }

    private static String singleFailure(TaskResult task) {
        return "Error: task for " + task.worker() + " failed after " + task.attempt() + " attempt"
                + (task.attempt() == 1 ? "" : "s") + ": " + task.error();
    }

    private static String annotations(ResultMerger merger, List<TaskResult> failed) {
        if (failed.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("\n\n").append(merger.failureHeading());
        for (TaskResult task : failed) {
            sb.append("\n- ").append(merger.describe(task))
                    .append(" (attempts: ").append(task.attempt()).append("): ").append(task.error());
        }
        return sb.toString();
    }
}
