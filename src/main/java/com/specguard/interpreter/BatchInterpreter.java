package com.specguard.interpreter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.specguard.core.ir.IntermediateRepresentation;
import com.specguard.core.trace.ExecutionTrace;
import com.specguard.core.trace.IssueCategory;
import com.specguard.core.trace.SemanticIssue;
import com.specguard.core.validator.ValidationResult;

/**
 * Interprets many independent IRs in parallel.
 *
 * Results come back in input order. A task that throws or exceeds the timeout
 * yields a result carrying a single internal_error issue instead of failing the batch.
 * The timeout bounds the wait once every IR has been submitted.
 */
@Service
public class BatchInterpreter {

    private static final Logger log = LoggerFactory.getLogger(BatchInterpreter.class);

    private final IRInterpreter interpreter;
    private final Executor executor;
    private final long timeoutSeconds;

    public BatchInterpreter(
            IRInterpreter interpreter,
            @Qualifier("interpreterExecutor") Executor executor,
            @Value("${specguard.batch.timeout-seconds:30}") long timeoutSeconds
    ) {
        this.interpreter    = interpreter;
        this.executor       = executor;
        this.timeoutSeconds = timeoutSeconds;
    }

    public List<InterpretationResult> interpretAll(List<IntermediateRepresentation> irs) {
        if (irs == null || irs.isEmpty()) {
            return List.of();
        }

        log.info("[Batch] Interpreting {} IR(s), timeout {}s", irs.size(), timeoutSeconds);

        List<CompletableFuture<InterpretationResult>> futures = new ArrayList<>(irs.size());
        for (IntermediateRepresentation ir : irs) {
            futures.add(submit(ir, futures.size()));
        }

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
        List<InterpretationResult> results = new ArrayList<>(irs.size());

        for (int i = 0; i < futures.size(); i++) {
            results.add(await(futures.get(i), irs.get(i), i, deadline));
        }

        BatchSummary summary = summarize(results);
        log.info("[Batch] Done: {} proceed, {} blocked", summary.getProceed(), summary.getBlocked());
        return results;
    }

    /**
     * A saturated pool rejects the task; the IR is then interpreted on the calling
     * thread so every input still gets its own result.
     */
    private CompletableFuture<InterpretationResult> submit(IntermediateRepresentation ir, int position) {
        try {
            return CompletableFuture.supplyAsync(() -> interpreter.interpret(ir), executor);
        } catch (RejectedExecutionException e) {
            log.debug("[Batch] Pool saturated, interpreting IR #{} on the calling thread", position);
            CompletableFuture<InterpretationResult> inline = new CompletableFuture<>();
            try {
                inline.complete(interpreter.interpret(ir));
            } catch (RuntimeException failure) {
                inline.completeExceptionally(failure);
            }
            return inline;
        }
    }

    private InterpretationResult await(
            CompletableFuture<InterpretationResult> future,
            IntermediateRepresentation ir,
            int position,
            long deadline
    ) {
        long remaining = Math.max(0L, deadline - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);

        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Batch] IR #{} timed out after {}s", position, timeoutSeconds);
            return failed(ir, "Interpretation timed out after " + timeoutSeconds + "s");

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Batch] IR #{} failed: {}", position, cause.getMessage(), cause);
            return failed(ir, "Interpretation failed: " + cause.getMessage());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Batch] Interrupted while waiting for IR #{}", position);
            return failed(ir, "Interpretation interrupted");
        }
    }

    private InterpretationResult failed(IntermediateRepresentation ir, String message) {
        List<SemanticIssue> issues = List.of(
                SemanticIssue.error(IssueCategory.INTERNAL_ERROR, message, null, null));
        return new InterpretationResult(ir, new ExecutionTrace(), ValidationResult.of(issues), issues);
    }

    public BatchSummary summarize(List<InterpretationResult> results) {
        int proceed = 0;
        for (InterpretationResult result : results) {
            if (interpreter.shouldGenerateCode(result)) proceed++;
        }
        return new BatchSummary(results.size(), proceed, results.size() - proceed);
    }

    public static class BatchSummary {

        private final int total;
        private final int proceed;
        private final int blocked;

        public BatchSummary(int total, int proceed, int blocked) {
            this.total   = total;
            this.proceed = proceed;
            this.blocked = blocked;
        }

        public int getTotal()   { return total; }
        public int getProceed() { return proceed; }
        public int getBlocked() { return blocked; }

        @Override
        public String toString() {
            return "BatchSummary{total=" + total + ", proceed=" + proceed + ", blocked=" + blocked + "}";
        }
    }
}
