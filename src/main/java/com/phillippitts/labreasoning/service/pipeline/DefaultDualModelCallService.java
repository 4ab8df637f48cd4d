package com.phillippitts.labreasoning.service.pipeline;

import com.phillippitts.labreasoning.config.properties.PipelineProperties;
import com.phillippitts.labreasoning.exception.ModelCallException;
import com.phillippitts.labreasoning.service.model.ModelCallOutcome;
import com.phillippitts.labreasoning.service.model.ModelCallRequest;
import com.phillippitts.labreasoning.service.model.ModelClient;
import com.phillippitts.labreasoning.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default implementation running both fusion calls on the {@code modelExecutor} pool.
 *
 * <p><b>Thread Model:</b> each {@link #callBoth} submits up to two tasks to a bounded pool and
 * blocks until both finish or the join timeout expires. Worker threads inherit the caller's
 * Log4j2 ThreadContext through the executor's task decorator.
 *
 * <p><b>Error Handling:</b> every failure is captured per call as a failed
 * {@link ModelCallOutcome} with its own wall-clock duration. A call still pending at the deadline
 * is cancelled and reported as {@code timeout}.
 *
 * @see DualModelCallService
 */
@Service
public class DefaultDualModelCallService implements DualModelCallService {

    private static final Logger LOG = LogManager.getLogger(DefaultDualModelCallService.class);

    private final ModelClient modelClient;
    private final Executor executor;
    private final long defaultTimeoutMs;

    @Autowired
    public DefaultDualModelCallService(ModelClient modelClient,
                                       @Qualifier("modelExecutor") Executor executor,
                                       PipelineProperties properties) {
        this(modelClient, executor, properties.getFusionTimeoutMs());
    }

    /**
     * @param timeoutMs default join timeout; values {@code <= 0} fall back to 60000 ms
     */
    public DefaultDualModelCallService(ModelClient modelClient, Executor executor, long timeoutMs) {
        this.modelClient = Objects.requireNonNull(modelClient);
        this.executor = Objects.requireNonNull(executor);
        this.defaultTimeoutMs = timeoutMs <= 0 ? 60_000 : timeoutMs;
    }

    @Override
    public OutcomePair callBoth(ModelCallRequest primary, ModelCallRequest challenger, long timeoutMs) {
        Objects.requireNonNull(primary, "primary");
        final long toMs = timeoutMs > 0 ? timeoutMs : defaultTimeoutMs;

        CompletableFuture<ModelCallOutcome> fPrimary =
                CompletableFuture.supplyAsync(() -> runCall(primary), executor);
        CompletableFuture<ModelCallOutcome> fChallenger = challenger == null
                ? CompletableFuture.completedFuture(ModelCallOutcome.skipped(null))
                : CompletableFuture.supplyAsync(() -> runCall(challenger), executor);

        try {
            CompletableFuture.allOf(fPrimary, fChallenger).get(toMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            LOG.warn("Fusion calls timed out after {} ms", toMs);
            fPrimary.cancel(true);
            fChallenger.cancel(true);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException ee) {
            LOG.debug("Fusion join completed exceptionally, collecting finished outcomes: {}", ee.getMessage());
        }

        return new OutcomePair(
                resultOrTimeout(fPrimary, primary.modelId(), toMs),
                challenger == null
                        ? ModelCallOutcome.skipped(null)
                        : resultOrTimeout(fChallenger, challenger.modelId(), toMs));
    }

    private ModelCallOutcome resultOrTimeout(CompletableFuture<ModelCallOutcome> f, String modelId, long toMs) {
        try {
            if (f.isDone() && !f.isCancelled()) {
                return f.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            return ModelCallOutcome.failure(modelId, "unexpected_error", toMs);
        }
        return ModelCallOutcome.failure(modelId, "timeout", toMs);
    }

    private ModelCallOutcome runCall(ModelCallRequest request) {
        long t0 = System.nanoTime();
        try {
            String text = modelClient.invoke(request);
            return ModelCallOutcome.success(request.modelId(), text, TimeUtils.elapsedMillis(t0));
        } catch (ModelCallException e) {
            LOG.warn("{} failed: {}", request.modelId(), e.getMessage());
            return ModelCallOutcome.failure(request.modelId(), e.getMessage(), TimeUtils.elapsedMillis(t0));
        } catch (RuntimeException e) {
            LOG.error("{} unexpected error", request.modelId(), e);
            return ModelCallOutcome.failure(request.modelId(), "unexpected_error", TimeUtils.elapsedMillis(t0));
        }
    }
}
