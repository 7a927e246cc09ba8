package org.jstats.tipster_api.modules.prediction.service;

import org.jspecify.annotations.Nullable;
import org.jstats.tipster_api.core.config.ExecutorConfig;
import org.jstats.tipster_api.modules.prediction.model.CanonicalPredictionResult;
import org.jstats.tipster_api.modules.prediction.model.PredictionPayload;
import org.jstats.tipster_api.modules.prediction.model.PredictionRequest;
import org.jstats.tipster_api.modules.prediction.registry.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs one prediction: alias lookup, a single model call, normalization.
 * <p>
 * Entitlements are not checked here; callers consult the entitlement gate before invoking.
 * Results are not persisted here either; the model services hand them to the user service.
 */
@Service
public class PredictionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PredictionOrchestrator.class);

    private final ModelRegistry registry;
    private final PredictionModelClient client;
    private final ResponseNormalizer normalizer;
    private final ExecutorService executor;

    public PredictionOrchestrator(
            ModelRegistry registry,
            PredictionModelClient client,
            ResponseNormalizer normalizer,
            @Qualifier(ExecutorConfig.OUTBOUND_EXECUTOR) ExecutorService executor) {
        this.registry = registry;
        this.client = client;
        this.normalizer = normalizer;
        this.executor = executor;
    }

    /**
     * @param request    the match to predict
     * @param alias      registry alias of the model to call
     * @param credential bearer token forwarded to the model service, or null for anonymous calls
     * @throws org.jstats.tipster_api.modules.prediction.registry.UnknownModelException if the alias is not registered; nothing is sent
     * @throws org.jstats.tipster_api.core.upstream.TransportException on non-2xx, I/O failure or timeout
     * @throws CancellationException if the calling thread was interrupted while the call was in flight
     */
    public CanonicalPredictionResult predict(PredictionRequest request, String alias, @Nullable String credential) {
        var model = registry.require(alias);
        var payload = PredictionPayload.from(request, model);

        log.info("Predicting {} vs {} on {} with model '{}'",
                request.teamA(), request.teamB(), request.matchDateISO(), model.alias());

        var raw = client.predict(model, payload, credential);
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Prediction with model '" + alias + "' was cancelled");
        }

        var result = normalizer.normalize(raw, alias);
        if (log.isDebugEnabled()) {
            log.debug("Processed prediction response: {}", result);
        }
        return result;
    }

    /**
     * Same as {@link #predict} on the outbound executor. The alias is resolved before the task is
     * submitted, so an unknown alias fails here. Cancelling the returned future with
     * {@code mayInterruptIfRunning=true} aborts the HTTP exchange and produces no result.
     */
    public Future<CanonicalPredictionResult> predictAsync(PredictionRequest request, String alias, @Nullable String credential) {
        registry.require(alias);
        return executor.submit(() -> predict(request, alias, credential));
    }
}
