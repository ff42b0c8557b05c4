package com.meridian.backend.service.model;

import com.meridian.backend.config.ModelProperties;
import com.meridian.backend.exception.FeatureShapeMismatchException;
import com.meridian.backend.exception.InferenceTimeoutException;
import com.meridian.backend.exception.ModelUnavailableException;
import com.meridian.backend.model.Direction;
import com.meridian.backend.model.FeatureVector;
import com.meridian.backend.model.Horizon;
import com.meridian.backend.model.HorizonPrediction;
import com.meridian.backend.model.ModelPrediction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the {@link PredictionModel} on its own executor under a timeout and decodes the
 * raw output into per-horizon predictions.
 */
@Service
@Slf4j
public class ModelAdapter {

    private final PredictionModel model;
    private final ModelProperties properties;
    private final Executor inferenceExecutor;

    public ModelAdapter(PredictionModel model,
                        ModelProperties properties,
                        @Qualifier("inferenceExecutor") Executor inferenceExecutor) {
        this.model = model;
        this.properties = properties;
        this.inferenceExecutor = inferenceExecutor;
    }

    public ModelPrediction infer(FeatureVector features) {
        String symbol = features.getSymbol();
        if (features.size() != model.inputDimension()) {
            throw new FeatureShapeMismatchException(symbol, "Model input", model.inputDimension(), features.size());
        }
        double[] raw = invoke(symbol, features.getValues());
        if (raw == null || raw.length != ModelOutputLayout.OUTPUT_SIZE) {
            throw new FeatureShapeMismatchException(symbol, "Model output",
                    ModelOutputLayout.OUTPUT_SIZE, raw == null ? 0 : raw.length);
        }
        for (double value : raw) {
            if (!Double.isFinite(value)) {
                throw new ModelUnavailableException(symbol, "Model returned a non-finite output for " + symbol);
            }
        }
        return decode(symbol, features, raw);
    }

    public String modelVersion() {
        return model.version();
    }

    private double[] invoke(String symbol, double[] input) {
        long timeoutMs = properties.getInferenceTimeout().toMillis();
        FutureTask<double[]> task = new FutureTask<>(() -> model.predict(input));
        inferenceExecutor.execute(task);
        try {
            return task.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            task.cancel(true);
            log.warn("⏱️ Inference timed out symbol={} timeoutMs={}", symbol, timeoutMs);
            throw new InferenceTimeoutException(symbol, timeoutMs);
        } catch (InterruptedException ex) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new ModelUnavailableException(symbol, "Interrupted during inference", ex);
        } catch (CancellationException ex) {
            throw new ModelUnavailableException(symbol, "Inference was cancelled", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            throw new ModelUnavailableException(symbol, "Model failed for " + symbol + ": " + cause.getMessage(), cause);
        }
    }

    private ModelPrediction decode(String symbol, FeatureVector features, double[] raw) {
        Map<Horizon, HorizonPrediction> horizons = new EnumMap<>(Horizon.class);
        for (Horizon horizon : Horizon.values()) {
            double[] probabilities = ModelOutputLayout.softmax(raw, horizon);
            Direction direction = Direction.fromClassIndex(ModelOutputLayout.argmax(probabilities));
            horizons.put(horizon, new HorizonPrediction(
                    horizon,
                    raw[ModelOutputLayout.returnIndex(horizon)],
                    direction,
                    probabilities[Direction.DOWN.getValue()],
                    probabilities[Direction.FLAT.getValue()],
                    probabilities[Direction.UP.getValue()],
                    raw[ModelOutputLayout.riskIndex(horizon)]
            ));
        }
        log.debug("Decoded prediction symbol={} asOf={} model={}", symbol, features.getAsOf(), model.version());
        return new ModelPrediction(symbol, features.getAsOf(), model.version(), horizons);
    }
}
