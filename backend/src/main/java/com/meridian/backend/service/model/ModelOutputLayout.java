package com.meridian.backend.service.model;

import com.meridian.backend.model.Direction;
import com.meridian.backend.model.Horizon;

/**
 * Index arithmetic for the raw model output. For the horizons in ascending order the
 * array holds the predicted returns, then one (down, flat, up) logit triple per horizon,
 * then one risk score per horizon.
 */
public final class ModelOutputLayout {

    public static final int HORIZONS = Horizon.values().length;
    public static final int CLASSES = Direction.values().length;

    public static final int RETURNS_OFFSET = 0;
    public static final int LOGITS_OFFSET = RETURNS_OFFSET + HORIZONS;
    public static final int RISK_OFFSET = LOGITS_OFFSET + HORIZONS * CLASSES;
    public static final int OUTPUT_SIZE = RISK_OFFSET + HORIZONS;

    private ModelOutputLayout() {
    }

    public static int returnIndex(Horizon horizon) {
        return RETURNS_OFFSET + horizon.ordinal();
    }

    public static int logitIndex(Horizon horizon, Direction direction) {
        return LOGITS_OFFSET + horizon.ordinal() * CLASSES + direction.getValue();
    }

    public static int riskIndex(Horizon horizon) {
        return RISK_OFFSET + horizon.ordinal();
    }

    /**
     * Numerically stable softmax over the logit triple of one horizon.
     */
    public static double[] softmax(double[] raw, Horizon horizon) {
        int offset = logitIndex(horizon, Direction.DOWN);
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < CLASSES; i++) {
            max = Math.max(max, raw[offset + i]);
        }
        double[] probabilities = new double[CLASSES];
        double sum = 0.0;
        for (int i = 0; i < CLASSES; i++) {
            probabilities[i] = Math.exp(raw[offset + i] - max);
            sum += probabilities[i];
        }
        for (int i = 0; i < CLASSES; i++) {
            probabilities[i] /= sum;
        }
        return probabilities;
    }

    /**
     * Index of the largest probability; ties keep the lower index.
     */
    public static int argmax(double[] probabilities) {
        int best = 0;
        for (int i = 1; i < probabilities.length; i++) {
            if (probabilities[i] > probabilities[best]) {
                best = i;
            }
        }
        return best;
    }
}
