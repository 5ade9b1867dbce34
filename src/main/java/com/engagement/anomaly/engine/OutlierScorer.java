package com.engagement.anomaly.engine;

import com.engagement.anomaly.config.DetectionConfig;
import com.engagement.anomaly.engine.isolationforest.FeatureExtractor;
import com.engagement.anomaly.engine.isolationforest.IsolationForest;
import com.engagement.anomaly.engine.isolationforest.StandardScaler;
import com.engagement.anomaly.model.FeatureVector;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Labels every row of a feature batch as anomalous or normal.
 *
 * A fresh, seeded Isolation Forest is fitted on the standardized batch for each call and
 * discarded afterwards. The decision threshold is the {@code contamination} percentile of the
 * negated anomaly scores, so roughly that share of points ends up flagged.
 */
@Component
public class OutlierScorer {

    private final int ensembleSize;
    private final double contamination;
    private final long randomSeed;
    private final int maxSamples;

    @Autowired
    public OutlierScorer(DetectionConfig config) {
        this(config.getModel().getEnsembleSize(),
                config.getModel().getContamination(),
                config.getModel().getRandomSeed(),
                config.getModel().getMaxSamples());
    }

    public OutlierScorer(int ensembleSize, double contamination, long randomSeed, int maxSamples) {
        if (contamination <= 0.0 || contamination > 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got " + contamination);
        }
        if (ensembleSize <= 0 || maxSamples <= 0) {
            throw new IllegalArgumentException("ensembleSize and maxSamples must be positive");
        }
        this.ensembleSize = ensembleSize;
        this.contamination = contamination;
        this.randomSeed = randomSeed;
        this.maxSamples = maxSamples;
    }

    public List<Boolean> score(List<FeatureVector> features) {
        if (features.isEmpty()) {
            throw new IllegalArgumentException("Cannot score an empty feature batch");
        }

        double[][] scaled = StandardScaler.fitTransform(FeatureExtractor.toMatrix(features));
        requireFinite(scaled);
        IsolationForest forest = IsolationForest.fit(scaled, ensembleSize, maxSamples, randomSeed);

        // Lower is more abnormal
        double[] negated = forest.anomalyScores(scaled);
        for (int i = 0; i < negated.length; i++) negated[i] = -negated[i];

        double offset = percentile(negated, 100.0 * contamination);

        List<Boolean> flags = new ArrayList<>(negated.length);
        for (double s : negated) {
            flags.add(s < offset);
        }
        return flags;
    }

    // Overflow in the raw scores surfaces here as NaN or infinity
    private static void requireFinite(double[][] scaled) {
        for (int row = 0; row < scaled.length; row++) {
            for (int col = 0; col < scaled[row].length; col++) {
                if (!Double.isFinite(scaled[row][col])) {
                    throw new ArithmeticException("Non-finite feature " + FeatureExtractor.FEATURE_NAMES[col]
                            + " at point " + row);
                }
            }
        }
    }

    /**
     * Percentile with linear interpolation between the two closest ranks.
     */
    static double percentile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double rank = q / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (rank - lo);
    }
}
