package com.metricwatch.core.detection.ml;

import com.metricwatch.core.detection.ml.state.ModelState;
import com.metricwatch.core.detection.ml.state.ScalerState;
import com.metricwatch.core.error.ModelPersistenceException;

/**
 * Converts a {@link FittedModel} to its {@link ModelState} and back.
 *
 * <p>
 * {@link #toModel(ModelState)} rebuilds the complete fitted state or fails;
 * it never returns a partially populated model.
 * </p>
 */
final class ModelStateMapper {

    ModelState toState(FittedModel fitted) {
        ModelState state = new ModelState();
        state.setAlgorithm(fitted.algorithm().id());
        state.setContamination(fitted.contamination());
        state.setThreshold(fitted.threshold());
        state.setTrainingSamples(fitted.trainingSamples());
        state.setFittedAt(fitted.fittedAt());

        ScalerState scaler = new ScalerState();
        scaler.setMean(fitted.scaler().mean());
        scaler.setScale(fitted.scaler().scale());
        state.setScaler(scaler);

        AnomalyModel model = fitted.model();
        if (model instanceof IsolationForest forest) {
            state.setIsolationForest(forest.toState());
        } else if (model instanceof LocalOutlierFactor lof) {
            state.setLocalOutlierFactor(lof.toState());
        } else {
            throw new IllegalStateException("Unsupported model type: " + model.getClass().getName());
        }
        return state;
    }

    /**
     * @param state deserialized artifact
     * @return the fitted model it describes
     * @throws ModelPersistenceException if the artifact has an unknown format,
     *                                   version or algorithm, or is internally
     *                                   inconsistent
     */
    FittedModel toModel(ModelState state) {
        if (!ModelState.FORMAT.equals(state.getFormat())) {
            throw new ModelPersistenceException("Unsupported model format: '" + state.getFormat()
                    + "' (expected '" + ModelState.FORMAT + "')");
        }
        if (!ModelState.VERSION.equals(state.getVersion())) {
            throw new ModelPersistenceException("Unsupported model version: '" + state.getVersion()
                    + "' (expected '" + ModelState.VERSION + "')");
        }
        if (state.getAlgorithm() == null) {
            throw new ModelPersistenceException("Model artifact does not name an algorithm");
        }

        try {
            Algorithm algorithm = Algorithm.fromId(state.getAlgorithm());
            StandardScaler scaler = toScaler(state.getScaler());

            AnomalyModel model = switch (algorithm) {
                case ISOLATION_FOREST -> {
                    if (state.getIsolationForest() == null) {
                        throw new IllegalArgumentException("isolationForest section is missing");
                    }
                    yield IsolationForest.fromState(state.getIsolationForest(), scaler.features());
                }
                case LOCAL_OUTLIER_FACTOR -> {
                    if (state.getLocalOutlierFactor() == null) {
                        throw new IllegalArgumentException("localOutlierFactor section is missing");
                    }
                    yield LocalOutlierFactor.fromState(state.getLocalOutlierFactor(), scaler.features());
                }
            };

            if (!(state.getContamination() > 0 && state.getContamination() <= 0.5)) {
                throw new IllegalArgumentException("contamination out of range: " + state.getContamination());
            }
            if (!(state.getThreshold() > 0 && state.getThreshold() < 1)) {
                throw new IllegalArgumentException("threshold out of range: " + state.getThreshold());
            }

            return new FittedModel(scaler, model, state.getContamination(), state.getThreshold(),
                    state.getTrainingSamples(), state.getFittedAt());
        } catch (IllegalArgumentException e) {
            throw new ModelPersistenceException("Invalid model artifact: " + e.getMessage(), e);
        }
    }

    private static StandardScaler toScaler(ScalerState state) {
        if (state == null || state.getMean() == null || state.getScale() == null) {
            throw new IllegalArgumentException("scaler section is missing");
        }
        if (state.getMean().length == 0) {
            throw new IllegalArgumentException("scaler has no features");
        }
        for (double s : state.getScale()) {
            if (!(s > 0) || !Double.isFinite(s)) {
                throw new IllegalArgumentException("scaler scale must be positive and finite, got: " + s);
            }
        }
        return new StandardScaler(state.getMean(), state.getScale());
    }
}
