package com.metricwatch.core.detection.ml;

import com.metricwatch.core.config.MlSettings;
import com.metricwatch.core.detection.ml.state.ModelState;
import com.metricwatch.core.error.MetricWatchException;
import com.metricwatch.core.error.ModelFitException;
import com.metricwatch.core.error.ModelNotFittedException;
import com.metricwatch.core.error.ModelPersistenceException;
import com.metricwatch.core.model.DetectionResult;
import com.metricwatch.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Batch anomaly detector backed by an unsupervised model.
 *
 * <p>
 * The detector is fitted on a snapshot of historical feature vectors (usually
 * the buffered values of one metric, see
 * {@link com.metricwatch.core.buffer.MetricRingBuffer#toMatrix(String)}) and
 * afterwards scores new vectors against what it learned.
 * </p>
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>Standardize each feature to zero mean and unit variance.</li>
 * <li>Fit the configured {@link Algorithm} and calibrate its decision offset
 * so that a {@code contamination} fraction of training rows falls below
 * it.</li>
 * <li>Score: {@code decision = scoreSamples - offset} is squashed into
 * [0, 1] by {@link Algorithm#squash(double)}; a row is anomalous when its
 * score exceeds {@code threshold}.</li>
 * </ol>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The fitted state is one immutable value behind a {@code volatile} field.
 * {@link #fit} and {@link #load} build a complete replacement and install it
 * in a single write, serialized by a lock. Prediction never locks and always
 * sees either the old or the new state, never a mix. A failed fit or load
 * leaves the previous state untouched.
 * </p>
 *
 * @since 1.0.0
 */
public class MlAnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(MlAnomalyDetector.class);

    private final Algorithm algorithm;
    private final MlSettings settings;
    private final Clock clock;
    private final ModelSerDe serDe = new ModelSerDe();
    private final ReentrantLock fitLock = new ReentrantLock();

    private volatile FittedModel fitted;

    public MlAnomalyDetector() {
        this(new MlSettings());
    }

    public MlAnomalyDetector(MlSettings settings) {
        this(Objects.requireNonNull(settings, "MlSettings must not be null").algorithm(), settings);
    }

    public MlAnomalyDetector(Algorithm algorithm, MlSettings settings) {
        this(algorithm, settings, Clock.systemUTC());
    }

    /**
     * @param algorithm model family to fit
     * @param settings  hyper-parameters; {@code settings.algorithm} is ignored
     * @param clock     time source for fit timestamps and results
     * @throws IllegalArgumentException if contamination is outside (0, 0.5] or
     *                                  threshold outside (0, 1)
     */
    public MlAnomalyDetector(Algorithm algorithm, MlSettings settings, Clock clock) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm must not be null");
        this.settings = Objects.requireNonNull(settings, "MlSettings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (!(settings.getContamination() > 0 && settings.getContamination() <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got: "
                    + settings.getContamination());
        }
        if (!(settings.getThreshold() > 0 && settings.getThreshold() < 1)) {
            throw new IllegalArgumentException("threshold must be in (0, 1), got: " + settings.getThreshold());
        }
    }

    /**
     * Create a detector from a saved artifact, adopting whatever algorithm it
     * was fitted with.
     *
     * @param path model artifact written by {@link #save(Path)}
     * @return a fitted detector
     * @throws ModelPersistenceException if the artifact cannot be read or is
     *                                   invalid
     */
    public static MlAnomalyDetector restore(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        ModelSerDe serDe = new ModelSerDe();
        FittedModel model = serDe.toModel(serDe.readState(path));

        MlSettings settings = new MlSettings();
        settings.setAlgorithm(model.algorithm().id());
        settings.setContamination(model.contamination());
        settings.setThreshold(model.threshold());

        MlAnomalyDetector detector = new MlAnomalyDetector(model.algorithm(), settings);
        detector.fitted = model;
        LOG.info("Restored {} model from {} ({} training samples)",
                model.algorithm().id(), path, model.trainingSamples());
        return detector;
    }

    // ---------------------------------------------------------------
    // Training
    // ---------------------------------------------------------------

    /**
     * Fit on a matrix of feature vectors.
     *
     * @param x training rows; at least 2 rows of at least 1 finite feature,
     *          all rows the same length
     * @return this detector
     * @throws ModelFitException if the input is invalid or the algorithm fails;
     *                           the previous fitted state is kept
     */
    public MlAnomalyDetector fit(double[][] x) {
        validateTrainingData(x);
        fitLock.lock();
        try {
            long start = System.nanoTime();
            StandardScaler scaler = StandardScaler.fit(x);
            double[][] scaled = scaler.transform(x);
            AnomalyModel model;
            try {
                model = algorithm.trainer(settings).train(scaled, settings.getContamination());
            } catch (MetricWatchException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ModelFitException(algorithm.id() + " fit failed: " + e.getMessage(), e);
            }
            this.fitted = new FittedModel(scaler, model, settings.getContamination(),
                    settings.getThreshold(), x.length, clock.instant());
            LOG.info("Fitted {} on {} samples x {} feature(s) in {} ms",
                    algorithm.id(), x.length, scaler.features(), (System.nanoTime() - start) / 1_000_000);
            return this;
        } finally {
            fitLock.unlock();
        }
    }

    private static void validateTrainingData(double[][] x) {
        if (x == null) {
            throw new ModelFitException("Training data must not be null");
        }
        if (x.length < 2) {
            throw new ModelFitException("At least 2 training samples are required, got: " + x.length);
        }
        if (x[0] == null || x[0].length == 0) {
            throw new ModelFitException("Training samples must have at least one feature");
        }
        int features = x[0].length;
        for (int i = 0; i < x.length; i++) {
            double[] row = x[i];
            if (row == null || row.length != features) {
                throw new ModelFitException("Row " + i + " has " + (row == null ? 0 : row.length)
                        + " feature(s), expected " + features);
            }
            for (double v : row) {
                if (!Double.isFinite(v)) {
                    throw new ModelFitException("Row " + i + " contains a non-finite value: " + v);
                }
            }
        }
    }

    private static void validateScoringData(double[][] x) {
        for (int i = 0; i < x.length; i++) {
            double[] row = x[i];
            if (row == null) {
                throw new IllegalArgumentException("Row " + i + " must not be null");
            }
            for (double v : row) {
                if (!Double.isFinite(v)) {
                    throw new IllegalArgumentException("Row " + i + " contains a non-finite value: " + v);
                }
            }
        }
    }

    // ---------------------------------------------------------------
    // Scoring
    // ---------------------------------------------------------------

    /**
     * Score a batch of feature vectors.
     *
     * @param x rows with the same feature count as the training data
     * @return per-row anomaly flags and scores
     * @throws ModelNotFittedException  if the detector has not been fitted
     * @throws IllegalArgumentException if a row has the wrong feature count or
     *                                  a non-finite value
     */
    public Prediction predict(double[][] x) {
        Objects.requireNonNull(x, "x must not be null");
        FittedModel current = requireFitted();
        validateScoringData(x);
        double[][] scaled = current.scaler().transform(x);
        double[] decision = current.model().decisionFunction(scaled);

        boolean[] anomalies = new boolean[x.length];
        double[] scores = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            scores[i] = current.algorithm().squash(decision[i]);
            anomalies[i] = scores[i] > current.threshold();
        }
        return new Prediction(anomalies, scores);
    }

    /**
     * Score one feature vector.
     *
     * @param x features
     * @return anomaly flag and score
     */
    public SinglePrediction predictSingle(double[] x) {
        Objects.requireNonNull(x, "x must not be null");
        Prediction prediction = predict(new double[][] { x });
        return new SinglePrediction(prediction.isAnomaly(0), prediction.score(0));
    }

    /**
     * Score a single-feature value and wrap it as a {@link DetectionResult}.
     *
     * @param metricName metric the value belongs to
     * @param value      observed value
     * @return detection result
     */
    public DetectionResult evaluate(String metricName, double value) {
        SinglePrediction prediction = predictSingle(new double[] { value });
        return toResult(metricName, value, prediction.score(), prediction.isAnomaly());
    }

    /**
     * Build a {@link DetectionResult} for a score produced by this detector.
     * Severity: above 0.9 critical, above 0.8 high, above 0.7 medium,
     * otherwise low; non-anomalous results are always low.
     *
     * @param metricName metric key
     * @param value      observed value
     * @param score      anomaly score in [0, 1]
     * @param anomaly    whether the value was flagged
     * @return detection result
     */
    public DetectionResult toResult(String metricName, double value, double score, boolean anomaly) {
        FittedModel current = fitted;
        return DetectionResult.builder()
                .metricName(metricName)
                .value(value)
                .anomaly(anomaly)
                .score(score)
                .severity(anomaly ? Severity.fromScore(score) : Severity.LOW)
                .threshold(current != null ? current.threshold() : settings.getThreshold())
                .detector(algorithm.id())
                .timestamp(clock.instant())
                .build();
    }

    private FittedModel requireFitted() {
        FittedModel current = fitted;
        if (current == null) {
            throw new ModelNotFittedException(algorithm.id() + " detector must be fitted before prediction");
        }
        return current;
    }

    // ---------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------

    /**
     * Write the fitted state as a JSON artifact.
     *
     * @param path target file; parent directories are created
     * @throws ModelNotFittedException   if the detector has not been fitted
     * @throws ModelPersistenceException on I/O failure
     */
    public void save(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        FittedModel current = fitted;
        if (current == null) {
            throw new ModelNotFittedException("Cannot save an unfitted " + algorithm.id() + " detector");
        }
        serDe.write(current, path);
        LOG.info("Saved {} model to {}", algorithm.id(), path);
    }

    /**
     * Replace the fitted state with one read from an artifact.
     *
     * @param path artifact written by {@link #save(Path)}
     * @return this detector
     * @throws ModelPersistenceException if the artifact cannot be read, has an
     *                                   unknown format or version, or was
     *                                   fitted with a different algorithm; the
     *                                   previous state is kept
     */
    public MlAnomalyDetector load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        ModelState state = serDe.readState(path);
        FittedModel loaded = serDe.toModel(state);
        if (loaded.algorithm() != algorithm) {
            throw new ModelPersistenceException("Model at " + path + " was fitted with "
                    + loaded.algorithm().id() + ", this detector uses " + algorithm.id());
        }
        fitLock.lock();
        try {
            this.fitted = loaded;
        } finally {
            fitLock.unlock();
        }
        LOG.info("Loaded {} model from {} ({} training samples)",
                algorithm.id(), path, loaded.trainingSamples());
        return this;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public boolean isFitted() {
        return fitted != null;
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    /**
     * @return threshold applied to scores; the loaded artifact's value once
     *         one has been loaded
     */
    public double getThreshold() {
        FittedModel current = fitted;
        return current != null ? current.threshold() : settings.getThreshold();
    }

    /**
     * @return number of rows the current model was trained on, or 0 if unfitted
     */
    public int getTrainingSamples() {
        FittedModel current = fitted;
        return current != null ? current.trainingSamples() : 0;
    }

    // ---------------------------------------------------------------
    // Results
    // ---------------------------------------------------------------

    /**
     * Per-row outcome of {@link #predict(double[][])}.
     */
    public static final class Prediction {
        private final boolean[] anomalies;
        private final double[] scores;

        Prediction(boolean[] anomalies, double[] scores) {
            this.anomalies = anomalies;
            this.scores = scores;
        }

        public boolean[] anomalies() {
            return anomalies.clone();
        }

        public double[] scores() {
            return scores.clone();
        }

        public boolean isAnomaly(int row) {
            return anomalies[row];
        }

        public double score(int row) {
            return scores[row];
        }

        public int size() {
            return scores.length;
        }
    }

    /**
     * Outcome of {@link #predictSingle(double[])}.
     */
    public static final class SinglePrediction {
        private final boolean anomaly;
        private final double score;

        SinglePrediction(boolean anomaly, double score) {
            this.anomaly = anomaly;
            this.score = score;
        }

        public boolean isAnomaly() {
            return anomaly;
        }

        public double score() {
            return score;
        }

        @Override
        public String toString() {
            return "SinglePrediction{anomaly=" + anomaly + ", score=" + score + "}";
        }
    }
}
