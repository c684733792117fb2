package com.demo.loanmodel.evaluate;

import com.demo.loanmodel.config.ExportProperties;
import com.demo.loanmodel.exception.ModelEvaluationException;
import com.demo.loanmodel.normalize.FeatureColumn;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.EuclideanDistance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.neighboursearch.LinearNNSearch;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Held-out accuracy of a k-nearest-neighbour classifier over the scaled features.
 * The number is a quality signal for the client; the fitted model itself is discarded.
 * Voting mirrors the client: plain Euclidean distance, exactly k voters.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KnnEvaluator {

    /** Reported when every record carries the same label. */
    public static final double SINGLE_CLASS_ACCURACY = 100.0;

    private static final String CLASS_ATTRIBUTE = "loan_status_num";

    private final ExportProperties properties;

    /**
     * @param features scaled rows in {@link FeatureColumn} order
     * @param labels   0/1 label per row
     * @return accuracy in percent, rounded to two decimals
     */
    public double evaluate(double[][] features, int[] labels) {
        if (features.length != labels.length) {
            throw new IllegalArgumentException("features and labels differ in length");
        }
        if (Arrays.stream(labels).distinct().count() < 2) {
            log.info("Single label class; skipping KNN evaluation, accuracy = {}", SINGLE_CLASS_ACCURACY);
            return SINGLE_CLASS_ACCURACY;
        }

        int n = labels.length;
        int testSize = (int) Math.ceil(n * properties.getTestRatio());
        int trainSize = n - testSize;
        if (testSize == 0 || trainSize == 0) {
            throw new ModelEvaluationException(String.format(
                    "Cannot split %d records into train/test with ratio %.2f", n, properties.getTestRatio()));
        }

        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) order.add(i);
        Collections.shuffle(order, new Random(properties.getSeed()));

        Instances train = emptyDataset("train", trainSize);
        Instances test = emptyDataset("test", testSize);
        for (int i = 0; i < n; i++) {
            int row = order.get(i);
            (i < trainSize ? train : test).add(toInstance(features[row], labels[row]));
        }

        int k = Math.min(properties.getNeighbors(), trainSize);
        log.debug("KNN split: train={}, test={}, k={}", trainSize, testSize, k);

        try {
            LinearNNSearch search = newSearch(train);
            int correct = 0;
            for (Instance inst : test) {
                if (predict(search, inst, k) == (int) inst.classValue()) correct++;
            }
            double accuracy = round2(correct * 100.0 / testSize);
            log.info("KNN model trained successfully. Accuracy: {}%", accuracy);
            return accuracy;
        } catch (Exception e) {
            throw new ModelEvaluationException("KNN evaluation failed: " + e.getMessage(), e);
        }
    }

    static LinearNNSearch newSearch(Instances train) throws Exception {
        LinearNNSearch search = new LinearNNSearch();
        EuclideanDistance distance = new EuclideanDistance();
        // features are already in [0, 1]; Weka must not rescale them to the training range
        distance.setDontNormalize(true);
        search.setDistanceFunction(distance);
        search.setInstances(train);
        return search;
    }

    /**
     * Majority label of exactly {@code k} nearest rows. The search returns every row tied at the
     * k-th distance, nearest first; only the first {@code k} vote. A tied vote goes to label 0.
     */
    static int predict(LinearNNSearch search, Instance query, int k) throws Exception {
        Instances neighbours = search.kNearestNeighbours(query, k);
        int approved = 0;
        int voters = Math.min(k, neighbours.numInstances());
        for (int i = 0; i < voters; i++) {
            if ((int) neighbours.instance(i).classValue() == 1) approved++;
        }
        return approved * 2 > voters ? 1 : 0;
    }

    /** Half-even on the exact binary value, so 1.015 (stored as 1.01499...) becomes 1.01. */
    static double round2(double value) {
        return new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    static Instances emptyDataset(String name, int capacity) {
        ArrayList<Attribute> attributes = new ArrayList<>();
        for (FeatureColumn f : FeatureColumn.values()) {
            attributes.add(new Attribute(f.clientKey()));
        }
        attributes.add(new Attribute(CLASS_ATTRIBUTE, List.of("0", "1")));
        Instances data = new Instances(name, attributes, capacity);
        data.setClassIndex(attributes.size() - 1);
        return data;
    }

    static Instance toInstance(double[] features, int label) {
        double[] values = Arrays.copyOf(features, features.length + 1);
        values[features.length] = label;
        return new DenseInstance(1.0, values);
    }
}
