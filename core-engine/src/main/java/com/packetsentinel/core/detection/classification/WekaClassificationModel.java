package com.packetsentinel.core.detection.classification;

import weka.classifiers.AbstractClassifier;
import weka.classifiers.Classifier;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link ClassificationModel} backed by a trained Weka {@link Classifier}.
 *
 * <p>
 * The training header (an empty {@link Instances} with the attribute layout
 * and class index) defines the feature order: every attribute except the
 * class attribute is a feature, in header order. The class attribute must be
 * nominal; the malicious value is the first of {@code malicious},
 * {@code attack}, {@code anomaly}, {@code 1} that is present, or the second
 * value of a two-valued class.
 * </p>
 *
 * <p>
 * Weka does not document classifiers as thread-safe. Each calling thread
 * predicts with its own deep copy of the classifier and header, made on the
 * thread's first prediction; the classifier handed to the constructor is
 * never used for predictions.
 * </p>
 *
 * @since 1.0.0
 */
public final class WekaClassificationModel implements ClassificationModel {

    private static final List<String> MALICIOUS_VALUES = List.of("malicious", "attack", "anomaly", "1");

    private final Classifier classifier;
    private final Instances header;
    private final ThreadLocal<Replica> replicas;
    private final List<Integer> featureAttributes;
    private final List<String> featureNames;
    private final int maliciousIndex;

    /**
     * @param classifier trained classifier
     * @param header     training header with the class index set
     * @throws ModelLoadException if the header cannot drive the classifier
     */
    public WekaClassificationModel(Classifier classifier, Instances header) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        Objects.requireNonNull(header, "header must not be null");
        this.header = new Instances(header, 0);
        if (this.header.classIndex() < 0) {
            this.header.setClassIndex(this.header.numAttributes() - 1);
        }
        Attribute classAttribute = this.header.classAttribute();
        if (!classAttribute.isNominal()) {
            throw new ModelLoadException("Class attribute '" + classAttribute.name() + "' must be nominal");
        }
        this.maliciousIndex = resolveMaliciousIndex(classAttribute);

        List<Integer> attributes = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (int i = 0; i < this.header.numAttributes(); i++) {
            if (i == this.header.classIndex()) {
                continue;
            }
            Attribute attribute = this.header.attribute(i);
            if (!attribute.isNumeric()) {
                throw new ModelLoadException("Feature attribute '" + attribute.name() + "' must be numeric");
            }
            attributes.add(i);
            names.add(attribute.name());
        }
        if (attributes.isEmpty()) {
            throw new ModelLoadException("Model header has no feature attributes");
        }
        this.featureAttributes = Collections.unmodifiableList(attributes);
        this.featureNames = Collections.unmodifiableList(names);

        // fail at load time if the classifier cannot be copied
        Replica first = replicate();
        this.replicas = ThreadLocal.withInitial(this::replicate);
        this.replicas.set(first);
    }

    @Override
    public int featureCount() {
        return featureAttributes.size();
    }

    @Override
    public List<String> featureNames() {
        return featureNames;
    }

    @Override
    public double maliciousProbability(double[] features) {
        if (features.length != featureAttributes.size()) {
            throw new IllegalArgumentException("Expected " + featureAttributes.size()
                    + " features, got " + features.length);
        }
        Replica replica = replicas.get();
        Instance instance = new DenseInstance(replica.header.numAttributes());
        instance.setDataset(replica.header);
        for (int i = 0; i < features.length; i++) {
            instance.setValue(featureAttributes.get(i), features[i]);
        }
        instance.setClassMissing();
        try {
            double[] distribution = replica.classifier.distributionForInstance(instance);
            return distribution[maliciousIndex];
        } catch (Exception e) {
            throw new IllegalStateException("Classifier failed: " + e.getMessage(), e);
        }
    }

    private Replica replicate() {
        try {
            return new Replica(AbstractClassifier.makeCopy(classifier), new Instances(header, 0));
        } catch (Exception e) {
            throw new ModelLoadException("Classifier " + classifier.getClass().getName()
                    + " cannot be copied: " + e.getMessage(), e);
        }
    }

    private static int resolveMaliciousIndex(Attribute classAttribute) {
        if (classAttribute.numValues() < 2) {
            throw new ModelLoadException("Class attribute '" + classAttribute.name()
                    + "' needs at least two values");
        }
        for (String preferred : MALICIOUS_VALUES) {
            for (int i = 0; i < classAttribute.numValues(); i++) {
                if (classAttribute.value(i).toLowerCase(Locale.ROOT).equals(preferred)) {
                    return i;
                }
            }
        }
        if (classAttribute.numValues() == 2) {
            return 1;
        }
        throw new ModelLoadException("Cannot tell which class value is malicious, expected one of "
                + MALICIOUS_VALUES);
    }

    private static final class Replica {
        private final Classifier classifier;
        private final Instances header;

        private Replica(Classifier classifier, Instances header) {
            this.classifier = classifier;
            this.header = header;
        }
    }

    @Override
    public String toString() {
        return "WekaClassificationModel{" + classifier.getClass().getSimpleName()
                + ", features=" + featureNames + '}';
    }
}
