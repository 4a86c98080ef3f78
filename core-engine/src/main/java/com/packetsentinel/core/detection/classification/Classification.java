package com.packetsentinel.core.detection.classification;

import java.util.Locale;
import java.util.Objects;

/**
 * Result of {@link ClassificationDetector#classify}: a label and the
 * model's confidence in it.
 *
 * @since 1.0.0
 */
public final class Classification {

    /**
     * Classification labels.
     */
    public enum Label {
        BENIGN,
        MALICIOUS,
        /** No model loaded, or the model failed. */
        UNAVAILABLE;

        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private static final Classification UNAVAILABLE = new Classification(Label.UNAVAILABLE, 0.0, 0.0);

    private final Label label;
    private final double confidence;
    private final double maliciousProbability;

    private Classification(Label label, double confidence, double maliciousProbability) {
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.confidence = confidence;
        this.maliciousProbability = maliciousProbability;
    }

    /**
     * @return the shared "no model" result
     */
    public static Classification unavailable() {
        return UNAVAILABLE;
    }

    static Classification of(Label label, double confidence, double maliciousProbability) {
        return new Classification(label, confidence, maliciousProbability);
    }

    public Label getLabel() {
        return label;
    }

    /**
     * @return confidence of the model in its own prediction, in [0.5, 1] for
     *         a two-class model; {@code 0} when unavailable
     */
    public double getConfidence() {
        return confidence;
    }

    public double getMaliciousProbability() {
        return maliciousProbability;
    }

    public boolean isMalicious() {
        return label == Label.MALICIOUS;
    }

    public boolean isAvailable() {
        return label != Label.UNAVAILABLE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Classification that))
            return false;
        return label == that.label
                && Double.compare(confidence, that.confidence) == 0
                && Double.compare(maliciousProbability, that.maliciousProbability) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, confidence, maliciousProbability);
    }

    @Override
    public String toString() {
        return "Classification{" + label.id() + ", confidence=" + String.format("%.3f", confidence) + '}';
    }
}
