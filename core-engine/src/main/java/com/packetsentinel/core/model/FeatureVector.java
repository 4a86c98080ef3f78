package com.packetsentinel.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Fixed-order numeric summary of a packet and its flow.
 *
 * <p>
 * A vector is an ordered mapping of feature name to {@code double}. The
 * order is the order in which features were added and is what ML models
 * consume via {@link #toArray()}. Non-finite values are stored as {@code 0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureVector {

    private final List<String> names;
    private final double[] values;

    private FeatureVector(List<String> names, double[] values) {
        this.names = Collections.unmodifiableList(names);
        this.values = values;
    }

    /**
     * Create a vector of zeros for the given layout.
     *
     * @param layout feature layout
     * @return all-zero vector
     */
    public static FeatureVector zeros(FeatureLayout layout) {
        Objects.requireNonNull(layout, "layout must not be null");
        return new FeatureVector(new ArrayList<>(layout.names()), new double[layout.size()]);
    }

    /**
     * Create a vector from raw values with generated names
     * ({@code f0, f1, ...}). Useful for models that were trained on
     * positional data.
     *
     * @param values feature values; copied
     * @return new vector
     */
    public static FeatureVector of(double... values) {
        Objects.requireNonNull(values, "values must not be null");
        List<String> names = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            names.add("f" + i);
        }
        double[] copy = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            copy[i] = sanitize(values[i]);
        }
        return new FeatureVector(names, copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public int size() {
        return values.length;
    }

    /**
     * @return unmodifiable feature names in vector order
     */
    public List<String> names() {
        return names;
    }

    /**
     * @param index position in the vector
     * @return value at {@code index}
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public double get(int index) {
        return values[index];
    }

    /**
     * @param name feature name
     * @return the value, or empty if the vector has no such feature
     */
    public OptionalDouble get(String name) {
        int index = names.indexOf(name);
        return index < 0 ? OptionalDouble.empty() : OptionalDouble.of(values[index]);
    }

    /**
     * @param name         feature name
     * @param defaultValue value returned when the feature is absent
     * @return the value or {@code defaultValue}
     */
    public double getOrDefault(String name, double defaultValue) {
        return get(name).orElse(defaultValue);
    }

    /**
     * @return a copy of the values in vector order
     */
    public double[] toArray() {
        return values.clone();
    }

    /**
     * @return insertion-ordered copy of the name/value pairs
     */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(names.get(i), values[i]);
        }
        return map;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Ordered builder. Adding the same name twice is a programming error.
     */
    public static class Builder {
        private final List<String> names = new ArrayList<>();
        private final List<Double> values = new ArrayList<>();

        public Builder add(String name, double value) {
            Objects.requireNonNull(name, "Feature name must not be null");
            if (names.contains(name)) {
                throw new IllegalArgumentException("Duplicate feature name: " + name);
            }
            names.add(name);
            values.add(sanitize(value));
            return this;
        }

        public FeatureVector build() {
            double[] array = new double[values.size()];
            for (int i = 0; i < array.length; i++) {
                array[i] = values.get(i);
            }
            return new FeatureVector(new ArrayList<>(names), array);
        }
    }

    private static double sanitize(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureVector that))
            return false;
        return names.equals(that.names) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * names.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + asMap();
    }
}
