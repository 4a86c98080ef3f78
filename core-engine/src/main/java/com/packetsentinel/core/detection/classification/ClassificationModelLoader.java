package com.packetsentinel.core.detection.classification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import weka.classifiers.Classifier;
import weka.core.Instances;
import weka.core.SerializationHelper;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes Weka model files.
 *
 * <p>
 * A model file holds two serialized objects, written with
 * {@link SerializationHelper#writeAll(String, Object[])}: the trained
 * {@link Classifier} followed by the empty training {@link Instances}
 * header.
 * </p>
 *
 * @since 1.0.0
 */
public final class ClassificationModelLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ClassificationModelLoader.class);

    private ClassificationModelLoader() {
        // utility class
    }

    /**
     * @param path model file
     * @return the loaded model
     * @throws ModelLoadException if the file is missing, unreadable or does
     *                            not contain a classifier and a header
     */
    public static ClassificationModel load(Path path) {
        Objects.requireNonNull(path, "Model path must not be null");
        if (!Files.isReadable(path)) {
            throw new ModelLoadException("Model file is not readable: " + path);
        }
        Object[] objects;
        try {
            objects = SerializationHelper.readAll(path.toString());
        } catch (Exception e) {
            throw new ModelLoadException("Failed to read model file " + path + ": " + e.getMessage(), e);
        }
        if (objects.length < 2 || !(objects[0] instanceof Classifier classifier)
                || !(objects[1] instanceof Instances header)) {
            throw new ModelLoadException("Model file " + path
                    + " must contain a Weka classifier followed by its training header");
        }
        WekaClassificationModel model = new WekaClassificationModel(classifier, header);
        LOG.info("Loaded classification model from {}: {}", path, model);
        return model;
    }

    /**
     * Write {@code classifier} and its training header to {@code path}.
     *
     * @throws ModelLoadException if writing fails
     */
    public static void save(Path path, Classifier classifier, Instances trainingData) {
        Objects.requireNonNull(path, "Model path must not be null");
        Objects.requireNonNull(classifier, "classifier must not be null");
        Objects.requireNonNull(trainingData, "trainingData must not be null");
        try {
            SerializationHelper.writeAll(path.toString(), new Object[] { classifier, new Instances(trainingData, 0) });
        } catch (Exception e) {
            throw new ModelLoadException("Failed to write model file " + path + ": " + e.getMessage(), e);
        }
    }
}
