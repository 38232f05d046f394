package com.vtb.attribution.model;

import com.vtb.attribution.models.DatabaseVersion;
import com.vtb.attribution.training.BinaryTokenVectorizer;
import smile.classification.DiscreteNaiveBayes;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Обученная модель атрибуции: векторизатор, наивный байесовский
 * классификатор (модель Бернулли) и упорядоченный список классов.
 *
 * Индекс класса в {@link #getClasses()} совпадает с индексом
 * в векторе апостериорных вероятностей.
 */
public class AttributionModel implements Serializable {

    private static final long serialVersionUID = 1L;

    private final BinaryTokenVectorizer vectorizer;
    private final DiscreteNaiveBayes classifier;
    private final List<String> classes;
    private final DatabaseVersion version;

    public AttributionModel(BinaryTokenVectorizer vectorizer,
                            DiscreteNaiveBayes classifier,
                            List<String> classes,
                            DatabaseVersion version) {
        this.vectorizer = vectorizer;
        this.classifier = classifier;
        this.classes = classes != null ? new ArrayList<>(classes) : new ArrayList<>();
        this.version = version;
    }

    /**
     * Апостериорные вероятности классов для документа.
     */
    public double[] predictProbabilities(String document) {
        double[] posteriori = new double[classes.size()];
        classifier.predict(vectorizer.transform(document), posteriori);
        return posteriori;
    }

    public String predictLabel(String document) {
        return classes.get(classifier.predict(vectorizer.transform(document)));
    }

    public int predictIndex(int[] features) {
        return classifier.predict(features);
    }

    public BinaryTokenVectorizer getVectorizer() {
        return vectorizer;
    }

    public List<String> getClasses() {
        return Collections.unmodifiableList(classes);
    }

    public DatabaseVersion getVersion() {
        return version;
    }
}
