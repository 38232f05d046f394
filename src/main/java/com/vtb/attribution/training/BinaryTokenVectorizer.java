package com.vtb.attribution.training;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Бинарный мешок токенов: признак равен 1, если токен встречается в документе.
 *
 * Документ разбивается по одиночному пробелу без схлопывания, так что пустые
 * токены (например, у документа-заглушки {@code " "}) тоже становятся признаком.
 * Словарь строится по обучающей выборке и упорядочен лексикографически,
 * неизвестные токены игнорируются.
 *
 * Признак 0 всегда равен 1: классификатор не принимает документы без признаков,
 * а документ из одних неизвестных токенов иначе был бы нулевым вектором.
 */
public class BinaryTokenVectorizer implements Serializable {

    private static final long serialVersionUID = 1L;

    static final int CONSTANT_FEATURE = 0;

    private final Map<String, Integer> vocabulary = new LinkedHashMap<>();

    public static String[] tokenize(String document) {
        return document == null ? new String[0] : document.split(" ", -1);
    }

    public BinaryTokenVectorizer fit(List<String> documents) {
        TreeSet<String> tokens = new TreeSet<>();
        for (String document : documents) {
            Collections.addAll(tokens, tokenize(document));
        }
        vocabulary.clear();
        for (String token : tokens) {
            vocabulary.put(token, vocabulary.size() + 1);
        }
        return this;
    }

    public int[] transform(String document) {
        int[] features = new int[size()];
        features[CONSTANT_FEATURE] = 1;
        for (String token : tokenize(document)) {
            Integer index = vocabulary.get(token);
            if (index != null) {
                features[index] = 1;
            }
        }
        return features;
    }

    /**
     * Размерность вектора признаков (словарь + постоянный признак).
     */
    public int size() {
        return vocabulary.size() + 1;
    }

    public List<String> getVocabulary() {
        return new ArrayList<>(vocabulary.keySet());
    }
}
