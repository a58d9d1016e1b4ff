package com.trafficguardian.detector.feature;

import com.trafficguardian.detector.traffic.TrafficRecord;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Frozen set of categories for one one-hot encoded field.
 *
 * <p>
 * Categories are sorted and always contain {@value TrafficRecord#UNKNOWN};
 * values not seen at training time are encoded as that bucket.
 * </p>
 *
 * @param prefix     feature name prefix, e.g. {@code protocol}
 * @param categories sorted category values
 */
public record CategoryVocabulary(String prefix, List<String> categories) {

    public CategoryVocabulary {
        categories = List.copyOf(categories);
        if (!categories.contains(TrafficRecord.UNKNOWN)) {
            throw new IllegalArgumentException("Vocabulary " + prefix + " lacks the unknown bucket");
        }
    }

    public static CategoryVocabulary learn(String prefix, Collection<String> observed) {
        TreeSet<String> sorted = new TreeSet<>(observed);
        sorted.add(TrafficRecord.UNKNOWN);
        return new CategoryVocabulary(prefix, List.copyOf(sorted));
    }

    public int size() {
        return categories.size();
    }

    /** Column offset of a value inside this vocabulary's one-hot block. */
    public int indexOf(String value) {
        int index = categories.indexOf(value);
        return index >= 0 ? index : categories.indexOf(TrafficRecord.UNKNOWN);
    }

    public List<String> featureNames() {
        return categories.stream().map(category -> prefix + "_" + category).toList();
    }
}
