package io.databrain.similarity;

import io.databrain.graph.Node;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Character-trigram containment scorer.
 *
 * <p>Text is lower-cased and split into words; each word is padded with {@code _} on both sides
 * and cut into trigrams. The score is the fraction of the query's trigrams that also occur in
 * the node's label and description, so a query that is a whole word of the label scores 1.0.</p>
 *
 * <p>The signature is the node's sorted trigram set joined by spaces.</p>
 */
public class NGramSimilarityScorer implements SimilarityScorer {

    private static final Pattern WORD_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int N = 3;

    @Override
    public String signature(String label, String description) {
        return String.join(" ", grams(join(label, description)));
    }

    @Override
    public double score(String query, Node node) {
        Set<String> queryGrams = grams(query);
        if (queryGrams.isEmpty() || node == null) {
            return 0.0;
        }
        Set<String> nodeGrams = nodeGrams(node);
        if (nodeGrams.isEmpty()) {
            return 0.0;
        }
        long shared = queryGrams.stream().filter(nodeGrams::contains).count();
        return (double) shared / queryGrams.size();
    }

    private Set<String> nodeGrams(Node node) {
        String signature = node.similaritySignature();
        if (signature != null && !signature.isBlank()) {
            return new TreeSet<>(Arrays.asList(signature.trim().split(" ")));
        }
        return grams(join(node.label(), node.description()));
    }

    static Set<String> grams(String text) {
        Set<String> grams = new TreeSet<>();
        if (text == null || text.isBlank()) {
            return grams;
        }
        for (String word : WORD_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (word.isEmpty()) continue;
            String padded = "_" + word + "_";
            for (int i = 0; i + N <= padded.length(); i++) {
                grams.add(padded.substring(i, i + N));
            }
        }
        return grams;
    }

    private static String join(String label, String description) {
        return (label == null ? "" : label) + " " + (description == null ? "" : description);
    }
}
