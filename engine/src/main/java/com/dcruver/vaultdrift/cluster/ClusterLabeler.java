package com.dcruver.vaultdrift.cluster;

import com.dcruver.vaultdrift.config.EngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Names clusters with class-based TF-IDF.
 *
 * All texts of a cluster are joined into one document, unigrams and bigrams are scored with smoothed
 * TF-IDF across the cluster documents, and Maximal Marginal Relevance picks a few high scoring terms that
 * do not repeat each other's words.
 */
@Component
@Slf4j
public class ClusterLabeler {

    private static final Pattern TOKEN = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Set<String> STOP_WORDS = loadStopWords("/stopwords-en.txt");

    private final int terms;
    private final int candidates;
    private final int maxFeatures;
    private final double diversity;

    @Autowired
    public ClusterLabeler(EngineProperties properties) {
        this(properties.getClustering().getLabelTerms(),
            properties.getClustering().getLabelCandidates(),
            properties.getClustering().getLabelMaxFeatures(),
            properties.getClustering().getLabelDiversity());
    }

    public ClusterLabeler(int terms, int candidates, int maxFeatures, double diversity) {
        this.terms = terms;
        this.candidates = candidates;
        this.maxFeatures = maxFeatures;
        this.diversity = diversity;
    }

    /**
     * Keyword label per cluster id, terms joined by ", ". Clusters without usable terms get "Cluster &lt;id&gt;".
     */
    public Map<Integer, String> label(Map<Integer, List<String>> textsByCluster) {
        Map<Integer, String> labels = new TreeMap<>();
        if (textsByCluster.isEmpty()) {
            return labels;
        }

        List<Integer> clusterIds = new ArrayList<>(new TreeMap<>(textsByCluster).keySet());
        List<Map<String, Integer>> counts = new ArrayList<>();
        Map<String, Integer> corpusCounts = new HashMap<>();
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (Integer id : clusterIds) {
            Map<String, Integer> termCounts = countTerms(String.join(" ", textsByCluster.get(id)));
            counts.add(termCounts);
            termCounts.forEach((term, count) -> {
                corpusCounts.merge(term, count, Integer::sum);
                documentFrequency.merge(term, 1, Integer::sum);
            });
        }

        List<String> vocabulary = limitVocabulary(corpusCounts);
        int documents = clusterIds.size();
        for (int i = 0; i < documents; i++) {
            int clusterId = clusterIds.get(i);
            Map<String, Double> scores = scoreDocument(counts.get(i), vocabulary, documentFrequency, documents);
            List<String> picked = scores.isEmpty() ? List.of() : selectTerms(scores);
            labels.put(clusterId, picked.isEmpty() ? "Cluster " + clusterId : String.join(", ", picked));
        }
        return labels;
    }

    /**
     * "Notes about a", "Notes about a and b", "Notes about a, b, and c".
     */
    public static String formatLabel(String keywordLabel) {
        if (keywordLabel == null || keywordLabel.isBlank()) {
            return "";
        }
        if (keywordLabel.startsWith("Cluster ")) {
            return keywordLabel;
        }
        List<String> parts = new ArrayList<>();
        for (String part : keywordLabel.split(",")) {
            parts.add(part.trim());
        }
        if (parts.size() == 1) {
            return "Notes about " + parts.get(0);
        }
        if (parts.size() == 2) {
            return "Notes about " + parts.get(0) + " and " + parts.get(1);
        }
        return "Notes about " + String.join(", ", parts.subList(0, parts.size() - 1)) + ", and " + parts.get(parts.size() - 1);
    }

    Map<String, Integer> countTerms(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            if (!STOP_WORDS.contains(token)) {
                tokens.add(token);
            }
        }
        Map<String, Integer> termCounts = new HashMap<>();
        for (int i = 0; i < tokens.size(); i++) {
            termCounts.merge(tokens.get(i), 1, Integer::sum);
            if (i + 1 < tokens.size()) {
                termCounts.merge(tokens.get(i) + " " + tokens.get(i + 1), 1, Integer::sum);
            }
        }
        return termCounts;
    }

    // most frequent terms over all clusters, ties alphabetical
    private List<String> limitVocabulary(Map<String, Integer> corpusCounts) {
        List<String> vocabulary = new ArrayList<>(corpusCounts.keySet());
        vocabulary.sort(Comparator.<String>comparingInt(corpusCounts::get).reversed()
            .thenComparing(Comparator.naturalOrder()));
        if (vocabulary.size() > maxFeatures) {
            vocabulary = new ArrayList<>(vocabulary.subList(0, maxFeatures));
        }
        Collections.sort(vocabulary);
        return vocabulary;
    }

    // smoothed idf, l2-normalized row
    private static Map<String, Double> scoreDocument(Map<String, Integer> termCounts, List<String> vocabulary,
                                                     Map<String, Integer> documentFrequency, int documents) {
        Map<String, Double> scores = new LinkedHashMap<>();
        double norm = 0.0;
        for (String term : vocabulary) {
            Integer count = termCounts.get(term);
            if (count == null) {
                continue;
            }
            double idf = Math.log((1.0 + documents) / (1.0 + documentFrequency.get(term))) + 1.0;
            double score = count * idf;
            scores.put(term, score);
            norm += score * score;
        }
        if (norm > 0.0) {
            double length = Math.sqrt(norm);
            scores.replaceAll((term, score) -> score / length);
        }
        return scores;
    }

    List<String> selectTerms(Map<String, Double> scores) {
        List<String> ranked = new ArrayList<>(scores.keySet());
        ranked.sort(Comparator.<String>comparingDouble(scores::get).reversed()
            .thenComparing(Comparator.naturalOrder()));
        List<String> pool = ranked.subList(0, Math.min(candidates, ranked.size()));
        return maximalMarginalRelevance(pool, scores);
    }

    /**
     * Greedy MMR: relevance weighted against the largest word overlap with terms already picked.
     */
    List<String> maximalMarginalRelevance(List<String> pool, Map<String, Double> scores) {
        if (pool.size() <= terms) {
            return new ArrayList<>(pool);
        }
        List<String> selected = new ArrayList<>();
        List<String> remaining = new ArrayList<>(pool);
        while (selected.size() < terms && !remaining.isEmpty()) {
            String best = null;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (String term : remaining) {
                double penalty = 0.0;
                for (String chosen : selected) {
                    penalty = Math.max(penalty, wordOverlap(term, chosen));
                }
                double mmr = diversity * scores.get(term) - (1.0 - diversity) * penalty;
                if (mmr > bestScore) {
                    bestScore = mmr;
                    best = term;
                }
            }
            selected.add(best);
            remaining.remove(best);
        }
        return selected;
    }

    static double wordOverlap(String a, String b) {
        Set<String> wordsA = new HashSet<>(Arrays.asList(a.split(" ")));
        Set<String> wordsB = new HashSet<>(Arrays.asList(b.split(" ")));
        Set<String> union = new HashSet<>(wordsA);
        union.addAll(wordsB);
        wordsA.retainAll(wordsB);
        return union.isEmpty() ? 0.0 : (double) wordsA.size() / union.size();
    }

    private static Set<String> loadStopWords(String resource) {
        InputStream in = ClusterLabeler.class.getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalStateException("Stop word list not found on classpath: " + resource);
        }
        Set<String> words = new HashSet<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String word = line.trim();
                if (!word.isEmpty() && !word.startsWith("#")) {
                    words.add(word);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read stop words from " + resource, e);
        }
        return Collections.unmodifiableSet(words);
    }
}
