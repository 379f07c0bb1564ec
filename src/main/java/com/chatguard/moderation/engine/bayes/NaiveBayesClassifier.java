package com.chatguard.moderation.engine.bayes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Multinomial naive Bayes over word tokens, with Laplace smoothing.
 * Immutable once trained; a retrain builds a new instance.
 */
public class NaiveBayesClassifier {

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]{2,}");

    private final Map<String, Integer> spamCounts;
    private final Map<String, Integer> hamCounts;
    private final long spamTokenTotal;
    private final long hamTokenTotal;
    private final int spamDocs;
    private final int hamDocs;
    private final int vocabularySize;

    private NaiveBayesClassifier(Map<String, Integer> spamCounts, Map<String, Integer> hamCounts,
                                 int spamDocs, int hamDocs) {
        this.spamCounts = spamCounts;
        this.hamCounts = hamCounts;
        this.spamDocs = spamDocs;
        this.hamDocs = hamDocs;
        this.spamTokenTotal = spamCounts.values().stream().mapToLong(Integer::longValue).sum();
        this.hamTokenTotal = hamCounts.values().stream().mapToLong(Integer::longValue).sum();

        Set<String> vocabulary = new HashSet<>(spamCounts.keySet());
        vocabulary.addAll(hamCounts.keySet());
        this.vocabularySize = Math.max(1, vocabulary.size());
    }

    /**
     * Train a classifier from labelled texts.
     */
    public static NaiveBayesClassifier train(Collection<String> spamTexts, Collection<String> hamTexts) {
        Map<String, Integer> spam = new HashMap<>();
        Map<String, Integer> ham = new HashMap<>();
        spamTexts.forEach(t -> tokenize(t).forEach(token -> spam.merge(token, 1, Integer::sum)));
        hamTexts.forEach(t -> tokenize(t).forEach(token -> ham.merge(token, 1, Integer::sum)));
        return new NaiveBayesClassifier(spam, ham, spamTexts.size(), hamTexts.size());
    }

    public static NaiveBayesClassifier empty() {
        return new NaiveBayesClassifier(new HashMap<>(), new HashMap<>(), 0, 0);
    }

    public int getSpamDocs() {
        return spamDocs;
    }

    public int getHamDocs() {
        return hamDocs;
    }

    /**
     * Posterior probability that the text is spam.
     *
     * @return value in [0, 1]; 0.5 when the text has no known tokens and the classes are balanced
     */
    public double spamProbability(String text) {
        if (spamDocs == 0 || hamDocs == 0) {
            return 0.5;
        }
        double logSpam = Math.log((double) spamDocs / (spamDocs + hamDocs));
        double logHam = Math.log((double) hamDocs / (spamDocs + hamDocs));

        for (String token : tokenize(text)) {
            logSpam += Math.log((spamCounts.getOrDefault(token, 0) + 1.0) / (spamTokenTotal + vocabularySize));
            logHam += Math.log((hamCounts.getOrDefault(token, 0) + 1.0) / (hamTokenTotal + vocabularySize));
        }

        // log-sum-exp to stay finite for long messages
        double max = Math.max(logSpam, logHam);
        double spam = Math.exp(logSpam - max);
        double ham = Math.exp(logHam - max);
        return spam / (spam + ham);
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) return tokens;
        Matcher m = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            tokens.add(m.group());
        }
        return tokens;
    }
}
