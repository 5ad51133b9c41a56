package com.procureagent.negotiation.service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic keyword policy for acceptance and rejection in negotiation messages.
 *
 * <p>Text is split into sentences on {@code . ! ?} and newlines, and each sentence into
 * clauses on commas and semicolons. A marker counts only when no negation or condition
 * word precedes it in the same clause. Sentences ending in {@code ?} are proposals and
 * never signal anything. A rejection marker followed in its clause by a price bound
 * ("below", "under", ...) is a counter-offer, not a rejection. Rejection wins over
 * acceptance.
 */
public final class AcceptancePolicy {

    public enum Signal { ACCEPT, REJECT, NONE }

    private static final Pattern SENTENCE = Pattern.compile("[^.!?\\n]+[.!?]*");

    private static final Pattern CLAUSE_SPLIT = Pattern.compile("[,;]+");

    private static final Pattern ACCEPTANCE = Pattern.compile(
        "\\b(?:accept|accepted|agree|agreed|confirm|confirmed|we have a deal)\\b");

    private static final Pattern NEGATION = Pattern.compile(
        "\\b(?:not|cannot|can't|won't|don't|never|unable|no)\\b");

    private static final Pattern CONDITION = Pattern.compile("\\b(?:if|unless)\\b");

    private static final List<Pattern> REJECTION = List.of(
        Pattern.compile("\\b(?:reject|rejected|decline|declined)\\b"),
        Pattern.compile("\\bno deal\\b"),
        Pattern.compile("\\bwalk away\\b"),
        Pattern.compile("\\bnot interested\\b"),
        Pattern.compile("\\bend the negotiation\\b"));

    private static final Pattern PRICE_BOUND = Pattern.compile(
        "\\b(?:below|under|less than|lower than|above|over|more than)\\b");

    private AcceptancePolicy() {}

    public static Signal detect(String text) {
        if (text == null || text.isBlank()) {
            return Signal.NONE;
        }
        String normalised = text.toLowerCase(Locale.ROOT).replace('’', '\'');

        boolean accepted = false;
        Matcher sentences = SENTENCE.matcher(normalised);
        while (sentences.find()) {
            String sentence = sentences.group().trim();
            if (sentence.endsWith("?")) {
                continue;
            }
            for (String clause : CLAUSE_SPLIT.split(sentence)) {
                if (rejects(clause)) {
                    return Signal.REJECT;
                }
                accepted = accepted || accepts(clause);
            }
        }
        return accepted ? Signal.ACCEPT : Signal.NONE;
    }

    private static boolean accepts(String clause) {
        Matcher marker = ACCEPTANCE.matcher(clause);
        while (marker.find()) {
            String before = clause.substring(0, marker.start());
            if (!NEGATION.matcher(before).find() && !CONDITION.matcher(before).find()) {
                return true;
            }
        }
        return false;
    }

    private static boolean rejects(String clause) {
        for (Pattern rejection : REJECTION) {
            Matcher marker = rejection.matcher(clause);
            while (marker.find()) {
                String before = clause.substring(0, marker.start());
                String after  = clause.substring(marker.end());
                if (!NEGATION.matcher(before).find()
                        && !CONDITION.matcher(before).find()
                        && !PRICE_BOUND.matcher(after).find()) {
                    return true;
                }
            }
        }
        return false;
    }

    /** Price at or below {@code target × (1 + tolerance)}. */
    public static boolean withinTolerance(double price, double target, double tolerance) {
        return price <= target * (1.0 + tolerance);
    }
}
