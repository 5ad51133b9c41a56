package com.procureagent.negotiation.service;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the first currency-like amount in free text.
 *
 * <p>Recognised forms: {@code ₹1,250.50}, {@code Rs. 900}, {@code INR 900}, {@code $12},
 * {@code USD 12}, {@code 900 rupees}, {@code offer 900}, {@code price: 900}, {@code at 900}.
 * Thousands separators are allowed. Zero amounts are skipped.
 */
public final class PriceExtractor {

    private static final String AMOUNT = "(\\d+(?:,\\d+)*(?:\\.\\d+)?)";

    private static final List<Pattern> PATTERNS = List.of(
        Pattern.compile("(?:₹|\\$|\\bRs\\.?|\\bINR\\b|\\bUSD\\b)\\s*" + AMOUNT, Pattern.CASE_INSENSITIVE),
        Pattern.compile(AMOUNT + "\\s*(?:rupees\\b|INR\\b|USD\\b|/-)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b(?:offer|price|at)\\b\\s*(?:of|is|:)?\\s*" + AMOUNT, Pattern.CASE_INSENSITIVE));

    private PriceExtractor() {}

    /**
     * @return the amount with the earliest position in {@code text}; null when there is none
     */
    public static Double extract(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        int bestStart = Integer.MAX_VALUE;
        Double best = null;
        for (Pattern pattern : PATTERNS) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                if (m.start() >= bestStart) {
                    break;
                }
                double value = Double.parseDouble(m.group(1).replace(",", ""));
                if (value > 0.0) {
                    bestStart = m.start();
                    best = value;
                    break;
                }
            }
        }
        return best;
    }
}
