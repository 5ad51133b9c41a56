package com.procureagent.negotiation.model;

import java.util.List;

/**
 * Negotiating temperament of a simulated vendor.
 *
 * <p>{@code priceFlexibility} is the largest discount off the opening quote the vendor
 * will ever grant; {@code concessionRounds} is how many counter-offers it makes before
 * standing firm.
 */
public enum VendorPersona {

    AGGRESSIVE("Firm on prices, minimal discounts", 0.03, 2, "direct",
        List.of("This is our best price",
                "We cannot go lower than this",
                "Take it or leave it",
                "Market rates don't allow further reduction")),

    COOPERATIVE("Willing to negotiate, values relationships", 0.12, 4, "friendly",
        List.of("Let's find a win-win solution",
                "We value long-term partnerships",
                "How can we make this work for both of us?",
                "We're flexible on terms")),

    STRATEGIC("Data-driven, considers volume and terms", 0.08, 3, "analytical",
        List.of("Based on market analysis...",
                "Considering the volume commitment...",
                "Our pricing model shows...",
                "Let's look at the total value proposition"));

    private final String description;
    private final double priceFlexibility;
    private final int concessionRounds;
    private final String responseStyle;
    private final List<String> commonPhrases;

    VendorPersona(String description, double priceFlexibility, int concessionRounds,
                  String responseStyle, List<String> commonPhrases) {
        this.description      = description;
        this.priceFlexibility = priceFlexibility;
        this.concessionRounds = concessionRounds;
        this.responseStyle    = responseStyle;
        this.commonPhrases    = commonPhrases;
    }

    public String description()       { return description; }
    public double priceFlexibility()  { return priceFlexibility; }
    public int concessionRounds()     { return concessionRounds; }
    public String responseStyle()     { return responseStyle; }
    public List<String> commonPhrases() { return commonPhrases; }

    /** Lowest unit price this persona will quote for an opening price. */
    public double floorPrice(double initialPrice) {
        return initialPrice * (1.0 - priceFlexibility);
    }
}
