package com.procureagent.negotiation.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriceExtractorTest {

    @Test
    @DisplayName("rupee symbol with thousands separator and decimals")
    void rupeeSymbol() {
        assertEquals(1250.50, PriceExtractor.extract("Our best is ₹1,250.50 per unit"));
    }

    @Test
    @DisplayName("currency prefixes and suffixes")
    void prefixesAndSuffixes() {
        assertEquals(900.0, PriceExtractor.extract("Rs. 900 is final"));
        assertEquals(900.0, PriceExtractor.extract("INR 900 per box"));
        assertEquals(12.0,  PriceExtractor.extract("That comes to $12"));
        assertEquals(450.0, PriceExtractor.extract("We can do 450 rupees"));
        assertEquals(450.0, PriceExtractor.extract("450/- only"));
    }

    @Test
    @DisplayName("keyword forms")
    void keywords() {
        assertEquals(875.0, PriceExtractor.extract("Our offer is 875 for the lot"));
        assertEquals(875.0, PriceExtractor.extract("price: 875"));
        assertEquals(875.0, PriceExtractor.extract("We can sell at 875"));
    }

    @Test
    @DisplayName("earliest amount wins")
    void earliestWins() {
        assertEquals(1000.0, PriceExtractor.extract("Down from ₹1000, we offer ₹950 now"));
        assertEquals(950.0, PriceExtractor.extract("We can do 950 rupees, list price is ₹1000"));
    }

    @Test
    @DisplayName("no amount, zero amount or empty text → null")
    void nothing() {
        assertNull(PriceExtractor.extract("Let's find a win-win solution"));
        assertNull(PriceExtractor.extract("₹0 is not a price"));
        assertNull(PriceExtractor.extract(""));
        assertNull(PriceExtractor.extract(null));
    }

    @Test
    @DisplayName("bare numbers without a currency or keyword are ignored")
    void bareNumbers() {
        assertNull(PriceExtractor.extract("We need 500 units within 7 days"));
    }
}
