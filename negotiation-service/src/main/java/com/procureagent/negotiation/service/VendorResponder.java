package com.procureagent.negotiation.service;

import com.procureagent.common.llm.TextGenerationClient;
import com.procureagent.common.negotiation.NegotiationMessage;
import com.procureagent.common.negotiation.NegotiationSessionView;
import com.procureagent.common.negotiation.SenderKind;
import com.procureagent.negotiation.model.Vendor;
import com.procureagent.negotiation.model.VendorPersona;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Synthesises the vendor side of a negotiation round through the text-generation
 * collaborator. The persona drives the system instruction; the transcript drives the prompt.
 */
public class VendorResponder {

    private final TextGenerationClient textGeneration;

    public VendorResponder(TextGenerationClient textGeneration) {
        this.textGeneration = textGeneration;
    }

    public Mono<String> reply(NegotiationSessionView session, Vendor vendor) {
        return Mono.fromCallable(() -> prompt(session))
            .flatMap(prompt -> textGeneration.generate(prompt, systemInstruction(session, vendor)));
    }

    // ── prompt construction ───────────────────────────────────────────────

    static String systemInstruction(NegotiationSessionView session, Vendor vendor) {
        VendorPersona persona = vendor.persona();
        return String.format(Locale.ROOT, """
            You are %s of %s, a stationery supplier negotiating with a procurement buyer.
            Personality: %s (%s). Response style: %s.
            Phrases you like to use: %s.
            Never quote below ₹%.2f per unit. Concede gradually over at most %d counter-offers.
            Always state your price per unit in the form ₹<amount>.
            Say "we have a deal" only when you accept the buyer's price.
            Say "no deal" only when you end the negotiation.
            Reply in at most four sentences.""",
            vendor.contactName(), vendor.company(),
            persona.name(), persona.description(), persona.responseStyle(),
            String.join("; ", persona.commonPhrases()),
            persona.floorPrice(session.initialPrice()), persona.concessionRounds());
    }

    static String prompt(NegotiationSessionView session) {
        StringBuilder transcript = new StringBuilder();
        for (NegotiationMessage m : session.messages()) {
            if (m.sender() == SenderKind.SYSTEM) {
                continue;
            }
            transcript.append(m.sender() == SenderKind.BUYER ? "Buyer: " : "You: ")
                      .append(m.content())
                      .append('\n');
        }
        return String.format(Locale.ROOT, """
            Item: %s, quantity %d units.
            Your opening quote: ₹%.2f per unit. Latest price on the table: %s.
            Round %d.

            Conversation so far:
            %s
            Write your next reply to the buyer.""",
            session.itemSku(), session.quantity(), session.initialPrice(),
            session.currentOffer() == null ? "none" : String.format(Locale.ROOT, "₹%.2f", session.currentOffer()),
            session.roundCount(), transcript);
    }
}
