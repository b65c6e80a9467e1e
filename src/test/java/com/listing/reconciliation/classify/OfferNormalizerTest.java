package com.listing.reconciliation.classify;

import com.listing.reconciliation.core.model.Offer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OfferNormalizer Tests")
class OfferNormalizerTest {

    private final OfferNormalizer normalizer = new OfferNormalizer(36, 15_000);

    @Test
    @DisplayName("Should fill defaults and compute the total price")
    void fillsDefaults() {
        Offer normalized = normalizer.normalize(Offer.of(3000, null, null, null));

        assertEquals(3000, normalized.monthlyPrice());
        assertEquals(0, normalized.firstPayment());
        assertEquals(36, normalized.periodMonths());
        assertEquals(15_000, normalized.mileagePerYear());
        assertEquals(108_000, normalized.totalPrice());
    }

    @Test
    @DisplayName("Should keep an explicit total price")
    void keepsExplicitTotal() {
        Offer normalized = normalizer.normalize(new Offer(3000, 10_000, 24, 20_000, 99_999));

        assertEquals(99_999, normalized.totalPrice());
        assertEquals(24, normalized.periodMonths());
    }

    @Test
    @DisplayName("Should sort by monthly price, then first payment")
    void sorts() {
        List<Offer> normalized = normalizer.normalize(List.of(
                Offer.of(3500, 0, 36, 15_000),
                Offer.of(3000, 5000, 36, 15_000),
                Offer.of(3000, 0, 36, 15_000)));

        assertEquals(List.of(3000, 3000, 3500), normalized.stream().map(Offer::monthlyPrice).toList());
        assertEquals(0, normalized.get(0).firstPayment());
        assertEquals(5000, normalized.get(1).firstPayment());
    }

    @Test
    @DisplayName("sameOffers compares as sets after applying defaults")
    void sameOffers() {
        List<Offer> stored = List.of(Offer.of(3500, 0, 36, 15_000), Offer.of(3000, 0, 36, 15_000));
        List<Offer> extracted = List.of(Offer.of(3000, null, null, null), Offer.of(3500, null, 36, null));

        assertTrue(normalizer.sameOffers(stored, extracted));
    }

    @Test
    @DisplayName("sameOffers ignores the derived total price")
    void ignoresTotal() {
        assertTrue(normalizer.sameOffers(
                List.of(new Offer(3000, 0, 36, 15_000, 1)),
                List.of(Offer.of(3000, 0, 36, 15_000))));
    }

    @Test
    @DisplayName("sameOffers detects any differing term or size")
    void differentOffers() {
        List<Offer> stored = List.of(Offer.of(3000, 0, 36, 15_000));

        assertFalse(normalizer.sameOffers(stored, List.of(Offer.of(3000, 0, 36, 20_000))));
        assertFalse(normalizer.sameOffers(stored, List.of(Offer.of(3000, 0, 36, 15_000), Offer.of(3100, 0, 36, 15_000))));
        assertFalse(normalizer.sameOffers(stored, List.of()));
    }
}
