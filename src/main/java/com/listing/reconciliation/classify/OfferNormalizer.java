package com.listing.reconciliation.classify;

import com.listing.reconciliation.core.model.Offer;

import java.util.Comparator;
import java.util.List;

/**
 * Brings offer lists into a canonical form so two lists can be compared as sets: missing
 * first payment becomes 0, missing period and mileage take the configured defaults, the total
 * price is filled in, and offers are sorted by monthly price, first payment, mileage and period.
 */
public class OfferNormalizer {

    private static final Comparator<Offer> CANONICAL_ORDER = Comparator
            .comparing(Offer::monthlyPrice)
            .thenComparing(Offer::firstPayment)
            .thenComparing(Offer::mileagePerYear)
            .thenComparing(Offer::periodMonths);

    private final int defaultPeriodMonths;
    private final int defaultMileagePerYear;

    public OfferNormalizer(int defaultPeriodMonths, int defaultMileagePerYear) {
        this.defaultPeriodMonths = defaultPeriodMonths;
        this.defaultMileagePerYear = defaultMileagePerYear;
    }

    public List<Offer> normalize(List<Offer> offers) {
        return offers.stream()
                .map(this::normalize)
                .sorted(CANONICAL_ORDER)
                .toList();
    }

    public Offer normalize(Offer offer) {
        int firstPayment = offer.firstPayment() != null ? offer.firstPayment() : 0;
        int period = offer.periodMonths() != null ? offer.periodMonths() : defaultPeriodMonths;
        int mileage = offer.mileagePerYear() != null ? offer.mileagePerYear() : defaultMileagePerYear;
        return new Offer(offer.monthlyPrice(), firstPayment, period, mileage,
                offer.effectiveTotalPrice(defaultPeriodMonths));
    }

    /**
     * Compares two offer lists as sets of (monthly price, first payment, period, mileage).
     * The total price does not take part since it is derived.
     */
    public boolean sameOffers(List<Offer> left, List<Offer> right) {
        if (left.size() != right.size()) {
            return false;
        }
        List<Offer> a = normalize(left);
        List<Offer> b = normalize(right);
        for (int i = 0; i < a.size(); i++) {
            if (!sameTerms(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean sameTerms(Offer a, Offer b) {
        return a.monthlyPrice().equals(b.monthlyPrice())
                && a.firstPayment().equals(b.firstPayment())
                && a.periodMonths().equals(b.periodMonths())
                && a.mileagePerYear().equals(b.mileagePerYear());
    }
}
