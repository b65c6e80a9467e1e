package com.listing.reconciliation.core.model;

import java.util.Objects;

/**
 * A single lease offer attached to a listing: monthly price, down payment,
 * term length, yearly mileage allowance and total cost.
 *
 * <p>Amounts are whole kroner. Only {@code monthlyPrice} is required; offers extracted
 * without a monthly price are dropped before they reach the engine.</p>
 */
public record Offer(
        Integer monthlyPrice,
        Integer firstPayment,
        Integer periodMonths,
        Integer mileagePerYear,
        Integer totalPrice
) {
    public Offer {
        Objects.requireNonNull(monthlyPrice, "monthlyPrice is required");
        if (monthlyPrice < 0) {
            throw new IllegalArgumentException("monthlyPrice must be >= 0");
        }
    }

    /**
     * Creates an offer without an explicit total price.
     */
    public static Offer of(int monthlyPrice, Integer firstPayment, Integer periodMonths, Integer mileagePerYear) {
        return new Offer(monthlyPrice, firstPayment, periodMonths, mileagePerYear, null);
    }

    /**
     * Returns the total cost of the lease, computing {@code period * monthly + first payment}
     * when the extractor did not supply one.
     */
    public int effectiveTotalPrice(int defaultPeriodMonths) {
        if (totalPrice != null) {
            return totalPrice;
        }
        int period = periodMonths != null ? periodMonths : defaultPeriodMonths;
        int down = firstPayment != null ? firstPayment : 0;
        return period * monthlyPrice + down;
    }
}
