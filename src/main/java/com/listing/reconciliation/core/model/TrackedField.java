package com.listing.reconciliation.core.model;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Listing attributes that take part in the field-level diff.
 * Make and model are identity attributes resolved against the taxonomy and are not tracked.
 */
public enum TrackedField {
    VARIANT("variant", ListingAttributes::variant, (b, v) -> b.variant((String) v)),
    YEAR("year", ListingAttributes::year, (b, v) -> b.year((Integer) v)),
    HORSEPOWER("horsepower", ListingAttributes::horsepower, (b, v) -> b.horsepower((Integer) v)),
    FUEL_TYPE("fuel_type", ListingAttributes::fuelType, (b, v) -> b.fuelType((String) v)),
    TRANSMISSION("transmission", ListingAttributes::transmission, (b, v) -> b.transmission((String) v)),
    BODY_TYPE("body_type", ListingAttributes::bodyType, (b, v) -> b.bodyType((String) v)),
    SEATS("seats", ListingAttributes::seats, (b, v) -> b.seats((Integer) v)),
    DOORS("doors", ListingAttributes::doors, (b, v) -> b.doors((Integer) v)),
    WLTP("wltp", ListingAttributes::wltp, (b, v) -> b.wltp((Integer) v)),
    CO2_EMISSION("co2_emission", ListingAttributes::co2Emission, (b, v) -> b.co2Emission((Integer) v)),
    CO2_TAX_HALF_YEAR("co2_tax_half_year", ListingAttributes::co2TaxHalfYear, (b, v) -> b.co2TaxHalfYear((Integer) v)),
    CONSUMPTION_L_100KM("consumption_l_100km", ListingAttributes::consumptionL100km,
            (b, v) -> b.consumptionL100km(toDouble(v))),
    CONSUMPTION_KWH_100KM("consumption_kwh_100km", ListingAttributes::consumptionKwh100km,
            (b, v) -> b.consumptionKwh100km(toDouble(v))),
    RETAIL_PRICE("retail_price", ListingAttributes::retailPrice, (b, v) -> b.retailPrice((Integer) v)),
    MONTHLY_PRICE("monthly_price", ListingAttributes::monthlyPrice, (b, v) -> b.monthlyPrice((Integer) v));

    /**
     * Synthetic field name used when the offer set of a listing is replaced.
     */
    public static final String OFFERS_REPLACEMENT = "offers_replacement";

    private final String fieldName;
    private final Function<ListingAttributes, Object> reader;
    private final BiConsumer<ListingAttributes.Builder, Object> writer;

    TrackedField(String fieldName, Function<ListingAttributes, Object> reader,
                 BiConsumer<ListingAttributes.Builder, Object> writer) {
        this.fieldName = fieldName;
        this.reader = reader;
        this.writer = writer;
    }

    public String fieldName() {
        return fieldName;
    }

    public Object read(ListingAttributes attributes) {
        return reader.apply(attributes);
    }

    public void write(ListingAttributes.Builder builder, Object value) {
        writer.accept(builder, value);
    }

    public boolean isText() {
        return this == VARIANT || this == FUEL_TYPE || this == TRANSMISSION || this == BODY_TYPE;
    }

    public boolean isDecimal() {
        return this == CONSUMPTION_L_100KM || this == CONSUMPTION_KWH_100KM;
    }

    /**
     * Looks up a tracked field by its wire name.
     *
     * @throws IllegalArgumentException if no field has that name
     */
    public static TrackedField fromFieldName(String fieldName) {
        for (TrackedField field : values()) {
            if (field.fieldName.equals(fieldName)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown tracked field: " + fieldName);
    }

    private static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        return ((Number) value).doubleValue();
    }
}
