package com.listing.reconciliation.core.model;

/**
 * Identity and specification attributes shared by extracted candidates and persisted listings.
 * Taxonomy-backed attributes (make, model, fuel type, transmission, body type) are kept as
 * display names here; their resolved ids live in {@link TaxonomyRefs}.
 */
public record ListingAttributes(
        String make,
        String model,
        String variant,
        Integer year,
        Integer horsepower,
        String fuelType,
        String transmission,
        String bodyType,
        Integer seats,
        Integer doors,
        Integer wltp,
        Integer co2Emission,
        Integer co2TaxHalfYear,
        Double consumptionL100km,
        Double consumptionKwh100km,
        Integer retailPrice,
        Integer monthlyPrice
) {

    /**
     * Returns a builder pre-populated with this record's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .make(make)
                .model(model)
                .variant(variant)
                .year(year)
                .horsepower(horsepower)
                .fuelType(fuelType)
                .transmission(transmission)
                .bodyType(bodyType)
                .seats(seats)
                .doors(doors)
                .wltp(wltp)
                .co2Emission(co2Emission)
                .co2TaxHalfYear(co2TaxHalfYear)
                .consumptionL100km(consumptionL100km)
                .consumptionKwh100km(consumptionKwh100km)
                .retailPrice(retailPrice)
                .monthlyPrice(monthlyPrice);
    }

    /**
     * Short human-readable label, e.g. {@code Toyota Yaris 1.5 Hybrid}.
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder();
        appendPart(sb, make);
        appendPart(sb, model);
        appendPart(sb, variant);
        return sb.toString();
    }

    private static void appendPart(StringBuilder sb, String part) {
        if (part == null || part.isBlank()) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(' ');
        }
        sb.append(part.trim());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String make;
        private String model;
        private String variant;
        private Integer year;
        private Integer horsepower;
        private String fuelType;
        private String transmission;
        private String bodyType;
        private Integer seats;
        private Integer doors;
        private Integer wltp;
        private Integer co2Emission;
        private Integer co2TaxHalfYear;
        private Double consumptionL100km;
        private Double consumptionKwh100km;
        private Integer retailPrice;
        private Integer monthlyPrice;

        public Builder make(String make) {
            this.make = make;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder variant(String variant) {
            this.variant = variant;
            return this;
        }

        public Builder year(Integer year) {
            this.year = year;
            return this;
        }

        public Builder horsepower(Integer horsepower) {
            this.horsepower = horsepower;
            return this;
        }

        public Builder fuelType(String fuelType) {
            this.fuelType = fuelType;
            return this;
        }

        public Builder transmission(String transmission) {
            this.transmission = transmission;
            return this;
        }

        public Builder bodyType(String bodyType) {
            this.bodyType = bodyType;
            return this;
        }

        public Builder seats(Integer seats) {
            this.seats = seats;
            return this;
        }

        public Builder doors(Integer doors) {
            this.doors = doors;
            return this;
        }

        public Builder wltp(Integer wltp) {
            this.wltp = wltp;
            return this;
        }

        public Builder co2Emission(Integer co2Emission) {
            this.co2Emission = co2Emission;
            return this;
        }

        public Builder co2TaxHalfYear(Integer co2TaxHalfYear) {
            this.co2TaxHalfYear = co2TaxHalfYear;
            return this;
        }

        public Builder consumptionL100km(Double consumptionL100km) {
            this.consumptionL100km = consumptionL100km;
            return this;
        }

        public Builder consumptionKwh100km(Double consumptionKwh100km) {
            this.consumptionKwh100km = consumptionKwh100km;
            return this;
        }

        public Builder retailPrice(Integer retailPrice) {
            this.retailPrice = retailPrice;
            return this;
        }

        public Builder monthlyPrice(Integer monthlyPrice) {
            this.monthlyPrice = monthlyPrice;
            return this;
        }

        public ListingAttributes build() {
            return new ListingAttributes(make, model, variant, year, horsepower, fuelType, transmission,
                    bodyType, seats, doors, wltp, co2Emission, co2TaxHalfYear, consumptionL100km,
                    consumptionKwh100km, retailPrice, monthlyPrice);
        }
    }
}
