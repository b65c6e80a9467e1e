package com.listing.reconciliation.api;

/**
 * Tuning for matching, offer normalization and apply execution.
 */
public class ReconciliationOptions {

    private static final double DEFAULT_FUZZY_CONFIDENCE_FLOOR = 0.70;
    private static final double DEFAULT_COMPOSITE_KEY_CONFIDENCE = 0.95;
    private static final int DEFAULT_HORSEPOWER_TOLERANCE = 5;
    private static final int DEFAULT_PERIOD_MONTHS = 36;
    private static final int DEFAULT_MILEAGE_PER_YEAR = 15_000;
    private static final String DEFAULT_REVIEWER = "admin";

    private final double fuzzyConfidenceFloor;
    private final double compositeKeyConfidence;
    private final int horsepowerTolerance;
    private final int defaultPeriodMonths;
    private final int defaultMileagePerYear;
    private final boolean parallelMatching;
    private final int applyConcurrency;
    private final String defaultReviewer;

    private ReconciliationOptions(Builder builder) {
        this.fuzzyConfidenceFloor = builder.fuzzyConfidenceFloor;
        this.compositeKeyConfidence = builder.compositeKeyConfidence;
        this.horsepowerTolerance = builder.horsepowerTolerance;
        this.defaultPeriodMonths = builder.defaultPeriodMonths;
        this.defaultMileagePerYear = builder.defaultMileagePerYear;
        this.parallelMatching = builder.parallelMatching;
        this.applyConcurrency = builder.applyConcurrency;
        this.defaultReviewer = builder.defaultReviewer;
    }

    /**
     * Minimum similarity a fuzzy match must reach to be accepted.
     */
    public double getFuzzyConfidenceFloor() {
        return fuzzyConfidenceFloor;
    }

    /**
     * Confidence assigned to matches found through the make/model/core-variant/spec key.
     */
    public double getCompositeKeyConfidence() {
        return compositeKeyConfidence;
    }

    public int getHorsepowerTolerance() {
        return horsepowerTolerance;
    }

    public int getDefaultPeriodMonths() {
        return defaultPeriodMonths;
    }

    public int getDefaultMileagePerYear() {
        return defaultMileagePerYear;
    }

    public boolean isParallelMatching() {
        return parallelMatching;
    }

    /**
     * Maximum number of store operations issued concurrently within one apply phase.
     * {@code 1} runs every operation on the calling thread.
     */
    public int getApplyConcurrency() {
        return applyConcurrency;
    }

    public String getDefaultReviewer() {
        return defaultReviewer;
    }

    public static ReconciliationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double fuzzyConfidenceFloor = DEFAULT_FUZZY_CONFIDENCE_FLOOR;
        private double compositeKeyConfidence = DEFAULT_COMPOSITE_KEY_CONFIDENCE;
        private int horsepowerTolerance = DEFAULT_HORSEPOWER_TOLERANCE;
        private int defaultPeriodMonths = DEFAULT_PERIOD_MONTHS;
        private int defaultMileagePerYear = DEFAULT_MILEAGE_PER_YEAR;
        private boolean parallelMatching = false;
        private int applyConcurrency = 1;
        private String defaultReviewer = DEFAULT_REVIEWER;

        public Builder fuzzyConfidenceFloor(double fuzzyConfidenceFloor) {
            validateScore(fuzzyConfidenceFloor, "fuzzyConfidenceFloor");
            this.fuzzyConfidenceFloor = fuzzyConfidenceFloor;
            return this;
        }

        public Builder compositeKeyConfidence(double compositeKeyConfidence) {
            validateScore(compositeKeyConfidence, "compositeKeyConfidence");
            this.compositeKeyConfidence = compositeKeyConfidence;
            return this;
        }

        public Builder horsepowerTolerance(int horsepowerTolerance) {
            if (horsepowerTolerance < 0) {
                throw new IllegalArgumentException("horsepowerTolerance must be >= 0");
            }
            this.horsepowerTolerance = horsepowerTolerance;
            return this;
        }

        public Builder defaultPeriodMonths(int defaultPeriodMonths) {
            if (defaultPeriodMonths <= 0) {
                throw new IllegalArgumentException("defaultPeriodMonths must be positive");
            }
            this.defaultPeriodMonths = defaultPeriodMonths;
            return this;
        }

        public Builder defaultMileagePerYear(int defaultMileagePerYear) {
            if (defaultMileagePerYear <= 0) {
                throw new IllegalArgumentException("defaultMileagePerYear must be positive");
            }
            this.defaultMileagePerYear = defaultMileagePerYear;
            return this;
        }

        public Builder parallelMatching(boolean parallelMatching) {
            this.parallelMatching = parallelMatching;
            return this;
        }

        public Builder applyConcurrency(int applyConcurrency) {
            if (applyConcurrency <= 0) {
                throw new IllegalArgumentException("applyConcurrency must be positive");
            }
            this.applyConcurrency = applyConcurrency;
            return this;
        }

        public Builder defaultReviewer(String defaultReviewer) {
            if (defaultReviewer == null || defaultReviewer.isBlank()) {
                throw new IllegalArgumentException("defaultReviewer must not be blank");
            }
            this.defaultReviewer = defaultReviewer;
            return this;
        }

        public ReconciliationOptions build() {
            if (compositeKeyConfidence < fuzzyConfidenceFloor) {
                throw new IllegalArgumentException(
                        "compositeKeyConfidence must be >= fuzzyConfidenceFloor");
            }
            return new ReconciliationOptions(this);
        }

        private void validateScore(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "ReconciliationOptions{" +
                "fuzzyConfidenceFloor=" + fuzzyConfidenceFloor +
                ", compositeKeyConfidence=" + compositeKeyConfidence +
                ", horsepowerTolerance=" + horsepowerTolerance +
                ", defaultPeriodMonths=" + defaultPeriodMonths +
                ", defaultMileagePerYear=" + defaultMileagePerYear +
                ", parallelMatching=" + parallelMatching +
                ", applyConcurrency=" + applyConcurrency +
                ", defaultReviewer='" + defaultReviewer + '\'' +
                '}';
    }
}
