package com.listing.reconciliation.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits dealer variant names such as {@code "2.0 TDI 150 HK DSG quattro"} into a core variant
 * ({@code "2.0"}) and the specs it mentions.
 *
 * <p>Removal is rule-driven: each rule is a case-insensitive pattern applied in order, the way
 * name normalization rules are. Dealers spell the same trim with and without engine codes, so
 * those are stripped from the core variant as well.</p>
 */
public class VariantSpecExtractor {
    private static final Logger log = LoggerFactory.getLogger(VariantSpecExtractor.class);

    private static final Pattern HORSEPOWER = Pattern.compile("(\\d+)\\s*(?:hk|hp)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern AUTOMATIC = Pattern.compile(
            "\\b(?:dsg\\d*|s[\\s-]?tronic|automatgear|automatic|automatik)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern MANUAL = Pattern.compile("\\b(?:manual|manuel)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern AWD = Pattern.compile(
            "\\b(?:quattro|4motion|awd|4wd|xdrive|allrad)\\b", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> NOISE = List.of(
            Pattern.compile("\\b(?:mild\\s*hybrid|hybrid|phev|ev|e-tron)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:tsi|tfsi|tdi|fsi|etsi)\\b", Pattern.CASE_INSENSITIVE));
    private static final Pattern DASH = Pattern.compile("\\s*-\\s*");

    /**
     * Parses {@code variant}. A null or blank variant yields an empty core and no specs.
     */
    public VariantSpecs extract(String variant) {
        if (variant == null || variant.isBlank()) {
            return new VariantSpecs("", null, null, false);
        }

        String core = variant;
        Integer horsepower = null;
        String transmission = null;

        Matcher hp = HORSEPOWER.matcher(core);
        if (hp.find()) {
            horsepower = Integer.valueOf(hp.group(1));
            core = HORSEPOWER.matcher(core).replaceAll(" ");
        }

        if (AUTOMATIC.matcher(core).find()) {
            transmission = "automatic";
            core = AUTOMATIC.matcher(core).replaceAll(" ");
        } else if (MANUAL.matcher(core).find()) {
            transmission = "manual";
            core = MANUAL.matcher(core).replaceAll(" ");
        }

        boolean awd = AWD.matcher(core).find();
        if (awd) {
            core = AWD.matcher(core).replaceAll(" ");
        }

        for (Pattern noise : NOISE) {
            core = noise.matcher(core).replaceAll(" ");
        }
        core = KeyNormalizer.normalize(DASH.matcher(core).replaceAll(" "));

        VariantSpecs specs = new VariantSpecs(core, horsepower, transmission, awd);
        log.trace("Variant '{}' parsed as {}", variant, specs);
        return specs;
    }

    /**
     * Maps a transmission attribute value onto {@code automatic} or {@code manual}; other values
     * are returned normalized.
     */
    public static String canonicalTransmission(String transmission) {
        String normalized = KeyNormalizer.normalize(transmission);
        if (normalized.isEmpty()) {
            return null;
        }
        if (normalized.startsWith("auto") || AUTOMATIC.matcher(normalized).find()) {
            return "automatic";
        }
        if (normalized.startsWith("manu")) {
            return "manual";
        }
        return normalized;
    }

    /**
     * Builds the composite key {@code make|model|coreVariant[|<hp>hp][|transmission][|awd]}.
     * Explicit horsepower and transmission attributes take precedence over values parsed from
     * the variant.
     */
    public String compositeKey(String make, String model, String variant,
                               Integer horsepower, String transmission) {
        VariantSpecs specs = extract(variant);
        Integer hp = horsepower != null ? horsepower : specs.horsepower();
        String trans = transmission != null ? canonicalTransmission(transmission) : specs.transmission();

        StringBuilder key = new StringBuilder(KeyNormalizer.makeModelKey(make, model))
                .append('|').append(specs.coreVariant());
        if (hp != null) {
            key.append('|').append(hp).append("hp");
        }
        if (trans != null) {
            key.append('|').append(trans);
        }
        if (specs.awd()) {
            key.append("|awd");
        }
        return key.toString().toLowerCase(Locale.ROOT);
    }
}
