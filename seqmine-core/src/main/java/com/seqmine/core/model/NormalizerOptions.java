package com.seqmine.core.model;

import com.seqmine.core.exception.ConfigurationException;

import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Explicit timestamp settings for temporal normalization.
 * 
 * @param subSecondDigits fractional-second digits kept on parsed timestamps (0-9, 9 keeps full precision)
 * @param zone            zone applied to timestamps that carry no offset
 */
public record NormalizerOptions(int subSecondDigits, ZoneId zone) {

    public static final int DEFAULT_SUB_SECOND_DIGITS = 9;

    public NormalizerOptions {
        if (subSecondDigits < 0 || subSecondDigits > 9) {
            throw new ConfigurationException("subSecondDigits must be in [0, 9]: " + subSecondDigits);
        }
        if (zone == null) {
            throw new ConfigurationException("zone must not be null");
        }
    }

    public static NormalizerOptions defaults() {
        return new NormalizerOptions(DEFAULT_SUB_SECOND_DIGITS, ZoneOffset.UTC);
    }

    public NormalizerOptions withSubSecondDigits(int digits) {
        return new NormalizerOptions(digits, zone);
    }

    public NormalizerOptions withZone(ZoneId zone) {
        return new NormalizerOptions(subSecondDigits, zone);
    }
}
