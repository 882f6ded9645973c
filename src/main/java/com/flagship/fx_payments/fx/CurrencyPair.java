package com.flagship.fx_payments.fx;

import com.flagship.fx_payments.exception.ValidationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Currency;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Ordered pair of ISO-4217 codes. Source and target always differ.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CurrencyPair {

    private static final Pattern ISO_CODE = Pattern.compile("^[A-Z]{3}$");

    String source;
    String target;

    /**
     * Normalises both codes to upper case and validates them.
     *
     * @throws ValidationException if a code is missing, malformed, not an ISO-4217 currency,
     *                             or both codes are the same
     */
    public static CurrencyPair of(String source, String target) {
        String from = normalise(source, "Source");
        String to = normalise(target, "Target");
        if (from.equals(to)) {
            throw new ValidationException("Source and target currencies must differ, both were " + from);
        }
        return new CurrencyPair(from, to);
    }

    public CurrencyPair inverse() {
        return new CurrencyPair(target, source);
    }

    public boolean involves(String code) {
        return source.equals(code) || target.equals(code);
    }

    @Override
    public String toString() {
        return source + "/" + target;
    }

    private static String normalise(String code, String side) {
        if (code == null || code.isBlank()) {
            throw new ValidationException(side + " currency is required");
        }
        String upper = code.trim().toUpperCase(Locale.ROOT);
        if (!ISO_CODE.matcher(upper).matches()) {
            throw new ValidationException(side + " currency must be a 3-letter ISO code: " + code);
        }
        try {
            Currency.getInstance(upper);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown " + side.toLowerCase(Locale.ROOT) + " currency: " + upper);
        }
        return upper;
    }
}
