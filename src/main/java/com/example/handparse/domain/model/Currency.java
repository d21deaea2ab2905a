package com.example.handparse.domain.model;

import java.util.Locale;

/**
 * Currencies that appear as explicit codes in hand history headers.
 */
public enum Currency {
    USD("USD"),
    EUR("EUR"),
    GBP("GBP"),
    CAD("CAD"),
    STARS_COIN("SC");

    private final String code;

    Currency(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

	/**
	 * Resolves a currency from the code written in the header.
	 *
	 * @param code raw code such as {@code USD} or {@code SC}
	 * @return currency or {@code null} when the code is unknown
	 */
    public static Currency fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (Currency currency : values()) {
            if (currency.code.equals(normalized)) {
                return currency;
            }
        }
        return null;
    }
}
