package com.amannmalik.money.api;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recognized ISO-4217 currency codes.
 */
public enum CurrencyCode {
    PLN,
    EUR,
    USD,
    GBP,
    CHF,
    CZK,
    DKK,
    SEK,
    NOK,
    HUF,
    RON,
    BGN,
    UAH,
    TRY,
    JPY,
    CNY,
    AUD,
    CAD,
    NZD,
    ZAR,
    BRL,
    MXN,
    INR,
    KRW,
    SGD,
    HKD,
    THB,
    IDR,
    MYR,
    PHP,
    SAR,
    KWD,
    QAR,
    OMR,
    AED,
    BHD,
    IQD,
    SYP,
    EGP;

    private static final Set<String> CODES = Arrays.stream(values())
            .map(Enum::name)
            .collect(Collectors.toUnmodifiableSet());

    public static boolean isRecognized(String code) {
        return code != null && CODES.contains(code);
    }

    /**
     * Resolves an exact, uppercase code.
     *
     * @throws MoneyException {@code INVALID_CURRENCY} when the code is not recognized
     */
    public static CurrencyCode parse(String code) {
        if (!isRecognized(code)) {
            throw MoneyException.invalidCurrency(code);
        }
        return valueOf(code);
    }
}
