package com.amannmalik.money.api;

import com.amannmalik.money.util.Ensure;

import java.util.regex.Pattern;

/**
 * Plain amount/currency pair used to move a {@link Money} across a process boundary. The amount is
 * kept as a string so that no precision is lost in transit.
 */
public record MoneyTransfer(String amount, String currency) {
    public static final Pattern AMOUNT = Pattern.compile("^-?\\d+(\\.\\d+)?$");

    public MoneyTransfer {
        amount = Ensure.notNull("money.amount", amount);
        currency = Ensure.notNull("money.currency", currency);
    }

    /**
     * Strict interop check: a plain, non-exponential amount and a recognized currency.
     */
    public boolean isWellFormed() {
        return AMOUNT.matcher(amount).matches() && CurrencyCode.isRecognized(currency);
    }
}
