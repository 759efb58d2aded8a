package com.example.reconciliation.application.reconciliation;

import com.example.reconciliation.domain.exception.UnparseableAmountException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Reads currency-like cells ({@code "$1,234.50"}, {@code "48.00 USD"}, {@code "-12"}) as decimals.
 *
 * <ul>
 *     <li>Accounting negatives in parentheses are negated: {@code "(50.00)"} is {@code -50.00}.</li>
 *     <li>Scientific notation as written by spreadsheets is read as is: {@code "1.5E+3"} is {@code 1500}.</li>
 *     <li>Otherwise everything except digits, the decimal point and the minus sign is stripped.</li>
 * </ul>
 * An exponent mixed with other text is rejected rather than stripped into a different number.
 */
@Component
public class AmountParser {

    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9.\\-]+");
    private static final Pattern SCIENTIFIC = Pattern.compile("[+-]?\\d+(\\.\\d+)?[eE][+-]?\\d+");
    private static final Pattern EMBEDDED_EXPONENT = Pattern.compile("\\d[eE][+-]?\\d");

    /**
     * @param raw cell value
     * @return parsed amount, scale as written
     * @throws UnparseableAmountException when nothing numeric is left or the remainder is not a decimal
     */
    public BigDecimal parse(String raw) {
        if (raw == null) {
            throw new UnparseableAmountException("");
        }
        String value = raw.trim();
        boolean parenthesized = value.length() > 2 && value.startsWith("(") && value.endsWith(")");
        if (parenthesized) {
            value = value.substring(1, value.length() - 1).trim();
        }

        BigDecimal amount = parseUnsigned(raw, value);
        if (!parenthesized) {
            return amount;
        }
        if (amount.signum() < 0) {
            throw new UnparseableAmountException(raw);
        }
        return amount.negate();
    }

    private BigDecimal parseUnsigned(String raw, String value) {
        if (SCIENTIFIC.matcher(value).matches()) {
            return new BigDecimal(value);
        }
        if (EMBEDDED_EXPONENT.matcher(value).find() || value.indexOf('(') >= 0 || value.indexOf(')') >= 0) {
            throw new UnparseableAmountException(raw);
        }
        String cleaned = NON_NUMERIC.matcher(value).replaceAll("");
        if (cleaned.isEmpty() || cleaned.equals("-") || cleaned.equals(".")) {
            throw new UnparseableAmountException(raw);
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException ex) {
            throw new UnparseableAmountException(raw, ex);
        }
    }
}
