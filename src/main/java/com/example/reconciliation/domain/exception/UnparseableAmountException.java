package com.example.reconciliation.domain.exception;

/**
 * Raised when a monetary cell cannot be read as a decimal.
 * Normalizers catch it and exclude the row; it never reaches the caller of a run.
 */
public class UnparseableAmountException extends DomainException {

    private final String rawValue;

    public UnparseableAmountException(String rawValue) {
        super("Not a decimal amount: '" + rawValue + "'");
        this.rawValue = rawValue;
    }

    public UnparseableAmountException(String rawValue, Throwable cause) {
        super("Not a decimal amount: '" + rawValue + "'", cause);
        this.rawValue = rawValue;
    }

    public String getRawValue() {
        return rawValue;
    }
}
