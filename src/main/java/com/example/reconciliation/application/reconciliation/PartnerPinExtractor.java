package com.example.reconciliation.application.reconciliation;

import com.example.reconciliation.domain.model.PartnerPin;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Pulls the PartnerPin out of a free-text field.
 * Trailing non-digit characters are skipped, then the maximal run of digits before them is taken;
 * only a run of exactly {@value PartnerPin#LENGTH} digits is a key. Longer or shorter runs are never
 * truncated or padded.
 */
@Component
public class PartnerPinExtractor {

    /**
     * @param text description or key cell, may be {@code null}
     * @return the PartnerPin, or empty when the trailing digit run is not exactly 11 long
     */
    public Optional<PartnerPin> extract(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int end = text.length();
        while (end > 0 && !isAsciiDigit(text.charAt(end - 1))) {
            end--;
        }
        int start = end;
        while (start > 0 && isAsciiDigit(text.charAt(start - 1))) {
            start--;
        }
        if (end - start != PartnerPin.LENGTH) {
            return Optional.empty();
        }
        return Optional.of(new PartnerPin(text.substring(start, end)));
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
