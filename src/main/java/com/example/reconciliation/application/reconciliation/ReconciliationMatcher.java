package com.example.reconciliation.application.reconciliation;

import com.example.reconciliation.config.ReconciliationProperties;
import com.example.reconciliation.domain.exception.DuplicateKeyCollisionException;
import com.example.reconciliation.domain.model.CollisionPolicy;
import com.example.reconciliation.domain.model.IssueKind;
import com.example.reconciliation.domain.model.MatchingResult;
import com.example.reconciliation.domain.model.PartnerPin;
import com.example.reconciliation.domain.model.ReconcilableRecord;
import com.example.reconciliation.domain.model.ReconcileOutcome;
import com.example.reconciliation.domain.model.ReconciliationResult;
import com.example.reconciliation.domain.model.RowIssue;
import com.example.reconciliation.domain.model.SettlementRecord;
import com.example.reconciliation.domain.model.SourceType;
import com.example.reconciliation.domain.model.StatementRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Full outer join of the two eligible sets on PartnerPin.
 *
 * <p>Matched pins get {@code variance = settlementUSD - statementAmount}, rounded half-up to cents;
 * the rounded value is also what the tolerance check sees. Results come back sorted by PartnerPin.
 * Ineligible records handed in are ignored.
 */
@Component
public class ReconciliationMatcher {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationMatcher.class);
    private static final int CENTS = 2;

    private final ReconciliationProperties.Matching matching;

    public ReconciliationMatcher(ReconciliationProperties properties) {
        this.matching = properties.getMatching();
    }

    /**
     * Joins the eligible statement and settlement records.
     *
     * @param statementRecords  normalized statement records
     * @param settlementRecords normalized settlement records
     * @return one result per distinct PartnerPin, plus any collisions folded under {@link CollisionPolicy#FOLD}
     * @throws DuplicateKeyCollisionException under {@link CollisionPolicy#REJECT} when a side has
     *                                        several eligible records for one PartnerPin
     */
    public MatchingResult match(List<StatementRecord> statementRecords, List<SettlementRecord> settlementRecords) {
        List<RowIssue> issues = new ArrayList<>();
        Map<PartnerPin, BigDecimal> statement = amountsByPin(SourceType.STATEMENT, statementRecords, issues);
        Map<PartnerPin, BigDecimal> settlement = amountsByPin(SourceType.SETTLEMENT, settlementRecords, issues);

        SortedSet<PartnerPin> pins = new TreeSet<>(statement.keySet());
        pins.addAll(settlement.keySet());

        List<ReconciliationResult> results = new ArrayList<>(pins.size());
        for (PartnerPin pin : pins) {
            BigDecimal statementAmount = statement.get(pin);
            BigDecimal settlementAmount = settlement.get(pin);
            if (statementAmount != null && settlementAmount != null) {
                BigDecimal variance = variance(statementAmount, settlementAmount);
                results.add(ReconciliationResult.matched(pin, statementAmount, settlementAmount, variance,
                        outcomeFor(variance)));
            } else if (settlementAmount != null) {
                results.add(ReconciliationResult.settlementOnly(pin, settlementAmount));
            } else {
                results.add(ReconciliationResult.statementOnly(pin, statementAmount));
            }
        }
        return new MatchingResult(results, issues);
    }

    /**
     * @param statementAmount     Settle.Amt of the statement
     * @param settlementAmountUsd converted settlement amount
     * @return settlement minus statement, rounded half-up to 2 decimals
     */
    public BigDecimal variance(BigDecimal statementAmount, BigDecimal settlementAmountUsd) {
        return settlementAmountUsd.subtract(statementAmount).setScale(CENTS, RoundingMode.HALF_UP);
    }

    ReconcileOutcome outcomeFor(BigDecimal variance) {
        return variance.abs().compareTo(matching.getTolerance()) <= 0
                ? ReconcileOutcome.RECONCILED
                : ReconcileOutcome.AMOUNT_MISMATCH;
    }

    private Map<PartnerPin, BigDecimal> amountsByPin(SourceType source,
                                                     List<? extends ReconcilableRecord> records,
                                                     List<RowIssue> issues) {
        Map<PartnerPin, List<ReconcilableRecord>> byPin = new LinkedHashMap<>();
        for (ReconcilableRecord record : records) {
            if (record.reconcileEligible()) {
                byPin.computeIfAbsent(record.pin(), pin -> new ArrayList<>()).add(record);
            }
        }

        Map<PartnerPin, BigDecimal> amounts = new HashMap<>();
        Set<PartnerPin> collisions = new TreeSet<>();
        byPin.forEach((pin, group) -> {
            if (group.size() > 1) {
                collisions.add(pin);
            }
            amounts.put(pin, group.stream()
                    .map(ReconcilableRecord::comparableAmount)
                    .reduce(BigDecimal.ZERO, BigDecimal::add));
        });
        if (collisions.isEmpty()) {
            return amounts;
        }

        if (matching.getCollisionPolicy() == CollisionPolicy.REJECT) {
            log.warn("Rejecting run: {} eligible set has {} colliding PartnerPin(s)", source.displayName(), collisions.size());
            throw new DuplicateKeyCollisionException(source, collisions);
        }
        for (PartnerPin pin : collisions) {
            List<ReconcilableRecord> group = byPin.get(pin);
            String rowNumbers = group.stream()
                    .map(record -> String.valueOf(record.rowNumber()))
                    .collect(Collectors.joining(", "));
            issues.add(new RowIssue(source, group.get(0).rowNumber(), IssueKind.DUPLICATE_KEY_COLLISION,
                    pin + " summed from rows " + rowNumbers));
        }
        log.warn("Folded {} colliding PartnerPin(s) in the {} eligible set by summing their amounts",
                collisions.size(), source.displayName());
        return amounts;
    }
}
