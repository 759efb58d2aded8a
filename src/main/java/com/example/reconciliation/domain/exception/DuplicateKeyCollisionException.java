package com.example.reconciliation.domain.exception;

import com.example.reconciliation.domain.model.PartnerPin;
import com.example.reconciliation.domain.model.SourceType;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Raised under the REJECT collision policy when one side still holds several eligible records
 * for the same PartnerPin after tagging.
 */
public class DuplicateKeyCollisionException extends DomainException {

    private final SourceType source;
    private final List<PartnerPin> pins;

	/**
	 * @param source ledger holding the colliding records
	 * @param pins   every PartnerPin that collides, in any order
	 */
    public DuplicateKeyCollisionException(SourceType source, Collection<PartnerPin> pins) {
        super(source.displayName() + " has several eligible records for PartnerPin(s): "
                + sorted(pins).stream().map(PartnerPin::value).collect(Collectors.joining(", ")));
        this.source = source;
        this.pins = sorted(pins);
    }

    public SourceType getSource() {
        return source;
    }

    /**
     * @return colliding PartnerPins in ascending order
     */
    public List<PartnerPin> getPins() {
        return pins;
    }

    private static List<PartnerPin> sorted(Collection<PartnerPin> pins) {
        return List.copyOf(new TreeSet<>(pins));
    }
}
