package com.example.reconciliation.domain.model;

/**
 * What the matcher does when one side holds more than one eligible record for the same PartnerPin.
 */
public enum CollisionPolicy {
    /** Sum the amounts of the colliding records and report the collision as a row issue. */
    FOLD,
    /** Fail the whole run. */
    REJECT
}
