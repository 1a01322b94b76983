package io.hostorchestrator.enums;

/**
 * Why a capacity reservation was taken.
 */
public enum ReservationKind {
    PLACEMENT,
    MIGRATION
}
