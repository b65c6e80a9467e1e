package com.listing.reconciliation.core.model;

/**
 * Old and new value of a single tracked field.
 */
public record FieldChange(Object oldValue, Object newValue) {
}
