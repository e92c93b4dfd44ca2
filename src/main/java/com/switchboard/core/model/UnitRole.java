package com.switchboard.core.model;

/**
 * Position of a unit in the hierarchy.
 */
public enum UnitRole {
    LEAF,
    SUPERVISOR
}
