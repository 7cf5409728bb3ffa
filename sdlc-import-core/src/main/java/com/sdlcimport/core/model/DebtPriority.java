package com.sdlcimport.core.model;

/**
 * Priority tiers for technical debt items, P0 being the most urgent.
 */
public enum DebtPriority {
    P0,
    P1,
    P2,
    P3
}
