package com.battleship.cpu;

/**
 * Phase of a queue-driven CPU strategy.
 */
public enum TargetingMode {
    HUNTING,    // No unresolved hit, searching
    PROBING     // Following up candidates around a hit ship
}
