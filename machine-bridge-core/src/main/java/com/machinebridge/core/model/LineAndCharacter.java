package com.machinebridge.core.model;

/**
 * Zero-based line and column of a character offset.
 *
 * @param line zero-based line number
 * @param character zero-based column in UTF-16 code units
 */
public record LineAndCharacter(int line, int character) {
}
