package com.basketbot.model;

/**
 * Option type as used in exchange trading symbols.
 */
public enum OptionType {
    /** Call */
    CE,
    /** Put */
    PE
}
