package com.basketbot.model;

/**
 * How a basket's leg sides are applied when orders are sent.
 */
public enum SideTransform {
    AS_IS,
    INVERT;

    public Side apply(Side side) {
        return this == INVERT ? side.opposite() : side;
    }
}
