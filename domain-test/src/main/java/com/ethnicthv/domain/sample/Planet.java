package com.ethnicthv.domain.sample;

import com.ethnicthv.domain.annotation.EnumerationType;
import com.ethnicthv.domain.enumeration.Enumeration;

/**
 * Mixes literal and computed constant values.
 */
@EnumerationType
public class Planet extends Enumeration {
    private static final int OUTER = 100;

    public static final Planet MERCURY = new Planet(1, "Mercury", 0.38);
    public static final Planet EARTH = new Planet(3, "Earth", 1.0);
    public static final Planet JUPITER = new Planet(OUTER + 5, "Jupiter", 2.53);

    private final double gravity;

    private Planet(int value, String name, double gravity) {
        super(value, name);
        this.gravity = gravity;
    }

    public double getGravity() {
        return gravity;
    }
}
