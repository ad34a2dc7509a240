package com.ethnicthv.domain.sample;

import com.ethnicthv.domain.annotation.IncludeInEquality;
import com.ethnicthv.domain.annotation.ValueObjectType;
import com.ethnicthv.domain.valueobject.ValueObject;

/**
 * Sensor reading. {@code sensor} and {@code value} share order 5 and are compared in declaration order
 * after {@code timestamp}; javac reports a duplicate-order warning for this class.
 */
@ValueObjectType
public abstract class Reading extends ValueObject<Reading> {
    @IncludeInEquality(order = 5)
    final String sensor;

    @IncludeInEquality(order = 5)
    final double value;

    @IncludeInEquality(order = 1)
    final long timestamp;

    Reading(String sensor, double value, long timestamp) {
        this.sensor = sensor;
        this.value = value;
        this.timestamp = timestamp;
    }

    public static Reading of(String sensor, double value, long timestamp) {
        return new Reading__ValueObject(sensor, value, timestamp);
    }
}
