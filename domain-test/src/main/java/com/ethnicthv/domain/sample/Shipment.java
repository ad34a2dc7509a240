package com.ethnicthv.domain.sample;

import com.ethnicthv.domain.annotation.EnumerationType;
import com.ethnicthv.domain.annotation.IgnoreEquality;
import com.ethnicthv.domain.annotation.IncludeInEquality;
import com.ethnicthv.domain.annotation.ValueObjectType;
import com.ethnicthv.domain.enumeration.Enumeration;
import com.ethnicthv.domain.valueobject.ValueObject;

/**
 * Holder for nested domain types.
 */
public final class Shipment {
    private Shipment() {}

    @ValueObjectType
    public abstract static class Dimensions extends ValueObject<Dimensions> {
        @IncludeInEquality
        final double weight;
        @IncludeInEquality(order = 1)
        final float ratio;
        @IncludeInEquality(order = 2)
        final boolean fragile;
        @IncludeInEquality(order = 3)
        final char grade;
        @IncludeInEquality(order = 4)
        final int[] sizes;
        @IncludeInEquality(order = 5)
        final String[][] labels;
        @IgnoreEquality
        final String comment;

        protected Dimensions(double weight, float ratio, boolean fragile, char grade, int[] sizes, String[][] labels, String comment) {
            this.weight = weight;
            this.ratio = ratio;
            this.fragile = fragile;
            this.grade = grade;
            this.sizes = sizes;
            this.labels = labels;
            this.comment = comment;
        }

        public static Dimensions of(double weight, float ratio, boolean fragile, char grade, int[] sizes, String[][] labels, String comment) {
            return new Shipment_Dimensions__ValueObject(weight, ratio, fragile, grade, sizes, labels, comment);
        }
    }

    @EnumerationType
    public static class Carrier extends Enumeration {
        public static final Carrier POST = new Carrier(10, "Post");
        public static final Carrier COURIER = new Carrier(20, "Courier");

        protected Carrier(int value, String name) {
            super(value, name);
        }
    }
}
