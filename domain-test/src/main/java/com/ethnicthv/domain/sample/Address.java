package com.ethnicthv.domain.sample;

import com.ethnicthv.domain.annotation.CustomEquality;
import com.ethnicthv.domain.annotation.IncludeInEquality;
import com.ethnicthv.domain.annotation.ValueObjectType;
import com.ethnicthv.domain.valueobject.ValueObject;

import java.util.Locale;

/**
 * Postal address. The city must match exactly, the last name ignoring case.
 */
@ValueObjectType
public abstract class Address extends ValueObject<Address> {
    @IncludeInEquality
    private final String city;

    @CustomEquality(order = 1)
    private final String lastName;

    Address(String city, String lastName) {
        this.city = city;
        this.lastName = lastName;
    }

    public static Address of(String city, String lastName) {
        return new Address__ValueObject(city, lastName);
    }

    public String getCity() {
        return city;
    }

    public String getLastName() {
        return lastName;
    }

    static boolean equals_LastName(String value, String otherValue) {
        return value == null ? otherValue == null : value.equalsIgnoreCase(otherValue);
    }

    static int hashCode_LastName(String value) {
        return value == null ? 0 : value.toLowerCase(Locale.ROOT).hashCode();
    }

    @Override
    public String toString() {
        return "Address[" + city + ", " + lastName + "]";
    }
}
