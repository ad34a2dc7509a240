package com.ethnicthv.domain.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an abstract {@link com.ethnicthv.domain.valueobject.ValueObject} subclass as an equality contract.
 * <p>
 * The annotation processor validates the equality annotations of every instance field and generates a final
 * {@code <Name>__ValueObject} subclass in the same package that implements {@code equalsCore} and
 * {@code hashCodeCore}. The host exposes instances through its own factory methods:
 * <pre>{@code
 * @ValueObjectType
 * public abstract class Address extends ValueObject<Address> {
 *     @IncludeInEquality
 *     final String city;
 *     @CustomEquality(order = 1)
 *     final String lastName;
 *
 *     Address(String city, String lastName) { this.city = city; this.lastName = lastName; }
 *
 *     public static Address of(String city, String lastName) {
 *         return new Address__ValueObject(city, lastName);
 *     }
 *
 *     static boolean equals_LastName(String a, String b) { return a.equalsIgnoreCase(b); }
 *     static int hashCode_LastName(String v) { return v.toLowerCase(Locale.ROOT).hashCode(); }
 * }
 * }</pre>
 * Not needed (and reported as unnecessary) on {@link com.ethnicthv.domain.valueobject.SimpleValueObject} wrappers.
 */
@Retention(RetentionPolicy.CLASS)
@Target(ElementType.TYPE)
public @interface ValueObjectType {
}
