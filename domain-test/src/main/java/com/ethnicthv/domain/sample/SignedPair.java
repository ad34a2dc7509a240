package com.ethnicthv.domain.sample;

import com.ethnicthv.domain.annotation.CustomEquality;
import com.ethnicthv.domain.annotation.IncludeInEquality;
import com.ethnicthv.domain.annotation.ValueObjectType;
import com.ethnicthv.domain.valueobject.ValueObject;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Key plus signature; the signature comparison is counted so callers can observe how often it runs.
 */
@ValueObjectType
public abstract class SignedPair extends ValueObject<SignedPair> {
    static final AtomicInteger SIGNATURE_COMPARISONS = new AtomicInteger();

    @IncludeInEquality
    final String key;

    @CustomEquality(order = 1)
    final String signature;

    SignedPair(String key, String signature) {
        this.key = key;
        this.signature = signature;
    }

    public static SignedPair of(String key, String signature) {
        return new SignedPair__ValueObject(key, signature);
    }

    static boolean equals_Signature(String value, String otherValue) {
        SIGNATURE_COMPARISONS.incrementAndGet();
        return Objects.equals(value, otherValue);
    }

    static int hashCode_Signature(String value) {
        return Objects.hashCode(value);
    }
}
