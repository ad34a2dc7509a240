package com.ethnicthv.domain.sample;

import com.ethnicthv.domain.annotation.IncludeInEquality;
import com.ethnicthv.domain.annotation.ValueObjectType;
import com.ethnicthv.domain.valueobject.ValueObject;

@ValueObjectType
public abstract class Tagged<T extends Comparable<T>> extends ValueObject<Tagged<T>> {
    @IncludeInEquality
    final T value;

    @IncludeInEquality(order = 1)
    final String tag;

    protected Tagged(T value, String tag) {
        this.value = value;
        this.tag = tag;
    }

    public static <T extends Comparable<T>> Tagged<T> of(T value, String tag) {
        return new Tagged__ValueObject<>(value, tag);
    }

    public T getValue() {
        return value;
    }
}
