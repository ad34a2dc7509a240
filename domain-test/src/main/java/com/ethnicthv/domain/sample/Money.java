package com.ethnicthv.domain.sample;

import com.ethnicthv.domain.annotation.IncludeInEquality;
import com.ethnicthv.domain.annotation.ValueObjectType;
import com.ethnicthv.domain.valueobject.SimpleValueObject;

import java.math.BigDecimal;

/**
 * Amount wrapper. The marker and the annotated note are both ignored (javac warns about each);
 * equality is the wrapped amount's.
 */
@ValueObjectType
public final class Money extends SimpleValueObject<Money, BigDecimal> {
    @IncludeInEquality
    private final String note;

    public Money(BigDecimal amount, String note) {
        super(amount);
        this.note = note;
    }

    public String getNote() {
        return note;
    }
}
