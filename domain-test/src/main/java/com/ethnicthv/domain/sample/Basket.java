package com.ethnicthv.domain.sample;

import com.ethnicthv.domain.annotation.SequenceEquality;
import com.ethnicthv.domain.annotation.ValueObjectType;
import com.ethnicthv.domain.valueobject.ValueObject;

import java.util.List;

/**
 * Shopping basket: line order matters, tags and handles are bags, codes are an unordered array.
 */
@ValueObjectType
public abstract class Basket extends ValueObject<Basket> {
    @SequenceEquality
    final List<String> lines;

    @SequenceEquality(order = 1, orderMatters = false)
    final List<String> tags;

    @SequenceEquality(order = 2, orderMatters = false, deepEquality = false)
    final List<Object> handles;

    @SequenceEquality(order = 3, orderMatters = false)
    final String[] codes;

    Basket(List<String> lines, List<String> tags, List<Object> handles, String[] codes) {
        this.lines = lines;
        this.tags = tags;
        this.handles = handles;
        this.codes = codes;
    }

    public static Basket of(List<String> lines, List<String> tags, List<Object> handles, String... codes) {
        return new Basket__ValueObject(lines, tags, handles, codes);
    }
}
