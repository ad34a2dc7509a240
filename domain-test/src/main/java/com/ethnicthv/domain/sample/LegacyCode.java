package com.ethnicthv.domain.sample;

import com.ethnicthv.domain.annotation.EnumerationType;
import com.ethnicthv.domain.enumeration.Enumeration;

/**
 * Two constants share a value through a computed argument, which only the generated table can detect.
 */
@EnumerationType
public class LegacyCode extends Enumeration {
    private static final int FIRST_VALUE = 1;

    public static final LegacyCode FIRST = new LegacyCode(1, "First");
    public static final LegacyCode ALIAS = new LegacyCode(FIRST_VALUE * 1, "Alias");

    private LegacyCode(int value, String name) {
        super(value, name);
    }
}
