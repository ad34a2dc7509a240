package com.ethnicthv.domain.sample;

import com.ethnicthv.domain.annotation.SequenceEquality;
import com.ethnicthv.domain.annotation.ValueObjectType;
import com.ethnicthv.domain.valueobject.ValueObject;

/**
 * Round scores of a player: rounds in play order, bonus points as a bag.
 */
@ValueObjectType
public abstract class Scores extends ValueObject<Scores> {
    @SequenceEquality
    final double[] rounds;

    @SequenceEquality(order = 1, orderMatters = false)
    final int[] bonuses;

    Scores(double[] rounds, int[] bonuses) {
        this.rounds = rounds;
        this.bonuses = bonuses;
    }

    public static Scores of(double[] rounds, int... bonuses) {
        return new Scores__ValueObject(rounds, bonuses);
    }
}
