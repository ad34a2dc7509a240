package com.ethnicthv.domain.valueobject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sequence equality and hashing used by generated {@code equalsCore}/{@code hashCodeCore} implementations.
 * <ul>
 *   <li>ordered: equal elements at equal positions; hash folds element hashes in iteration order</li>
 *   <li>unordered: multiset equality; hash folds (class hash, cardinality) pairs sorted by value, so any
 *       permutation of an equal multiset hashes the same</li>
 * </ul>
 * Deep mode compares elements with {@link Objects#equals}, shallow mode by reference. Primitive arrays
 * always compare element values, whatever the mode; floating point elements compare like
 * {@link Double#equals}.
 * Two {@code null} sequences are equal only because they are the same reference; {@code null} is never
 * equal to a non-null sequence.
 */
public final class SequenceComparison {
    private SequenceComparison() {}

    public static boolean sequenceEquals(Iterable<?> first, Iterable<?> second, boolean orderMatters, boolean deepEquality) {
        if (first == second) return true;
        if (first == null || second == null) return false;
        if (orderMatters) return positionalEquals(first, second, deepEquality);
        Map<Object, Integer> left = countClasses(first, deepEquality);
        Map<Object, Integer> right = countClasses(second, deepEquality);
        if (left.size() != right.size()) return false;
        for (Map.Entry<Object, Integer> e : left.entrySet()) {
            if (!e.getValue().equals(right.get(e.getKey()))) return false;
        }
        return true;
    }

    public static boolean sequenceEquals(Object[] first, Object[] second, boolean orderMatters, boolean deepEquality) {
        if (first == second) return true;
        if (first == null || second == null) return false;
        return sequenceEquals(Arrays.asList(first), Arrays.asList(second), orderMatters, deepEquality);
    }

    public static int sequenceHashCode(Iterable<?> source, boolean orderMatters, boolean deepEquality) {
        if (source == null) return 0;
        int hash = 1;
        if (orderMatters) {
            for (Object element : source) {
                hash = 31 * hash + elementHash(element, deepEquality);
            }
            return hash;
        }
        Map<Object, Integer> classes = countClasses(source, deepEquality);
        long[] pairs = new long[classes.size()];
        int i = 0;
        for (Map.Entry<Object, Integer> e : classes.entrySet()) {
            // high word: representative hash, low word: cardinality
            pairs[i++] = ((long) elementHash(e.getKey(), deepEquality) << 32) | (e.getValue() & 0xFFFFFFFFL);
        }
        Arrays.sort(pairs);
        for (long pair : pairs) {
            hash = 31 * hash + (int) (pair >> 32);
            hash = 31 * hash + (int) pair;
        }
        return hash;
    }

    public static int sequenceHashCode(Object[] source, boolean orderMatters, boolean deepEquality) {
        if (source == null) return 0;
        return sequenceHashCode(Arrays.asList(source), orderMatters, deepEquality);
    }

    public static boolean sequenceEquals(boolean[] first, boolean[] second, boolean orderMatters, boolean deepEquality) {
        if (first == second) return true;
        if (first == null || second == null) return false;
        return sequenceEquals(boxed(first), boxed(second), orderMatters, true);
    }

    public static int sequenceHashCode(boolean[] source, boolean orderMatters, boolean deepEquality) {
        if (source == null) return 0;
        return sequenceHashCode(boxed(source), orderMatters, true);
    }

    public static boolean sequenceEquals(byte[] first, byte[] second, boolean orderMatters, boolean deepEquality) {
        if (first == second) return true;
        if (first == null || second == null) return false;
        return sequenceEquals(boxed(first), boxed(second), orderMatters, true);
    }

    public static int sequenceHashCode(byte[] source, boolean orderMatters, boolean deepEquality) {
        if (source == null) return 0;
        return sequenceHashCode(boxed(source), orderMatters, true);
    }

    public static boolean sequenceEquals(char[] first, char[] second, boolean orderMatters, boolean deepEquality) {
        if (first == second) return true;
        if (first == null || second == null) return false;
        return sequenceEquals(boxed(first), boxed(second), orderMatters, true);
    }

    public static int sequenceHashCode(char[] source, boolean orderMatters, boolean deepEquality) {
        if (source == null) return 0;
        return sequenceHashCode(boxed(source), orderMatters, true);
    }

    public static boolean sequenceEquals(short[] first, short[] second, boolean orderMatters, boolean deepEquality) {
        if (first == second) return true;
        if (first == null || second == null) return false;
        return sequenceEquals(boxed(first), boxed(second), orderMatters, true);
    }

    public static int sequenceHashCode(short[] source, boolean orderMatters, boolean deepEquality) {
        if (source == null) return 0;
        return sequenceHashCode(boxed(source), orderMatters, true);
    }

    public static boolean sequenceEquals(int[] first, int[] second, boolean orderMatters, boolean deepEquality) {
        if (first == second) return true;
        if (first == null || second == null) return false;
        return sequenceEquals(boxed(first), boxed(second), orderMatters, true);
    }

    public static int sequenceHashCode(int[] source, boolean orderMatters, boolean deepEquality) {
        if (source == null) return 0;
        return sequenceHashCode(boxed(source), orderMatters, true);
    }

    public static boolean sequenceEquals(long[] first, long[] second, boolean orderMatters, boolean deepEquality) {
        if (first == second) return true;
        if (first == null || second == null) return false;
        return sequenceEquals(boxed(first), boxed(second), orderMatters, true);
    }

    public static int sequenceHashCode(long[] source, boolean orderMatters, boolean deepEquality) {
        if (source == null) return 0;
        return sequenceHashCode(boxed(source), orderMatters, true);
    }

    public static boolean sequenceEquals(float[] first, float[] second, boolean orderMatters, boolean deepEquality) {
        if (first == second) return true;
        if (first == null || second == null) return false;
        return sequenceEquals(boxed(first), boxed(second), orderMatters, true);
    }

    public static int sequenceHashCode(float[] source, boolean orderMatters, boolean deepEquality) {
        if (source == null) return 0;
        return sequenceHashCode(boxed(source), orderMatters, true);
    }

    public static boolean sequenceEquals(double[] first, double[] second, boolean orderMatters, boolean deepEquality) {
        if (first == second) return true;
        if (first == null || second == null) return false;
        return sequenceEquals(boxed(first), boxed(second), orderMatters, true);
    }

    public static int sequenceHashCode(double[] source, boolean orderMatters, boolean deepEquality) {
        if (source == null) return 0;
        return sequenceHashCode(boxed(source), orderMatters, true);
    }

    private static boolean positionalEquals(Iterable<?> first, Iterable<?> second, boolean deepEquality) {
        Iterator<?> a = first.iterator();
        Iterator<?> b = second.iterator();
        while (a.hasNext() && b.hasNext()) {
            if (!elementEquals(a.next(), b.next(), deepEquality)) return false;
        }
        return !a.hasNext() && !b.hasNext();
    }

    private static Map<Object, Integer> countClasses(Iterable<?> source, boolean deepEquality) {
        Map<Object, Integer> counts = deepEquality ? new HashMap<>() : new IdentityHashMap<>();
        for (Object element : source) {
            counts.merge(element, 1, Integer::sum);
        }
        return counts;
    }

    private static boolean elementEquals(Object a, Object b, boolean deepEquality) {
        return deepEquality ? Objects.equals(a, b) : a == b;
    }

    private static int elementHash(Object element, boolean deepEquality) {
        return deepEquality ? Objects.hashCode(element) : System.identityHashCode(element);
    }

    private static List<Boolean> boxed(boolean[] values) {
        List<Boolean> list = new ArrayList<>(values.length);
        for (boolean v : values) list.add(v);
        return list;
    }

    private static List<Byte> boxed(byte[] values) {
        List<Byte> list = new ArrayList<>(values.length);
        for (byte v : values) list.add(v);
        return list;
    }

    private static List<Character> boxed(char[] values) {
        List<Character> list = new ArrayList<>(values.length);
        for (char v : values) list.add(v);
        return list;
    }

    private static List<Short> boxed(short[] values) {
        List<Short> list = new ArrayList<>(values.length);
        for (short v : values) list.add(v);
        return list;
    }

    private static List<Integer> boxed(int[] values) {
        List<Integer> list = new ArrayList<>(values.length);
        for (int v : values) list.add(v);
        return list;
    }

    private static List<Long> boxed(long[] values) {
        List<Long> list = new ArrayList<>(values.length);
        for (long v : values) list.add(v);
        return list;
    }

    private static List<Float> boxed(float[] values) {
        List<Float> list = new ArrayList<>(values.length);
        for (float v : values) list.add(v);
        return list;
    }

    private static List<Double> boxed(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) list.add(v);
        return list;
    }
}
