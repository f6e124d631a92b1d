package com.fsnow.filterengine.storage.operand;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;

/**
 * Centered interval tree answering "which intervals contain this point".
 * <p>
 * Intervals may be open or closed at either end, and unbounded. The tree is
 * rebuilt lazily on the first query following a modification, so that bursts
 * of insertions and removals do not pay for rebalancing. A query costs
 * O(log n + k), k being the number of intervals reported.
 *
 * @param <T> Value attached to each interval
 */
public final class IntervalTree<T> {

    private final List<Interval<T>> intervals = new ArrayList<>();
    private Node<T> root;
    private boolean dirty;

    public void add(Interval<T> interval) {
        intervals.add(interval);
        dirty = true;
    }

    /**
     * Removes an interval, compared by identity.
     *
     * @return true if the interval was found
     */
    public boolean remove(Interval<T> interval) {
        for (int i = 0; i < intervals.size(); i++) {
            if (intervals.get(i) == interval) {
                intervals.remove(i);
                dirty = true;
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }

    public int size() {
        return intervals.size();
    }

    /**
     * Calls the consumer with the value of every interval containing the point.
     */
    public void query(double point, Consumer<T> consumer) {
        if (dirty) {
            root = build(new ArrayList<>(intervals));
            dirty = false;
        }

        Node<T> node = root;
        while (node != null) {
            if (point < node.center) {
                for (Interval<T> interval : node.byLow) {
                    if (interval.low > point) {
                        break;
                    }
                    if (interval.contains(point)) {
                        consumer.accept(interval.value);
                    }
                }
                node = node.left;
            } else if (point > node.center) {
                for (Interval<T> interval : node.byHigh) {
                    if (interval.high < point) {
                        break;
                    }
                    if (interval.contains(point)) {
                        consumer.accept(interval.value);
                    }
                }
                node = node.right;
            } else {
                for (Interval<T> interval : node.byLow) {
                    if (interval.contains(point)) {
                        consumer.accept(interval.value);
                    }
                }
                node = null;
            }
        }
    }

    private static <T> Node<T> build(List<Interval<T>> intervals) {
        if (intervals.isEmpty()) {
            return null;
        }

        List<Double> endpoints = new ArrayList<>();
        for (Interval<T> interval : intervals) {
            if (!Double.isInfinite(interval.low)) {
                endpoints.add(interval.low);
            }
            if (!Double.isInfinite(interval.high)) {
                endpoints.add(interval.high);
            }
        }
        Collections.sort(endpoints);
        double center = endpoints.isEmpty() ? 0 : endpoints.get(endpoints.size() / 2);

        List<Interval<T>> left = new ArrayList<>();
        List<Interval<T>> right = new ArrayList<>();
        List<Interval<T>> here = new ArrayList<>();

        for (Interval<T> interval : intervals) {
            if (interval.high < center) {
                left.add(interval);
            } else if (interval.low > center) {
                right.add(interval);
            } else {
                here.add(interval);
            }
        }

        Node<T> node = new Node<>(center);
        node.byLow = new ArrayList<>(here);
        node.byLow.sort(Comparator.comparingDouble(i -> i.low));
        node.byHigh = new ArrayList<>(here);
        node.byHigh.sort(Comparator.comparingDouble((Interval<T> i) -> i.high).reversed());
        node.left = build(left);
        node.right = build(right);
        return node;
    }

    private static final class Node<T> {
        private final double center;
        private List<Interval<T>> byLow;
        private List<Interval<T>> byHigh;
        private Node<T> left;
        private Node<T> right;

        private Node(double center) {
            this.center = center;
        }
    }

    /**
     * An interval of the real line. Unbounded ends use infinite values.
     */
    public static final class Interval<T> {
        private final double low;
        private final boolean lowInclusive;
        private final double high;
        private final boolean highInclusive;
        private final T value;

        public Interval(double low, boolean lowInclusive, double high, boolean highInclusive, T value) {
            this.low = low;
            this.lowInclusive = lowInclusive;
            this.high = high;
            this.highInclusive = highInclusive;
            this.value = value;
        }

        public boolean contains(double point) {
            return (lowInclusive ? point >= low : point > low)
                    && (highInclusive ? point <= high : point < high);
        }

        public double getLow() {
            return low;
        }

        public double getHigh() {
            return high;
        }

        public T getValue() {
            return value;
        }

        @Override
        public String toString() {
            return (lowInclusive ? "[" : "]") + low + ", " + high + (highInclusive ? "]" : "[");
        }
    }
}
