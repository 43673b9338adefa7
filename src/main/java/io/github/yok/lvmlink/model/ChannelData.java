package io.github.yok.lvmlink.model;

import java.util.Arrays;
import lombok.EqualsAndHashCode;

/**
 * X and Y samples of one channel in one segment. Both arrays always have the same length.
 *
 * @author Yasuharu.Okawauchi
 */
@EqualsAndHashCode
public final class ChannelData {

    private final double[] x;
    private final double[] y;

    /**
     * Creates channel data.
     *
     * @param x X values (copied)
     * @param y Y values (copied)
     * @throws IllegalArgumentException if the lengths differ
     */
    public ChannelData(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException(
                    "X and Y lengths differ: " + x.length + " != " + y.length);
        }
        this.x = x.clone();
        this.y = y.clone();
    }

    public double[] getX() {
        return x.clone();
    }

    public double[] getY() {
        return y.clone();
    }

    public int size() {
        return x.length;
    }

    public boolean isEmpty() {
        return x.length == 0;
    }

    public double getX(int index) {
        return x[index];
    }

    public double getY(int index) {
        return y[index];
    }

    @Override
    public String toString() {
        return "ChannelData(size=" + x.length + ", x=" + Arrays.toString(x) + ", y="
                + Arrays.toString(y) + ")";
    }
}
