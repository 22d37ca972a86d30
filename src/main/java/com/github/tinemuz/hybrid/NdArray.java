/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.hybrid;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

import ucar.ma2.Array;
import ucar.ma2.Index;
import ucar.ma2.IndexIterator;
import ucar.ma2.MAMath;

/**
 * Immutable N-dimensional array of numbers backed by a netCDF
 * {@link Array}, with a {@link NumericType} precision.
 *
 * <p>Arithmetic follows the usual broadcasting rules: shapes are aligned on
 * their trailing axes and axes of size 1 are stretched.</p>
 */
public final class NdArray {
    private final Array values;
    private final NumericType type;

    private NdArray(Array values, NumericType type) {
        this.values = values;
        this.type = type;
    }

    /**
     * Wrap values (row-major) with the given shape. Values are rounded to the
     * requested precision.
     *
     * @throws IllegalArgumentException if the value count does not match the shape
     */
    public static NdArray of(NumericType type, int[] shape, double... values) {
        int size = sizeOf(shape);
        if (size != values.length) {
            throw new IllegalArgumentException(
                    "cannot create array of shape " + formatShape(shape) + " from "
                            + values.length + " values");
        }
        Array a = Array.factory(type.dataType(), shape.clone());
        IndexIterator it = a.getIndexIterator();
        for (double v : values) it.setDoubleNext(type.round(v));
        return new NdArray(a, type);
    }

    /** Double precision array with the given shape. */
    public static NdArray of(int[] shape, double... values) {
        return of(NumericType.FLOAT64, shape, values);
    }

    /**
     * Copy of a netCDF array, e.g. a variable read from a file. Float data
     * stays single precision; other numeric data becomes double.
     *
     * @throws IllegalArgumentException if the array is not numeric
     */
    public static NdArray of(Array array) {
        NumericType type = NumericType.of(array.getDataType());
        return new NdArray(convert(array, type), type);
    }

    /** One-dimensional double precision array. */
    public static NdArray vector(double... values) {
        return of(NumericType.FLOAT64, new int[] {values.length}, values);
    }

    /** Rank-0 array holding a single value. */
    public static NdArray scalar(NumericType type, double value) {
        return of(type, new int[0], value);
    }

    public int[] shape() {
        return values.getShape().clone();
    }

    public int ndim() {
        return values.getRank();
    }

    public int size() {
        return (int) values.getSize();
    }

    public NumericType type() {
        return type;
    }

    /** Element at the given multi-index. */
    public double get(int... index) {
        int[] shape = values.getShape();
        if (index.length != shape.length) {
            throw new IllegalArgumentException(
                    "expected " + shape.length + " indices, got " + index.length);
        }
        for (int d = 0; d < shape.length; d++) {
            if (index[d] < 0 || index[d] >= shape[d]) {
                throw new IndexOutOfBoundsException(
                        "index " + index[d] + " is out of bounds for axis " + d
                                + " with size " + shape[d]);
            }
        }
        Index ima = values.getIndex();
        if (index.length > 0) ima.set(index);
        return values.getDouble(ima);
    }

    /** Copy of the values in row-major order. */
    public double[] toArray() {
        double[] out = new double[size()];
        IndexIterator it = values.getIndexIterator();
        for (int i = 0; it.hasNext(); i++) out[i] = it.getDoubleNext();
        return out;
    }

    /** Smallest value, ignoring NaN. */
    public double min() {
        return MAMath.getMinimum(values);
    }

    /** Largest value, ignoring NaN. */
    public double max() {
        return MAMath.getMaximum(values);
    }

    /**
     * Same values, new shape. Element count must be unchanged.
     *
     * @throws IllegalArgumentException if the sizes differ
     */
    public NdArray reshape(int... newShape) {
        if (sizeOf(newShape) != size()) {
            throw new IllegalArgumentException(
                    "cannot reshape array of size " + size() + " into shape "
                            + formatShape(newShape));
        }
        return new NdArray(values.reshape(newShape.clone()), type);
    }

    /** Same shape, values converted to another precision. */
    public NdArray astype(NumericType newType) {
        if (newType == type) return this;
        return new NdArray(convert(values, newType), newType);
    }

    /**
     * Permute axes: axis {@code i} of the result is axis {@code order[i]} of
     * this array.
     */
    public NdArray transpose(int... order) {
        int n = ndim();
        boolean[] seen = new boolean[n];
        boolean valid = order.length == n;
        for (int i = 0; valid && i < n; i++) {
            valid = order[i] >= 0 && order[i] < n && !seen[order[i]];
            if (valid) seen[order[i]] = true;
        }
        if (!valid) {
            throw new IllegalArgumentException("invalid axis permutation " + Arrays.toString(order)
                    + " for shape " + formatShape(values.getShape()));
        }
        return new NdArray(values.permute(order.clone()), type);
    }

    public NdArray add(NdArray other) {
        return broadcast(other, false);
    }

    public NdArray multiply(NdArray other) {
        return broadcast(other, true);
    }

    /**
     * Little-endian row-major bytes, each element written at this array's
     * precision.
     */
    public byte[] toByteArray() {
        ByteBuffer buf = ByteBuffer.allocate(size() * type.byteSize()).order(ByteOrder.LITTLE_ENDIAN);
        IndexIterator it = values.getIndexIterator();
        while (it.hasNext()) {
            double v = it.getDoubleNext();
            switch (type) {
                case FLOAT16:
                    buf.putShort(NumericType.floatToHalfBits((float) v));
                    break;
                case FLOAT32:
                    buf.putFloat((float) v);
                    break;
                default:
                    buf.putDouble(v);
            }
        }
        return buf.array();
    }

    /** Shape of the result of broadcasting two shapes together. */
    public static int[] broadcastShape(int[] a, int[] b) {
        int n = Math.max(a.length, b.length);
        int[] out = new int[n];
        for (int i = 0; i < n; i++) {
            int da = i < n - a.length ? 1 : a[i - (n - a.length)];
            int db = i < n - b.length ? 1 : b[i - (n - b.length)];
            if (da != db && da != 1 && db != 1) {
                throw new IllegalArgumentException(
                        "operands could not be broadcast together with shapes "
                                + formatShape(a) + " " + formatShape(b));
            }
            out[i] = da == 1 ? db : da;
        }
        return out;
    }

    private NdArray broadcast(NdArray other, boolean multiply) {
        int[] aShape = values.getShape();
        int[] bShape = other.values.getShape();
        int[] outShape = broadcastShape(aShape, bShape);
        NumericType outType = NumericType.promote(type, other.type);

        Array out = Array.factory(outType.dataType(), outShape);
        Index ia = values.getIndex();
        Index ib = other.values.getIndex();
        int[] counter = new int[outShape.length];
        int[] ca = new int[aShape.length];
        int[] cb = new int[bShape.length];
        IndexIterator it = out.getIndexIterator();
        while (it.hasNext()) {
            double a = values.getDouble(project(counter, aShape, ca, ia));
            double b = other.values.getDouble(project(counter, bShape, cb, ib));
            it.setDoubleNext(outType.round(multiply ? a * b : a + b));
            // Odometer increment over the result index
            for (int d = counter.length - 1; d >= 0; d--) {
                if (++counter[d] < outShape[d]) break;
                counter[d] = 0;
            }
        }
        return new NdArray(out, outType);
    }

    // Operand position for a result position: leading axes dropped, stretched axes pinned to 0
    private static Index project(int[] counter, int[] shape, int[] scratch, Index index) {
        if (shape.length == 0) return index;
        int offset = counter.length - shape.length;
        for (int i = 0; i < shape.length; i++) scratch[i] = shape[i] == 1 ? 0 : counter[offset + i];
        return index.set(scratch);
    }

    private static Array convert(Array source, NumericType type) {
        Array out = Array.factory(type.dataType(), source.getShape());
        IndexIterator from = source.getIndexIterator();
        IndexIterator to = out.getIndexIterator();
        while (from.hasNext()) to.setDoubleNext(type.round(from.getDoubleNext()));
        return out;
    }

    static int sizeOf(int[] s) {
        int size = 1;
        for (int d : s) {
            if (d < 0) throw new IllegalArgumentException("negative dimensions are not allowed");
            size *= d;
        }
        return size;
    }

    /** Tuple-style text for a shape, e.g. {@code (70,)} or {@code (1, 2)}. */
    static String formatShape(int[] s) {
        if (s.length == 1) return "(" + s[0] + ",)";
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < s.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(s[i]);
        }
        return sb.append(')').toString();
    }

    @Override
    public String toString() {
        return "NdArray(shape=" + formatShape(values.getShape()) + ", type=" + type + ")";
    }
}
