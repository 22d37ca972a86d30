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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Broadcasting helpers that line up a coordinate's values with the
 * dimensions of the array that owns it.
 *
 * <p>A coordinate spanning host dimensions {@code dims} is first transposed
 * so its axes appear in ascending host-dimension order, then reshaped to
 * rank {@code ndim} with size-1 axes everywhere it is not defined. Bounds get
 * the same treatment plus a trailing bounds axis that never moves.</p>
 *
 * <p>All methods are pure. The {@code lazy...} variants compute only the
 * resulting shape up front and defer the transpose until the values are
 * read.</p>
 */
final class DimensionRemapper {

    private DimensionRemapper() {}

    /**
     * Points lined up with an {@code ndim}-dimensional host.
     *
     * <p>Example: shape {@code (4, 3)}, dims {@code [3, 2]}, ndim 5 gives
     * shape {@code (1, 1, 3, 4, 1)}.</p>
     */
    static NdArray ndPoints(NdArray points, int[] dims, int ndim) {
        int[] coordShape = points.shape();
        NdArray result = points;
        if (dims.length > 0) {
            result = result.transpose(ascendingOrder(dims));
        }
        return result.reshape(ndPointsShape(coordShape, dims, ndim));
    }

    /**
     * Bounds lined up with an {@code ndim}-dimensional host, bounds axis last.
     *
     * <p>Example: points shape {@code (70,)} with 2 bounds, dims {@code [3]},
     * ndim 5 gives shape {@code (1, 1, 1, 70, 1, 2)}.</p>
     */
    static NdArray ndBounds(NdArray bounds, int[] dims, int ndim) {
        int[] boundsShape = bounds.shape();
        int nbounds = boundsShape[boundsShape.length - 1];
        NdArray result = bounds;
        if (dims.length > 0) {
            int[] order = ascendingOrder(dims);
            int[] withBoundsAxis = new int[order.length + 1];
            System.arraycopy(order, 0, withBoundsAxis, 0, order.length);
            withBoundsAxis[order.length] = dims.length;
            result = result.transpose(withBoundsAxis);
        }
        return result.reshape(ndBoundsShape(boundsShape, dims, ndim, nbounds));
    }

    static int[] ndPointsShape(int[] coordShape, int[] dims, int ndim) {
        int[] nd = new int[ndim];
        Arrays.fill(nd, 1);
        for (int i = 0; i < dims.length && i < coordShape.length; i++) {
            nd[dims[i]] = coordShape[i];
        }
        return nd;
    }

    static int[] ndBoundsShape(int[] boundsShape, int[] dims, int ndim, int nbounds) {
        int[] nd = new int[ndim + 1];
        Arrays.fill(nd, 1);
        nd[ndim] = nbounds;
        for (int i = 0; i < dims.length && i < boundsShape.length - 1; i++) {
            nd[dims[i]] = boundsShape[i];
        }
        return nd;
    }

    /**
     * Keep only the axes at {@code derivedDims} (already ascending). With no
     * derived dims the result is {@code [1]} so scalars stay array-shaped.
     * A {@code trailing} size of zero or more is appended as a bounds axis.
     */
    static int[] narrow(int[] ndShape, int[] derivedDims, int trailing) {
        List<Integer> out = new ArrayList<>();
        for (int dim : derivedDims) out.add(ndShape[dim]);
        if (derivedDims.length == 0) out.add(1);
        if (trailing >= 0) out.add(trailing);
        return out.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Combine operand shapes: start from the highest-rank shape, then let
     * any axis of size greater than 1 in another operand override. Conflicts
     * are not reported here; they surface when the values are computed.
     */
    static int[] reconcileShapes(Collection<int[]> shapes) {
        List<int[]> sorted = new ArrayList<>(shapes);
        if (sorted.isEmpty()) {
            throw new IllegalArgumentException("no operand shapes to reconcile");
        }
        sorted.sort(Comparator.comparingInt(s -> s.length));
        int[] result = sorted.remove(sorted.size() - 1).clone();
        for (int[] s : sorted) {
            for (int i = 0; i < s.length && i < result.length; i++) {
                // A mismatch here can only be a differing bounds count
                if (s[i] > 1) result[i] = s[i];
            }
        }
        return result;
    }

    /** Narrowed points, computed on first read. */
    static LazyArray lazyPoints(LazyArray points, int[] dims, int ndim, int[] derivedDims) {
        int[] shape = narrow(ndPointsShape(points.shape(), dims, ndim), derivedDims, -1);
        return new LazyArray(shape, () -> ndPoints(points.materialize(), dims, ndim).reshape(shape));
    }

    /**
     * Narrowed points with a trailing bounds axis of size 1, for combining
     * with bounded operands.
     */
    static LazyArray lazyPointsAsBounds(LazyArray points, int[] dims, int ndim, int[] derivedDims) {
        int[] shape = narrow(ndPointsShape(points.shape(), dims, ndim), derivedDims, 1);
        return new LazyArray(shape, () -> ndPoints(points.materialize(), dims, ndim).reshape(shape));
    }

    /** Narrowed bounds, computed on first read. */
    static LazyArray lazyBounds(LazyArray bounds, int[] dims, int ndim, int[] derivedDims) {
        int[] boundsShape = bounds.shape();
        int nbounds = boundsShape[boundsShape.length - 1];
        int[] nd = ndBoundsShape(boundsShape, dims, ndim, nbounds);
        int[] shape = narrow(nd, derivedDims, nbounds);
        return new LazyArray(shape, () -> ndBounds(bounds.materialize(), dims, ndim).reshape(shape));
    }

    // Permutation that sorts axes by their host dimension
    private static int[] ascendingOrder(int[] dims) {
        Integer[] axes = new Integer[dims.length];
        for (int i = 0; i < dims.length; i++) axes[i] = i;
        Arrays.sort(axes, Comparator.comparingInt(a -> dims[a]));
        int[] order = new int[dims.length];
        for (int i = 0; i < order.length; i++) order[i] = axes[i];
        return order;
    }
}
