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

/**
 * A coordinate as seen by a factory: sample points, optional bounds, units
 * and names. Factories match dependencies by identity, never by value.
 */
public interface Coordinate {

    /** Sample values. Forces computation if they are lazy. */
    default NdArray points() {
        return lazyPoints().materialize();
    }

    /** Bounds with one extra trailing axis, or null if unbounded. */
    default NdArray bounds() {
        LazyArray b = lazyBounds();
        return b == null ? null : b.materialize();
    }

    /** Sample values, possibly not computed yet. */
    LazyArray lazyPoints();

    /** Bounds, possibly not computed yet, or null if unbounded. */
    LazyArray lazyBounds();

    CoordMetadata metadata();

    /** Shape of the points. Never forces computation. */
    default int[] shape() {
        return lazyPoints().shape();
    }

    /** Size of the trailing bounds axis, 0 if unbounded. */
    default int nbounds() {
        LazyArray b = lazyBounds();
        if (b == null) return 0;
        int[] s = b.shape();
        return s.length == 0 ? 0 : s[s.length - 1];
    }

    default Units units() {
        return metadata().units();
    }

    default String name() {
        return metadata().name();
    }
}
