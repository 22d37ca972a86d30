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

/** Small builders for coordinates used across the tests. */
final class Coords {

    private Coords() {}

    static AuxCoord coord(String name, String units, int[] shape, double... values) {
        return new AuxCoord(NdArray.of(shape, values), CoordMetadata.named(name, units));
    }

    static AuxCoord coord(String name, String units, double... values) {
        return coord(name, units, new int[] {values.length}, values);
    }

    static AuxCoord bounded(String name, String units, double[] points, double[] bounds) {
        int n = points.length;
        int nbounds = bounds.length / n;
        return new AuxCoord(
                NdArray.vector(points),
                NdArray.of(new int[] {n, nbounds}, bounds),
                CoordMetadata.named(name, units));
    }

    static AuxCoord float32(String name, String units, int[] shape, double... values) {
        return new AuxCoord(NdArray.of(NumericType.FLOAT32, shape, values), CoordMetadata.named(name, units));
    }
}
