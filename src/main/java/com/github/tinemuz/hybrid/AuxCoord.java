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
 * Auxiliary coordinate holding its values directly or lazily.
 *
 * <p>Points, bounds and metadata may be replaced after construction.
 * Replacing them does not touch lazy arrays that a factory captured from
 * this coordinate earlier.</p>
 */
public final class AuxCoord implements Coordinate {
    private LazyArray points;
    private LazyArray bounds;
    private CoordMetadata metadata;

    public AuxCoord(LazyArray points, LazyArray bounds, CoordMetadata metadata) {
        if (points == null) throw new IllegalArgumentException("points must not be null");
        if (metadata == null) throw new IllegalArgumentException("metadata must not be null");
        this.points = points;
        this.bounds = bounds;
        this.metadata = metadata;
    }

    public AuxCoord(NdArray points, NdArray bounds, CoordMetadata metadata) {
        this(LazyArray.of(points), bounds == null ? null : LazyArray.of(bounds), metadata);
    }

    public AuxCoord(NdArray points, CoordMetadata metadata) {
        this(points, null, metadata);
    }

    @Override
    public LazyArray lazyPoints() {
        return points;
    }

    @Override
    public LazyArray lazyBounds() {
        return bounds;
    }

    @Override
    public CoordMetadata metadata() {
        return metadata;
    }

    public void setPoints(NdArray newPoints) {
        this.points = LazyArray.of(newPoints);
    }

    /** Replace the bounds; null removes them. */
    public void setBounds(NdArray newBounds) {
        this.bounds = newBounds == null ? null : LazyArray.of(newBounds);
    }

    public void setUnits(String newUnits) {
        this.metadata = metadata.withUnits(Units.of(newUnits));
    }

    public void rename(String longName) {
        this.metadata = new CoordMetadata(
                null, longName, metadata.varName(), metadata.units(),
                metadata.attributes(), metadata.coordSystem());
    }

    /** Copy sharing the (immutable) arrays and metadata. */
    public AuxCoord copy() {
        return new AuxCoord(points, bounds, metadata);
    }

    @Override
    public String toString() {
        return "AuxCoord(" + name() + ", shape=" + NdArray.formatShape(shape())
                + ", units=" + units() + (bounds == null ? "" : ", nbounds=" + nbounds()) + ")";
    }
}
