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

import java.util.function.Supplier;
import java.util.zip.CRC32;

/**
 * An array whose values are only computed when first needed.
 *
 * <p>The shape is fixed at construction; the producer runs at most once, on
 * the first call to {@link #materialize()} or any operation that needs the
 * values. The result is cached for the lifetime of this object and the
 * producer reference is released. A lazy array that is never read never
 * runs its producer.</p>
 *
 * <p>The shape is not checked against what the producer returns. A mismatch
 * only shows up when a later operation (a reshape, a broadcast) fails.</p>
 *
 * <p>Not thread-safe: two threads reading an unmaterialized instance at the
 * same time may both run the producer. Materialize before sharing.</p>
 */
public final class LazyArray {
    private final int[] shape;
    private Supplier<NdArray> producer;
    private NdArray array;

    public LazyArray(int[] shape, Supplier<NdArray> producer) {
        if (producer == null) throw new IllegalArgumentException("producer must not be null");
        this.shape = shape.clone();
        this.producer = producer;
    }

    /** An already materialized lazy array wrapping {@code array}. */
    public static LazyArray of(NdArray array) {
        LazyArray lazy = new LazyArray(array.shape(), () -> array);
        lazy.materialize();
        return lazy;
    }

    /** Declared shape. Never triggers computation. */
    public int[] shape() {
        return shape.clone();
    }

    public int ndim() {
        return shape.length;
    }

    public boolean isMaterialized() {
        return array != null;
    }

    /**
     * Compute (first call only) and return the real array. Later calls return
     * the same instance.
     */
    public NdArray materialize() {
        if (array == null) {
            NdArray result = producer.get();
            if (result == null) {
                throw new IllegalStateException("lazy array producer returned null");
            }
            array = result;
            producer = null;
        }
        return array;
    }

    /** The real array reshaped. See {@link NdArray#reshape}. */
    public NdArray reshape(int... newShape) {
        return materialize().reshape(newShape);
    }

    /** The real array as-is. */
    public NdArray view() {
        return materialize();
    }

    /** The real array converted to another precision. See {@link NdArray#astype}. */
    public NdArray astype(NumericType type) {
        return materialize().astype(type);
    }

    /**
     * Stable text identity for structural comparison and serialization:
     * declared shape plus a CRC-32 of the row-major bytes.
     */
    public String descriptor() {
        CRC32 crc = new CRC32();
        crc.update(materialize().toByteArray());
        return "LazyArray(shape=" + NdArray.formatShape(shape) + ", checksum=" + crc.getValue() + ")";
    }

    @Override
    public String toString() {
        return "<LazyArray(shape=" + NdArray.formatShape(shape) + ")>";
    }
}
