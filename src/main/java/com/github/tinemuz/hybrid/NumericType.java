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

import ucar.ma2.DataType;

/**
 * Element precision of an {@link NdArray}.
 *
 * <p>FLOAT32 and FLOAT64 map onto the netCDF {@link DataType}s of the same
 * width. FLOAT16 has no netCDF counterpart: its values are stored as
 * {@code float} after rounding to half precision, and written as two bytes
 * in checksums. Binary operations produce the wider of their two operand
 * precisions.</p>
 */
public enum NumericType {
    FLOAT16(DataType.FLOAT),
    FLOAT32(DataType.FLOAT),
    FLOAT64(DataType.DOUBLE);

    private final DataType storage;

    NumericType(DataType storage) {
        this.storage = storage;
    }

    /** netCDF type the values are held in. */
    public DataType dataType() {
        return storage;
    }

    /** Bytes used per element in the row-major byte representation. */
    public int byteSize() {
        return this == FLOAT16 ? 2 : storage.getSize();
    }

    /** The wider of two precisions. */
    public static NumericType promote(NumericType a, NumericType b) {
        return a.byteSize() >= b.byteSize() ? a : b;
    }

    /** Precision matching a netCDF type; integral types widen to FLOAT64. */
    public static NumericType of(DataType dataType) {
        if (!dataType.isNumeric()) {
            throw new IllegalArgumentException("not a numeric type: " + dataType);
        }
        return dataType == DataType.FLOAT ? FLOAT32 : FLOAT64;
    }

    /** Round a value to this precision. */
    double round(double value) {
        switch (this) {
            case FLOAT16:
                return halfBitsToFloat(floatToHalfBits((float) value));
            case FLOAT32:
                return (float) value;
            default:
                return value;
        }
    }

    /**
     * IEEE 754 binary16 encoding of a float, round-half-even on the dropped
     * mantissa bits. Overflow maps to infinity.
     */
    static short floatToHalfBits(float value) {
        int bits = Float.floatToRawIntBits(value);
        int sign = (bits >>> 16) & 0x8000;
        int exp = (bits >>> 23) & 0xff;
        int mant = bits & 0x7fffff;
        if (exp == 0xff) {
            // Inf or NaN
            return (short) (sign | 0x7c00 | (mant != 0 ? 0x200 : 0));
        }
        int e = exp - 127 + 15;
        if (e >= 0x1f) return (short) (sign | 0x7c00);
        if (e <= 0) {
            if (e < -10) return (short) sign;
            mant |= 0x800000;
            int shift = 14 - e;
            int half = mant >> shift;
            int rem = mant & ((1 << shift) - 1);
            int mid = 1 << (shift - 1);
            if (rem > mid || (rem == mid && (half & 1) != 0)) half++;
            return (short) (sign | half);
        }
        int half = (e << 10) | (mant >> 13);
        int rem = mant & 0x1fff;
        if (rem > 0x1000 || (rem == 0x1000 && (half & 1) != 0)) half++;
        return (short) (sign | half);
    }

    static float halfBitsToFloat(short halfBits) {
        int h = halfBits & 0xffff;
        int sign = (h & 0x8000) << 16;
        int exp = (h >>> 10) & 0x1f;
        int mant = h & 0x3ff;
        if (exp == 0) {
            if (mant == 0) return Float.intBitsToFloat(sign);
            // subnormal
            float v = mant / 1024.0f * (float) Math.pow(2, -14);
            return sign != 0 ? -v : v;
        }
        if (exp == 0x1f) {
            return Float.intBitsToFloat(sign | 0x7f800000 | (mant << 13));
        }
        return Float.intBitsToFloat(sign | ((exp - 15 + 127) << 23) | (mant << 13));
    }
}
