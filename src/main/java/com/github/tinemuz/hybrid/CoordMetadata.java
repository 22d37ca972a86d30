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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descriptive metadata shared by coordinates and the factories that make
 * them. Any name may be null; attributes are never null and are read-only.
 *
 * @param standardName CF standard name
 * @param longName     free-text descriptive name
 * @param varName      CF variable name
 * @param units        physical units
 * @param attributes   extra CF attributes, e.g. {@code positive=up}
 * @param coordSystem  coordinate reference system, or null
 */
public record CoordMetadata(
        String standardName,
        String longName,
        String varName,
        Units units,
        Map<String, String> attributes,
        CoordSystem coordSystem) {

    public CoordMetadata {
        if (units == null) throw new IllegalArgumentException("units must not be null");
        attributes = attributes == null || attributes.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /** Metadata with only a long name and units. */
    public static CoordMetadata named(String longName, String units) {
        return new CoordMetadata(null, longName, null, Units.of(units), null, null);
    }

    /**
     * The most descriptive name available: standard name, else long name,
     * else variable name, else {@code "unknown"}.
     */
    public String name() {
        if (standardName != null) return standardName;
        if (longName != null) return longName;
        if (varName != null) return varName;
        return "unknown";
    }

    public CoordMetadata withUnits(Units newUnits) {
        return new CoordMetadata(standardName, longName, varName, newUnits, attributes, coordSystem);
    }
}
