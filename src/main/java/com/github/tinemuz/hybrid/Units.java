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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Physical units of a coordinate.
 *
 * <p>Only what is needed to validate formula inputs is supported: deciding
 * whether a unit is dimensionless, whether two units measure the same
 * quantity, and whether two units are the same. No value conversion is
 * performed.</p>
 *
 * <p>Known units are read from the classpath resource <code>units.txt</code>
 * on first use. A symbol not in that table still parses, but is only
 * convertible to (and equal to) the same symbol.</p>
 */
public final class Units {
    private static final Logger log = LoggerFactory.getLogger(Units.class);
    private static final String RESOURCE = "units.txt";
    private static final String UNKNOWN_DIMENSION = "unknown";

    private static volatile boolean loaded = false;
    private static Map<String, Definition> definitions; // symbol or alias -> definition

    /** Metres. */
    public static final Units METRE = of("m");

    /** Pascals. */
    public static final Units PASCAL = of("Pa");

    /** The dimensionless unit "1". */
    public static final Units DIMENSIONLESS = of("1");

    private final String symbol;
    private final String dimension;
    private final double scale;

    private Units(String symbol, String dimension, double scale) {
        this.symbol = symbol;
        this.dimension = dimension;
        this.scale = scale;
    }

    /**
     * Parse a unit string.
     *
     * @throws IllegalArgumentException if the string is blank
     * @throws IllegalStateException if the unit table cannot be loaded
     */
    public static Units of(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("unit string must not be blank");
        }
        ensureLoaded();
        String key = text.trim();
        Definition def = definitions.get(key);
        if (def == null) {
            return new Units(key, UNKNOWN_DIMENSION, 1.0);
        }
        return new Units(key, def.dimension, def.scale);
    }

    /** The symbol this unit was parsed from. */
    public String symbol() {
        return symbol;
    }

    public boolean isDimensionless() {
        return "dimensionless".equals(dimension);
    }

    /** True if both units measure the same kind of quantity. */
    public boolean isConvertible(Units other) {
        if (UNKNOWN_DIMENSION.equals(dimension) || UNKNOWN_DIMENSION.equals(other.dimension)) {
            return symbol.equals(other.symbol);
        }
        return dimension.equals(other.dimension);
    }

    /** Convenience for {@code isConvertible(Units.of(text))}. */
    public boolean isConvertible(String text) {
        return isConvertible(of(text));
    }

    /**
     * Units are equal when they measure the same quantity on the same scale,
     * so aliases such as {@code m} and {@code metre} are equal.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Units)) return false;
        Units other = (Units) o;
        if (UNKNOWN_DIMENSION.equals(dimension) || UNKNOWN_DIMENSION.equals(other.dimension)) {
            return symbol.equals(other.symbol);
        }
        return dimension.equals(other.dimension) && Double.compare(scale, other.scale) == 0;
    }

    @Override
    public int hashCode() {
        if (UNKNOWN_DIMENSION.equals(dimension)) return symbol.hashCode();
        return Objects.hash(dimension, scale);
    }

    @Override
    public String toString() {
        return symbol;
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        definitions = loadDefinitionsFromResource();
        loaded = true;
    }

    /**
     * Read the unit table. Each non-comment row is
     * {@code symbol dimension scale [alias ...]}.
     */
    private static Map<String, Definition> loadDefinitionsFromResource() {
        InputStream in = Units.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Unit table '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException("Unit table '" + RESOURCE + "' not found on classpath");
        }
        Map<String, Definition> table = new HashMap<>();
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] toks = line.split("\\s+");
                if (toks.length < 3) {
                    throw new IllegalStateException(
                            "Malformed row " + lineNo + " in unit table: '" + line + "'");
                }
                Definition def = new Definition(toks[1], Double.parseDouble(toks[2]));
                for (int i = 0; i < toks.length; i++) {
                    if (i == 1 || i == 2) continue;
                    table.put(toks[i], def);
                }
            }
        } catch (IOException e) {
            log.error("Failed to read unit table", e);
            throw new IllegalStateException("Failed to read unit table", e);
        } catch (RuntimeException e) {
            log.error("Failed to parse unit table", e);
            throw new IllegalStateException("Failed to parse unit table", e);
        }
        log.debug("Loaded {} unit symbols from {}", table.size(), RESOURCE);
        return table;
    }

    private record Definition(String dimension, double scale) {}
}
