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

import static com.github.tinemuz.hybrid.Coords.bounded;
import static com.github.tinemuz.hybrid.Coords.coord;
import static org.junit.jupiter.api.Assertions.*;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AuxCoordFactoryTest {

    private AuxCoord delta;
    private AuxCoord sigma;
    private AuxCoord orography;
    private HostDims host;
    private HybridHeightFactory factory;

    @BeforeEach
    void setUp() {
        delta = coord("level_height", "m", 10, 20, 30);
        sigma = coord("sigma", "1", 0.9, 0.5, 0.1);
        orography = coord("surface_altitude", "m", new int[] {2, 2}, 100, 200, 300, 400);
        host = new HostDims().with(delta, 2).with(sigma, 2).with(orography, 3, 0);
        factory = new HybridHeightFactory(delta, sigma, orography);
    }

    private static List<String> presentRoles(AuxCoordFactory f) {
        return f.dependencies().entrySet().stream()
                .filter(e -> e.getValue() != null)
                .map(Map.Entry::getKey)
                .sorted()
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Derived dims are the sorted union of the dependency dims")
    void derivedDimensions() {
        assertArrayEquals(new int[] {0, 2, 3}, factory.derivedDimensions(host));
        assertArrayEquals(new int[] {2, 3, 2}, factory.makeCoordinate(host).shape());
    }

    @Test
    @DisplayName("toString lists roles alphabetically")
    void describe() {
        factory.update(sigma);
        assertEquals("<HybridHeightFactory(delta='level_height', orography='surface_altitude', sigma=None)>",
                factory.toString());
    }

    @Test
    @DisplayName("Definition combines fixed and user metadata")
    void definition() {
        factory.setVarName("alt");
        CoordMetadata defn = factory.definition();
        assertEquals("altitude", defn.standardName());
        assertEquals("alt", defn.varName());
        assertEquals(Units.METRE, defn.units());
        assertEquals("up", defn.attributes().get("positive"));
    }

    @Test
    @DisplayName("Only the formulas in this package extend the factory")
    void closedFormulaSet() {
        for (Constructor<?> c : AuxCoordFactory.class.getDeclaredConstructors()) {
            int modifiers = c.getModifiers();
            assertFalse(Modifier.isPublic(modifiers) || Modifier.isProtected(modifiers), c.toString());
        }
        assertTrue(Modifier.isFinal(HybridHeightFactory.class.getModifiers()));
        assertTrue(Modifier.isFinal(HybridPressureFactory.class.getModifiers()));
    }

    @Nested
    @DisplayName("Removing dependencies")
    class RemovalTests {

        @Test
        @DisplayName("Removing sigma leaves delta and orography")
        void removeSigma() {
            factory.update(sigma);

            assertEquals(Arrays.asList("delta", "orography"), presentRoles(factory));
            assertSame(delta, factory.delta());
            assertSame(orography, factory.orography());
            // delta + 0 * orography, broadcast over the orography dims
            NdArray points = factory.makeCoordinate(host).points();
            assertArrayEquals(new int[] {2, 3, 2}, points.shape());
            assertEquals(20.0, points.get(1, 1, 0));
        }

        @Test
        @DisplayName("Removing orography leaves delta and sigma")
        void removeOrography() {
            factory.update(orography, null);

            assertEquals(Arrays.asList("delta", "sigma"), presentRoles(factory));
            assertArrayEquals(new int[] {2}, factory.derivedDimensions(host));
            assertArrayEquals(new double[] {10, 20, 30}, factory.makeCoordinate(host).points().toArray());
        }

        @Test
        @DisplayName("Removing delta switches to orography's units")
        void removeDelta() {
            AuxCoord orogKm = coord("surface_altitude", "km", new int[] {2, 2}, 0.1, 0.2, 0.3, 0.4);
            AuxCoord d = coord("level_height", "km", 1, 2, 3);
            HybridHeightFactory f = new HybridHeightFactory(d, sigma, orogKm);

            f.update(d);
            assertEquals("km", f.units().symbol());
            assertNull(f.delta());
        }

        @Test
        @DisplayName("Removing the last of delta/orography is refused and changes nothing")
        void removeLastRequired() {
            factory.update(orography);
            Map<String, Coordinate> before = factory.dependencies();

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> factory.update(delta));
            assertTrue(e.getMessage().startsWith("Failed to update dependencies. "), e.getMessage());
            assertSame(before, factory.dependencies());
            assertSame(delta, factory.delta());
            assertEquals(Units.METRE, factory.units());
        }

        @Test
        @DisplayName("The same dependency set fails as a fresh construction too")
        void freshConstructionAgrees() {
            assertThrows(IllegalArgumentException.class, () -> new HybridHeightFactory(null, sigma, null));
        }

        @Test
        @DisplayName("Coordinates that are not dependencies are ignored")
        void unrelated() {
            Map<String, Coordinate> before = factory.dependencies();
            factory.update(coord("level_height", "m", 10, 20, 30));
            assertSame(before, factory.dependencies());
        }

        @Test
        @DisplayName("Removing p0 with a dimensionless delta is refused")
        void removeReferencePressure() {
            AuxCoord a = coord("delta", "1", 0.01, 0.05, 0.1);
            AuxCoord ps = coord("surface_air_pressure", "Pa", 100000, 98000);
            AuxCoord p0 = coord("reference_air_pressure", "Pa", 100000);
            HybridPressureFactory pressure = new HybridPressureFactory(a, sigma, ps, p0);

            assertThrows(IllegalArgumentException.class, () -> pressure.update(p0));
            assertSame(p0, pressure.referenceAirPressure());

            pressure.update(sigma);
            assertNull(pressure.sigma());
            assertSame(ps, pressure.surfaceAirPressure());
        }
    }

    @Nested
    @DisplayName("Replacing dependencies")
    class ReplacementTests {

        @Test
        @DisplayName("A valid replacement is rebound")
        void replace() {
            AuxCoord newDelta = coord("level_height", "m", 11, 21, 31);
            host.with(newDelta, 2);
            factory.update(delta, newDelta);

            assertSame(newDelta, factory.delta());
            assertEquals(11 + 0.9 * 100, factory.makeCoordinate(host).points().get(0, 0, 0), 1e-9);
        }

        @Test
        @DisplayName("A replacement with 3 bounds is refused")
        void replaceWithBadBounds() {
            AuxCoord badDelta = bounded("level_height", "m",
                    new double[] {1, 2, 3}, new double[] {0, 1, 2, 3, 4, 5, 6, 7, 8});
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> factory.update(delta, badDelta));
            assertEquals("Failed to update dependencies. Invalid delta coordinate: must have either 0 or 2 bounds.",
                    e.getMessage());
            assertSame(delta, factory.delta());
        }

        @Test
        @DisplayName("A replacement with incompatible units is refused")
        void replaceWithBadUnits() {
            AuxCoord feet = coord("surface_altitude", "ft", new int[] {2, 2}, 1, 2, 3, 4);
            assertThrows(IllegalArgumentException.class, () -> factory.update(orography, feet));
            assertSame(orography, factory.orography());
        }

        @Test
        @DisplayName("Coordinates made before a replacement keep the old values")
        void earlierCoordinatesUnaffected() {
            AuxCoord before = factory.makeCoordinate(host);
            AuxCoord newDelta = coord("level_height", "m", 0, 0, 0);
            host.with(newDelta, 2);
            factory.update(delta, newDelta);

            assertEquals(10 + 0.9 * 100, before.points().get(0, 0, 0), 1e-9);
        }
    }

    @Nested
    @DisplayName("Remapped copies")
    class RemapTests {

        @Test
        @DisplayName("Every present dependency is swapped for its copy")
        void remap() {
            factory.setLongName("height");
            factory.update(sigma);
            AuxCoord deltaCopy = delta.copy();
            AuxCoord orogCopy = orography.copy();
            Map<Coordinate, Coordinate> copies = new IdentityHashMap<>();
            copies.put(delta, deltaCopy);
            copies.put(orography, orogCopy);

            AuxCoordFactory copy = factory.withRemappedDependencies(copies);

            assertTrue(copy instanceof HybridHeightFactory);
            assertNotSame(factory, copy);
            assertSame(deltaCopy, copy.dependencies().get("delta"));
            assertSame(orogCopy, copy.dependencies().get("orography"));
            assertNull(copy.dependencies().get("sigma"));
            assertEquals("height", copy.longName());
            assertSame(delta, factory.delta());
        }

        @Test
        @DisplayName("A missing replacement is an error")
        void missing() {
            Map<Coordinate, Coordinate> copies = new IdentityHashMap<>();
            copies.put(delta, delta.copy());
            assertThrows(IllegalArgumentException.class, () -> factory.withRemappedDependencies(copies));
        }

        @Test
        @DisplayName("Pressure factories copy as pressure factories")
        void pressureCopy() {
            AuxCoord pa = coord("level_pressure", "Pa", 1000, 2000, 3000);
            AuxCoord ps = coord("surface_air_pressure", "Pa", 100000, 98000);
            HybridPressureFactory pressure = new HybridPressureFactory(pa, sigma, ps);
            Map<Coordinate, Coordinate> copies = new IdentityHashMap<>();
            for (Coordinate c : pressure.dependencies().values()) {
                if (c != null) copies.put(c, ((AuxCoord) c).copy());
            }

            AuxCoordFactory copy = pressure.withRemappedDependencies(copies);
            assertTrue(copy instanceof HybridPressureFactory);
            assertEquals(3, copy.dependencies().values().stream().filter(Objects::nonNull).count());
            assertEquals(Units.PASCAL, copy.units());
        }
    }
}
