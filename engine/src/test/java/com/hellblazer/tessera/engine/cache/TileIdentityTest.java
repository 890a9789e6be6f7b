package com.hellblazer.tessera.engine.cache;

import com.hellblazer.tessera.engine.scale.ScaleMath;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class TileIdentityTest {

    private final ScaleMath scaleMath = new ScaleMath();

    @Test
    public void testKeyFormat() {
        var tile = new TileIdentity(3, 4, 5, 32, 256);
        assertEquals("p3-t4x5-s32-ts256", tile.key());
        assertEquals("p3-t4x5-s32-ts256", tile.toString());
        assertEquals("p0-t0x0-s0.25-ts512", new TileIdentity(0, 0, 0, 0.25, 512).key());
    }

    @Test
    public void testRawScaleIsQuantized() {
        var a = TileIdentity.of(3, 4, 5, 31.5, 256, scaleMath);
        var b = TileIdentity.of(3, 4, 5, 32.5, 256, scaleMath);
        assertEquals(32, a.scale());
        assertEquals(a, b);
        assertEquals(a.key(), b.key());
    }

    @Test
    public void testGeometry() {
        var tile = new TileIdentity(0, 3, 2, 8, 256);
        assertEquals(32, tile.pageSpan());
        var other = tile.withScale(16, 128);
        assertEquals(3, other.tileX());
        assertEquals(8, other.pageSpan());
        assertEquals(tile.key(), tile.toRef().tileKey());
    }

    @Test
    public void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new TileIdentity(-1, 0, 0, 1, 256));
        assertThrows(IllegalArgumentException.class, () -> new TileIdentity(0, 0, 0, 0, 256));
        assertThrows(IllegalArgumentException.class, () -> new TileIdentity(0, 0, 0, Double.NaN, 256));
        assertThrows(IllegalArgumentException.class, () -> new TileIdentity(0, 0, 0, 1, 0));
    }
}
