package com.flowmable.enhancer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Raster construction, AWT conversion and PNG file round trips.
 */
class RasterImageTest {

    @TempDir
    Path tmp;

    @Test
    void constructor_rejectsMismatchedBuffer() {
        assertThrows(IllegalArgumentException.class, () -> new RasterImage(2, 2, 3, new byte[11]));
        assertThrows(IllegalArgumentException.class, () -> new RasterImage(-1, 2, 3, new byte[0]));
    }

    @Test
    void constructor_rejectsOverflowingShape() {
        // 32768 * 32768 * 4 wraps to 0 in int arithmetic
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new RasterImage(32768, 32768, 4, new byte[0]));
        assertTrue(e.getMessage().contains("too large"), e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> RasterImage.create(65536, 65536, 3));
    }

    @Test
    void set_clampsValues() {
        RasterImage img = RasterImage.create(1, 1, RasterImage.RGB);
        img.set(0, 0, 0, 400);
        img.set(0, 0, 1, -3);
        assertEquals(255, img.get(0, 0, 0));
        assertEquals(0, img.get(0, 0, 1));
    }

    @Test
    void fromBufferedImage_opaqueIsRgb() {
        BufferedImage bi = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
        bi.setRGB(2, 1, 0x123456);
        RasterImage img = RasterImage.fromBufferedImage(bi);

        assertEquals(RasterImage.RGB, img.channels());
        assertEquals(0x12, img.get(2, 1, 0));
        assertEquals(0x34, img.get(2, 1, 1));
        assertEquals(0x56, img.get(2, 1, 2));
    }

    @Test
    void fromBufferedImage_translucentIsRgba() {
        BufferedImage bi = new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB);
        bi.setRGB(0, 0, 0x80FF0000);
        RasterImage img = RasterImage.fromBufferedImage(bi);

        assertTrue(img.hasAlpha());
        assertEquals(0x80, img.get(0, 0, 3));
        assertEquals(255, img.get(0, 0, 0));
    }

    @Test
    void toBufferedImage_rejectsGray() {
        assertThrows(UnsupportedFormatException.class, () -> RasterImage.create(2, 2, 1).toBufferedImage());
    }

    @Test
    void pngRoundTrip_isLossless() throws IOException {
        RasterImage img = TestRasters.random(13, 9, RasterImage.RGBA, 21L);
        Path file = tmp.resolve("nested/dir/out.png");
        ImageFiles.writePng(img, file);

        assertTrue(Files.isRegularFile(file), "Parent directories are created");
        assertTrue(ImageFiles.read(file).contentEquals(img));
    }

    @Test
    void read_garbageFails() throws IOException {
        Path bogus = tmp.resolve("broken.png");
        Files.writeString(bogus, "not an image");
        IOException e = assertThrows(IOException.class, () -> ImageFiles.read(bogus));
        assertTrue(e.getMessage().contains("broken.png"), e.getMessage());
    }

    @Test
    void supportedExtensions_caseInsensitive() {
        assertTrue(ImageFiles.isSupported(Path.of("a/B.JPG")));
        assertTrue(ImageFiles.isSupported(Path.of("scan.tiff")));
        assertFalse(ImageFiles.isSupported(Path.of("notes.txt")));
        assertFalse(ImageFiles.isSupported(Path.of("README")));
    }

    @Test
    void enhancedName_replacesExtension() {
        assertEquals("beach_enhanced.png", ImageFiles.enhancedName(Path.of("pics/beach.jpg")));
        assertEquals("raw_enhanced.png", ImageFiles.enhancedName(Path.of("raw")));
    }
}
