package com.flowmable.enhancer;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Container decode/encode at the edge of the pipeline, via ImageIO.
 * Output is always lossless PNG.
 */
public final class ImageFiles {

    private ImageFiles() {}

    public static final Set<String> SUPPORTED_EXTENSIONS =
            Set.of(".jpg", ".jpeg", ".png", ".bmp", ".tiff", ".webp");

    public static boolean isSupported(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && SUPPORTED_EXTENSIONS.contains(name.substring(dot));
    }

    /**
     * Decode an image file into an RGB or RGBA raster.
     *
     * @throws IOException if the file cannot be read or no ImageIO reader handles it
     */
    public static RasterImage read(Path file) throws IOException {
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("Failed to decode image: " + file);
        }
        return RasterImage.fromBufferedImage(image);
    }

    public static void writePng(RasterImage raster, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!ImageIO.write(raster.toBufferedImage(), "png", file.toFile())) {
            throw new IOException("No PNG writer available for " + file);
        }
    }

    /** {@code photo.jpg} becomes {@code photo_enhanced.png}. */
    public static String enhancedName(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return stem + "_enhanced.png";
    }
}
