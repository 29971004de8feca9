package com.scanprep;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import com.drew.metadata.MetadataException;
import com.drew.metadata.exif.ExifIFD0Directory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * First stage for every file, including pass-through ones: decode, honor the EXIF
 * orientation, flatten onto an opaque white RGB canvas and optionally cap the longest side.
 */
public class UploadNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UploadNormalizer.class);

    private final int maxDimension;

    /**
     * @param maxDimension longest allowed side in pixels, 0 for no limit
     */
    public UploadNormalizer(int maxDimension) {
        if (maxDimension < 0) {
            throw new ConfigException("Max dimension must not be negative, got " + maxDimension);
        }
        this.maxDimension = maxDimension;
    }

    public BufferedImage normalize(Path file) throws IOException {
        byte[] data = Files.readAllBytes(file);
        return normalize(data, file.getFileName().toString());
    }

    /**
     * Normalizes an encoded image held in memory, e.g. an HTTP upload.
     *
     * @param name used in error messages only
     */
    public BufferedImage normalize(byte[] data, String name) throws IOException {
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(data));
        if (decoded == null) {
            throw new IOException("Unsupported or corrupt image: " + name);
        }
        int orientation = readOrientation(new ByteArrayInputStream(data), name);
        return normalize(decoded, orientation);
    }

    public BufferedImage normalize(BufferedImage decoded, int orientation) {
        BufferedImage upright = orient(decoded, orientation);
        return downscale(upright);
    }

    /**
     * EXIF orientation tag (1..8), or 1 when the image carries none or it cannot be read.
     */
    static int readOrientation(InputStream in, String name) {
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(in);
            ExifIFD0Directory dir = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
            if (dir != null && dir.containsTag(ExifIFD0Directory.TAG_ORIENTATION)) {
                int orientation = dir.getInt(ExifIFD0Directory.TAG_ORIENTATION);
                return orientation >= 1 && orientation <= 8 ? orientation : 1;
            }
        } catch (ImageProcessingException | IOException | MetadataException e) {
            log.debug("No usable EXIF orientation in {}: {}", name, e.getMessage());
        }
        return 1;
    }

    /**
     * Draws the image upright onto a white {@code TYPE_INT_RGB} canvas. Orientations 5 to 8
     * swap width and height.
     */
    static BufferedImage orient(BufferedImage src, int orientation) {
        int w = src.getWidth();
        int h = src.getHeight();
        boolean swaps = orientation >= 5 && orientation <= 8;
        int outW = swaps ? h : w;
        int outH = swaps ? w : h;

        BufferedImage out = new BufferedImage(outW, outH, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, outW, outH);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
            g.drawImage(src, orientationTransform(orientation, w, h), null);
        } finally {
            g.dispose();
        }
        return out;
    }

    // x' = m00 x + m01 y + m02, y' = m10 x + m11 y + m12
    private static AffineTransform orientationTransform(int orientation, int w, int h) {
        switch (orientation) {
            case 2: return new AffineTransform(-1, 0, 0, 1, w, 0);   // mirror horizontal
            case 3: return new AffineTransform(-1, 0, 0, -1, w, h);  // rotate 180
            case 4: return new AffineTransform(1, 0, 0, -1, 0, h);   // mirror vertical
            case 5: return new AffineTransform(0, 1, 1, 0, 0, 0);    // transpose
            case 6: return new AffineTransform(0, 1, -1, 0, h, 0);   // rotate 90 cw
            case 7: return new AffineTransform(0, -1, -1, 0, h, w);  // transverse
            case 8: return new AffineTransform(0, -1, 1, 0, 0, w);   // rotate 90 ccw
            default: return new AffineTransform();
        }
    }

    private BufferedImage downscale(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int longest = Math.max(w, h);
        if (maxDimension == 0 || longest <= maxDimension) {
            return image;
        }
        double scale = (double) maxDimension / longest;
        int targetWidth = Math.max(1, (int) Math.round(w * scale));
        int targetHeight = Math.max(1, (int) Math.round(h * scale));
        log.debug("Downscaling {}x{} to {}x{}", w, h, targetWidth, targetHeight);

        BufferedImage scaled = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = scaled.createGraphics();
        g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
        g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g2d.drawImage(image, 0, 0, targetWidth, targetHeight, null);
        g2d.dispose();
        return scaled;
    }
}
