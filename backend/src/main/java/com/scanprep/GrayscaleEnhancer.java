package com.scanprep;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;

/**
 * Enhancement shared by both binarization branches: grayscale, non-local means
 * denoising and, when enabled, contrast stretching followed by CLAHE.
 * <p>
 * Contrast enhancement is an operator decision rather than something inferred
 * from the image, since it also amplifies isolated speckle.
 */
public class GrayscaleEnhancer {

    private static final Logger log = LoggerFactory.getLogger(GrayscaleEnhancer.class);

    /**
     * Runs the full enhancement chain for one image.
     *
     * @param image color or grayscale input
     * @param config run configuration (denoise, contrast and CLAHE parameters)
     * @return a new single-channel image
     */
    public BufferedImage enhance(BufferedImage image, PreprocessConfig config) {
        BufferedImage gray = toGrayscale(image);

        NonLocalMeansDenoiser denoiser = new NonLocalMeansDenoiser(
                config.getDenoiseStrength(),
                config.getDenoiseTemplateWindow(),
                config.getDenoiseSearchWindow());
        gray = denoiser.denoise(gray);

        if (config.isContrastEnhance()) {
            gray = stretchContrast(gray);
            gray = new Clahe(config.getClaheClipLimit(), config.getClaheTileGrid()).apply(gray);
        }
        return gray;
    }

    /**
     * Converts to 8-bit luma with the BT.601 weights (0.299 R + 0.587 G + 0.114 B)
     * in 14-bit fixed point. {@code TYPE_BYTE_GRAY} input is copied as is.
     */
    public static BufferedImage toGrayscale(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            return GrayRasters.copy(image);
        }

        int[] rgb = image.getRGB(0, 0, w, h, null, 0, w);
        int[] out = new int[w * h];
        for (int i = 0; i < rgb.length; i++) {
            int r = (rgb[i] >> 16) & 0xFF;
            int g = (rgb[i] >> 8) & 0xFF;
            int b = rgb[i] & 0xFF;
            out[i] = (r * 4899 + g * 9617 + b * 1868 + 8192) >> 14;
        }
        return GrayRasters.fromSamples(out, w, h);
    }

    /**
     * Linearly remaps the observed [min, max] range onto [0, 255].
     * An image with a single intensity is returned unchanged.
     */
    public static BufferedImage stretchContrast(BufferedImage gray) {
        int w = gray.getWidth();
        int h = gray.getHeight();
        int[] src = GrayRasters.samples(gray);

        int min = 255;
        int max = 0;
        for (int v : src) {
            if (v < min) min = v;
            if (v > max) max = v;
        }
        if (max == min) {
            log.debug("Zero dynamic range (value {}), skipping contrast stretch", min);
            return GrayRasters.fromSamples(src, w, h);
        }

        double scale = 255.0 / (max - min);
        int[] out = new int[src.length];
        for (int i = 0; i < src.length; i++) {
            out[i] = GrayRasters.clamp((int) Math.round((src[i] - min) * scale), 0, 255);
        }
        return GrayRasters.fromSamples(out, w, h);
    }
}
