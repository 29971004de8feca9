package com.scanprep;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * GOOD branch binarizer: delegates to the learned {@link BinarizationModel} and
 * normalizes whatever it returns to a two-level {0, 255} grayscale image of the input size.
 */
public class MlBinarizerAdapter implements Binarizer {

    private static final Logger log = LoggerFactory.getLogger(MlBinarizerAdapter.class);

    static final int LEVEL_THRESHOLD = 128;

    private final BinarizationModel model;
    private final ModelCallExecutor modelCalls;

    public MlBinarizerAdapter(BinarizationModel model, ModelCallExecutor modelCalls) {
        this.model = model;
        this.modelCalls = modelCalls;
    }

    @Override
    public BufferedImage binarize(BufferedImage gray) throws BinarizationFailedException {
        BufferedImage input = GrayRasters.copy(gray);
        BufferedImage result;
        try {
            result = modelCalls.call(() -> model.binarize(input));
        } catch (TimeoutException e) {
            throw new BinarizationFailedException("Binarization model timed out after "
                    + modelCalls.getTimeout().toSeconds() + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BinarizationFailedException) {
                throw (BinarizationFailedException) cause;
            }
            throw new BinarizationFailedException("Binarization model failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BinarizationFailedException("Interrupted while waiting for binarization model", e);
        }

        if (result == null) {
            throw new BinarizationFailedException("Binarization model returned no image");
        }
        if (result.getWidth() != gray.getWidth() || result.getHeight() != gray.getHeight()) {
            throw new BinarizationFailedException(String.format(
                    "Binarization model changed dimensions from %dx%d to %dx%d",
                    gray.getWidth(), gray.getHeight(), result.getWidth(), result.getHeight()));
        }
        return toTwoLevel(GrayscaleEnhancer.toGrayscale(result));
    }

    static BufferedImage toTwoLevel(BufferedImage gray) {
        int[] samples = GrayRasters.samples(gray);
        int changed = 0;
        for (int i = 0; i < samples.length; i++) {
            int v = samples[i] < LEVEL_THRESHOLD ? GrayRasters.FOREGROUND : GrayRasters.BACKGROUND;
            if (v != samples[i]) changed++;
            samples[i] = v;
        }
        if (changed > 0) {
            log.debug("Forced {} intermediate samples to two levels", changed);
        }
        return GrayRasters.fromSamples(samples, gray.getWidth(), gray.getHeight());
    }
}
