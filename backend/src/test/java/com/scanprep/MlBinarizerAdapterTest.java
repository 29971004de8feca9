package com.scanprep;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MlBinarizerAdapterTest {

    private final ModelCallExecutor modelCalls = new ModelCallExecutor(Duration.ofSeconds(5));

    @AfterEach
    void tearDown() {
        modelCalls.close();
    }

    @Test
    void forcesTwoLevelOutput() throws Exception {
        int[] samples = {0, 127, 128, 255, 40, 200};
        BufferedImage gray = GrayRasters.fromSamples(samples, 3, 2);
        MlBinarizerAdapter adapter = new MlBinarizerAdapter(GrayRasters::copy, modelCalls);

        BufferedImage out = adapter.binarize(gray);
        assertArrayEquals(new int[]{0, 0, 255, 255, 0, 255}, GrayRasters.samples(out));
    }

    @Test
    void colorModelOutputIsConvertedToGray() throws Exception {
        MlBinarizerAdapter adapter = new MlBinarizerAdapter(
                gray -> TestImages.solidRgb(gray.getWidth(), gray.getHeight(), Color.WHITE), modelCalls);
        BufferedImage out = adapter.binarize(TestImages.solidGray(6, 4, 30));
        assertEquals(BufferedImage.TYPE_BYTE_GRAY, out.getType());
        assertEquals(24, TestImages.countSamples(out, 255));
    }

    @Test
    void modelDoesNotSeeCallerBuffer() throws Exception {
        BufferedImage gray = TestImages.solidGray(4, 4, 255);
        MlBinarizerAdapter adapter = new MlBinarizerAdapter(input -> {
            input.getRaster().setSample(0, 0, 0, 0);
            return input;
        }, modelCalls);
        adapter.binarize(gray);
        assertEquals(255, gray.getRaster().getSample(0, 0, 0));
    }

    @Test
    void dimensionMismatchFails() {
        MlBinarizerAdapter adapter = new MlBinarizerAdapter(gray -> TestImages.solidGray(3, 3, 255), modelCalls);
        assertThrows(BinarizationFailedException.class, () -> adapter.binarize(TestImages.solidGray(4, 4, 255)));
    }

    @Test
    void nullOutputFails() {
        MlBinarizerAdapter adapter = new MlBinarizerAdapter(gray -> null, modelCalls);
        assertThrows(BinarizationFailedException.class, () -> adapter.binarize(TestImages.solidGray(4, 4, 255)));
    }

    @Test
    void modelExceptionIsWrapped() {
        IOException boom = new IOException("model crashed");
        MlBinarizerAdapter adapter = new MlBinarizerAdapter(gray -> {
            throw boom;
        }, modelCalls);
        BinarizationFailedException e = assertThrows(BinarizationFailedException.class,
                () -> adapter.binarize(TestImages.solidGray(4, 4, 255)));
        assertSame(boom, e.getCause());
    }

    @Test
    void timeoutFails() {
        try (ModelCallExecutor shortCalls = new ModelCallExecutor(Duration.ofMillis(100))) {
            MlBinarizerAdapter adapter = new MlBinarizerAdapter(gray -> {
                Thread.sleep(10_000);
                return gray;
            }, shortCalls);
            BinarizationFailedException e = assertThrows(BinarizationFailedException.class,
                    () -> adapter.binarize(TestImages.solidGray(4, 4, 255)));
            assertTrue(e.getMessage().contains("timed out"), e.getMessage());
        }
    }

    @Test
    void unconfiguredModelFails() {
        MlBinarizerAdapter adapter = new MlBinarizerAdapter(BinarizationModel.none(), modelCalls);
        assertThrows(BinarizationFailedException.class, () -> adapter.binarize(TestImages.solidGray(4, 4, 255)));
    }
}
