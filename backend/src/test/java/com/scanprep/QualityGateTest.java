package com.scanprep;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QualityGateTest {

    @Test
    void boundaryIsGood() {
        assertEquals(Classification.GOOD, QualityGate.classify(0.335, 0.335));
    }

    @Test
    void belowThresholdIsBad() {
        assertEquals(Classification.BAD, QualityGate.classify(0.3349, 0.335));
        assertEquals(Classification.BAD, QualityGate.classify(-5.0, 0.0));
    }

    @Test
    void aboveThresholdIsGood() {
        assertEquals(Classification.GOOD, QualityGate.classify(0.9, 0.335));
        assertEquals(Classification.GOOD, QualityGate.classify(12.0, 11.5));
    }

    @Test
    void lowerIsBetterInvertsTheGate() {
        assertEquals(Classification.GOOD, QualityGate.classify(20.0, 30.0, true));
        assertEquals(Classification.GOOD, QualityGate.classify(30.0, 30.0, true));
        assertEquals(Classification.BAD, QualityGate.classify(31.0, 30.0, true));
        assertEquals(Classification.BAD, QualityGate.classify(20.0, 30.0, false));
    }
}
