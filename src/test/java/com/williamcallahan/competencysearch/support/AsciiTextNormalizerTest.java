package com.williamcallahan.competencysearch.support;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class AsciiTextNormalizerTest {

    @Test
    void foldsFrenchDiacritics() {
        assertEquals("Metier eleve", AsciiTextNormalizer.foldDiacritics("Métier élevé"));
    }

    @Test
    void lowerCasesAsciiOnly() {
        assertEquals("python programming", AsciiTextNormalizer.toLowerAscii("Python PROGRAMMING"));
    }
}
