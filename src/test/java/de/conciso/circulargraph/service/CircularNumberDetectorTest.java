package de.conciso.circulargraph.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CircularNumberDetectorTest {

    private final CircularNumberDetector detector = new CircularNumberDetector();

    @Test
    void findsNumberBelowCircularHeading() {
        String text = "CIRCULAR\nSEBI/HO/MRD/MRD-PoD-3/P/CIR/2021/672\n\nDecember 07, 2021\n";

        assertThat(detector.detect(text)).contains("SEBI/HO/MRD/MRD-PoD-3/P/CIR/2021/672");
    }

    @Test
    void findsNumberAfterCircularNoLabel() {
        String text = "Securities and Exchange Board of India\nCircular No.: CIR/MRD/DP/13/2015\nDate: June 12, 2015";

        assertThat(detector.detect(text)).contains("CIR/MRD/DP/13/2015");
    }

    @Test
    void fallsBackToAnySebiNumberInHeader() {
        String text = "To all stock exchanges. Ref: SEBI/HO/CFD/PoD-2/P/CIR/2023/120 of this date.";

        assertThat(detector.detect(text)).contains("SEBI/HO/CFD/PoD-2/P/CIR/2023/120");
    }

    @Test
    void collapsesLineBreaksInsideNumber() {
        String text = "CIRCULAR\nSEBI/HO/MRD/MRD-PoD-3/\nP/CIR/2021/672\n";

        assertThat(detector.detect(text)).contains("SEBI/HO/MRD/MRD-PoD-3/ P/CIR/2021/672");
    }

    @Test
    void onlyLooksAtTheHeader() {
        String text = "Press Release\n" + "x".repeat(CircularNumberDetector.HEADER_LENGTH)
                + "\nSEBI/HO/CFD/PoD-2/P/CIR/2023/120";

        assertThat(detector.detect(text)).isEmpty();
    }

    @Test
    void emptyTextHasNoNumber() {
        assertThat(detector.detect(null)).isEmpty();
        assertThat(detector.detect("  ")).isEmpty();
        assertThat(detector.detect("Press Release\n\nSEBI board meeting")).isEmpty();
    }
}
