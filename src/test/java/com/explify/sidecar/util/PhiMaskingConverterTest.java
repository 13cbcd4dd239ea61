package com.explify.sidecar.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class PhiMaskingConverterTest {

    @Test
    void redactsCommonIdentifiers() {
        String masked = PhiMaskingConverter.mask(
                "Report for MRN: A1234567, DOB 04/12/1961, SSN 123-45-6789, jane.doe@example.com, (555) 123-4567");

        assertFalse(masked.contains("A1234567"));
        assertFalse(masked.contains("04/12/1961"));
        assertFalse(masked.contains("123-45-6789"));
        assertFalse(masked.contains("jane.doe@example.com"));
        assertFalse(masked.contains("123-4567"));
        assertTrue(masked.contains("MRN [MRN-REDACTED]"));
        assertTrue(masked.contains("DOB [DOB-REDACTED]"));
        assertTrue(masked.contains("[SSN-REDACTED]"));
        assertTrue(masked.contains("[EMAIL-REDACTED]"));
        assertTrue(masked.contains("[PHONE-REDACTED]"));
    }

    @Test
    void leavesOrdinaryMessagesAlone() {
        String message = "Audit writer dropped 3 entries; queue capacity 1000";

        assertEquals(message, PhiMaskingConverter.mask(message));
        assertEquals("", PhiMaskingConverter.mask(null));
    }
}
