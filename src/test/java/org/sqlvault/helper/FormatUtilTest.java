package org.sqlvault.helper;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class FormatUtilTest {

    @Test
    public void testFormatSize() {
        assertEquals("0.0B", FormatUtil.formatSize(0));
        assertEquals("512.0B", FormatUtil.formatSize(512));
        assertEquals("1.0KB", FormatUtil.formatSize(1024));
        assertEquals("1.5KB", FormatUtil.formatSize(1536));
        assertEquals("2.0MB", FormatUtil.formatSize(2L * 1024 * 1024));
        assertEquals("3.0GB", FormatUtil.formatSize(3L * 1024 * 1024 * 1024));
    }

}
