package com.trackflow.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("content scanner")
class ContentScannerTest {

    private final ContentScanner scanner = new ContentScanner();

    @ParameterizedTest
    @ValueSource(strings = {
            "ID3<SCRIPT>alert(1)</script>",
            "javascript:void(0)",
            "<?php system($_GET['c']); ?>",
            "#!/bin/sh\nrm -rf /",
            "C:\\Windows\\System32\\CMD.EXE /c",
            "PowerShell -enc AAAA"
    })
    @DisplayName("script and shell markers are found regardless of case")
    void detectsMarkers(String payload) {
        assertThat(scanner.scan(payload.getBytes(StandardCharsets.UTF_8))).isPresent();
    }

    @Test
    @DisplayName("binary audio frames pass")
    void binaryAudioPasses() {
        byte[] head = new byte[1024];
        head[0] = 'I';
        head[1] = 'D';
        head[2] = '3';
        for (int i = 3; i < head.length; i++) {
            head[i] = (byte) (i * 31);
        }

        assertThat(scanner.scan(head)).isEmpty();
        assertThat(scanner.scan(new byte[0])).isEmpty();
    }
}
