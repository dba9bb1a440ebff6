package com.trackflow.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Looks for script and shell markers in the leading bytes of an upload.
 * Audio payloads never legitimately start with any of these.
 */
@Component
@Slf4j
public class ContentScanner {

    private static final List<String> SUSPICIOUS_PATTERNS = List.of(
            "<script",
            "javascript:",
            "<?php",
            "#!/bin/",
            "cmd.exe",
            "powershell");

    /**
     * @return the first suspicious marker found, if any
     */
    public Optional<String> scan(byte[] head) {
        if (head == null || head.length == 0) {
            return Optional.empty();
        }
        // ISO-8859-1 maps every byte to one char, so binary audio frames survive intact
        String text = new String(head, StandardCharsets.ISO_8859_1).toLowerCase(Locale.ROOT);
        return SUSPICIOUS_PATTERNS.stream()
                .filter(text::contains)
                .findFirst();
    }
}
