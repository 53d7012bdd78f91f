package com.company.silencing.event;

import com.company.silencing.domain.Silence;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;
import java.util.List;

/**
 * Published by the GC worker when active silences will end within the warning window.
 */
@Getter
@AllArgsConstructor
public class SilencesExpiringSoonEvent {
    private final List<Silence> silences;
    private final Duration window;
}
