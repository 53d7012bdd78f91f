package com.company.silencing.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SilenceDeletedEvent {
    private final String silenceId;
}
