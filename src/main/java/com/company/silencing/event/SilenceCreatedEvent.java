package com.company.silencing.event;

import com.company.silencing.domain.Silence;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SilenceCreatedEvent {
    private final Silence silence;
}
