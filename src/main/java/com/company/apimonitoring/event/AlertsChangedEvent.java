package com.company.apimonitoring.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class AlertsChangedEvent {
    private final List<String> alertIds;
    private final String reason;
}
