package com.example.evcharging.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {
    private String type; // session_started, session_completed
    private String title;
    private String message;
    private String sessionId;
    private Instant timestamp;
    private boolean read;
}
