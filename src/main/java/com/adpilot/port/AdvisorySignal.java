package com.adpilot.port;

public record AdvisorySignal(double confidence, String reasoning) {
}
