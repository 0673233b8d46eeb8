package com.prospectenhancer.enhancement.job;

public record StopResult(EnhancementRunStatus status, int processed) {
}
