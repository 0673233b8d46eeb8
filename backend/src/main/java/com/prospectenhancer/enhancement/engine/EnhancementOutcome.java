package com.prospectenhancer.enhancement.engine;

/**
 * Which sub-enhancements changed the prospect in one engine call.
 */
public record EnhancementOutcome(boolean values, boolean naics, boolean titles, boolean setAsides) {

    public boolean anySucceeded() {
        return values || naics || titles || setAsides;
    }
}
