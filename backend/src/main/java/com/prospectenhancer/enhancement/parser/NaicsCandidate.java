package com.prospectenhancer.enhancement.parser;

public record NaicsCandidate(String code, String description, double confidence) {
}
