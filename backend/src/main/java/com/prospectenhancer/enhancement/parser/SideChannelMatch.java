package com.prospectenhancer.enhancement.parser;

/**
 * NAICS code found in a prospect's side-channel payload, with the rule that found it.
 */
public record SideChannelMatch(String code, String description, boolean foundInSideChannel, String rule) {

    private static final SideChannelMatch NOT_FOUND = new SideChannelMatch(null, null, false, null);

    public static SideChannelMatch notFound() {
        return NOT_FOUND;
    }

    public static SideChannelMatch found(String code, String description, String rule) {
        return new SideChannelMatch(code, description, true, rule);
    }
}
