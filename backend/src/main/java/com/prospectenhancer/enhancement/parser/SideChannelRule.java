package com.prospectenhancer.enhancement.parser;

import java.util.Map;
import java.util.Optional;

/**
 * One tier of side-channel NAICS extraction. Tiers are consulted in a fixed order; the first hit wins.
 */
public interface SideChannelRule {

    /** Short identifier recorded with the match, e.g. the source key. */
    String name();

    Optional<SideChannelMatch> extract(Map<String, Object> extra);
}
