package com.leadnurture.model;

import java.util.Locale;

/**
 * Which nurture campaign a lead follows.
 *
 * Classification is priority ordered: the first matching flag (or tag) wins,
 * VETERAN before RECOVERY before REENTRY, falling back to GENERAL.
 */
public enum CampaignType {
    VETERAN,
    RECOVERY,
    REENTRY,
    GENERAL;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CampaignType classify(Lead lead) {
        if (lead.isVeteran() || lead.hasTag(VETERAN.tag())) {
            return VETERAN;
        }
        if (lead.isInRecovery() || lead.hasTag(RECOVERY.tag())) {
            return RECOVERY;
        }
        if (lead.isReentry() || lead.hasTag(REENTRY.tag())) {
            return REENTRY;
        }
        return GENERAL;
    }

    public static CampaignType fromTag(String tag) {
        return CampaignType.valueOf(tag.trim().toUpperCase(Locale.ROOT));
    }
}
