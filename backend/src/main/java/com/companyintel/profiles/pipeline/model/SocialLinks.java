package com.companyintel.profiles.pipeline.model;

public record SocialLinks(
    String linkedin,
    String twitter,
    String github,
    String facebook
) {
    public static final SocialLinks EMPTY = new SocialLinks(null, null, null, null);
}
