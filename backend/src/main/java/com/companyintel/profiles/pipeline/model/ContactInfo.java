package com.companyintel.profiles.pipeline.model;

public record ContactInfo(
    String email,
    String phone,
    PostalAddress address,
    SocialLinks socialLinks
) {
    public static final ContactInfo EMPTY = new ContactInfo(null, null, PostalAddress.EMPTY, SocialLinks.EMPTY);
}
