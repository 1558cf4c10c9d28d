package com.companyintel.profiles.pipeline.model;

public record PostalAddress(
    String full,
    String city,
    String country
) {
    public static final PostalAddress EMPTY = new PostalAddress(null, null, null);
}
