package com.multifish.action.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ProfilePatch(@JsonProperty("Profile") String profile) {

    public static final List<String> ALLOWED_PROFILES =
            List.of("Performance", "Balanced", "PowerSaver", "Custom");

    @JsonIgnore
    public boolean isKnownProfile() {
        return ALLOWED_PROFILES.contains(profile);
    }
}
