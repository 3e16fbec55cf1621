package it.unimib.datai.autolayer.cli.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class Config {
    private String currentProfile;
    private Map<String, Profile> profiles = new LinkedHashMap<>();

    public String getCurrentProfile() {
        return currentProfile;
    }

    public void setCurrentProfile(String currentProfile) {
        this.currentProfile = currentProfile;
    }

    public Map<String, Profile> getProfiles() {
        return profiles;
    }

    public void setProfiles(Map<String, Profile> profiles) {
        this.profiles = (profiles == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(profiles);
    }
}
