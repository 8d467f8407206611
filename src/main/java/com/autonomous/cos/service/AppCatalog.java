package com.autonomous.cos.service;

import java.util.List;
import java.util.Optional;

/**
 * Source of the managed applications that app-improvement work rotates through.
 */
public interface AppCatalog {

    List<String> activeApps();

    /** Directory agents work in for the app, if one is configured. */
    Optional<String> workspaceFor(String appId);

    default boolean contains(String appId) {
        return activeApps().contains(appId);
    }
}
