package com.autonomous.cos.service;

import com.autonomous.cos.config.CosProperties;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class ConfiguredAppCatalog implements AppCatalog {

    private final CosProperties properties;

    public ConfiguredAppCatalog(CosProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<String> activeApps() {
        return List.copyOf(properties.getApps());
    }

    @Override
    public Optional<String> workspaceFor(String appId) {
        if (appId == null) {
            return Optional.ofNullable(properties.getDefaultWorkspace());
        }
        return Optional.ofNullable(properties.getAppWorkspaces().get(appId));
    }
}
