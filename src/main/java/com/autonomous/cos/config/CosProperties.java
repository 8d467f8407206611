package com.autonomous.cos.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Component
@ConfigurationProperties(prefix = "cos")
public class CosProperties {

    private String dataPath = "data/cos";
    private String userTasksFile = "TASKS.md";
    private String systemTasksFile = "COS-TASKS.md";
    private String scheduleFile = "task-schedule.json";
    private String learningFile = "learning.json";
    private String configFile = "cos-config.yaml";

    /** Start the evaluator when the application is ready. */
    private boolean autoStart = false;

    /** Managed application ids eligible for app-improvement work. */
    private List<String> apps = new ArrayList<>();

    /** Workspace directory per app; falls back to {@link #defaultWorkspace}. */
    private Map<String, String> appWorkspaces = new LinkedHashMap<>();
    private String defaultWorkspace = ".";

    private Agent agent = new Agent();
    private Slack slack = new Slack();

    /** Provider used when a task names none. */
    private String defaultProvider = "claude";

    /** Agent CLIs by provider id. */
    private Map<String, Provider> providers = new LinkedHashMap<>(Map.of("claude", Provider.claudeCode()));

    @Data
    public static class Agent {
        private int maxOutputLines = 500;
        private long killGraceMs = 5000;
        private int resumeOutputLines = 50;
    }

    /**
     * How to invoke one agent CLI and which models it offers. Tier models fall back to
     * {@code defaultModel}; a task may also name any of {@code models} or an alias key.
     */
    @Data
    public static class Provider {
        private String command;
        private List<String> args = new ArrayList<>();
        private String modelFlag = "--model";
        /** Write the prompt to stdin instead of passing it as the last argument. */
        private boolean promptViaStdin;
        private String defaultModel;
        private String lightModel;
        private String mediumModel;
        private String heavyModel;
        private List<String> models = new ArrayList<>();
        private Map<String, String> aliases = new LinkedHashMap<>();

        static Provider claudeCode() {
            Provider provider = new Provider();
            provider.setCommand("claude");
            provider.setArgs(new ArrayList<>(List.of("--print")));
            provider.setLightModel("claude-3-haiku-20240307");
            provider.setMediumModel("claude-3-5-sonnet-20241022");
            provider.setHeavyModel("claude-3-opus-20240229");
            provider.setDefaultModel("claude-3-5-sonnet-20241022");
            provider.setAliases(new LinkedHashMap<>(Map.of(
                "haiku", "claude-3-haiku-20240307",
                "sonnet", "claude-3-5-sonnet-20241022",
                "opus", "claude-3-opus-20240229")));
            return provider;
        }
    }

    @Data
    public static class Slack {
        private String alertChannel;
    }
}
