package com.autonomous.cos.service;

import com.autonomous.cos.config.CosProperties;
import com.autonomous.cos.model.TaskPriority;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Runs agents through a configured CLI, Claude Code in print mode by default. The provider
 * picks the command and its models; when a task names no model one is chosen by tier.
 */
@Slf4j
@Service
public class ClaudeProcessLauncher implements ProcessLauncher {

    static final String TIER_LIGHT = "light";
    static final String TIER_MEDIUM = "medium";
    static final String TIER_HEAVY = "heavy";

    private static final int LONG_CONTEXT_CHARS = 500;
    private static final Pattern VISUAL = Pattern.compile("image|screenshot|visual|photo|picture");
    private static final Pattern COMPLEX = Pattern.compile(
        "architect|refactor|design|complex|optimi[sz]e|security|audit|review.*code|performance");
    private static final Pattern CODING = Pattern.compile(
        "\\b(fix|bug|implement|develop|code|refactor|test|feature|function|class|module|api|endpoint|component"
            + "|service|route|schema|migration|script|build|deploy|debug|error|exception|crash|issue|patch)\\b");
    private static final Pattern DOCUMENTATION = Pattern.compile(
        "fix typo|update text|update docs|edit readme|update readme|write docs|documentation|format text");

    /** Model picked for a request, with the tier and the rule that chose it. */
    public record ModelSelection(String model, String tier, String reason) {
    }

    private final CosProperties properties;
    private final ExecutorService executor = Executors.newCachedThreadPool();

    public ClaudeProcessLauncher(CosProperties properties) {
        this.properties = properties;
    }

    @PreDestroy
    public void shutdown() {
        List<Runnable> pending = executor.shutdownNow();
        log.info("Stopped agent output readers ({} pending)", pending.size());
    }

    @Override
    public AgentProcess launch(LaunchRequest request, Consumer<String> outputSink) throws IOException {
        if (executor.isShutdown()) {
            throw new IllegalStateException("Launcher is shut down");
        }
        CosProperties.Provider provider = resolveProvider(request.provider());
        ModelSelection selection = selectModel(request, provider);
        List<String> command = buildCommand(request, provider, selection.model());

        ProcessBuilder pb = new ProcessBuilder(command);
        if (request.workspace() != null) {
            pb.directory(new File(request.workspace()));
        }
        pb.redirectErrorStream(true);

        Process process = pb.start();
        log.info("Started agent {} (pid {}) in {} with {} [{} tier, {}]", request.agentId(), process.pid(),
            request.workspace(), selection.model(), selection.tier(), selection.reason());
        if (provider.isPromptViaStdin()) {
            try {
                writePrompt(process, request.prompt());
            } catch (IOException e) {
                process.destroyForcibly();
                throw e;
            }
        }

        CompletableFuture<Integer> exit = CompletableFuture.supplyAsync(() -> drain(process, outputSink), executor);
        return new LocalAgentProcess(process, exit);
    }

    /**
     * @throws IllegalArgumentException if the provider id is not configured
     */
    CosProperties.Provider resolveProvider(String providerId) {
        String id = providerId == null || providerId.isBlank() ? properties.getDefaultProvider() : providerId;
        CosProperties.Provider provider = properties.getProviders().get(id);
        if (provider == null || provider.getCommand() == null || provider.getCommand().isBlank()) {
            throw new IllegalArgumentException("Unknown provider: " + id
                + " (configured: " + properties.getProviders().keySet() + ")");
        }
        return provider;
    }

    ModelSelection selectModel(LaunchRequest request, CosProperties.Provider provider) {
        if (request.model() != null && !request.model().isBlank()) {
            return new ModelSelection(resolveNamedModel(request.model(), provider), "user-specified", "task-model");
        }
        String desc = request.description() == null ? "" : request.description().toLowerCase(Locale.ROOT);
        if (VISUAL.matcher(desc).find()) {
            return tier(provider, TIER_HEAVY, "visual-analysis");
        }
        if (request.priority() == TaskPriority.CRITICAL) {
            return tier(provider, TIER_HEAVY, "critical-priority");
        }
        if (COMPLEX.matcher(desc).find()) {
            return tier(provider, TIER_HEAVY, "complex-task");
        }
        int contextChars = request.prompt() == null ? 0 : request.prompt().length() - desc.length();
        if (contextChars > LONG_CONTEXT_CHARS) {
            return tier(provider, TIER_HEAVY, "long-context");
        }
        if (!CODING.matcher(desc).find() && DOCUMENTATION.matcher(desc).find()) {
            return tier(provider, TIER_LIGHT, "documentation-task");
        }
        return tier(provider, TIER_MEDIUM, "standard-task");
    }

    List<String> buildCommand(LaunchRequest request, CosProperties.Provider provider, String model) {
        List<String> command = new ArrayList<>();
        command.add(provider.getCommand());
        command.addAll(provider.getArgs());
        if (model != null && provider.getModelFlag() != null) {
            command.add(provider.getModelFlag());
            command.add(model);
        }
        if (!provider.isPromptViaStdin()) {
            command.add(request.prompt());
        }
        return command;
    }

    private String resolveNamedModel(String name, CosProperties.Provider provider) {
        String key = name.toLowerCase(Locale.ROOT);
        String tierModel = switch (key) {
            case TIER_LIGHT -> provider.getLightModel();
            case TIER_MEDIUM -> provider.getMediumModel();
            case TIER_HEAVY -> provider.getHeavyModel();
            default -> null;
        };
        if (tierModel != null) {
            return tierModel;
        }
        String aliased = provider.getAliases().get(key);
        if (aliased != null) {
            return aliased;
        }
        if (provider.getModels().isEmpty()) {
            return name;
        }
        List<String> offered = new ArrayList<>(provider.getModels());
        Stream.of(provider.getDefaultModel(), provider.getLightModel(), provider.getMediumModel(), provider.getHeavyModel())
            .filter(Objects::nonNull)
            .forEach(offered::add);
        offered.addAll(provider.getAliases().values());
        if (offered.contains(name)) {
            return name;
        }
        throw new IllegalArgumentException("Model " + name + " is not offered by " + provider.getCommand()
            + " (choose from " + offered + ")");
    }

    private static ModelSelection tier(CosProperties.Provider provider, String tier, String reason) {
        String model = switch (tier) {
            case TIER_LIGHT -> provider.getLightModel();
            case TIER_HEAVY -> provider.getHeavyModel();
            default -> provider.getMediumModel();
        };
        return new ModelSelection(model != null ? model : provider.getDefaultModel(), tier, reason);
    }

    private static void writePrompt(Process process, String prompt) throws IOException {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(prompt.getBytes(StandardCharsets.UTF_8));
        }
    }

    private int drain(Process process, Consumer<String> outputSink) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                outputSink.accept(line);
            }
            return process.waitFor();
        } catch (IOException e) {
            throw new UncheckedIOException("Lost output stream of pid " + process.pid(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for pid " + process.pid(), e);
        }
    }

    private static final class LocalAgentProcess implements AgentProcess {
        private final Process process;
        private final CompletableFuture<Integer> exit;

        private LocalAgentProcess(Process process, CompletableFuture<Integer> exit) {
            this.process = process;
            this.exit = exit;
        }

        @Override
        public Long pid() {
            return process.pid();
        }

        @Override
        public CompletableFuture<Integer> onExit() {
            return exit;
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void destroy() {
            process.destroy();
        }

        @Override
        public void destroyForcibly() {
            process.destroyForcibly();
        }
    }
}
