package com.autonomous.cos.service;

import com.autonomous.cos.model.ProcessSample;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Samples processes managed by pm2 through {@code pm2 jlist}.
 */
@Slf4j
@Service
public class Pm2ProcessMetricsSource implements ProcessMetricsSource {

    private static final long PROBE_TIMEOUT_SECONDS = 30;

    @Value("${cos.pm2.path:pm2}")
    private String pm2Path;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public List<ProcessSample> sample() throws IOException {
        ProcessBuilder pb = new ProcessBuilder(pm2Path, "jlist");
        pb.redirectErrorStream(false);
        Process process = pb.start();

        String output;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            output = reader.lines().collect(Collectors.joining("\n"));
        }

        try {
            if (!process.waitFor(PROBE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IOException("pm2 jlist timed out after " + PROBE_TIMEOUT_SECONDS + "s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted waiting for pm2", e);
        }
        if (process.exitValue() != 0) {
            throw new IOException("pm2 jlist exited with code " + process.exitValue());
        }
        return parse(output);
    }

    /**
     * Parses the JSON array printed by {@code pm2 jlist}. Leading non-JSON noise is skipped.
     */
    List<ProcessSample> parse(String json) throws IOException {
        int start = json.indexOf('[');
        if (start < 0) {
            throw new IOException("pm2 output contained no process list");
        }
        JsonNode root = objectMapper.readTree(json.substring(start));
        List<ProcessSample> samples = new ArrayList<>();
        for (JsonNode node : root) {
            JsonNode env = node.path("pm2_env");
            JsonNode monit = node.path("monit");
            samples.add(ProcessSample.builder()
                .name(node.path("name").asText())
                .status(env.path("status").asText("unknown"))
                .memoryBytes(monit.path("memory").asLong(0))
                .cpuPercent(monit.path("cpu").asDouble(0))
                .restarts(env.path("restart_time").asInt(0))
                .build());
        }
        log.debug("Sampled {} pm2 processes", samples.size());
        return samples;
    }
}
