package com.autonomous.cos.service;

import com.autonomous.cos.model.ProcessSample;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Pm2ProcessMetricsSourceTest {

    private final Pm2ProcessMetricsSource source = new Pm2ProcessMetricsSource();

    @Test
    void shouldParseJlistOutput() throws IOException {
        String json = "[{\"name\":\"api\",\"pm2_env\":{\"status\":\"online\",\"restart_time\":3},"
            + "\"monit\":{\"memory\":104857600,\"cpu\":12.5}},"
            + "{\"name\":\"worker\",\"pm2_env\":{\"status\":\"errored\"},\"monit\":{}}]";

        List<ProcessSample> samples = source.parse(json);

        assertEquals(2, samples.size());
        ProcessSample api = samples.get(0);
        assertEquals("api", api.getName());
        assertEquals(100, api.getMemoryMb());
        assertEquals(12.5, api.getCpuPercent());
        assertEquals(3, api.getRestarts());
        assertFalse(api.isErrored());
        assertTrue(samples.get(1).isErrored());
        assertEquals(0, samples.get(1).getMemoryMb());
    }

    @Test
    void shouldSkipBannerBeforeJson() throws IOException {
        String output = ">>>> In-memory PM2 is out-of-date, do:\n>>>> $ pm2 update\n[]";

        assertTrue(source.parse(output).isEmpty());
    }

    @Test
    void shouldRejectOutputWithoutProcessList() {
        assertThrows(IOException.class, () -> source.parse("command not found"));
    }
}
