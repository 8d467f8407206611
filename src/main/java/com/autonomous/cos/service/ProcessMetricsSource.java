package com.autonomous.cos.service;

import com.autonomous.cos.model.ProcessSample;

import java.io.IOException;
import java.util.List;

public interface ProcessMetricsSource {

    /**
     * @throws IOException if the probe could not be run or its output not read
     */
    List<ProcessSample> sample() throws IOException;
}
