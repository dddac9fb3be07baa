package com.mendloop.worker;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "mendloop.worker")
public class WorkerProperties {

    /**
     * Worker command template. Placeholders: {payloadFile}, {model}, {logPath}, {sharePath}, {label}.
     */
    private List<String> command = new ArrayList<>(List.of(
            "copilot", "--model", "{model}", "--prompt-file", "{payloadFile}", "--share", "{sharePath}"));

    /** Flag emitted before each extra context directory. */
    private String contextFlag = "--add-dir";

    /** Default model/variant selector. */
    private String model = "default";

    /** Per-phase model overrides keyed by phase slug (e.g. "analyze-failures"). */
    private Map<String, String> phaseModels = new HashMap<>();

    /** Extra context directories handed to every worker in addition to the artifact directories. */
    private List<String> extraContext = new ArrayList<>();

    private int maxParallel = 5;

    /** Per-job deadline; 0 disables it. */
    private int timeoutSeconds = 1800;

    private int pollIntervalMs = 500;

    /** Upper bound on output kept in memory per job; the log file keeps everything. */
    private int maxOutputChars = 10_000;

    public String modelFor(String phaseSlug) {
        String override = phaseModels.get(phaseSlug);
        return override != null && !override.isBlank() ? override : model;
    }

    public List<String> getCommand() { return command; }
    public void setCommand(List<String> command) { this.command = command; }
    public String getContextFlag() { return contextFlag; }
    public void setContextFlag(String contextFlag) { this.contextFlag = contextFlag; }
    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public Map<String, String> getPhaseModels() { return phaseModels; }
    public void setPhaseModels(Map<String, String> phaseModels) { this.phaseModels = phaseModels; }
    public List<String> getExtraContext() { return extraContext; }
    public void setExtraContext(List<String> extraContext) { this.extraContext = extraContext; }
    public int getMaxParallel() { return maxParallel; }
    public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public int getPollIntervalMs() { return pollIntervalMs; }
    public void setPollIntervalMs(int pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    public int getMaxOutputChars() { return maxOutputChars; }
    public void setMaxOutputChars(int maxOutputChars) { this.maxOutputChars = maxOutputChars; }
}
