package com.mendloop.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "mendloop.loop")
public class LoopProperties {

    /** Ceiling on work/validate cycles before the run is finalized as DONE_CEILING. */
    private int maxIterations = 5;

    /** Root for plans, checks, guidance, logs, checkpoint and report. */
    private String artifactDir = ".mendloop";

    /** Task manifest loaded once at startup. */
    private String manifest = "manifest.json";

    /** Directory the workers operate on (the repository under repair). */
    private String workingDir = ".";

    public int getMaxIterations() { return maxIterations; }
    public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
    public String getArtifactDir() { return artifactDir; }
    public void setArtifactDir(String artifactDir) { this.artifactDir = artifactDir; }
    public String getManifest() { return manifest; }
    public void setManifest(String manifest) { this.manifest = manifest; }
    public String getWorkingDir() { return workingDir; }
    public void setWorkingDir(String workingDir) { this.workingDir = workingDir; }
}
