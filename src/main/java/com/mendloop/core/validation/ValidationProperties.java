package com.mendloop.core.validation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "mendloop.validation")
public class ValidationProperties {

    /**
     * Harness command. Placeholders: {reportPath}, {iteration}.
     */
    private List<String> command = new ArrayList<>(List.of("./validate.sh", "{reportPath}"));

    /** Where the harness writes its JSON report, relative to the working directory. */
    private String reportPath = "validation-report.json";

    /** 0 disables the deadline. */
    private int timeoutSeconds = 3600;

    public List<String> getCommand() { return command; }
    public void setCommand(List<String> command) { this.command = command; }
    public String getReportPath() { return reportPath; }
    public void setReportPath(String reportPath) { this.reportPath = reportPath; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
}
