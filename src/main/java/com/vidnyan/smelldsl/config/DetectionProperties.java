package com.vidnyan.smelldsl.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for a command line detection run.
 * Can be configured via application.properties or command line arguments.
 */
@Data
@Component
@ConfigurationProperties(prefix = "smelldsl.run")
public class DetectionProperties {

    /**
     * Path to the .smelldsl source. The run is skipped when empty.
     */
    private String dslPath = "";

    /**
     * Path to the thresholds JSON document.
     */
    private String thresholdsPath = "thresholds.json";

    /**
     * Path to the measured values JSON document.
     */
    private String measuredPath = "measured.json";

    /**
     * Shut the application down once the run finished.
     */
    private boolean exitAfterRun = true;
}
