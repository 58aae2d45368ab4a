package com.peptide_toxicity.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Settings of the out-of-process predictor, bound from the {@code predictor.*} keys.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "predictor")
public class PredictorProperties {

    /**
     * Interpreter used to launch the scripts, e.g. {@code python3}.
     */
    private String pythonExecutable = "python3";

    /**
     * Directory holding the predictor scripts. Relative paths resolve against the working directory.
     */
    private String scriptsDir = "scripts";

    private String predictScript = "predict_api.py";

    private String featuresScript = "extract_features.py";

    /**
     * Upper bound on the wall-clock time of one predictor process.
     */
    private Duration timeout = Duration.ofSeconds(120);

    /**
     * Maximum number of predictor processes alive at the same time.
     */
    private int maxConcurrentProcesses = 4;

    /**
     * How long a request waits for a free process slot before it is rejected.
     */
    private Duration acquireTimeout = Duration.ofSeconds(10);

    public Path getPredictScriptPath() {
        return resolve(predictScript);
    }

    public Path getFeaturesScriptPath() {
        return resolve(featuresScript);
    }

    private Path resolve(String script) {
        Path configured = Paths.get(scriptsDir);
        Path root = configured.isAbsolute() ? configured : configured.toAbsolutePath();
        return root.resolve(script).normalize();
    }
}
