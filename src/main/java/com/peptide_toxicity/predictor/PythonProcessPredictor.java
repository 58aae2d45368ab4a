package com.peptide_toxicity.predictor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.peptide_toxicity.config.PredictorProperties;
import com.peptide_toxicity.dto.analysis.ExtractedFeaturesDTO;
import com.peptide_toxicity.dto.prediction.PredictorResult;
import com.peptide_toxicity.enumeration.ToxicityLabelEnum;
import com.peptide_toxicity.exception.PredictorBusyException;
import com.peptide_toxicity.exception.PredictorFailureException;
import com.peptide_toxicity.exception.PredictorOutputParseException;
import com.peptide_toxicity.exception.PredictorTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code predict_api.py} and {@code extract_features.py} as child processes.
 * <p>
 * At most {@code predictor.max-concurrent-processes} children run at once; further callers wait up to
 * {@code predictor.acquire-timeout} for a slot. Each child is killed once {@code predictor.timeout} elapses.
 * stdout and stderr are captured to separate temp files, so a chatty child can never block on a full pipe.
 */
@Slf4j
@Component
public class PythonProcessPredictor implements ToxicityPredictor {

    private static final TypeReference<List<PredictorResult>> RESULT_LIST = new TypeReference<>() {
    };

    private final PredictorProperties properties;
    private final ObjectMapper objectMapper;
    private final Semaphore processSlots;

    public PythonProcessPredictor(PredictorProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.processSlots = new Semaphore(Math.max(1, properties.getMaxConcurrentProcesses()), true);
    }

    @Override
    public List<PredictorResult> predict(List<String> sequences, String modelName) {
        if (sequences.isEmpty()) {
            return List.of();
        }

        String payload;
        try {
            payload = objectMapper.writeValueAsString(sequences);
        } catch (JsonProcessingException e) {
            throw new PredictorFailureException("Could not serialize sequences for the predictor", e);
        }

        log.info("Running predictor [model={}, sequences={}]", modelName, sequences.size());
        ProcessOutput output = run("Python script",
                properties.getPythonExecutable(),
                properties.getPredictScriptPath().toString(),
                "--sequences", payload,
                "--model", modelName);

        List<PredictorResult> results;
        try {
            results = objectMapper.readValue(output.stdout(), RESULT_LIST);
        } catch (JsonProcessingException e) {
            throw new PredictorOutputParseException("Failed to parse Python output", e);
        }

        if (results == null || results.size() != sequences.size()) {
            throw new PredictorOutputParseException("Predictor returned " + (results == null ? 0 : results.size())
                    + " results for " + sequences.size() + " sequences");
        }
        results.forEach(this::checkResult);
        return results;
    }

    private void checkResult(PredictorResult result) {
        if (result == null || result.getProbability() == null) {
            throw new PredictorOutputParseException("Predictor returned an incomplete result: " + result);
        }
        if (!ToxicityLabelEnum.isKnown(result.getPrediction())) {
            throw new PredictorOutputParseException("Predictor returned an unknown label: " + result.getPrediction());
        }
        if (!isUnitInterval(result.getConfidence())
                || !isUnitInterval(result.getProbability().getToxic())
                || !isUnitInterval(result.getProbability().getNonToxic())) {
            throw new PredictorOutputParseException("Predictor returned a score outside [0, 1]: " + result);
        }
    }

    private static boolean isUnitInterval(Double value) {
        return value != null && value >= 0.0 && value <= 1.0;
    }

    @Override
    public ExtractedFeaturesDTO extractFeatures(String sequence) {
        log.info("Running feature extraction [length={}]", sequence.length());
        ProcessOutput output = run("Feature extraction",
                properties.getPythonExecutable(),
                properties.getFeaturesScriptPath().toString(),
                "--sequence", sequence);

        try {
            ExtractedFeaturesDTO features = objectMapper.readValue(output.stdout(), ExtractedFeaturesDTO.class);
            if (features == null) {
                throw new PredictorOutputParseException("Feature extraction produced no output");
            }
            return features;
        } catch (JsonProcessingException e) {
            throw new PredictorOutputParseException("Failed to parse feature output", e);
        }
    }

    private ProcessOutput run(String task, String... command) {
        boolean acquired;
        try {
            acquired = processSlots.tryAcquire(properties.getAcquireTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PredictorFailureException("Interrupted while waiting for a predictor slot", e);
        }
        if (!acquired) {
            throw new PredictorBusyException("All " + properties.getMaxConcurrentProcesses()
                    + " predictor slots are busy, try again later");
        }

        try {
            return execute(task, command);
        } finally {
            processSlots.release();
        }
    }

    private ProcessOutput execute(String task, String... command) {
        Path stdoutFile = null;
        Path stderrFile = null;
        try {
            stdoutFile = Files.createTempFile("predictor-", ".out");
            stderrFile = Files.createTempFile("predictor-", ".err");

            Process process = new ProcessBuilder(command)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile())
                    .start();

            boolean finished;
            try {
                finished = process.waitFor(properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new PredictorFailureException(task + " was interrupted", e);
            }

            if (!finished) {
                process.destroyForcibly();
                log.error("{} exceeded {} and was killed", task, properties.getTimeout());
                throw new PredictorTimeoutException(task + " did not finish within " + properties.getTimeout().toSeconds() + "s");
            }

            String stdout = Files.readString(stdoutFile, StandardCharsets.UTF_8);
            String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8);

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.error("{} exited with code {}: {}", task, exitCode, stderr);
                throw new PredictorFailureException(task + " failed: " + stderr.strip(), stderr);
            }
            if (!stderr.isBlank()) {
                log.debug("{} stderr: {}", task, stderr);
            }
            return new ProcessOutput(stdout, stderr);

        } catch (IOException e) {
            throw new PredictorFailureException("Failed to run " + task + ": " + String.join(" ", command[0], command[1]), e);
        } finally {
            deleteTempFile(stdoutFile);
            deleteTempFile(stderrFile);
        }
    }

    private void deleteTempFile(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }

    private record ProcessOutput(String stdout, String stderr) {
    }
}
