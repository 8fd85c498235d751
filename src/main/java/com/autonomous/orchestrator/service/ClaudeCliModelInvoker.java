package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.exception.ProviderException;
import com.autonomous.orchestrator.model.ModelResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs prompts through the Claude CLI in print mode.
 * <p>
 * The CLI reports no usage, so tokens are estimated from text length and priced with
 * {@link ModelPricing}. The CLI has no output cap flag; {@code maxTokens} is not enforced here.
 */
@Slf4j
@Service
public class ClaudeCliModelInvoker implements ModelInvoker {

    private final ModelPricing pricing;
    private String cliPath;

    public ClaudeCliModelInvoker(ModelPricing pricing, OrchestratorProperties properties) {
        this.pricing = pricing;
        this.cliPath = properties.getCliPath();
    }

    public void setCliPath(String cliPath) {
        this.cliPath = cliPath;
    }

    @Override
    public ModelResponse invoke(String prompt, String model, int maxTokens) {
        List<String> command = new ArrayList<>();
        command.add(cliPath);
        command.add("--print");
        command.add("--model");
        command.add(mapModelName(model));

        File input = null;
        File output = null;
        Process process = null;
        try {
            // prompts go through stdin, never argv
            input = File.createTempFile("model-prompt-", ".txt");
            Files.writeString(input.toPath(), prompt, StandardCharsets.UTF_8);
            output = File.createTempFile("model-output-", ".txt");
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectInput(input);
            pb.redirectErrorStream(true);
            pb.redirectOutput(output);

            process = pb.start();
            int exitCode = process.waitFor();
            String text = Files.readString(output.toPath(), StandardCharsets.UTF_8).trim();

            if (exitCode != 0) {
                throw new ProviderException("Claude CLI exited with code " + exitCode + ": " + abbreviate(text));
            }
            if (text.isEmpty()) {
                throw new ProviderException("Claude CLI returned no output");
            }

            long inputTokens = pricing.estimateTokens(prompt);
            long outputTokens = pricing.estimateTokens(text);
            double cost = pricing.calculateCost(model, inputTokens, outputTokens);
            log.debug("Model call finished. model={}, inputTokens={}, outputTokens={}, cost={}",
                model, inputTokens, outputTokens, cost);

            return ModelResponse.builder()
                .text(text)
                .tokensUsed(inputTokens + outputTokens)
                .costUsd(cost)
                .build();
        } catch (IOException e) {
            throw new ProviderException("Failed to run Claude CLI: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Claude CLI call interrupted", e);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            deleteQuietly(input);
            deleteQuietly(output);
        }
    }

    String mapModelName(String shortName) {
        String name = shortName == null ? "" : shortName.toLowerCase(Locale.ROOT);
        if (name.startsWith("claude-")) {
            return name;
        }
        return switch (name) {
            case "opus" -> "claude-3-opus-20240229";
            case "haiku" -> "claude-3-haiku-20240307";
            default -> "claude-3-5-sonnet-20241022";
        };
    }

    private static void deleteQuietly(File file) {
        if (file != null && !file.delete()) {
            file.deleteOnExit();
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 500 ? text : text.substring(0, 500) + "...";
    }
}
