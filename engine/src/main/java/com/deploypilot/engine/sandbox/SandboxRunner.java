package com.deploypilot.engine.sandbox;

import com.deploypilot.engine.definition.DefinitionParseResult;
import com.deploypilot.engine.definition.PipelineDefinition;
import com.deploypilot.engine.definition.PipelineDefinitionParser;
import com.deploypilot.engine.definition.StepDefinition;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Executes a pipeline definition locally, one fresh sandbox per step.
 *
 * Steps run strictly in declared order and the run stops at the first step
 * that exits non-zero. The working copy and every sandbox are released on
 * all exit paths, including timeouts and unexpected exceptions.
 *
 * Failures are returned as a {@link SandboxRunResult}, never thrown.
 */
@Component
public class SandboxRunner {

    private static final Logger log = LoggerFactory.getLogger(SandboxRunner.class);

    // Scripts live in the working copy so the sandbox sees them under /workspace.
    static final String SCRIPT_DIR = ".deploypilot";

    private final SandboxProvider          provider;
    private final PipelineDefinitionParser parser;
    private final ProcessRunner            processes;
    private final MeterRegistry            meterRegistry;
    private final Clock                    clock;
    private final Duration                 stepTimeout;
    private final Duration                 runTimeout;
    private final Duration                 cloneTimeout;

    @Autowired
    public SandboxRunner(SandboxProvider provider,
                         PipelineDefinitionParser parser,
                         ProcessRunner processes,
                         MeterRegistry meterRegistry,
                         Clock clock,
                         @Value("${deploypilot.sandbox.step-timeout:PT5M}")  Duration stepTimeout,
                         @Value("${deploypilot.sandbox.run-timeout:PT30M}")  Duration runTimeout,
                         @Value("${deploypilot.sandbox.clone-timeout:PT5M}") Duration cloneTimeout) {
        this.provider      = provider;
        this.parser        = parser;
        this.processes     = processes;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.stepTimeout   = stepTimeout;
        this.runTimeout    = runTimeout;
        this.cloneTimeout  = cloneTimeout;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /** Parse {@code yaml} and run it; parse errors come back as CONFIG_INVALID. */
    public SandboxRunResult run(String yaml, String sourceLocation) {
        DefinitionParseResult parsed = parser.parse(yaml);
        if (!parsed.isValid()) {
            return record(SandboxRunResult.failed("", null, SandboxFailure.CONFIG_INVALID,
                    "Invalid pipeline configuration: " + parsed.errorSummary()));
        }
        return run(parsed.definition(), sourceLocation);
    }

    public SandboxRunResult run(PipelineDefinition definition, String sourceLocation) {
        List<String> errors = definition.validate();
        if (!errors.isEmpty()) {
            return record(SandboxRunResult.failed("", null, SandboxFailure.CONFIG_INVALID,
                    "Invalid pipeline configuration: " + String.join("; ", errors)));
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        SandboxRunResult result = execute(definition, sourceLocation);
        sample.stop(meterRegistry.timer("deploypilot.sandbox.runs", "outcome", outcomeTag(result)));
        return result;
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    private SandboxRunResult execute(PipelineDefinition definition, String sourceLocation) {
        Instant deadline = clock.instant().plus(runTimeout);
        StringBuilder transcript = new StringBuilder();
        String currentStep = null;

        try (WorkingCopy workingCopy = WorkingCopy.prepare(sourceLocation, processes, cloneTimeout)) {
            List<StepDefinition> steps = definition.steps();
            for (int i = 0; i < steps.size(); i++) {
                StepDefinition step = steps.get(i);
                currentStep = step.name();

                Duration remaining = Duration.between(clock.instant(), deadline);
                if (!isPositive(remaining)) {
                    return runTimedOut(transcript, step, "before");
                }

                transcript.append("=== ").append(step.name()).append(" ===\n");
                String script = writeScript(workingCopy.root(), i, step);
                log.info("Running step {}/{} '{}' in {}", i + 1, steps.size(), step.name(), step.image());

                CommandResult outcome;
                Duration budget;
                try (Sandbox sandbox = provider.provision(step.image(), workingCopy.root(), remaining)) {
                    // Provisioning counts against the run deadline.
                    remaining = Duration.between(clock.instant(), deadline);
                    if (!isPositive(remaining)) {
                        return runTimedOut(transcript, step, "while provisioning");
                    }
                    budget = remaining.compareTo(stepTimeout) < 0 ? remaining : stepTimeout;
                    outcome = sandbox.execute(script, budget);
                }
                appendOutput(transcript, outcome.output());

                if (outcome.timedOut()) {
                    return SandboxRunResult.failed(transcript.toString(), step.name(), SandboxFailure.TIMEOUT,
                            "Step \"%s\" timed out after %ds".formatted(step.name(), budget.toSeconds()));
                }
                if (outcome.exitCode() != 0) {
                    log.info("Step '{}' failed with exit code {}", step.name(), outcome.exitCode());
                    return SandboxRunResult.stepFailed(transcript.toString(), step.name(), outcome.exitCode());
                }
            }
            return SandboxRunResult.passed(transcript.toString());

        } catch (SandboxException e) {
            log.warn("Sandbox run failed ({}) at step '{}': {}", e.getKind(), currentStep, e.getMessage());
            return SandboxRunResult.failed(transcript.toString(), currentStep, e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error in sandbox run at step '{}'", currentStep, e);
            return SandboxRunResult.failed(transcript.toString(), currentStep, SandboxFailure.ENVIRONMENT_UNAVAILABLE,
                    "Error running step \"" + currentStep + "\": " + e.getMessage());
        }
    }

    private SandboxRunResult runTimedOut(StringBuilder transcript, StepDefinition step, String when) {
        return SandboxRunResult.failed(transcript.toString(), step.name(), SandboxFailure.TIMEOUT,
                "Pipeline exceeded the run timeout of " + runTimeout.toSeconds() + "s " + when + " step \""
                + step.name() + "\"");
    }

    private static boolean isPositive(Duration d) {
        return !d.isNegative() && !d.isZero();
    }

    private static String writeScript(Path root, int index, StepDefinition step) {
        String relative = SCRIPT_DIR + "/step-" + (index + 1) + ".sh";
        StringBuilder body = new StringBuilder("#!/bin/bash\nset -e\n");
        step.commands().forEach(command -> body.append(command).append('\n'));
        try {
            Path file = root.resolve(relative);
            Files.createDirectories(file.getParent());
            Files.writeString(file, body.toString(), StandardCharsets.UTF_8);
            file.toFile().setExecutable(true, false);
        } catch (IOException e) {
            throw new SandboxException(SandboxFailure.ENVIRONMENT_UNAVAILABLE,
                    "Could not write script for step \"" + step.name() + "\": " + e.getMessage(), e);
        }
        return relative;
    }

    private static void appendOutput(StringBuilder transcript, String output) {
        if (output == null || output.isEmpty()) return;
        transcript.append(output);
        if (!output.endsWith("\n")) transcript.append('\n');
    }

    private SandboxRunResult record(SandboxRunResult result) {
        meterRegistry.counter("deploypilot.sandbox.rejected", "outcome", outcomeTag(result)).increment();
        return result;
    }

    private static String outcomeTag(SandboxRunResult result) {
        return result.success() ? "success" : result.failure().name().toLowerCase();
    }
}
