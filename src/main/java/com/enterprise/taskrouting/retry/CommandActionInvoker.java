package com.enterprise.taskrouting.retry;

import com.enterprise.taskrouting.core.Payload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Delegates an action to an external program. The payload body is written to the
 * program's stdin, structured fields are passed as {@code TASK_<FIELD>} environment
 * variables and the action name as {@code TASK_ACTION}. Exit code 0 is success;
 * otherwise the tail of the program's output becomes the failure detail.
 */
public class CommandActionInvoker implements ActionInvoker {

    private static final Logger logger = LoggerFactory.getLogger(CommandActionInvoker.class);

    private static final int MAX_DETAIL_LENGTH = 500;

    private final List<String> command;
    private final Duration timeout;

    public CommandActionInvoker(List<String> command, Duration timeout) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    /**
     * Splits a command line on whitespace
     */
    public static CommandActionInvoker ofCommandLine(String commandLine, Duration timeout) {
        return new CommandActionInvoker(List.of(commandLine.trim().split("\\s+")), timeout);
    }

    @Override
    public InvocationResponse invoke(String actionName, Payload payload)
            throws IOException, InterruptedException, TimeoutException {
        Path output = Files.createTempFile("task-action-", ".out");
        try {
            ProcessBuilder builder = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(output.toFile());
            Map<String, String> env = builder.environment();
            env.put("TASK_ACTION", actionName);
            payload.getFields().forEach((key, value) ->
                env.put("TASK_" + key.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_"), value));

            logger.debug("Running {} for action {}", command, actionName);
            Process process = builder.start();
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(payload.getBody().getBytes(StandardCharsets.UTF_8));
            }

            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }
            if (!finished) {
                process.destroyForcibly();
                throw new TimeoutException("Action " + actionName + " timed out after " + timeout);
            }

            String detail = tail(output);
            return process.exitValue() == 0
                ? InvocationResponse.success(detail)
                : InvocationResponse.failure("exit " + process.exitValue() + (detail.isEmpty() ? "" : ": " + detail));
        } finally {
            Files.deleteIfExists(output);
        }
    }

    public List<String> getCommand() {
        return command;
    }

    private static String tail(Path output) throws IOException {
        try (InputStream in = Files.newInputStream(output)) {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            return text.length() <= MAX_DETAIL_LENGTH ? text : text.substring(text.length() - MAX_DETAIL_LENGTH);
        }
    }
}
