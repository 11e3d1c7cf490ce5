package com.simrelay.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.simrelay.core.command.Task;
import com.simrelay.core.command.TaskOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Runs a command's tasks in order against the simulator. A pulse writes its value,
 * holds, then writes the reset value. Execution stops at the first failing task.
 */
public class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    /**
     * @param outputs one entry per attempted task
     * @param failure description of the failing task, {@code null} when all tasks succeeded
     */
    public record Outcome(ArrayNode outputs, String failure) {
        public boolean succeeded() {
            return failure == null;
        }
    }

    private final SimulatorClient simulator;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;

    public TaskExecutor(SimulatorClient simulator, ObjectMapper objectMapper, Sleeper sleeper) {
        this.simulator = simulator;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;
    }

    public Outcome execute(List<Task> tasks) {
        ArrayNode outputs = objectMapper.createArrayNode();
        for (int i = 0; i < tasks.size(); i++) {
            Task task = tasks.get(i);
            ObjectNode entry = outputs.addObject();
            entry.put("index", i);
            entry.put("operation", task.operation().wireName());
            entry.put("variable", task.variable());
            try {
                simulator.setVariable(task.variable(), task.value());
                if (task.operation() == TaskOperation.PULSE) {
                    sleeper.sleep(Duration.ofMillis(Math.round(task.holdSeconds() * 1000)));
                    simulator.setVariable(task.variable(), task.resetValue());
                }
                entry.put("status", "ok");
            } catch (AgentException e) {
                log.warn("Task {} ({} {}) failed: {}", i, task.operation().wireName(), task.variable(), e.getMessage());
                entry.put("status", "error");
                entry.put("error", e.getMessage());
                return new Outcome(outputs, "Task %d (%s %s) failed: %s"
                        .formatted(i, task.operation().wireName(), task.variable(), e.getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                entry.put("status", "interrupted");
                return new Outcome(outputs, "Interrupted while holding pulse on " + task.variable());
            }
        }
        return new Outcome(outputs, null);
    }
}
