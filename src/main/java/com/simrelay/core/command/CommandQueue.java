package com.simrelay.core.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.simrelay.core.error.BadRequestException;
import com.simrelay.core.error.ConflictException;
import com.simrelay.core.error.NotFoundException;
import com.simrelay.core.logging.MdcContext;
import com.simrelay.core.metrics.RelayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory priority queue of operator commands.
 * <p>
 * A single lock covers create and trim, claim selection and transition, and result
 * reporting, so a pending command is handed to at most one claimant and sequence
 * numbers are strictly increasing.
 * <p>
 * Claims never expire. Commands claimed longer than
 * {@link CommandProperties#getStaleClaimAfter()} ago are only reported as stale.
 */
@Service
public class CommandQueue {

    private static final Logger log = LoggerFactory.getLogger(CommandQueue.class);

    /** Priority descending, then creation order ascending. */
    static final Comparator<Command> DISPATCH_ORDER =
            Comparator.comparingInt(Command::priority).reversed()
                    .thenComparingLong(Command::sequence);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Command> commands = new HashMap<>();
    private long nextSequence = 1;

    private final CommandProperties properties;
    private final RelayMetrics metrics;
    private final Clock clock;

    @Autowired
    public CommandQueue(CommandProperties properties, RelayMetrics metrics) {
        this(properties, metrics, Clock.systemUTC());
    }

    CommandQueue(CommandProperties properties, RelayMetrics metrics, Clock clock) {
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        metrics.bindQueueGauges(this::size, this::countStaleClaims);
    }

    /**
     * Validates and enqueues a new command, then trims history.
     */
    public Command create(String purpose, List<TaskDraft> tasks, JsonNode metadata,
                          Integer priority, JsonNode guidance) {
        String validPurpose = CommandValidator.purpose(purpose);
        List<Task> validTasks = CommandValidator.tasks(tasks);
        int validPriority = CommandValidator.priority(priority);

        lock.lock();
        try {
            Command command = new Command(UUID.randomUUID().toString(), validPurpose, validTasks, validPriority,
                    metadata, guidance, CommandStatus.PENDING, clock.instant(), null, null, null, nextSequence++);
            commands.put(command.id(), command);
            MdcContext.setCommand(command.id());
            log.info("Queued command '{}' with {} task(s) at priority {}",
                    command.purpose(), command.tasks().size(), command.priority());
            metrics.recordCommandCreated(command.priority());
            trim();
            return command;
        } finally {
            MdcContext.clear();
            lock.unlock();
        }
    }

    /**
     * Claims up to {@code limit} pending commands for {@code claimantId}, highest priority first.
     *
     * @throws BadRequestException if {@code limit} is outside 1..max-claim-batch
     */
    public List<Command> claimNext(int limit, String claimantId) {
        if (limit < 1 || limit > properties.getMaxClaimBatch()) {
            throw new BadRequestException("limit must be between 1 and " + properties.getMaxClaimBatch());
        }
        lock.lock();
        try {
            MdcContext.setClient(claimantId);
            Instant now = clock.instant();
            List<Command> selected = commands.values().stream()
                    .filter(c -> c.status() == CommandStatus.PENDING)
                    .sorted(DISPATCH_ORDER)
                    .limit(limit)
                    .toList();

            var claimed = new ArrayList<Command>(selected.size());
            for (Command pending : selected) {
                Command inProgress = pending.claim(claimantId, now);
                commands.put(inProgress.id(), inProgress);
                claimed.add(inProgress);
                log.info("Command {} claimed by {}", inProgress.id(), claimantId);
            }
            metrics.recordCommandsClaimed(claimed.size());

            long stale = staleClaims(now);
            if (stale > 0) {
                log.warn("{} command(s) have been in progress longer than {}", stale, properties.getStaleClaimAfter());
            }
            return claimed;
        } finally {
            MdcContext.clear();
            lock.unlock();
        }
    }

    /**
     * Records the terminal outcome of a command.
     *
     * @param status "completed" or "failed"
     * @throws BadRequestException if {@code status} is not a terminal status
     * @throws NotFoundException   if the command is unknown
     * @throws ConflictException   if a result was already recorded
     */
    public Command reportResult(String commandId, String status, String detail, JsonNode outputs) {
        CommandStatus terminal = CommandStatus.fromWire(status)
                .filter(CommandStatus::isTerminal)
                .orElseThrow(() -> new BadRequestException("status must be 'completed' or 'failed'"));

        lock.lock();
        try {
            MdcContext.setCommand(commandId);
            Command current = commands.get(commandId);
            if (current == null) {
                throw new NotFoundException("Command not found: " + commandId);
            }
            if (current.status().isTerminal()) {
                log.warn("Rejected result '{}' for command already {}", terminal.wireName(), current.status().wireName());
                throw new ConflictException("Command already " + current.status().wireName());
            }
            Command resolved = current.resolve(terminal, new CommandResult(detail, outputs, clock.instant()));
            commands.put(commandId, resolved);
            log.info("Command resolved as {}", terminal.wireName());
            metrics.recordCommandResolved(terminal.wireName());
            trim();
            return resolved;
        } finally {
            MdcContext.clear();
            lock.unlock();
        }
    }

    public Command get(String commandId) {
        lock.lock();
        try {
            Command command = commands.get(commandId);
            if (command == null) {
                throw new NotFoundException("Command not found: " + commandId);
            }
            return command;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Retained commands in creation order, optionally restricted to one status.
     */
    public List<Command> list(CommandStatus status) {
        lock.lock();
        try {
            return commands.values().stream()
                    .filter(c -> status == null || c.status() == status)
                    .sorted(Comparator.comparingLong(Command::sequence))
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return commands.size();
        } finally {
            lock.unlock();
        }
    }

    public long countStaleClaims() {
        lock.lock();
        try {
            return staleClaims(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Evicts terminal commands, oldest sequence first, until the store is back at the
     * history limit. Pending and in-progress commands are never evicted. Caller holds the lock.
     */
    private void trim() {
        int limit = properties.getHistoryLimit();
        if (commands.size() <= limit) {
            return;
        }
        List<Command> evictable = commands.values().stream()
                .filter(c -> c.status().isTerminal())
                .sorted(Comparator.comparingLong(Command::sequence))
                .toList();
        int evicted = 0;
        for (Command command : evictable) {
            if (commands.size() <= limit) {
                break;
            }
            commands.remove(command.id());
            evicted++;
        }
        if (evicted > 0) {
            log.info("Trimmed {} terminal command(s); {} retained", evicted, commands.size());
            metrics.recordEvictions(evicted);
        }
        if (commands.size() > limit) {
            log.debug("Command store at {} exceeds history limit {} with no terminal entries left",
                    commands.size(), limit);
        }
    }

    private long staleClaims(Instant now) {
        Instant threshold = now.minus(properties.getStaleClaimAfter());
        return commands.values().stream()
                .filter(c -> c.status() == CommandStatus.IN_PROGRESS)
                .filter(c -> c.claimedAt() != null && c.claimedAt().isBefore(threshold))
                .count();
    }
}
