package com.simrelay.dispatch.api;

import com.simrelay.core.command.Command;
import com.simrelay.core.command.CommandQueue;
import com.simrelay.core.command.CommandStatus;
import com.simrelay.core.error.BadRequestException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command submission, claiming and result reporting.
 * Every route is guarded by {@link com.simrelay.core.security.CommandTokenFilter}.
 */
@RestController
@RequestMapping("/api/commands")
public class CommandController {

    private final CommandQueue commandQueue;

    public CommandController(CommandQueue commandQueue) {
        this.commandQueue = commandQueue;
    }

    /**
     * POST /api/commands: Queue a new command.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestBody CommandRequest request) {
        Command command = commandQueue.create(request.purpose(), request.tasks(), request.metadata(),
                request.priority(), request.guidance());
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "queued");
        response.put("command", CommandView.from(command));
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/commands: Retained commands in creation order.
     */
    @GetMapping
    public ResponseEntity<Map<String, List<CommandView>>> list(@RequestParam(required = false) String status) {
        CommandStatus filter = null;
        if (status != null && !status.isBlank()) {
            filter = CommandStatus.fromWire(status)
                    .orElseThrow(() -> new BadRequestException("Unknown status: " + status));
        }
        return ResponseEntity.ok(Map.of("commands", views(commandQueue.list(filter))));
    }

    /**
     * GET /api/commands/next: Claim up to {@code limit} pending commands.
     */
    @GetMapping("/next")
    public ResponseEntity<Map<String, List<CommandView>>> next(
            @RequestParam(defaultValue = "1") int limit,
            @RequestParam(name = "client_id", required = false) String clientId) {
        return ResponseEntity.ok(Map.of("commands", views(commandQueue.claimNext(limit, clientId))));
    }

    /**
     * GET /api/commands/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<Map<String, CommandView>> get(@PathVariable String id) {
        return ResponseEntity.ok(Map.of("command", CommandView.from(commandQueue.get(id))));
    }

    /**
     * POST /api/commands/{id}/result: Record the terminal outcome.
     */
    @PostMapping("/{id}/result")
    public ResponseEntity<Map<String, CommandView>> result(@PathVariable String id,
                                                          @RequestBody ResultRequest request) {
        Command command = commandQueue.reportResult(id, request.status(), request.detail(), request.outputs());
        return ResponseEntity.ok(Map.of("command", CommandView.from(command)));
    }

    private static List<CommandView> views(List<Command> commands) {
        return commands.stream().map(CommandView::from).toList();
    }
}
