package io.fleethive.commander.app;

import io.fleethive.controlplane.command.CommandAuditLog;
import io.fleethive.fleet.error.ValidationException;
import io.fleethive.fleet.model.Command;
import io.fleethive.fleet.model.ListOptions;
import io.fleethive.fleet.model.ListResponse;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class CommandController {

    private static final Logger log = LoggerFactory.getLogger(CommandController.class);

    private final CommandAuditLog commandLog;

    public CommandController(CommandAuditLog commandLog) {
        this.commandLog = Objects.requireNonNull(commandLog, "commandLog");
    }

    @GetMapping("/commands")
    public ListResponse<Command> list(@RequestParam(defaultValue = "0") int limit,
                                      @RequestParam(name = "continue", required = false) String continueToken) {
        log.info("[REST] GET /api/v1/commands limit={}", limit);
        ListResponse<Command> page = commandLog.listCommands(new ListOptions(limit, continueToken));
        log.info("[REST] GET /api/v1/commands -> {} items remaining={}", page.items().size(), page.remainingItemCount());
        return page;
    }

    @GetMapping("/commands/{id}")
    public Command get(@PathVariable("id") UUID id) {
        log.info("[REST] GET /api/v1/commands/{}", id);
        return commandLog.getCommand(id);
    }

    @GetMapping("/agents/{instanceUid}/commands")
    public List<Command> byInstance(@PathVariable("instanceUid") String instanceUid) {
        log.info("[REST] GET /api/v1/agents/{}/commands", instanceUid);
        return commandLog.getCommandsByInstanceUid(instanceUid);
    }

    @PostMapping("/agents/{instanceUid}/commands")
    @ResponseStatus(HttpStatus.CREATED)
    public Command issue(@PathVariable("instanceUid") String instanceUid,
                         @RequestHeader(value = ActingUser.HEADER, required = false) String user,
                         @RequestBody CommandRequest request) {
        if (request == null || request.kind() == null) {
            throw new ValidationException("command kind is required");
        }
        log.info("[REST] POST /api/v1/agents/{}/commands kind={} by={}",
            instanceUid, request.kind().wireName(), ActingUser.resolve(user));
        Command command = commandLog.saveCommand(request.kind(), instanceUid, request.data());
        log.info("[REST] POST /api/v1/agents/{}/commands -> status=201 id={}", instanceUid, command.id());
        return command;
    }
}
