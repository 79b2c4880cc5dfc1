package io.fleethive.commander.app;

import io.fleethive.controlplane.connection.ConnectionRegistry;
import io.fleethive.controlplane.connection.ConnectionSnapshot;
import io.fleethive.fleet.error.NotFoundException;
import io.fleethive.fleet.model.ListOptions;
import io.fleethive.fleet.model.ListResponse;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/connections")
public class ConnectionController {

    private static final Logger log = LoggerFactory.getLogger(ConnectionController.class);

    private final ConnectionRegistry registry;
    private final Clock clock;

    public ConnectionController(ConnectionRegistry registry, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @GetMapping
    public ListResponse<ConnectionSnapshot> list(@RequestParam(defaultValue = "0") int limit,
                                                 @RequestParam(name = "continue", required = false) String continueToken) {
        log.info("[REST] GET /api/v1/connections limit={}", limit);
        ListResponse<ConnectionSnapshot> page = registry.list(new ListOptions(limit, continueToken), clock.instant());
        log.info("[REST] GET /api/v1/connections -> {} items remaining={}", page.items().size(), page.remainingItemCount());
        return page;
    }

    @GetMapping("/{id}")
    public ConnectionSnapshot get(@PathVariable("id") String id) {
        log.info("[REST] GET /api/v1/connections/{}", id);
        return registry.find(id, clock.instant())
            .orElseThrow(() -> NotFoundException.of("connection", id));
    }
}
