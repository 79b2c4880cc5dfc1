package io.fleethive.commander.app;

import io.fleethive.controlplane.agent.AgentInventory;
import io.fleethive.fleet.model.ListOptions;
import io.fleethive.fleet.model.ListResponse;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private final AgentInventory inventory;
    private final AgentViews views;

    public AgentController(AgentInventory inventory, AgentViews views) {
        this.inventory = Objects.requireNonNull(inventory, "inventory");
        this.views = Objects.requireNonNull(views, "views");
    }

    @GetMapping
    public ListResponse<AgentView> list(@RequestParam(defaultValue = "0") int limit,
                                        @RequestParam(name = "continue", required = false) String continueToken) {
        log.info("[REST] GET /api/v1/agents limit={}", limit);
        ListResponse<AgentView> page = views.page(inventory.list(new ListOptions(limit, continueToken)));
        log.info("[REST] GET /api/v1/agents -> {} items remaining={}", page.items().size(), page.remainingItemCount());
        return page;
    }

    @GetMapping("/{instanceUid}")
    public AgentView get(@PathVariable("instanceUid") String instanceUid) {
        log.info("[REST] GET /api/v1/agents/{}", instanceUid);
        return views.view(inventory.get(instanceUid));
    }
}
