package io.fleethive.commander.app;

import io.fleethive.controlplane.agent.AgentInventory;
import io.fleethive.controlplane.group.AgentGroupStore;
import io.fleethive.controlplane.group.SelectorResolver;
import io.fleethive.fleet.error.ValidationException;
import io.fleethive.fleet.model.AgentGroup;
import io.fleethive.fleet.model.ListOptions;
import io.fleethive.fleet.model.ListResponse;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/agentgroups")
public class AgentGroupController {

    private static final Logger log = LoggerFactory.getLogger(AgentGroupController.class);

    private final AgentGroupStore store;
    private final SelectorResolver resolver;
    private final AgentInventory inventory;
    private final AgentViews views;

    public AgentGroupController(AgentGroupStore store,
                                SelectorResolver resolver,
                                AgentInventory inventory,
                                AgentViews views) {
        this.store = Objects.requireNonNull(store, "store");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.inventory = Objects.requireNonNull(inventory, "inventory");
        this.views = Objects.requireNonNull(views, "views");
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public AgentGroupView create(@RequestHeader(value = ActingUser.HEADER, required = false) String user,
                                 @RequestBody AgentGroupRequest request) {
        if (request == null) {
            throw new ValidationException("request body is required");
        }
        String actor = ActingUser.resolve(user);
        log.info("[REST] POST /api/v1/agentgroups name={} by={}", request.name(), actor);
        AgentGroupView created = AgentGroupView.from(store.create(request.name(), request.toSpec(), actor));
        log.info("[REST] POST /api/v1/agentgroups -> status=201 name={}", created.name());
        return created;
    }

    @GetMapping
    public ListResponse<AgentGroupView> list(@RequestParam(defaultValue = "0") int limit,
                                             @RequestParam(name = "continue", required = false) String continueToken,
                                             @RequestParam(defaultValue = "false") boolean includeDeleted) {
        log.info("[REST] GET /api/v1/agentgroups limit={} includeDeleted={}", limit, includeDeleted);
        return store.list(new ListOptions(limit, continueToken), includeDeleted).map(AgentGroupView::from);
    }

    @GetMapping("/{name}")
    public AgentGroupView get(@PathVariable("name") String name) {
        log.info("[REST] GET /api/v1/agentgroups/{}", name);
        return AgentGroupView.from(store.get(name));
    }

    /**
     * Agents whose identifying attributes match the group's selector. A deleted group selects nobody.
     */
    @GetMapping("/{name}/agents")
    public ListResponse<AgentView> agents(@PathVariable("name") String name,
                                          @RequestParam(defaultValue = "0") int limit,
                                          @RequestParam(name = "continue", required = false) String continueToken) {
        log.info("[REST] GET /api/v1/agentgroups/{}/agents limit={}", name, limit);
        AgentGroup group = store.get(name);
        if (group.isDeleted()) {
            return ListResponse.empty();
        }
        return views.page(inventory.listBySelector(group.selector(), new ListOptions(limit, continueToken)));
    }

    @PutMapping("/{name}")
    public AgentGroupView update(@PathVariable("name") String name,
                                 @RequestHeader(value = ActingUser.HEADER, required = false) String user,
                                 @RequestBody AgentGroupRequest request) {
        if (request == null) {
            throw new ValidationException("request body is required");
        }
        if (request.name() != null && !request.name().equals(name)) {
            throw new ValidationException("agent group name cannot be changed");
        }
        String actor = ActingUser.resolve(user);
        log.info("[REST] PUT /api/v1/agentgroups/{} by={}", name, actor);
        return AgentGroupView.from(store.update(name, request.toSpec(), actor));
    }

    @DeleteMapping("/{name}")
    public AgentGroupView delete(@PathVariable("name") String name,
                                 @RequestHeader(value = ActingUser.HEADER, required = false) String user) {
        String actor = ActingUser.resolve(user);
        log.info("[REST] DELETE /api/v1/agentgroups/{} by={}", name, actor);
        return AgentGroupView.from(store.delete(name, actor));
    }

    /**
     * Shows which group would govern an agent with the given identifying attributes.
     */
    @PostMapping("/resolve")
    public ResolveResponse resolve(@RequestBody ResolveRequest request) {
        log.info("[REST] POST /api/v1/agentgroups/resolve attributes={}",
            request == null ? null : request.identifyingAttributes());
        return resolver.resolve(request == null ? null : request.identifyingAttributes(), store.activeSnapshot())
            .map(group -> new ResolveResponse(true, AgentGroupView.from(group)))
            .orElseGet(() -> new ResolveResponse(false, null));
    }
}
