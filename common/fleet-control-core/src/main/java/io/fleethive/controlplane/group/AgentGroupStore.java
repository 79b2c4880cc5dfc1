package io.fleethive.controlplane.group;

import io.fleethive.fleet.model.AgentGroup;
import io.fleethive.fleet.model.ListOptions;
import io.fleethive.fleet.model.ListResponse;
import java.util.List;

/**
 * Keyed store of agent groups with soft deletion.
 * <p>
 * A deleted group stays addressable by name and keeps its name reserved.
 */
public interface AgentGroupStore {

    /**
     * @throws io.fleethive.fleet.error.ValidationException for an invalid name
     * @throws io.fleethive.fleet.error.AlreadyExistsException if the name is taken, even by a deleted group
     */
    AgentGroup.Active create(String name, AgentGroupSpec spec, String actor);

    /**
     * Replaces the mutable part of an active group and records an {@code Updated} condition.
     *
     * @throws io.fleethive.fleet.error.NotFoundException for an unknown name
     * @throws io.fleethive.fleet.error.ValidationException if the group was deleted
     */
    AgentGroup.Active update(String name, AgentGroupSpec spec, String actor);

    /**
     * Tombstones the group. Deleting an already deleted group returns the existing tombstone.
     *
     * @throws io.fleethive.fleet.error.NotFoundException for an unknown name
     */
    AgentGroup.Deleted delete(String name, String actor);

    /**
     * @throws io.fleethive.fleet.error.NotFoundException for an unknown name
     */
    AgentGroup get(String name);

    /**
     * Groups ordered by name. Tombstones are only included when asked for.
     */
    ListResponse<AgentGroup> list(ListOptions options, boolean includeDeleted);

    /**
     * Point-in-time copy of the active groups, for selector resolution.
     */
    List<AgentGroup.Active> activeSnapshot();
}
