package dk.trustworks.staffing.rollup.services;

import dk.trustworks.staffing.allocation.model.Assignment;
import dk.trustworks.staffing.model.Project;
import dk.trustworks.staffing.model.Resource;
import dk.trustworks.staffing.model.StaffingSnapshot;
import dk.trustworks.staffing.rollup.model.RollupDimension;
import dk.trustworks.staffing.rollup.model.RollupKey;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Optional;

/**
 * Resolves the group an assignment belongs to at one rollup level.
 *
 * <p>A missing reference (no client, no contract, no location) lands in an explicit
 * "unassigned" group. A reference to something that is not in the snapshot, such as a
 * deleted client, resolves to empty and the assignment is left out.
 */
@ApplicationScoped
public class DimensionResolver {

    public static final String NO_CLIENT = "NO_CLIENT";
    public static final String NO_CONTRACT = "NO_CONTRACT";
    public static final String NO_LOCATION = "NO_LOCATION";
    public static final String NO_HORIZONTAL = "NO_HORIZONTAL";

    public Optional<RollupKey> resolve(RollupDimension dimension, Assignment assignment, Resource resource, Project project, StaffingSnapshot snapshot) {
        return switch (dimension) {
            case RESOURCE, NONE -> Optional.of(new RollupKey(resource.getId(), labelOrId(resource.getName(), resource.getId())));
            case PROJECT -> Optional.of(new RollupKey(project.getId(), labelOrId(project.getName(), project.getId())));
            case CLIENT -> resolveClient(project, snapshot);
            case CONTRACT -> resolveContract(project, snapshot);
            case LOCATION -> Optional.of(isBlank(resource.getLocation())
                    ? new RollupKey(NO_LOCATION, "Unspecified location")
                    : new RollupKey(resource.getLocation(), resource.getLocation()));
            case HORIZONTAL -> Optional.of(isBlank(resource.getHorizontal())
                    ? new RollupKey(NO_HORIZONTAL, "Unspecified horizontal")
                    : new RollupKey(resource.getHorizontal(), resource.getHorizontal()));
        };
    }

    private Optional<RollupKey> resolveClient(Project project, StaffingSnapshot snapshot) {
        if (project.getClientId() == null) return Optional.of(new RollupKey(NO_CLIENT, "No client"));
        return snapshot.findClient(project.getClientId())
                .map(client -> new RollupKey(client.getId(), labelOrId(client.getName(), client.getId())));
    }

    private Optional<RollupKey> resolveContract(Project project, StaffingSnapshot snapshot) {
        if (project.getContractId() == null) return Optional.of(new RollupKey(NO_CONTRACT, "No contract"));
        return snapshot.findContract(project.getContractId())
                .map(contract -> new RollupKey(contract.getId(), labelOrId(contract.getLabel(), contract.getId())));
    }

    private static String labelOrId(String label, String id) {
        return isBlank(label) ? id : label;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
