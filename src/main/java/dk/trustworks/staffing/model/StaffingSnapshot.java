package dk.trustworks.staffing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dk.trustworks.staffing.allocation.model.Assignment;
import dk.trustworks.staffing.calendar.model.CompanyCalendar;
import dk.trustworks.staffing.costs.model.RateCard;
import dk.trustworks.staffing.costs.model.Role;
import dk.trustworks.staffing.costs.services.CostHistoryResolver;
import dk.trustworks.staffing.costs.services.SellRateResolver;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Immutable copy of everything a calculation reads, indexed once on construction.
 *
 * <p>{@code version} identifies the state of the source data as the caller sees it.
 * Cached results are keyed on the version together with a fingerprint of the content,
 * so two snapshots with the same version but different data never share a result.
 */
@Getter
public final class StaffingSnapshot {

    private final long version;
    private final List<Resource> resources;
    private final List<Role> roles;
    private final List<Project> projects;
    private final List<Client> clients;
    private final List<Contract> contracts;
    private final List<Assignment> assignments;
    private final CompanyCalendar calendar;
    private final List<RateCard> rateCards;
    private final List<BillingMilestone> billingMilestones;

    @JsonIgnore
    private final int fingerprint;

    @JsonIgnore
    private final CostHistoryResolver costResolver;
    @JsonIgnore
    private final SellRateResolver sellRateResolver;

    @JsonIgnore
    private final Map<String, Resource> resourcesById;
    @JsonIgnore
    private final Map<String, Project> projectsById;
    @JsonIgnore
    private final Map<String, Client> clientsById;
    @JsonIgnore
    private final Map<String, Contract> contractsById;
    @JsonIgnore
    private final Map<String, Assignment> assignmentsById;
    @JsonIgnore
    private final Map<String, List<Assignment>> assignmentsByResource;
    @JsonIgnore
    private final Map<String, List<Assignment>> assignmentsByProject;
    @JsonIgnore
    private final Map<String, List<BillingMilestone>> milestonesByProject;

    @Builder
    @JsonCreator
    public StaffingSnapshot(@JsonProperty("version") long version,
                            @JsonProperty("resources") List<Resource> resources,
                            @JsonProperty("roles") List<Role> roles,
                            @JsonProperty("projects") List<Project> projects,
                            @JsonProperty("clients") List<Client> clients,
                            @JsonProperty("contracts") List<Contract> contracts,
                            @JsonProperty("assignments") List<Assignment> assignments,
                            @JsonProperty("calendar") CompanyCalendar calendar,
                            @JsonProperty("rateCards") List<RateCard> rateCards,
                            @JsonProperty("billingMilestones") List<BillingMilestone> billingMilestones) {
        this.version = version;
        this.resources = copy(resources);
        this.roles = copy(roles);
        this.projects = copy(projects);
        this.clients = copy(clients);
        this.contracts = copy(contracts);
        this.assignments = copy(assignments);
        this.calendar = calendar == null ? CompanyCalendar.empty() : calendar;
        this.rateCards = copy(rateCards);
        this.billingMilestones = copy(billingMilestones);
        this.fingerprint = Objects.hash(this.resources, this.roles, this.projects, this.clients, this.contracts,
                this.assignments, this.calendar, this.rateCards, this.billingMilestones);

        this.costResolver = CostHistoryResolver.of(this.roles);
        this.sellRateResolver = SellRateResolver.of(this.rateCards);
        this.resourcesById = index(this.resources, Resource::getId);
        this.projectsById = index(this.projects, Project::getId);
        this.clientsById = index(this.clients, Client::getId);
        this.contractsById = index(this.contracts, Contract::getId);
        this.assignmentsById = index(this.assignments, Assignment::getId);
        this.assignmentsByResource = group(this.assignments, Assignment::getResourceId);
        this.assignmentsByProject = group(this.assignments, Assignment::getProjectId);
        this.milestonesByProject = group(this.billingMilestones, BillingMilestone::getProjectId);
    }

    public Optional<Resource> findResource(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(resourcesById.get(id));
    }

    public Optional<Project> findProject(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(projectsById.get(id));
    }

    public Optional<Client> findClient(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(clientsById.get(id));
    }

    public Optional<Contract> findContract(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(contractsById.get(id));
    }

    public Optional<Assignment> findAssignment(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(assignmentsById.get(id));
    }

    public List<Assignment> assignmentsOfResource(String resourceId) {
        return assignmentsByResource.getOrDefault(resourceId, List.of());
    }

    public List<Assignment> assignmentsOfProject(String projectId) {
        return assignmentsByProject.getOrDefault(projectId, List.of());
    }

    public List<BillingMilestone> milestonesOfProject(String projectId) {
        return milestonesByProject.getOrDefault(projectId, List.of());
    }

    /**
     * The project's own billing type, else its contract's, else time and material.
     */
    public BillingType billingTypeOf(Project project) {
        if (project.getBillingType() != null) return project.getBillingType();
        return findContract(project.getContractId())
                .map(Contract::getBillingType)
                .orElse(BillingType.TIME_MATERIAL);
    }

    /**
     * Daily sell rate of a resource on the rate card of the project's contract.
     */
    public BigDecimal sellRate(Project project, String resourceId) {
        String rateCardId = findContract(project.getContractId()).map(Contract::getRateCardId).orElse(null);
        return sellRateResolver.sellRate(rateCardId, resourceId);
    }

    private static <T> List<T> copy(Collection<T> source) {
        if (source == null) return List.of();
        List<T> list = new ArrayList<>(source);
        list.removeIf(Objects::isNull);
        return List.copyOf(list);
    }

    private static <T> Map<String, T> index(List<T> items, Function<T, String> key) {
        Map<String, T> index = new HashMap<>();
        for (T item : items) {
            String id = key.apply(item);
            if (id != null) index.put(id, item);
        }
        return Map.copyOf(index);
    }

    private static <T> Map<String, List<T>> group(List<T> items, Function<T, String> key) {
        Map<String, List<T>> grouped = new LinkedHashMap<>();
        for (T item : items) {
            String id = key.apply(item);
            if (id != null) grouped.computeIfAbsent(id, k -> new ArrayList<>()).add(item);
        }
        grouped.replaceAll((k, list) -> List.copyOf(list));
        return Collections.unmodifiableMap(grouped);
    }
}
