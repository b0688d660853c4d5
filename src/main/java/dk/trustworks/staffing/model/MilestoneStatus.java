package dk.trustworks.staffing.model;

public enum MilestoneStatus {
    PLANNED, INVOICED, PAID
}
