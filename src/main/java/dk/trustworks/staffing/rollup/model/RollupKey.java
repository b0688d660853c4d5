package dk.trustworks.staffing.rollup.model;

import lombok.Value;

/**
 * Identity and display label of a group at one rollup level.
 */
@Value
public class RollupKey {

    String id;
    String label;
}
