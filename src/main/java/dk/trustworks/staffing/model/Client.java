package dk.trustworks.staffing.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Client {

    String id;
    String name;
    String sector;
}
