package com.flagship.escort_market.assignment.policy;

import com.flagship.escort_market.assignment.ApplicationEntity;

import java.util.List;
import java.util.UUID;

/**
 * The earliest application wins.
 */
public class EarliestApplicationPolicy implements AssignmentPolicy {

    public static final String NAME = "earliest";

    @Override
    public List<UUID> selectExecutors(List<ApplicationEntity> applications) {
        return applications.stream()
            .findFirst()
            .map(application -> List.of(application.getEscortId()))
            .orElse(List.of());
    }

    @Override
    public String name() {
        return NAME;
    }
}
