package com.flagship.escort_market.assignment.policy;

import com.flagship.escort_market.assignment.ApplicationEntity;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * The squad of the earliest applicant that applied as a squad member wins; every
 * applicant of that squad becomes an executor. Fewer than {@code minMembers}
 * applicants of the winning squad means no valid choice.
 */
public class EarliestSquadPolicy implements AssignmentPolicy {

    public static final String NAME = "earliest-squad";

    private final int minMembers;
    private final int maxExecutors;

    public EarliestSquadPolicy(int minMembers, int maxExecutors) {
        if (minMembers < 1 || maxExecutors < minMembers) {
            throw new IllegalArgumentException(
                "Invalid squad assignment bounds: min=" + minMembers + ", max=" + maxExecutors);
        }
        this.minMembers = minMembers;
        this.maxExecutors = maxExecutors;
    }

    @Override
    public List<UUID> selectExecutors(List<ApplicationEntity> applications) {
        UUID winningSquad = applications.stream()
            .map(ApplicationEntity::getSquadId)
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(null);
        if (winningSquad == null) {
            return List.of();
        }
        List<UUID> members = applications.stream()
            .filter(application -> winningSquad.equals(application.getSquadId()))
            .map(ApplicationEntity::getEscortId)
            .limit(maxExecutors)
            .toList();
        return members.size() >= minMembers ? members : List.of();
    }

    @Override
    public String name() {
        return NAME;
    }
}
