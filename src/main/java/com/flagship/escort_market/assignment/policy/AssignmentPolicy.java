package com.flagship.escort_market.assignment.policy;

import com.flagship.escort_market.assignment.ApplicationEntity;

import java.util.List;
import java.util.UUID;

/**
 * Picks the executors of an order when no operator chose them.
 */
public interface AssignmentPolicy {

    /**
     * @param applications eligible applications, earliest first
     * @return chosen escort ids in assignment order, empty when no valid choice exists
     */
    List<UUID> selectExecutors(List<ApplicationEntity> applications);

    String name();
}
