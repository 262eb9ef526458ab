package com.leadnurture.service;

import com.leadnurture.model.Task;

/**
 * Executes one task type. Throwing marks the attempt as failed; the runner
 * decides between retry and terminal failure.
 */
@FunctionalInterface
public interface TaskHandler {

    Object handle(Task task) throws Exception;
}
