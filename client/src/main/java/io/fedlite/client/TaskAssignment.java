package io.fedlite.client;

import java.util.List;

/**
 * Work handed to a collaborator by {@code GetTasks}.
 *
 * @param tasks       task names to run this round, in order
 * @param roundNumber current federation round
 * @param sleepTime   seconds to wait before asking again when there is no work
 * @param quit        true once the experiment is over for this collaborator
 */
public record TaskAssignment(
        List<String> tasks,
        int roundNumber,
        int sleepTime,
        boolean quit
) {
    public TaskAssignment {
        tasks = List.copyOf(tasks);
    }
}
