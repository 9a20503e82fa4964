package org.neuralchilli.flotilla.service;

import org.neuralchilli.flotilla.domain.TaskStatus;

import java.util.List;

public record GroupView(String name, TaskStatus status, List<TaskView> tasks) {

    public GroupView {
        tasks = List.copyOf(tasks);
    }
}
