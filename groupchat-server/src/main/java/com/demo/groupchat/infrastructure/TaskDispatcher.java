package com.demo.groupchat.infrastructure;

import com.demo.groupchat.domain.TaskRequest;

/**
 * Hands a task off for out-of-band execution.
 *
 * Fire and forget: the caller never sees the task's outcome, and a task is run at most once.
 */
public interface TaskDispatcher {

    void dispatch(TaskRequest task);
}
