package com.example.frontdesk.infra.exec;

import org.springframework.core.task.TaskDecorator;

/**
 * Spring {@link TaskDecorator} that propagates the MDC into pooled threads.
 */
public class ContextAwareTaskDecorator implements TaskDecorator {

    @Override
    public Runnable decorate(Runnable runnable) {
        return ContextPropagation.wrap(runnable);
    }
}
