package com.astrazeneca.structhunt.collection;

import java.util.concurrent.Executor;

/**
 * Executor running each task in the calling thread, used by the serial modes.
 */
public class DirectThreadExecutor implements Executor {
    @Override
    public void execute(Runnable command) {
        command.run();
    }
}
