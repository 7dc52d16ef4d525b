package com.codetracker.util;

import java.util.concurrent.ThreadFactory;

public final class DaemonThreadFactory implements ThreadFactory {

    private final String prefix;
    private int counter = 0;

    public DaemonThreadFactory(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public synchronized Thread newThread(Runnable r) {
        Thread thread = new Thread(r, prefix + "-" + counter++);
        thread.setDaemon(true);
        return thread;
    }
}
