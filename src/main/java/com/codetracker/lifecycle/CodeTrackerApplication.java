package com.codetracker.lifecycle;

public interface CodeTrackerApplication extends AutoCloseable {

    void start() throws Exception;

    void stop() throws Exception;
}
