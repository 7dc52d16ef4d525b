package com.codetracker.tracking;

public interface ActivityListener {

    void onActivityStarted();

    void onActivityStopped();
}
