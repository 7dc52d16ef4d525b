package com.codetracker.config;

@FunctionalInterface
public interface ConfigListener {

    void onConfigReload(AppConfig config);
}
