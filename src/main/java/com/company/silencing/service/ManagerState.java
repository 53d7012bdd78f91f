package com.company.silencing.service;

public enum ManagerState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING
}
