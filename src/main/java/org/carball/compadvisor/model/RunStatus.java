package org.carball.compadvisor.model;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
