package org.carball.compadvisor.model;

public enum ExecutionOperation {
    COMPRESS,
    REVERT
}
