package com.eyelevel.uploadqueue.model;

public enum PayloadKind {
    FILE,
    REFERENCE
}
